package com.flagship.bank_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bank_ledger.transfer.TransactionRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("from_account")
    UUID fromAccount;

    @JsonProperty("to_account")
    UUID toAccount;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(TransactionRecord record) {
        return TransactionResponse.builder()
            .id(record.getId())
            .fromAccount(record.getFromAccount())
            .toAccount(record.getToAccount())
            .amount(record.getAmount().toDisplayText())
            .createdAt(record.getCreatedAt())
            .build();
    }
}
