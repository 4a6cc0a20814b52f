package com.flagship.bank_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bank_ledger.account.Account;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Account as exposed over HTTP. The balance is decimal text, e.g. {@code "749.50"}.
 */
@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("balance")
    String balance;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .userId(account.getUserId())
            .balance(account.getBalance().toDisplayText())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
