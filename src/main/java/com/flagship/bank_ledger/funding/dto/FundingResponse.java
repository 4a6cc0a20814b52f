package com.flagship.bank_ledger.funding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bank_ledger.account.Account;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class FundingResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("balance")
    String balance;

    public static FundingResponse from(Account account) {
        return FundingResponse.builder()
            .id(account.getId())
            .userId(account.getUserId())
            .balance(account.getBalance().toDisplayText())
            .build();
    }
}
