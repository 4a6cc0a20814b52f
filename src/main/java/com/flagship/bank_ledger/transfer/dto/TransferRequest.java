package com.flagship.bank_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Body of {@code POST /transactions}. The amount is decimal text such as {@code "250.50"}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequest {

    @NotNull(message = "Source account is required")
    @JsonProperty("from_account")
    private UUID fromAccount;

    @NotNull(message = "Destination account is required")
    @JsonProperty("to_account")
    private UUID toAccount;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private String amount;
}
