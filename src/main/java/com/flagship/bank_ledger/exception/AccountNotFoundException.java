package com.flagship.bank_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class AccountNotFoundException extends LedgerException {

    private final UUID accountId;

    public AccountNotFoundException(UUID accountId) {
        super(ErrorCode.ACCOUNT_NOT_FOUND, "Account not found: " + accountId);
        this.accountId = accountId;
    }
}
