package com.flagship.bank_ledger.exception;

import java.util.UUID;

public class UserNotFoundException extends LedgerException {

    public UserNotFoundException(UUID userId) {
        super(ErrorCode.USER_NOT_FOUND, "User not found: " + userId);
    }
}
