package com.flagship.bank_ledger.exception;

public class DuplicateUsernameException extends LedgerException {

    public DuplicateUsernameException(String username) {
        super(ErrorCode.DUPLICATE_USERNAME, "Username already taken: " + username);
    }
}
