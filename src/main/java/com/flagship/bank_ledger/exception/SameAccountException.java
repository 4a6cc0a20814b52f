package com.flagship.bank_ledger.exception;

import java.util.UUID;

public class SameAccountException extends LedgerException {

    public SameAccountException(UUID accountId) {
        super(ErrorCode.SAME_ACCOUNT, "Source and destination account must differ: " + accountId);
    }
}
