package com.flagship.bank_ledger.exception;

import lombok.Getter;

/**
 * Base type for typed ledger failures.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected LedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
