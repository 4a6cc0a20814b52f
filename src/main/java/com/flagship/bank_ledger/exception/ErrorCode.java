package com.flagship.bank_ledger.exception;

/**
 * Machine-readable failure kinds surfaced to API clients.
 *
 * Only {@link #STORAGE_UNAVAILABLE} is retryable: it is raised when the
 * atomic scope could not complete, which implies nothing was applied.
 * Every other kind is deterministic for the same input.
 */
public enum ErrorCode {
    INVALID_AMOUNT(false),
    SAME_ACCOUNT(false),
    ACCOUNT_NOT_FOUND(false),
    INSUFFICIENT_FUNDS(false),
    USER_NOT_FOUND(false),
    DUPLICATE_USERNAME(false),
    STORAGE_UNAVAILABLE(true);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
