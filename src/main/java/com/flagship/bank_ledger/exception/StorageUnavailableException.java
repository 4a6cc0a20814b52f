package com.flagship.bank_ledger.exception;

/**
 * The persistence layer could not complete the atomic scope (connection loss,
 * lock timeout, deadlock abort, commit failure). No partial effect was applied,
 * so the whole operation may be retried by the caller.
 */
public class StorageUnavailableException extends LedgerException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }
}
