package com.flagship.bank_ledger.exception;

/**
 * Amount text is malformed, out of range, or not strictly positive.
 */
public class InvalidAmountException extends LedgerException {

    public InvalidAmountException(String message) {
        super(ErrorCode.INVALID_AMOUNT, message);
    }
}
