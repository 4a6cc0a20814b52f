package com.flagship.bank_ledger.exception;

import com.flagship.bank_ledger.money.Money;
import lombok.Getter;

import java.util.UUID;

/**
 * Debit would take the source balance below zero.
 */
@Getter
public class InsufficientFundsException extends LedgerException {

    private final UUID accountId;
    private final Money balance;
    private final Money requested;

    public InsufficientFundsException(UUID accountId, Money balance, Money requested) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Insufficient funds in account %s: balance=%s, requested=%s",
                        accountId, balance.toDisplayText(), requested.toDisplayText()));
        this.accountId = accountId;
        this.balance = balance;
        this.requested = requested;
    }
}
