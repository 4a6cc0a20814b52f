package com.flagship.bank_ledger.transfer;

import com.flagship.bank_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable fact of a completed transfer between two accounts.
 * Written once, in the same transaction as the balance changes it reflects.
 */
@Value
public class TransactionRecord {
    UUID id;
    UUID fromAccount;
    UUID toAccount;
    Money amount;
    Instant createdAt;
}
