package com.flagship.bank_ledger.account;

import com.flagship.bank_ledger.money.Money;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.UUID;

/**
 * A balance-holding record owned by exactly one user.
 *
 * Instances are snapshots of a row. Balances change only through
 * {@link AccountRepository#updateBalance(UUID, Money)} inside an
 * {@link AtomicScope} that holds the row lock.
 */
@Value
public class Account {
    UUID id;
    UUID userId;
    @With
    Money balance;
    Instant createdAt;
}
