package com.flagship.bank_ledger.account;

import com.flagship.bank_ledger.money.Money;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * JDBC access to the {@code accounts} table.
 *
 * Locking contract:
 * - {@link #findByIdForUpdate(UUID)} takes an exclusive row lock held until the
 *   surrounding transaction commits or rolls back
 * - {@link #lockInOrder(UUID...)} is the only way to lock more than one account;
 *   it always acquires locks in ascending id order so that two operations over
 *   the same accounts can never wait on each other in a cycle
 * - {@link #updateBalance(UUID, Money)} is only valid while holding the row lock
 */
@Repository
public class AccountRepository {

    private static final String SELECT_COLUMNS = "SELECT id, user_id, balance, created_at FROM accounts ";

    private final JdbcTemplate jdbcTemplate;

    public AccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Account account) {
        jdbcTemplate.update(
            "INSERT INTO accounts (id, user_id, balance, created_at) VALUES (?, ?, ?, ?)",
            account.getId(),
            account.getUserId(),
            account.getBalance().toBigDecimal(),
            Timestamp.from(account.getCreatedAt())
        );
    }

    /**
     * Plain read without a lock. Never use the result to compute a new balance.
     */
    public Optional<Account> findById(UUID accountId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", accountRowMapper(), accountId)
            .stream()
            .findFirst();
    }

    public List<Account> findByUserId(UUID userId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE user_id = ? ORDER BY created_at, id",
            accountRowMapper(),
            userId
        );
    }

    public boolean existsById(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE id = ?",
            Integer.class,
            accountId
        );
        return count != null && count > 0;
    }

    /**
     * Reads the account and locks its row until the current transaction ends.
     */
    public Optional<Account> findByIdForUpdate(UUID accountId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ? FOR UPDATE", accountRowMapper(), accountId)
            .stream()
            .findFirst();
    }

    /**
     * Locks every given account in ascending id order.
     *
     * @param accountIds accounts to lock; duplicates are locked once
     * @return locked accounts keyed by id, in lock order; ids with no row are absent
     */
    public Map<UUID, Account> lockInOrder(UUID... accountIds) {
        SortedSet<UUID> ordered = new TreeSet<>(Arrays.asList(accountIds));
        Map<UUID, Account> locked = new LinkedHashMap<>();
        for (UUID accountId : ordered) {
            findByIdForUpdate(accountId).ifPresent(account -> locked.put(accountId, account));
        }
        return locked;
    }

    public void updateBalance(UUID accountId, Money newBalance) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET balance = ? WHERE id = ?",
            newBalance.toBigDecimal(),
            accountId
        );
        if (updated != 1) {
            throw new IllegalStateException("Balance update touched " + updated + " rows for account " + accountId);
        }
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            Money.of(rs.getBigDecimal("balance")),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
