package com.flagship.bank_ledger.transfer;

import com.flagship.bank_ledger.money.Money;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Append-only access to the {@code transactions} ledger table.
 * There is deliberately no update or delete.
 */
@Repository
public class TransactionRepository {

    private final JdbcTemplate jdbcTemplate;

    public TransactionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(TransactionRecord record) {
        jdbcTemplate.update(
            "INSERT INTO transactions (id, from_account, to_account, amount, created_at) VALUES (?, ?, ?, ?, ?)",
            record.getId(),
            record.getFromAccount(),
            record.getToAccount(),
            record.getAmount().toBigDecimal(),
            Timestamp.from(record.getCreatedAt())
        );
    }

    /**
     * Records where the account is source or destination, newest first.
     */
    public List<TransactionRecord> findByAccount(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT id, from_account, to_account, amount, created_at FROM transactions " +
            "WHERE from_account = ? OR to_account = ? " +
            "ORDER BY created_at DESC, id DESC",
            transactionRowMapper(),
            accountId,
            accountId
        );
    }

    private RowMapper<TransactionRecord> transactionRowMapper() {
        return (rs, rowNum) -> new TransactionRecord(
            rs.getObject("id", UUID.class),
            rs.getObject("from_account", UUID.class),
            rs.getObject("to_account", UUID.class),
            Money.of(rs.getBigDecimal("amount")),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
