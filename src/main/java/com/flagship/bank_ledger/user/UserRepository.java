package com.flagship.bank_ledger.user;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class UserRepository {

    private final JdbcTemplate jdbcTemplate;

    public UserRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(User user) {
        jdbcTemplate.update(
            "INSERT INTO users (id, username, created_at) VALUES (?, ?, ?)",
            user.getId(),
            user.getUsername(),
            Timestamp.from(user.getCreatedAt())
        );
    }

    public Optional<User> findById(UUID userId) {
        List<User> rows = jdbcTemplate.query(
            "SELECT id, username, created_at FROM users WHERE id = ?",
            userRowMapper(),
            userId
        );
        return rows.stream().findFirst();
    }

    public boolean existsById(UUID userId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM users WHERE id = ?",
            Integer.class,
            userId
        );
        return count != null && count > 0;
    }

    private RowMapper<User> userRowMapper() {
        return (rs, rowNum) -> new User(
            rs.getObject("id", UUID.class),
            rs.getString("username"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
