package com.flagship.bank_ledger.user;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Owner of zero or more accounts. Credentials are managed elsewhere.
 */
@Value
public class User {
    UUID id;
    String username;
    Instant createdAt;
}
