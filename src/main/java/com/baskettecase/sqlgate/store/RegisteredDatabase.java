package com.baskettecase.sqlgate.store;

import com.baskettecase.sqlgate.db.Technology;

import java.time.Instant;

/**
 * A database added to the registry by an administrator.
 */
public record RegisteredDatabase(
    Long id,
    String serverName,
    String databaseName,
    Technology technology,
    Instant createdAt
) {
}
