package com.baskettecase.sqlgate.store;

import java.time.Instant;

/**
 * Application user. Database credentials are never stored here; they live in the credential cache.
 */
public record AppUser(
    Long id,
    String username,
    String email,
    boolean admin,
    boolean active,
    Instant createdAt
) {
}
