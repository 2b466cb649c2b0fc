package com.baskettecase.sqlgate.store;

import java.time.Instant;

/**
 * A workspace wraps exactly one {@link QueryRecord}. {@code showResults} is null until an
 * administrator decides.
 */
public record WorkspaceRecord(
    Long id,
    long userId,
    String name,
    String description,
    long queryId,
    Boolean showResults,
    Instant createdAt
) {

    public boolean resultsVisible() {
        return Boolean.TRUE.equals(showResults);
    }
}
