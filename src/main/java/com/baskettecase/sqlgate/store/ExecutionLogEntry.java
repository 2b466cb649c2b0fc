package com.baskettecase.sqlgate.store;

import java.time.Instant;

/**
 * One execution attempt. {@code finishedAt} is null while the attempt is running.
 */
public record ExecutionLogEntry(
    Long id,
    long userId,
    String queryText,
    String serverName,
    String databaseName,
    Instant startedAt,
    Instant finishedAt,
    Long durationMs,
    Boolean success,
    Integer rowCount,
    String errorMessage,
    boolean approvedExecution
) {
}
