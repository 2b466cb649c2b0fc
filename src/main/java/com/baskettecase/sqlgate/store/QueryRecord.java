package com.baskettecase.sqlgate.store;

import com.baskettecase.sqlgate.sql.RiskCategory;
import com.baskettecase.sqlgate.workflow.QueryStatus;

import java.time.Instant;

/**
 * A saved query and its approval status.
 */
public record QueryRecord(
    Long id,
    long userId,
    String serverName,
    String databaseName,
    String queryText,
    String correlationId,
    QueryStatus status,
    RiskCategory riskCategory,
    Instant createdAt,
    Instant updatedAt
) {
}
