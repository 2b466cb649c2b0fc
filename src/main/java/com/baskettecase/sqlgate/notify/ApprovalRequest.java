package com.baskettecase.sqlgate.notify;

import com.baskettecase.sqlgate.sql.RiskCategory;

import java.time.Instant;

/**
 * A query that needs an administrator's decision.
 */
public record ApprovalRequest(
    long workspaceId,
    String correlationId,
    String username,
    String server,
    String database,
    String queryText,
    RiskCategory riskCategory,
    Instant requestedAt
) {

    public String riskLabel() {
        return riskCategory == null ? "none" : riskCategory.wireValue();
    }
}
