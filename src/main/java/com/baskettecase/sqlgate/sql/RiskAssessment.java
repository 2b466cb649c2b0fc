package com.baskettecase.sqlgate.sql;

import java.util.Optional;

/**
 * Outcome of classifying a query: safe, or risky under one category.
 *
 * @param category null when safe
 * @param reason   what matched, for logs and the approval request
 */
public record RiskAssessment(RiskCategory category, String reason) {

    public static final RiskAssessment SAFE = new RiskAssessment(null, null);

    public static RiskAssessment risky(RiskCategory category, String reason) {
        if (category == null) {
            throw new IllegalArgumentException("A risky assessment needs a category");
        }
        return new RiskAssessment(category, reason);
    }

    public boolean isSafe() {
        return category == null;
    }

    public Optional<RiskCategory> riskCategory() {
        return Optional.ofNullable(category);
    }
}
