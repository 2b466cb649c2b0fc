package com.baskettecase.sqlgate.workflow;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a saved query.
 *
 * <pre>
 * DRAFT -> WAITING_FOR_APPROVAL -> APPROVED | APPROVED_WITH_RESULTS | REJECTED
 * APPROVED | APPROVED_WITH_RESULTS -> APPROVED_AND_EXECUTED | APPROVAL_EXECUTION_FAILED
 * </pre>
 */
public enum QueryStatus {
    DRAFT("saved_in_workspace"),
    WAITING_FOR_APPROVAL("waiting_for_approval"),
    APPROVED("approved"),
    APPROVED_WITH_RESULTS("approved_with_results"),
    REJECTED("rejected"),
    APPROVED_AND_EXECUTED("approved_and_executed"),
    APPROVAL_EXECUTION_FAILED("approval_execution_failed");

    private final String dbValue;

    QueryStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public Set<QueryStatus> successors() {
        switch (this) {
            case DRAFT:
                return EnumSet.of(WAITING_FOR_APPROVAL);
            case WAITING_FOR_APPROVAL:
                return EnumSet.of(APPROVED, APPROVED_WITH_RESULTS, REJECTED);
            case APPROVED:
            case APPROVED_WITH_RESULTS:
                return EnumSet.of(APPROVED_AND_EXECUTED, APPROVAL_EXECUTION_FAILED);
            default:
                return EnumSet.noneOf(QueryStatus.class);
        }
    }

    public boolean canTransitionTo(QueryStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    public boolean isApproved() {
        return this == APPROVED || this == APPROVED_WITH_RESULTS;
    }

    public static QueryStatus fromDbValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.dbValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown query status: " + value));
    }
}
