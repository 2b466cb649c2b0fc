package com.baskettecase.sqlgate.workflow;

import com.baskettecase.sqlgate.error.ErrorCode;
import com.baskettecase.sqlgate.execution.QueryResult;
import com.baskettecase.sqlgate.sql.RiskCategory;

/**
 * What happened to a submitted query.
 */
public record SubmissionResult(
    Outcome outcome,
    QueryResult result,
    Long workspaceId,
    RiskCategory riskCategory,
    ErrorCode errorCode,
    String message
) {

    public enum Outcome {
        EXECUTED,
        SENT_FOR_APPROVAL,
        FAILED
    }

    public static SubmissionResult executed(QueryResult result) {
        return new SubmissionResult(Outcome.EXECUTED, result, null, null, null, result.message());
    }

    public static SubmissionResult sentForApproval(long workspaceId, RiskCategory riskCategory) {
        return new SubmissionResult(Outcome.SENT_FOR_APPROVAL, null, workspaceId, riskCategory, null,
            String.format("Query flagged as %s. Query saved to your workspaces (workspace %d) "
                + "and sent for admin approval.", riskCategory.wireValue(), workspaceId));
    }

    public static SubmissionResult failed(ErrorCode errorCode, String message) {
        return new SubmissionResult(Outcome.FAILED, null, null, null, errorCode, message);
    }
}
