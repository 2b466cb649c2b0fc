package com.baskettecase.sqlgate.error;

/**
 * An approval workflow action is not allowed for the record in its current state.
 */
public class WorkflowStateException extends SqlGateException {

    public WorkflowStateException(ErrorCode code, String message) {
        super(code, message);
    }

    public static WorkflowStateException notFound(long workspaceId) {
        return new WorkflowStateException(ErrorCode.NOT_FOUND, "Workspace not found: " + workspaceId);
    }

    public static WorkflowStateException forbidden(String message) {
        return new WorkflowStateException(ErrorCode.FORBIDDEN, message);
    }

    public static WorkflowStateException notApproved(long workspaceId) {
        return new WorkflowStateException(ErrorCode.NOT_APPROVED,
            "Workspace " + workspaceId + " is not approved for execution");
    }

    public static WorkflowStateException conflict(String message) {
        return new WorkflowStateException(ErrorCode.CONFLICT, message);
    }

    public static WorkflowStateException inProgress(long workspaceId) {
        return new WorkflowStateException(ErrorCode.IN_PROGRESS,
            "Workspace " + workspaceId + " is already executing");
    }
}
