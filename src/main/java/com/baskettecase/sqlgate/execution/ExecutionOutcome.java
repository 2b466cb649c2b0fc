package com.baskettecase.sqlgate.execution;

/**
 * How an execution attempt ended.
 */
public record ExecutionOutcome(boolean success, Integer rowCount, String errorMessage) {

    public static ExecutionOutcome success(int rowCount) {
        return new ExecutionOutcome(true, rowCount, null);
    }

    public static ExecutionOutcome failure(String errorMessage) {
        return new ExecutionOutcome(false, null, errorMessage);
    }
}
