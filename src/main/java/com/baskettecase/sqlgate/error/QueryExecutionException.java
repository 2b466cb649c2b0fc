package com.baskettecase.sqlgate.error;

/**
 * The target database rejected or failed the query (or the connection to it). Never retried.
 */
public class QueryExecutionException extends SqlGateException {

    public QueryExecutionException(String message) {
        super(ErrorCode.EXECUTION_ERROR, message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(ErrorCode.EXECUTION_ERROR, message, cause);
    }
}
