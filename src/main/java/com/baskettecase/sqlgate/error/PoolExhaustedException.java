package com.baskettecase.sqlgate.error;

/**
 * No connection could be checked out within the configured timeout. Callers may retry with backoff.
 */
public class PoolExhaustedException extends SqlGateException {

    public PoolExhaustedException(String message, Throwable cause) {
        super(ErrorCode.POOL_EXHAUSTED, message, cause);
    }
}
