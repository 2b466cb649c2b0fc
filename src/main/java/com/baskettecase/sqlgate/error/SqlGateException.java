package com.baskettecase.sqlgate.error;

import lombok.Getter;

/**
 * Base class for failures surfaced to callers of the gateway.
 */
@Getter
public abstract class SqlGateException extends RuntimeException {

    private final ErrorCode code;

    protected SqlGateException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected SqlGateException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
