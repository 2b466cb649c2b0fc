package com.baskettecase.sqlgate.error;

import lombok.Getter;

/**
 * Outcome codes reported to callers of the execution paths and workflow transitions.
 */
@Getter
public enum ErrorCode {
    NOT_FOUND(404, false),
    FORBIDDEN(403, false),
    NOT_APPROVED(409, false),
    CONFLICT(409, false),
    IN_PROGRESS(409, false),
    NOT_CONFIGURED(400, false),
    SESSION_EXPIRED(401, false),
    POOL_EXHAUSTED(503, true),
    EXECUTION_ERROR(422, false);

    private final int httpStatus;
    private final boolean transientFailure;

    ErrorCode(int httpStatus, boolean transientFailure) {
        this.httpStatus = httpStatus;
        this.transientFailure = transientFailure;
    }
}
