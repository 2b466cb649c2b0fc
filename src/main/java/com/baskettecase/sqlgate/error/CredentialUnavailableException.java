package com.baskettecase.sqlgate.error;

import lombok.Getter;

/**
 * The caller's cached database credential is missing or has expired.
 * Clients should prompt for re-authentication rather than treat this as a permissions error.
 */
@Getter
public class CredentialUnavailableException extends SqlGateException {

    private final long userId;
    private final boolean expired;

    public CredentialUnavailableException(long userId, boolean expired) {
        super(ErrorCode.SESSION_EXPIRED, expired
            ? "Session expired, please log in again"
            : "No active session, please log in");
        this.userId = userId;
        this.expired = expired;
    }
}
