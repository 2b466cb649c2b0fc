package com.baskettecase.sqlgate.security;

import com.baskettecase.sqlgate.error.CredentialUnavailableException;

/**
 * Result of a credential cache lookup. The password is only present when {@link Status#FOUND}.
 */
public final class CredentialLookup {

    public enum Status {
        FOUND,
        NOT_FOUND,
        EXPIRED
    }

    private static final CredentialLookup NOT_FOUND = new CredentialLookup(Status.NOT_FOUND, null);
    private static final CredentialLookup EXPIRED = new CredentialLookup(Status.EXPIRED, null);

    private final Status status;
    private final String password;

    private CredentialLookup(Status status, String password) {
        this.status = status;
        this.password = password;
    }

    public static CredentialLookup found(String password) {
        return new CredentialLookup(Status.FOUND, password);
    }

    public static CredentialLookup notFound() {
        return NOT_FOUND;
    }

    public static CredentialLookup expired() {
        return EXPIRED;
    }

    public Status status() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * The plaintext password, or {@link CredentialUnavailableException} for a missing or expired entry
     */
    public String orElseThrow(long userId) {
        if (status != Status.FOUND) {
            throw new CredentialUnavailableException(userId, status == Status.EXPIRED);
        }
        return password;
    }

    @Override
    public String toString() {
        return "CredentialLookup[" + status + "]";
    }
}
