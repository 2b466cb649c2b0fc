package com.baskettecase.sqlgate.db;

/**
 * Cache index derived from a {@link ConnectionIdentity}. Never rendered.
 */
public record ConnectionKey(String digest) {

    @Override
    public String toString() {
        return "ConnectionKey[***]";
    }
}
