package com.baskettecase.sqlgate.db;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Fully-qualified identity of a target connection, including the caller's plaintext password.
 * Never log or persist this object. {@link #toString()} leaves the password out.
 */
public record ConnectionIdentity(
    Technology technology,
    String driver,
    String username,
    String password,
    String server,
    String database
) {

    public static ConnectionIdentity of(ServerEntry server, String database, String username, String password) {
        return new ConnectionIdentity(server.technology(), server.technology().getDriverClassName(),
            username, password, server.name(), database);
    }

    /**
     * SHA-256 over the length-prefixed identity fields
     */
    public ConnectionKey connectionKey() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            update(digest, technology.name());
            update(digest, driver);
            update(digest, username);
            update(digest, password);
            update(digest, server);
            update(digest, database);
            return new ConnectionKey(HexFormat.of().formatHex(digest.digest()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void update(MessageDigest digest, String field) {
        if (field == null) {
            digest.update(ByteBuffer.allocate(4).putInt(-1).array());
            return;
        }
        byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(4).putInt(bytes.length).array());
        digest.update(bytes);
    }

    @Override
    public String toString() {
        return "ConnectionIdentity[technology=" + technology + ", username=" + username
            + ", server=" + server + ", database=" + database + "]";
    }
}
