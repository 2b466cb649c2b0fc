package com.baskettecase.sqlgate.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A live, bounded pool of connections to one (server, database, credential) triple.
 */
public interface ConnectionHandle extends AutoCloseable {

    /**
     * Check out a connection, blocking at most the handle's connection timeout
     */
    Connection getConnection() throws SQLException;

    /**
     * Connections currently checked out, as reported by the underlying pool
     */
    int activeConnections();

    boolean isClosed();

    @Override
    void close();
}
