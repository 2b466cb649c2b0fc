package com.baskettecase.sqlgate.db;

import lombok.Getter;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One checked-out connection. Closing the session returns the connection to its handle.
 */
public class PooledSession implements AutoCloseable {

    @Getter
    private final Connection connection;
    @Getter
    private final Technology technology;
    private final Runnable onClose;
    private boolean closed;

    PooledSession(Connection connection, Technology technology, Runnable onClose) {
        this.connection = connection;
        this.technology = technology;
        this.onClose = onClose;
    }

    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
        } finally {
            onClose.run();
        }
    }
}
