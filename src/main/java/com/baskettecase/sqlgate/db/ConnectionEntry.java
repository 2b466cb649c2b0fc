package com.baskettecase.sqlgate.db;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached connection handle with its access bookkeeping.
 * All mutable state is guarded by the owning {@link ConnectionPool}'s lock.
 */
@Getter
public class ConnectionEntry {

    private final ConnectionKey key;
    private final ConnectionHandle handle;
    private final String poolName;
    private final long owner;
    private final String server;
    private final String database;
    private final Instant createdAt;
    private Instant lastAccessed;

    // Checkouts between lookup and the handle reporting them as active
    private int pendingCheckouts;

    ConnectionEntry(ConnectionKey key, ConnectionHandle handle, String poolName, long owner, String server,
                    String database, Instant now) {
        this.key = key;
        this.handle = handle;
        this.poolName = poolName;
        this.owner = owner;
        this.server = server;
        this.database = database;
        this.createdAt = now;
        this.lastAccessed = now;
    }

    void touch(Instant now) {
        this.lastAccessed = now;
    }

    void reserve(Instant now) {
        pendingCheckouts++;
        lastAccessed = now;
    }

    void releaseReservation() {
        if (pendingCheckouts > 0) {
            pendingCheckouts--;
        }
    }

    /**
     * True when no connection is checked out from the handle and none is about to be
     */
    boolean isIdle() {
        return pendingCheckouts == 0 && handle.activeConnections() == 0;
    }

    boolean idleLongerThan(Duration ttl, Instant now) {
        return !lastAccessed.plus(ttl).isAfter(now);
    }
}
