package com.baskettecase.sqlgate.db;

import com.baskettecase.sqlgate.config.GatewayProperties;
import com.baskettecase.sqlgate.error.PoolExhaustedException;
import com.baskettecase.sqlgate.error.QueryExecutionException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Connection Pool
 *
 * Bounded cache of connection handles keyed by {@link ConnectionKey}. Each handle is a small pool
 * opened with one user's credentials for one server/database. Entries are evicted least recently
 * used first, but only while idle; a background sweep closes entries idle for longer than the TTL.
 *
 * The entry map is guarded by a single lock. Handles are opened and closed outside it.
 */
@Slf4j
@Component
public class ConnectionPool implements AutoCloseable {

    private final ConnectionHandleFactory handleFactory;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final int maxEntries;
    private final Duration idleTtl;
    private final Duration sweepInterval;
    private final Duration shutdownTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<ConnectionKey, ConnectionEntry> entries = new HashMap<>();
    private final AtomicLong poolSequence = new AtomicLong();
    private boolean closed;

    private ScheduledExecutorService sweeper;
    private ScheduledFuture<?> sweepTask;

    @Autowired
    public ConnectionPool(ConnectionHandleFactory handleFactory, GatewayProperties properties,
                          Clock clock, MeterRegistry meterRegistry) {
        this(handleFactory, clock, meterRegistry,
            properties.getPool().getMaxEntries(),
            properties.getPool().getIdleTtl(),
            properties.getPool().getSweepInterval(),
            properties.getPool().getShutdownTimeout());
    }

    public ConnectionPool(ConnectionHandleFactory handleFactory, Clock clock, MeterRegistry meterRegistry,
                          int maxEntries, Duration idleTtl, Duration sweepInterval, Duration shutdownTimeout) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1");
        }
        this.handleFactory = handleFactory;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.maxEntries = maxEntries;
        this.idleTtl = idleTtl;
        this.sweepInterval = sweepInterval;
        this.shutdownTimeout = shutdownTimeout;

        Gauge.builder("sqlgate.pool.entries", this, ConnectionPool::size)
            .description("Cached connection handles")
            .register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        startSweep(sweepInterval);
    }

    /**
     * Check out a connection for the identity, creating its handle on a cache miss.
     * The returned session must be closed to give the connection back.
     *
     * @throws PoolExhaustedException when no connection frees up within the checkout timeout
     * @throws QueryExecutionException when the target cannot be reached
     */
    public PooledSession acquire(ConnectionIdentity identity, long owner) {
        ConnectionKey key = identity.connectionKey();

        ConnectionEntry entry = reserveExisting(key);
        if (entry == null) {
            entry = create(key, identity, owner);
        }

        try {
            return checkout(entry, identity);
        } catch (StaleHandleException e) {
            // Handle was force-evicted between lookup and checkout
            log.debug("Handle for {}/{} closed during checkout, reopening", identity.server(), identity.database());
            ConnectionEntry fresh = reserveExisting(key);
            if (fresh == null) {
                fresh = create(key, identity, owner);
            }
            try {
                return checkout(fresh, identity);
            } catch (StaleHandleException retryFailure) {
                throw new QueryExecutionException("Connection handle closed during checkout", retryFailure.getCause());
            }
        }
    }

    private ConnectionEntry reserveExisting(ConnectionKey key) {
        lock.lock();
        try {
            ensureOpen();
            ConnectionEntry entry = entries.get(key);
            if (entry != null) {
                entry.reserve(clock.instant());
            }
            return entry;
        } finally {
            lock.unlock();
        }
    }

    private ConnectionEntry create(ConnectionKey key, ConnectionIdentity identity, long owner) {
        String poolName = String.format("sqlgate-%s-%s-%d",
            identity.server(), identity.database(), poolSequence.incrementAndGet());

        // Handshake happens outside the lock
        ConnectionHandle handle = handleFactory.open(identity, poolName);

        List<ConnectionEntry> victims = new ArrayList<>();
        ConnectionEntry result;
        boolean lostRace = false;
        boolean poolClosed = false;

        lock.lock();
        try {
            Instant now = clock.instant();
            if (closed) {
                poolClosed = true;
                result = null;
            } else {
                ConnectionEntry existing = entries.get(key);
                if (existing != null) {
                    existing.reserve(now);
                    result = existing;
                    lostRace = true;
                } else {
                    while (entries.size() >= maxEntries) {
                        ConnectionEntry victim = selectVictim();
                        entries.remove(victim.getKey());
                        victims.add(victim);
                    }
                    result = new ConnectionEntry(key, handle, poolName, owner, identity.server(),
                        identity.database(), now);
                    result.reserve(now);
                    entries.put(key, result);
                }
            }
        } finally {
            lock.unlock();
        }

        if (poolClosed || lostRace) {
            handle.close();
        }
        if (poolClosed) {
            throw new IllegalStateException("Connection pool is closed");
        }

        victims.forEach(victim -> dispose(victim, "capacity"));

        if (!lostRace) {
            meterRegistry.counter("sqlgate.pool.created").increment();
            log.info("🔗 Created connection handle {} for {}/{} (owner: {})",
                poolName, identity.server(), identity.database(), owner);
        }
        return result;
    }

    /**
     * Least recently accessed idle entry, or the least recently accessed entry overall when none is idle.
     * Caller holds the lock.
     */
    private ConnectionEntry selectVictim() {
        Comparator<ConnectionEntry> byAccess = Comparator.comparing(ConnectionEntry::getLastAccessed);

        ConnectionEntry idle = entries.values().stream()
            .filter(ConnectionEntry::isIdle)
            .min(byAccess)
            .orElse(null);
        if (idle != null) {
            return idle;
        }

        ConnectionEntry oldest = entries.values().stream().min(byAccess).orElseThrow();
        log.warn("⚠️ All {} connection handles are in use, force-evicting {} ({}/{})",
            entries.size(), oldest.getPoolName(), oldest.getServer(), oldest.getDatabase());
        meterRegistry.counter("sqlgate.pool.forced_evictions").increment();
        return oldest;
    }

    private PooledSession checkout(ConnectionEntry entry, ConnectionIdentity identity) {
        try {
            Connection connection = entry.getHandle().getConnection();
            return new PooledSession(connection, identity.technology(), () -> touch(entry));
        } catch (SQLTransientConnectionException e) {
            throw new PoolExhaustedException(
                String.format("No connection to %s/%s available, try again shortly",
                    identity.server(), identity.database()), e);
        } catch (SQLException e) {
            if (entry.getHandle().isClosed()) {
                throw new StaleHandleException(e);
            }
            throw new QueryExecutionException(
                String.format("Could not connect to %s/%s: %s", identity.server(), identity.database(),
                    e.getMessage()), e);
        } finally {
            releaseReservation(entry);
        }
    }

    private void releaseReservation(ConnectionEntry entry) {
        lock.lock();
        try {
            entry.releaseReservation();
        } finally {
            lock.unlock();
        }
    }

    private void touch(ConnectionEntry entry) {
        lock.lock();
        try {
            entry.touch(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close idle entries created by the owner. Entries in use are left for the sweep.
     *
     * @return number of entries closed
     */
    public int evictOwner(long owner) {
        List<ConnectionEntry> victims = new ArrayList<>();
        int skipped = 0;

        lock.lock();
        try {
            for (ConnectionEntry entry : new ArrayList<>(entries.values())) {
                if (entry.getOwner() != owner) {
                    continue;
                }
                if (entry.isIdle()) {
                    entries.remove(entry.getKey());
                    victims.add(entry);
                } else {
                    skipped++;
                }
            }
        } finally {
            lock.unlock();
        }

        victims.forEach(victim -> dispose(victim, "owner"));
        if (!victims.isEmpty() || skipped > 0) {
            log.info("🔌 Closed {} connection handles for user {} ({} still in use)", victims.size(), owner, skipped);
        }
        return victims.size();
    }

    /**
     * Close entries idle for at least the TTL and confirmed idle by their handle
     *
     * @return number of entries closed
     */
    public int sweepExpired() {
        List<ConnectionEntry> victims = new ArrayList<>();

        lock.lock();
        try {
            Instant now = clock.instant();
            for (ConnectionEntry entry : new ArrayList<>(entries.values())) {
                if (entry.idleLongerThan(idleTtl, now) && entry.isIdle()) {
                    entries.remove(entry.getKey());
                    victims.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }

        victims.forEach(victim -> dispose(victim, "ttl"));
        if (!victims.isEmpty()) {
            log.info("🧹 Sweep closed {} expired connection handles", victims.size());
        }
        return victims.size();
    }

    /**
     * Start the background TTL sweep. Calling it again while running is a no-op.
     */
    public synchronized void startSweep(Duration interval) {
        if (sweepTask != null && !sweepTask.isDone()) {
            return;
        }
        if (sweeper == null || sweeper.isShutdown()) {
            sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "sqlgate-pool-sweep");
                thread.setDaemon(true);
                return thread;
            });
        }
        long millis = interval.toMillis();
        sweepTask = sweeper.scheduleWithFixedDelay(this::runSweep, millis, millis, TimeUnit.MILLISECONDS);
        log.info("⏱️ Connection sweep every {} (TTL {}, capacity {})", interval, idleTtl, maxEntries);
    }

    /**
     * Cancel the sweep and wait, bounded by the shutdown timeout, for an in-flight run to finish
     */
    public synchronized void stopSweep() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (sweeper == null) {
            return;
        }
        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("⚠️ Connection sweep did not stop within {}", shutdownTimeout);
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }
        sweeper = null;
    }

    private void runSweep() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            // An escaped exception would cancel the scheduled task
            log.error("❌ Connection sweep failed", e);
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop the sweep and close every handle
     */
    @PreDestroy
    @Override
    public void close() {
        stopSweep();

        List<ConnectionEntry> all;
        lock.lock();
        try {
            closed = true;
            all = new ArrayList<>(entries.values());
            entries.clear();
        } finally {
            lock.unlock();
        }

        log.info("🔌 Shutting down {} connection handles", all.size());
        all.forEach(entry -> dispose(entry, "shutdown"));
    }

    private void dispose(ConnectionEntry entry, String reason) {
        try {
            entry.getHandle().close();
        } catch (RuntimeException e) {
            log.warn("⚠️ Failed to close connection handle {}: {}", entry.getPoolName(), e.getMessage());
        }
        meterRegistry.counter("sqlgate.pool.evictions", "reason", reason).increment();
        log.debug("Closed connection handle {} ({}/{}), reason: {}",
            entry.getPoolName(), entry.getServer(), entry.getDatabase(), reason);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection pool is closed");
        }
    }

    private static final class StaleHandleException extends RuntimeException {
        StaleHandleException(SQLException cause) {
            super(cause);
        }
    }
}
