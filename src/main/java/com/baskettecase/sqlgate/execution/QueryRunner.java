package com.baskettecase.sqlgate.execution;

import com.baskettecase.sqlgate.config.GatewayProperties;
import com.baskettecase.sqlgate.db.ConnectionIdentity;
import com.baskettecase.sqlgate.db.ConnectionPool;
import com.baskettecase.sqlgate.db.PooledSession;
import com.baskettecase.sqlgate.db.ServerEntry;
import com.baskettecase.sqlgate.db.ServerRegistry;
import com.baskettecase.sqlgate.error.QueryExecutionException;
import com.baskettecase.sqlgate.security.CredentialCache;
import com.baskettecase.sqlgate.store.AppUser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;

/**
 * Runs a query as a given user: resolves the target, rehydrates the user's credential, checks a
 * connection out of the pool and brackets the work with an execution log entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryRunner {

    private final ServerRegistry serverRegistry;
    private final CredentialCache credentialCache;
    private final ConnectionPool connectionPool;
    private final QueryExecutor queryExecutor;
    private final ExecutionLogger executionLogger;
    private final GatewayProperties properties;
    private final MeterRegistry meterRegistry;

    private Timer queryTimer;

    @PostConstruct
    public void initializeMetrics() {
        queryTimer = Timer.builder("sqlgate.query.duration")
            .description("Time taken to execute queries")
            .register(meterRegistry);
    }

    /**
     * Execute {@code sql} on {@code server}/{@code database} with {@code user}'s database credential
     *
     * @throws com.baskettecase.sqlgate.error.ServerNotConfiguredException unknown server or database
     * @throws com.baskettecase.sqlgate.error.CredentialUnavailableException no live session for the user
     * @throws com.baskettecase.sqlgate.error.PoolExhaustedException no connection available in time
     * @throws QueryExecutionException the database failed the query
     */
    public QueryResult run(AppUser user, String server, String database, String sql, ExecutionMode mode) {
        serverRegistry.resolve(server, database);
        ServerEntry entry = serverRegistry.server(server);
        String canonicalDatabase = entry.findDatabase(database).orElse(database);

        String password = credentialCache.fetch(user.id()).orElseThrow(user.id());
        ConnectionIdentity identity = ConnectionIdentity.of(entry, canonicalDatabase, user.username(), password);

        ExecutionTicket ticket = executionLogger.begin(user.id(), sql, entry.name(), canonicalDatabase,
            mode == ExecutionMode.APPROVED);

        log.info("▶️ {} query by {} on {}/{} (log {})", mode, user.username(), entry.name(), canonicalDatabase,
            ticket.id());
        Timer.Sample sample = Timer.start(meterRegistry);
        PooledSession session = null;
        try {
            session = connectionPool.acquire(identity, user.id());
            QueryResult result = queryExecutor.execute(session.getConnection(), sql, rowLimit(mode));
            executionLogger.finish(ticket, ExecutionOutcome.success(result.rowCount()));
            count(mode, "success");
            log.info("✅ Query {} finished: {}", ticket.id(), result.message());
            return result;
        } catch (RuntimeException e) {
            executionLogger.finish(ticket, ExecutionOutcome.failure(failureMessage(e)));
            count(mode, "failure");
            throw e;
        } finally {
            release(session, ticket);
            sample.stop(queryTimer);
        }
    }

    /**
     * Return the connection. The query outcome is already logged, so a failed return is only reported.
     */
    private void release(PooledSession session, ExecutionTicket ticket) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (SQLException e) {
            log.warn("⚠️ Returning the connection of query {} failed: {}", ticket.id(), e.getMessage());
            meterRegistry.counter("sqlgate.query.release_failures").increment();
        }
    }

    private static String failureMessage(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private int rowLimit(ExecutionMode mode) {
        GatewayProperties.Execution limits = properties.getExecution();
        return mode == ExecutionMode.PREVIEW ? limits.getPreviewMaxRows() : limits.getMaxRows();
    }

    private void count(ExecutionMode mode, String outcome) {
        Counter.builder("sqlgate.query.executions")
            .description("Query executions by mode and outcome")
            .tag("mode", mode.name().toLowerCase())
            .tag("outcome", outcome)
            .register(meterRegistry)
            .increment();
    }
}
