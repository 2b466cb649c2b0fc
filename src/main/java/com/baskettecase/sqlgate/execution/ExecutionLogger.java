package com.baskettecase.sqlgate.execution;

import com.baskettecase.sqlgate.store.ExecutionLogRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Execution Logger
 *
 * Brackets every execution attempt with a log entry. {@link #finish} only updates an unfinished
 * entry, so a second call for the same ticket does nothing.
 */
@Slf4j
@Service
public class ExecutionLogger {

    private final ExecutionLogRepository repository;
    private final Clock clock;
    private final Counter failureCounter;

    public ExecutionLogger(ExecutionLogRepository repository, Clock clock, MeterRegistry meterRegistry) {
        this.repository = repository;
        this.clock = clock;
        this.failureCounter = Counter.builder("sqlgate.execution_log.failures")
            .description("Execution log writes that failed")
            .register(meterRegistry);
    }

    public ExecutionTicket begin(long userId, String queryText, String server, String database,
                                 boolean approvedExecution) {
        Instant startedAt = clock.instant();
        long id = repository.insertStarted(userId, queryText, server, database, startedAt, approvedExecution);
        log.debug("Execution {} started for user {} on {}/{}", id, userId, server, database);
        return new ExecutionTicket(id, startedAt);
    }

    /**
     * Finalize the entry. Store failures are logged and counted rather than thrown so they never
     * replace the outcome of the query itself.
     *
     * @return true when this call finalized the entry
     */
    public boolean finish(ExecutionTicket ticket, ExecutionOutcome outcome) {
        Instant finishedAt = clock.instant();
        long durationMs = Duration.between(ticket.startedAt(), finishedAt).toMillis();
        try {
            int updated = repository.finish(ticket.id(), finishedAt, durationMs, outcome.success(),
                outcome.rowCount(), outcome.errorMessage());
            if (updated == 0) {
                log.debug("Execution {} already finished", ticket.id());
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            failureCounter.increment();
            log.error("❌ Failed to finish execution log entry {}: {}", ticket.id(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * Record a query that was stopped before running, such as one sent for approval
     */
    public void recordRejected(long userId, String queryText, String server, String database, String reason) {
        try {
            ExecutionTicket ticket = begin(userId, queryText, server, database, false);
            finish(ticket, ExecutionOutcome.failure(reason));
        } catch (DataAccessException e) {
            failureCounter.increment();
            log.error("❌ Failed to log rejected query for user {}: {}", userId, e.getMessage(), e);
        }
    }
}
