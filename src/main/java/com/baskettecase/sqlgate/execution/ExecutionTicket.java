package com.baskettecase.sqlgate.execution;

import java.time.Instant;

/**
 * Handle for an execution log entry opened by {@link ExecutionLogger#begin}.
 */
public record ExecutionTicket(long id, Instant startedAt) {
}
