package com.baskettecase.sqlgate.workflow;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QueryStatus
 */
class QueryStatusTest {

    @Test
    void testHappyPathTransitions() {
        assertTrue(QueryStatus.DRAFT.canTransitionTo(QueryStatus.WAITING_FOR_APPROVAL));
        assertTrue(QueryStatus.WAITING_FOR_APPROVAL.canTransitionTo(QueryStatus.APPROVED_WITH_RESULTS));
        assertTrue(QueryStatus.APPROVED_WITH_RESULTS.canTransitionTo(QueryStatus.APPROVED_AND_EXECUTED));
        assertTrue(QueryStatus.APPROVED.canTransitionTo(QueryStatus.APPROVAL_EXECUTION_FAILED));
    }

    @Test
    void testNoStatusReturnsToAnEarlierOne() {
        for (QueryStatus from : QueryStatus.values()) {
            for (QueryStatus to : from.successors()) {
                assertTrue(to.ordinal() > from.ordinal(), from + " -> " + to);
                assertFalse(to.canTransitionTo(from), to + " -> " + from);
            }
        }
    }

    @Test
    void testDecidedQueriesCannotBeRedecided() {
        assertFalse(QueryStatus.APPROVED.canTransitionTo(QueryStatus.REJECTED));
        assertFalse(QueryStatus.REJECTED.canTransitionTo(QueryStatus.APPROVED));
        assertFalse(QueryStatus.WAITING_FOR_APPROVAL.canTransitionTo(QueryStatus.APPROVED_AND_EXECUTED));
    }

    @Test
    void testTerminalStatuses() {
        EnumSet<QueryStatus> terminal = EnumSet.noneOf(QueryStatus.class);
        for (QueryStatus status : QueryStatus.values()) {
            if (status.isTerminal()) {
                terminal.add(status);
            }
        }
        assertEquals(EnumSet.of(QueryStatus.REJECTED, QueryStatus.APPROVED_AND_EXECUTED,
            QueryStatus.APPROVAL_EXECUTION_FAILED), terminal);
    }

    @Test
    void testApprovedStatuses() {
        assertTrue(QueryStatus.APPROVED.isApproved());
        assertTrue(QueryStatus.APPROVED_WITH_RESULTS.isApproved());
        assertFalse(QueryStatus.WAITING_FOR_APPROVAL.isApproved());
        assertFalse(QueryStatus.APPROVED_AND_EXECUTED.isApproved());
    }

    @Test
    void testDbValues() {
        assertEquals("saved_in_workspace", QueryStatus.DRAFT.dbValue());
        for (QueryStatus status : QueryStatus.values()) {
            assertEquals(status, QueryStatus.fromDbValue(status.dbValue()));
        }
        assertThrows(IllegalArgumentException.class, () -> QueryStatus.fromDbValue("pending"));
    }
}
