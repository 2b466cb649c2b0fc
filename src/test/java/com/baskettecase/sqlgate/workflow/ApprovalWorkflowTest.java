package com.baskettecase.sqlgate.workflow;

import com.baskettecase.sqlgate.config.GatewayProperties;
import com.baskettecase.sqlgate.db.ServerEntry;
import com.baskettecase.sqlgate.db.ServerRegistry;
import com.baskettecase.sqlgate.db.Technology;
import com.baskettecase.sqlgate.error.CredentialUnavailableException;
import com.baskettecase.sqlgate.error.ErrorCode;
import com.baskettecase.sqlgate.error.QueryExecutionException;
import com.baskettecase.sqlgate.error.WorkflowStateException;
import com.baskettecase.sqlgate.execution.ExecutionLogger;
import com.baskettecase.sqlgate.execution.ExecutionMode;
import com.baskettecase.sqlgate.execution.QueryResult;
import com.baskettecase.sqlgate.execution.QueryRunner;
import com.baskettecase.sqlgate.notify.ApprovalNotifier;
import com.baskettecase.sqlgate.notify.ApprovalRequest;
import com.baskettecase.sqlgate.security.CredentialCache;
import com.baskettecase.sqlgate.security.CredentialLookup;
import com.baskettecase.sqlgate.sql.RiskCategory;
import com.baskettecase.sqlgate.sql.RiskClassifier;
import com.baskettecase.sqlgate.store.AppUser;
import com.baskettecase.sqlgate.store.QueryRecord;
import com.baskettecase.sqlgate.store.WorkspaceDetails;
import com.baskettecase.sqlgate.store.WorkspaceRecord;
import com.baskettecase.sqlgate.store.WorkspaceRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ApprovalWorkflow
 */
@ExtendWith(MockitoExtension.class)
class ApprovalWorkflowTest {

    private static final AppUser ALICE = new AppUser(7L, "alice", null, false, true, Instant.EPOCH);
    private static final AppUser BOB = new AppUser(8L, "bob", null, false, true, Instant.EPOCH);
    private static final AppUser ADMIN = new AppUser(1L, "admin", null, true, true, Instant.EPOCH);
    private static final ServerEntry SQL01 = new ServerEntry("sql01", Technology.MSSQL, "sql01", 1433,
        List.of("Sales"), Map.of());
    private static final long WORKSPACE_ID = 3L;
    private static final String RISKY = "DELETE FROM orders";
    private static final QueryResult RESULT = QueryResult.updated(12);

    @Mock
    private ServerRegistry serverRegistry;

    @Mock
    private QueryRunner queryRunner;

    @Mock
    private ExecutionLogger executionLogger;

    @Mock
    private CredentialCache credentialCache;

    @Mock
    private WorkspaceRepository workspaceRepository;

    @Mock
    private ApprovalNotifier approvalNotifier;

    private GatewayProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private ApprovalWorkflow workflow;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getExecution().setMaxBatchSize(3);
        meterRegistry = new SimpleMeterRegistry();
        workflow = new ApprovalWorkflow(serverRegistry, new RiskClassifier(), queryRunner, executionLogger,
            credentialCache, workspaceRepository, approvalNotifier, properties, meterRegistry);
    }

    private static WorkspaceDetails workspace(QueryStatus status, Boolean showResults) {
        QueryRecord query = new QueryRecord(30L, ALICE.id(), "sql01", "Sales", RISKY, "corr-1", status,
            RiskCategory.UNSCOPED_MUTATION, Instant.EPOCH, Instant.EPOCH);
        WorkspaceRecord workspace = new WorkspaceRecord(WORKSPACE_ID, ALICE.id(), "Pending: " + RISKY, null, 30L,
            showResults, Instant.EPOCH);
        return new WorkspaceDetails(workspace, query, ALICE.username());
    }

    private void stubTarget() {
        when(serverRegistry.resolve("sql01", "sales")).thenReturn(Technology.MSSQL);
        when(serverRegistry.server("sql01")).thenReturn(SQL01);
    }

    private void stubWorkspace(WorkspaceDetails details) {
        when(workspaceRepository.findById(WORKSPACE_ID)).thenReturn(Optional.of(details));
    }

    private static ErrorCode codeOf(Runnable action) {
        WorkflowStateException e = assertThrows(WorkflowStateException.class, action::run);
        return e.getCode();
    }

    // submit

    @Test
    void testSafeQueryRunsImmediately() {
        stubTarget();
        when(queryRunner.run(ALICE, "sql01", "Sales", "SELECT id FROM orders WHERE id = 1", ExecutionMode.DIRECT))
            .thenReturn(RESULT);

        SubmissionResult result = workflow.submit(ALICE, "sql01", "sales", "SELECT id FROM orders WHERE id = 1");

        assertEquals(SubmissionResult.Outcome.EXECUTED, result.outcome());
        assertSame(RESULT, result.result());
        verifyNoInteractions(workspaceRepository, approvalNotifier);
    }

    @Test
    void testRiskyQueryIsSavedAndSentForApproval() {
        stubTarget();
        when(workspaceRepository.createWithQuery(any(), anyString(), anyString(), isNull()))
            .thenReturn(workspace(QueryStatus.WAITING_FOR_APPROVAL, null));

        SubmissionResult result = workflow.submit(ALICE, "sql01", "sales", RISKY);

        assertEquals(SubmissionResult.Outcome.SENT_FOR_APPROVAL, result.outcome());
        assertEquals(WORKSPACE_ID, result.workspaceId());
        assertEquals(RiskCategory.UNSCOPED_MUTATION, result.riskCategory());
        assertEquals("Query flagged as risky_pattern. Query saved to your workspaces (workspace 3) "
            + "and sent for admin approval.", result.message());

        ArgumentCaptor<QueryRecord> record = ArgumentCaptor.forClass(QueryRecord.class);
        verify(workspaceRepository).createWithQuery(record.capture(), eq("Pending: " + RISKY),
            eq("Risk Type: risky_pattern - Waiting for admin approval"), isNull());
        assertEquals(QueryStatus.WAITING_FOR_APPROVAL, record.getValue().status());
        assertEquals("Sales", record.getValue().databaseName());
        assertNotNull(record.getValue().correlationId());

        verify(executionLogger).recordRejected(7L, RISKY, "sql01", "Sales", "Query rejected: risky_pattern");
        ArgumentCaptor<ApprovalRequest> request = ArgumentCaptor.forClass(ApprovalRequest.class);
        verify(approvalNotifier).notifyAsync(request.capture());
        assertEquals("alice", request.getValue().username());
        assertEquals("corr-1", request.getValue().correlationId());
        verifyNoInteractions(queryRunner);
        assertEquals(1.0, meterRegistry.counter("sqlgate.approvals", "outcome", "submitted").count());
    }

    @Test
    void testAdminBypassesTheGate() {
        stubTarget();
        when(queryRunner.run(ADMIN, "sql01", "Sales", RISKY, ExecutionMode.DIRECT)).thenReturn(RESULT);

        SubmissionResult result = workflow.submit(ADMIN, "sql01", "sales", RISKY);

        assertEquals(SubmissionResult.Outcome.EXECUTED, result.outcome());
        verifyNoInteractions(workspaceRepository);
    }

    @Test
    void testBlankQueryIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> workflow.submit(ALICE, "sql01", "sales", "  "));
        verifyNoInteractions(serverRegistry);
    }

    @Test
    void testPendingNameIsCompactedAndTruncated() {
        assertEquals("Pending: SELECT a FROM b", ApprovalWorkflow.pendingName("SELECT a\n   FROM b"));
        String longQuery = "SELECT " + "x".repeat(100);
        String name = ApprovalWorkflow.pendingName(longQuery);
        assertEquals("Pending: " + longQuery.substring(0, 50) + "...", name);
    }

    // batch

    @Test
    void testBatchReportsPerEntryFailures() {
        stubTarget();
        String good = "SELECT id FROM orders WHERE id = 1";
        String bad = "SELECT nope FROM orders WHERE id = 1";
        when(queryRunner.run(ALICE, "sql01", "Sales", good, ExecutionMode.DIRECT)).thenReturn(RESULT);
        when(queryRunner.run(ALICE, "sql01", "Sales", bad, ExecutionMode.DIRECT))
            .thenThrow(new QueryExecutionException("Invalid column name 'nope'"));

        List<SubmissionResult> results = workflow.submitBatch(ALICE, "sql01", "sales", List.of(good, bad));

        assertEquals(2, results.size());
        assertEquals(SubmissionResult.Outcome.EXECUTED, results.get(0).outcome());
        assertEquals(SubmissionResult.Outcome.FAILED, results.get(1).outcome());
        assertEquals(ErrorCode.EXECUTION_ERROR, results.get(1).errorCode());
        assertEquals("Invalid column name 'nope'", results.get(1).message());
    }

    @Test
    void testBatchSessionErrorStopsTheBatch() {
        stubTarget();
        when(queryRunner.run(eq(ALICE), anyString(), anyString(), anyString(), eq(ExecutionMode.DIRECT)))
            .thenThrow(new CredentialUnavailableException(7L, true));

        assertThrows(CredentialUnavailableException.class, () -> workflow.submitBatch(ALICE, "sql01", "sales",
            List.of("SELECT 1 FROM t WHERE a = 1", "SELECT 2 FROM t WHERE a = 1")));
        verify(queryRunner, times(1)).run(any(), anyString(), anyString(), anyString(), any());
    }

    @Test
    void testBatchSizeLimits() {
        assertThrows(IllegalArgumentException.class,
            () -> workflow.submitBatch(ALICE, "sql01", "sales", List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> workflow.submitBatch(ALICE, "sql01", "sales", Collections.nCopies(4, "SELECT 1")));
        verifyNoInteractions(serverRegistry, queryRunner);
    }

    // decisions

    @Test
    void testApproveWithResults() {
        when(workspaceRepository.findById(WORKSPACE_ID)).thenReturn(
            Optional.of(workspace(QueryStatus.WAITING_FOR_APPROVAL, null)),
            Optional.of(workspace(QueryStatus.APPROVED_WITH_RESULTS, true)));
        when(workspaceRepository.transition(WORKSPACE_ID, QueryStatus.WAITING_FOR_APPROVAL,
            QueryStatus.APPROVED_WITH_RESULTS, ApprovalWorkflow.APPROVED_CAN_EXECUTE, true)).thenReturn(true);

        WorkspaceDetails approved = workflow.approve(WORKSPACE_ID, ADMIN, true);

        assertEquals(QueryStatus.APPROVED_WITH_RESULTS, approved.query().status());
        verifyNoInteractions(queryRunner);
    }

    @Test
    void testApproveWithoutResults() {
        stubWorkspace(workspace(QueryStatus.WAITING_FOR_APPROVAL, null));
        when(workspaceRepository.transition(WORKSPACE_ID, QueryStatus.WAITING_FOR_APPROVAL,
            QueryStatus.APPROVED, ApprovalWorkflow.APPROVED_CANNOT_EXECUTE, false)).thenReturn(true);

        workflow.approve(WORKSPACE_ID, ADMIN, false);

        assertEquals(1.0, meterRegistry.counter("sqlgate.approvals", "outcome", "approved").count());
    }

    @Test
    void testReject() {
        stubWorkspace(workspace(QueryStatus.WAITING_FOR_APPROVAL, null));
        when(workspaceRepository.transition(WORKSPACE_ID, QueryStatus.WAITING_FOR_APPROVAL,
            QueryStatus.REJECTED, ApprovalWorkflow.REJECTED_BY_ADMIN, false)).thenReturn(true);

        workflow.reject(WORKSPACE_ID, ADMIN);

        verify(workspaceRepository).transition(WORKSPACE_ID, QueryStatus.WAITING_FOR_APPROVAL,
            QueryStatus.REJECTED, ApprovalWorkflow.REJECTED_BY_ADMIN, false);
    }

    @Test
    void testDecisionOnDecidedQueryIsAConflict() {
        stubWorkspace(workspace(QueryStatus.REJECTED, false));

        assertEquals(ErrorCode.CONFLICT, codeOf(() -> workflow.approve(WORKSPACE_ID, ADMIN, true)));
        verify(workspaceRepository, never()).transition(anyLong(), any(), any(), any(), any());
    }

    @Test
    void testLostDecisionRaceIsAConflict() {
        stubWorkspace(workspace(QueryStatus.WAITING_FOR_APPROVAL, null));
        when(workspaceRepository.transition(anyLong(), any(), any(), anyString(), anyBoolean())).thenReturn(false);

        assertEquals(ErrorCode.CONFLICT, codeOf(() -> workflow.reject(WORKSPACE_ID, ADMIN)));
    }

    @Test
    void testDecisionsRequireAdmin() {
        assertEquals(ErrorCode.FORBIDDEN, codeOf(() -> workflow.approve(WORKSPACE_ID, ALICE, true)));
        assertEquals(ErrorCode.FORBIDDEN, codeOf(() -> workflow.reject(WORKSPACE_ID, ALICE)));
        assertEquals(ErrorCode.FORBIDDEN, codeOf(() -> workflow.preview(WORKSPACE_ID, ALICE)));
        assertEquals(ErrorCode.FORBIDDEN, codeOf(() -> workflow.listPendingApprovals(ALICE)));
        verifyNoInteractions(workspaceRepository);
    }

    @Test
    void testUnknownWorkspaceIsNotFound() {
        when(workspaceRepository.findById(99L)).thenReturn(Optional.empty());

        assertEquals(ErrorCode.NOT_FOUND, codeOf(() -> workflow.approve(99L, ADMIN, true)));
    }

    @Test
    void testPreviewRunsAsAdminWithoutChangingStatus() {
        stubWorkspace(workspace(QueryStatus.WAITING_FOR_APPROVAL, null));
        when(queryRunner.run(ADMIN, "sql01", "Sales", RISKY, ExecutionMode.PREVIEW)).thenReturn(RESULT);

        assertSame(RESULT, workflow.preview(WORKSPACE_ID, ADMIN));
        verify(workspaceRepository, never()).transition(anyLong(), any(), any(), any(), any());
    }

    @Test
    void testListPendingApprovals() {
        when(workspaceRepository.findByStatus(QueryStatus.WAITING_FOR_APPROVAL))
            .thenReturn(List.of(workspace(QueryStatus.WAITING_FOR_APPROVAL, null)));

        assertEquals(1, workflow.listPendingApprovals(ADMIN).size());
    }

    // execution of approved queries

    @Test
    void testExecuteApprovedRunsAsOwnerAndRecordsExecution() {
        stubWorkspace(workspace(QueryStatus.APPROVED_WITH_RESULTS, true));
        when(credentialCache.fetch(7L)).thenReturn(CredentialLookup.found("pw"));
        when(queryRunner.run(ALICE, "sql01", "Sales", RISKY, ExecutionMode.APPROVED)).thenReturn(RESULT);
        when(workspaceRepository.transition(WORKSPACE_ID, QueryStatus.APPROVED_WITH_RESULTS,
            QueryStatus.APPROVED_AND_EXECUTED, ApprovalWorkflow.EXECUTED_BY_OWNER, null)).thenReturn(true);

        assertSame(RESULT, workflow.executeApproved(WORKSPACE_ID, ALICE));

        verify(workspaceRepository).transition(WORKSPACE_ID, QueryStatus.APPROVED_WITH_RESULTS,
            QueryStatus.APPROVED_AND_EXECUTED, ApprovalWorkflow.EXECUTED_BY_OWNER, null);
    }

    @Test
    void testExecuteApprovedFailureIsRecordedAndRethrown() {
        stubWorkspace(workspace(QueryStatus.APPROVED_WITH_RESULTS, true));
        when(credentialCache.fetch(7L)).thenReturn(CredentialLookup.found("pw"));
        when(queryRunner.run(ALICE, "sql01", "Sales", RISKY, ExecutionMode.APPROVED))
            .thenThrow(new QueryExecutionException("deadlock victim"));
        when(workspaceRepository.transition(WORKSPACE_ID, QueryStatus.APPROVED_WITH_RESULTS,
            QueryStatus.APPROVAL_EXECUTION_FAILED, "Execution failed: deadlock victim", null)).thenReturn(true);

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
            () -> workflow.executeApproved(WORKSPACE_ID, ALICE));

        assertEquals("deadlock victim", e.getMessage());
        verify(workspaceRepository, never()).transition(anyLong(), any(), eq(QueryStatus.APPROVED_AND_EXECUTED),
            any(), any());
    }

    @Test
    void testExecuteWhileWaitingIsNotApproved() {
        stubWorkspace(workspace(QueryStatus.WAITING_FOR_APPROVAL, null));

        assertEquals(ErrorCode.NOT_APPROVED, codeOf(() -> workflow.executeApproved(WORKSPACE_ID, ALICE)));
        verifyNoInteractions(queryRunner, credentialCache);
    }

    @Test
    void testExecuteAfterExecutionIsNotApproved() {
        stubWorkspace(workspace(QueryStatus.APPROVED_AND_EXECUTED, true));

        assertEquals(ErrorCode.NOT_APPROVED, codeOf(() -> workflow.executeApproved(WORKSPACE_ID, ALICE)));
    }

    @Test
    void testExecuteWithoutReleasedResultsIsForbidden() {
        stubWorkspace(workspace(QueryStatus.APPROVED, false));

        assertEquals(ErrorCode.FORBIDDEN, codeOf(() -> workflow.executeApproved(WORKSPACE_ID, ALICE)));
        verifyNoInteractions(queryRunner);
    }

    @Test
    void testOnlyOwnerMayExecute() {
        stubWorkspace(workspace(QueryStatus.APPROVED_WITH_RESULTS, true));

        assertEquals(ErrorCode.FORBIDDEN, codeOf(() -> workflow.executeApproved(WORKSPACE_ID, BOB)));
        assertEquals(ErrorCode.FORBIDDEN, codeOf(() -> workflow.executeApproved(WORKSPACE_ID, ADMIN)));
    }

    @Test
    void testExpiredSessionLeavesRecordUntouched() {
        stubWorkspace(workspace(QueryStatus.APPROVED_WITH_RESULTS, true));
        when(credentialCache.fetch(7L)).thenReturn(CredentialLookup.expired());

        assertThrows(CredentialUnavailableException.class, () -> workflow.executeApproved(WORKSPACE_ID, ALICE));

        verifyNoInteractions(queryRunner);
        verify(workspaceRepository, never()).transition(anyLong(), any(), any(), any(), any());
    }

    @Test
    void testConcurrentExecutionIsRefused() throws Exception {
        stubWorkspace(workspace(QueryStatus.APPROVED_WITH_RESULTS, true));
        when(credentialCache.fetch(7L)).thenReturn(CredentialLookup.found("pw"));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(queryRunner.run(ALICE, "sql01", "Sales", RISKY, ExecutionMode.APPROVED)).thenAnswer(invocation -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return RESULT;
        });
        when(workspaceRepository.transition(anyLong(), any(), any(), anyString(), isNull())).thenReturn(true);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<QueryResult> first = executor.submit(() -> workflow.executeApproved(WORKSPACE_ID, ALICE));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertEquals(ErrorCode.IN_PROGRESS, codeOf(() -> workflow.executeApproved(WORKSPACE_ID, ALICE)));

            release.countDown();
            assertSame(RESULT, first.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        verify(queryRunner, times(1)).run(any(), anyString(), anyString(), anyString(), any());
    }

    @Test
    void testOverlappingExecutionRunsTheQueryOnce() throws Exception {
        AtomicReference<QueryStatus> status = new AtomicReference<>(QueryStatus.APPROVED_WITH_RESULTS);
        when(workspaceRepository.findById(WORKSPACE_ID))
            .thenAnswer(invocation -> Optional.of(workspace(status.get(), true)));
        when(workspaceRepository.transition(eq(WORKSPACE_ID), any(), any(), anyString(), isNull()))
            .thenAnswer(invocation -> status.compareAndSet(invocation.getArgument(1), invocation.getArgument(2)));
        when(queryRunner.run(ALICE, "sql01", "Sales", RISKY, ExecutionMode.APPROVED)).thenReturn(RESULT);

        CountDownLatch firstInFetch = new CountDownLatch(1);
        CountDownLatch secondDone = new CountDownLatch(1);
        AtomicInteger fetches = new AtomicInteger();
        when(credentialCache.fetch(7L)).thenAnswer(invocation -> {
            if (fetches.incrementAndGet() == 1) {
                firstInFetch.countDown();
                assertTrue(secondDone.await(5, TimeUnit.SECONDS));
            }
            return CredentialLookup.found("pw");
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<QueryResult> first = executor.submit(() -> workflow.executeApproved(WORKSPACE_ID, ALICE));
            assertTrue(firstInFetch.await(5, TimeUnit.SECONDS));

            assertSame(RESULT, workflow.executeApproved(WORKSPACE_ID, ALICE));
            secondDone.countDown();

            ExecutionException e = assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
            WorkflowStateException refused = assertInstanceOf(WorkflowStateException.class, e.getCause());
            assertEquals(ErrorCode.NOT_APPROVED, refused.getCode());
        } finally {
            executor.shutdownNow();
        }
        verify(queryRunner, times(1)).run(any(), anyString(), anyString(), anyString(), any());
        assertEquals(QueryStatus.APPROVED_AND_EXECUTED, status.get());
    }

    @Test
    void testStoreErrorWhileRecordingFailureKeepsExecutionError() {
        stubWorkspace(workspace(QueryStatus.APPROVED_WITH_RESULTS, true));
        when(credentialCache.fetch(7L)).thenReturn(CredentialLookup.found("pw"));
        when(queryRunner.run(ALICE, "sql01", "Sales", RISKY, ExecutionMode.APPROVED))
            .thenThrow(new QueryExecutionException("deadlock victim"));
        DataAccessResourceFailureException storeDown = new DataAccessResourceFailureException("store down");
        when(workspaceRepository.transition(anyLong(), any(), eq(QueryStatus.APPROVAL_EXECUTION_FAILED),
            anyString(), isNull())).thenThrow(storeDown);

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
            () -> workflow.executeApproved(WORKSPACE_ID, ALICE));

        assertEquals("deadlock victim", e.getMessage());
        assertArrayEquals(new Throwable[] {storeDown}, e.getSuppressed());
    }

    // drafts

    @Test
    void testRequestApprovalClassifiesAndNotifies() {
        WorkspaceDetails draft = workspace(QueryStatus.DRAFT, null);
        when(workspaceRepository.transition(WORKSPACE_ID, QueryStatus.DRAFT, QueryStatus.WAITING_FOR_APPROVAL,
            "Risk Type: risky_pattern - Waiting for admin approval", null)).thenReturn(true);
        stubWorkspace(workspace(QueryStatus.WAITING_FOR_APPROVAL, null));

        WorkspaceDetails waiting = workflow.requestApproval(draft, ALICE);

        assertEquals(QueryStatus.WAITING_FOR_APPROVAL, waiting.query().status());
        verify(workspaceRepository).updateRiskCategory(WORKSPACE_ID, RiskCategory.UNSCOPED_MUTATION);
        verify(approvalNotifier).notifyAsync(any(ApprovalRequest.class));
    }

    @Test
    void testRequestApprovalOfChangedDraftIsAConflict() {
        when(workspaceRepository.transition(anyLong(), any(), any(), anyString(), isNull())).thenReturn(false);

        assertEquals(ErrorCode.CONFLICT,
            codeOf(() -> workflow.requestApproval(workspace(QueryStatus.DRAFT, null), ALICE)));
        verifyNoInteractions(approvalNotifier);
    }
}
