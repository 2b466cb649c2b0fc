package com.baskettecase.sqlgate.workflow;

import com.baskettecase.sqlgate.config.GatewayProperties;
import com.baskettecase.sqlgate.db.ServerEntry;
import com.baskettecase.sqlgate.db.ServerRegistry;
import com.baskettecase.sqlgate.error.QueryExecutionException;
import com.baskettecase.sqlgate.error.ServerNotConfiguredException;
import com.baskettecase.sqlgate.error.WorkflowStateException;
import com.baskettecase.sqlgate.execution.ExecutionLogger;
import com.baskettecase.sqlgate.execution.ExecutionMode;
import com.baskettecase.sqlgate.execution.QueryResult;
import com.baskettecase.sqlgate.execution.QueryRunner;
import com.baskettecase.sqlgate.notify.ApprovalNotifier;
import com.baskettecase.sqlgate.notify.ApprovalRequest;
import com.baskettecase.sqlgate.security.CredentialCache;
import com.baskettecase.sqlgate.sql.RiskAssessment;
import com.baskettecase.sqlgate.sql.RiskCategory;
import com.baskettecase.sqlgate.sql.RiskClassifier;
import com.baskettecase.sqlgate.store.AppUser;
import com.baskettecase.sqlgate.store.QueryRecord;
import com.baskettecase.sqlgate.store.WorkspaceDetails;
import com.baskettecase.sqlgate.store.WorkspaceRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Approval Workflow
 *
 * Gates query execution on the risk classifier. Safe queries, and every query from an
 * administrator, run immediately as the caller. Risky queries from other users are saved in
 * {@link QueryStatus#WAITING_FOR_APPROVAL} and an administrator is notified. The administrator may
 * preview, approve (with or without releasing results) or reject; an approved query with released
 * results is later run by its owner, with the owner's credential.
 *
 * Every status change is a compare-and-set against the status read before the action.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalWorkflow {

    static final String APPROVED_CAN_EXECUTE = "Approved by admin - User can execute";
    static final String APPROVED_CANNOT_EXECUTE = "Approved by admin - User cannot execute";
    static final String REJECTED_BY_ADMIN = "Rejected by admin";
    static final String EXECUTED_BY_OWNER = "Approved by admin - Executed by owner";

    private static final int PENDING_NAME_CHARS = 50;
    private static final int MAX_DESCRIPTION_CHARS = 1000;

    private final ServerRegistry serverRegistry;
    private final RiskClassifier riskClassifier;
    private final QueryRunner queryRunner;
    private final ExecutionLogger executionLogger;
    private final CredentialCache credentialCache;
    private final WorkspaceRepository workspaceRepository;
    private final ApprovalNotifier approvalNotifier;
    private final GatewayProperties properties;
    private final MeterRegistry meterRegistry;

    // Workspaces whose approved query is running in this process
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * Run a query, or route it for approval when it is risky and the user is not an administrator
     */
    public SubmissionResult submit(AppUser user, String server, String database, String queryText) {
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("Query text is required");
        }
        serverRegistry.resolve(server, database);
        ServerEntry entry = serverRegistry.server(server);
        String canonicalDatabase = entry.findDatabase(database).orElse(database);

        RiskAssessment risk = riskClassifier.classify(queryText);
        if (risk.isSafe() || user.admin()) {
            if (!risk.isSafe()) {
                log.info("🛡️ Admin {} bypasses {} gate", user.username(), risk.category().wireValue());
            }
            QueryResult result = queryRunner.run(user, entry.name(), canonicalDatabase, queryText, ExecutionMode.DIRECT);
            return SubmissionResult.executed(result);
        }

        RiskCategory category = risk.category();
        executionLogger.recordRejected(user.id(), queryText, entry.name(), canonicalDatabase,
            "Query rejected: " + category.wireValue());

        QueryRecord record = new QueryRecord(null, user.id(), entry.name(), canonicalDatabase, queryText,
            UUID.randomUUID().toString(), QueryStatus.WAITING_FOR_APPROVAL, category, null, null);
        WorkspaceDetails saved = workspaceRepository.createWithQuery(record, pendingName(queryText),
            waitingDescription(category), null);

        log.info("⏳ Query from {} flagged as {} ({}), waiting for approval in workspace {}",
            user.username(), category.wireValue(), risk.reason(), saved.workspaceId());
        countDecision("submitted");
        approvalNotifier.notifyAsync(toApprovalRequest(saved, user.username()));

        return SubmissionResult.sentForApproval(saved.workspaceId(), category);
    }

    /**
     * Submit several queries in order, one result per entry. Configuration and execution errors are
     * reported per entry; session and pool errors stop the batch.
     */
    public List<SubmissionResult> submitBatch(AppUser user, String server, String database, List<String> queries) {
        int maxBatchSize = properties.getExecution().getMaxBatchSize();
        if (queries == null || queries.isEmpty()) {
            throw new IllegalArgumentException("At least one query is required");
        }
        if (queries.size() > maxBatchSize) {
            throw new IllegalArgumentException(
                String.format("At most %d queries can be submitted together, got %d", maxBatchSize, queries.size()));
        }

        List<SubmissionResult> results = new ArrayList<>(queries.size());
        for (String query : queries) {
            try {
                results.add(submit(user, server, database, query));
            } catch (QueryExecutionException | ServerNotConfiguredException e) {
                results.add(SubmissionResult.failed(e.getCode(), e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Run a saved query with the administrator's own credential. Never changes its status.
     */
    public QueryResult preview(long workspaceId, AppUser admin) {
        requireAdmin(admin);
        WorkspaceDetails details = load(workspaceId);
        QueryRecord query = details.query();

        log.info("🔍 Admin {} previewing workspace {}", admin.username(), workspaceId);
        return queryRunner.run(admin, query.serverName(), query.databaseName(), query.queryText(),
            ExecutionMode.PREVIEW);
    }

    public WorkspaceDetails reject(long workspaceId, AppUser admin) {
        requireAdmin(admin);
        WorkspaceDetails details = load(workspaceId);
        decide(details, QueryStatus.REJECTED, REJECTED_BY_ADMIN, false);

        log.info("❌ Admin {} rejected workspace {}", admin.username(), workspaceId);
        countDecision("rejected");
        return load(workspaceId);
    }

    /**
     * Grant future execution. Does not run the query.
     */
    public WorkspaceDetails approve(long workspaceId, AppUser admin, boolean showResults) {
        requireAdmin(admin);
        WorkspaceDetails details = load(workspaceId);
        QueryStatus next = showResults ? QueryStatus.APPROVED_WITH_RESULTS : QueryStatus.APPROVED;
        decide(details, next, showResults ? APPROVED_CAN_EXECUTE : APPROVED_CANNOT_EXECUTE, showResults);

        log.info("✅ Admin {} approved workspace {} (show results: {})", admin.username(), workspaceId, showResults);
        countDecision(showResults ? "approved_with_results" : "approved");
        return load(workspaceId);
    }

    /**
     * Run an approved query as its owner. The record ends in
     * {@link QueryStatus#APPROVED_AND_EXECUTED} or {@link QueryStatus#APPROVAL_EXECUTION_FAILED};
     * on failure the error is also written to the workspace and rethrown.
     */
    public QueryResult executeApproved(long workspaceId, AppUser user) {
        requireExecutable(load(workspaceId), user);

        // Session must be live before the record is claimed
        credentialCache.fetch(user.id()).orElseThrow(user.id());

        if (!inFlight.add(workspaceId)) {
            throw WorkflowStateException.inProgress(workspaceId);
        }
        try {
            // Another execution may have finished since the first read
            WorkspaceDetails details = load(workspaceId);
            requireExecutable(details, user);
            QueryStatus status = details.query().status();
            QueryRecord query = details.query();
            QueryResult result;
            try {
                result = queryRunner.run(user, query.serverName(), query.databaseName(), query.queryText(),
                    ExecutionMode.APPROVED);
            } catch (RuntimeException e) {
                recordFailure(workspaceId, status, e);
                log.warn("❌ Approved execution of workspace {} failed: {}", workspaceId, e.getMessage());
                countDecision("execution_failed");
                throw e;
            }

            if (!workspaceRepository.transition(workspaceId, status, QueryStatus.APPROVED_AND_EXECUTED,
                    EXECUTED_BY_OWNER, null)) {
                log.warn("⚠️ Workspace {} changed while it was executing", workspaceId);
            }
            countDecision("executed");
            return result;
        } finally {
            inFlight.remove(workspaceId);
        }
    }

    public List<WorkspaceDetails> listPendingApprovals(AppUser admin) {
        requireAdmin(admin);
        return workspaceRepository.findByStatus(QueryStatus.WAITING_FOR_APPROVAL);
    }

    /**
     * Send a draft for approval, as if it had been submitted and flagged
     */
    WorkspaceDetails requestApproval(WorkspaceDetails draft, AppUser owner) {
        RiskAssessment risk = riskClassifier.classify(draft.query().queryText());
        RiskCategory category = risk.category();

        workspaceRepository.updateRiskCategory(draft.workspaceId(), category);
        if (!workspaceRepository.transition(draft.workspaceId(), QueryStatus.DRAFT,
                QueryStatus.WAITING_FOR_APPROVAL, waitingDescription(category), null)) {
            throw WorkflowStateException.conflict(
                "Workspace " + draft.workspaceId() + " is no longer a draft");
        }

        WorkspaceDetails waiting = load(draft.workspaceId());
        countDecision("submitted");
        approvalNotifier.notifyAsync(toApprovalRequest(waiting, owner.username()));
        return waiting;
    }

    private static void requireExecutable(WorkspaceDetails details, AppUser user) {
        long workspaceId = details.workspaceId();
        if (details.ownerId() != user.id()) {
            throw WorkflowStateException.forbidden("Only the owner can execute workspace " + workspaceId);
        }
        if (!details.query().status().isApproved()) {
            throw WorkflowStateException.notApproved(workspaceId);
        }
        if (!details.workspace().resultsVisible()) {
            throw WorkflowStateException.forbidden("Results of workspace " + workspaceId + " were not released");
        }
    }

    /**
     * Mark a failed approved execution. A store error here is attached to the execution error.
     */
    private void recordFailure(long workspaceId, QueryStatus status, RuntimeException failure) {
        String description = truncate("Execution failed: " + failure.getMessage());
        try {
            if (!workspaceRepository.transition(workspaceId, status, QueryStatus.APPROVAL_EXECUTION_FAILED,
                    description, null)) {
                log.warn("⚠️ Workspace {} changed while its failed execution was recorded", workspaceId);
            }
        } catch (RuntimeException storeError) {
            log.error("Could not record failed execution of workspace {}", workspaceId, storeError);
            failure.addSuppressed(storeError);
        }
    }

    private void decide(WorkspaceDetails details, QueryStatus next, String description, boolean showResults) {
        QueryStatus current = details.query().status();
        if (current != QueryStatus.WAITING_FOR_APPROVAL) {
            throw WorkflowStateException.conflict(String.format("Workspace %d is %s, not waiting for approval",
                details.workspaceId(), current.dbValue()));
        }
        if (!workspaceRepository.transition(details.workspaceId(), current, next, description, showResults)) {
            throw WorkflowStateException.conflict(
                "Workspace " + details.workspaceId() + " was decided by someone else");
        }
    }

    private WorkspaceDetails load(long workspaceId) {
        return workspaceRepository.findById(workspaceId)
            .orElseThrow(() -> WorkflowStateException.notFound(workspaceId));
    }

    private static void requireAdmin(AppUser user) {
        if (user == null || !user.admin()) {
            throw WorkflowStateException.forbidden("Administrator rights required");
        }
    }

    private ApprovalRequest toApprovalRequest(WorkspaceDetails details, String username) {
        QueryRecord query = details.query();
        return new ApprovalRequest(details.workspaceId(), query.correlationId(), username,
            query.serverName(), query.databaseName(), query.queryText(), query.riskCategory(), Instant.now());
    }

    static String pendingName(String queryText) {
        String compact = queryText.strip().replaceAll("\\s+", " ");
        if (compact.length() <= PENDING_NAME_CHARS) {
            return "Pending: " + compact;
        }
        return "Pending: " + compact.substring(0, PENDING_NAME_CHARS) + "...";
    }

    static String waitingDescription(RiskCategory category) {
        return category == null
            ? "Waiting for admin approval"
            : "Risk Type: " + category.wireValue() + " - Waiting for admin approval";
    }

    private static String truncate(String text) {
        return text.length() <= MAX_DESCRIPTION_CHARS ? text : text.substring(0, MAX_DESCRIPTION_CHARS);
    }

    private void countDecision(String outcome) {
        meterRegistry.counter("sqlgate.approvals", "outcome", outcome).increment();
    }
}
