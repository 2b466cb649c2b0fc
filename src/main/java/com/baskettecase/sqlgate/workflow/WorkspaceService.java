package com.baskettecase.sqlgate.workflow;

import com.baskettecase.sqlgate.db.ServerEntry;
import com.baskettecase.sqlgate.db.ServerRegistry;
import com.baskettecase.sqlgate.error.WorkflowStateException;
import com.baskettecase.sqlgate.store.AppUser;
import com.baskettecase.sqlgate.store.QueryRecord;
import com.baskettecase.sqlgate.store.WorkspaceDetails;
import com.baskettecase.sqlgate.store.WorkspaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Saved queries owned by a user. Drafts can be edited and sent for approval; any workspace
 * can be deleted by its owner.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkspaceService {

    private final WorkspaceRepository workspaceRepository;
    private final ServerRegistry serverRegistry;
    private final ApprovalWorkflow approvalWorkflow;

    public WorkspaceDetails create(AppUser user, String name, String server, String database, String queryText) {
        requireText(name, "Workspace name");
        requireText(queryText, "Query text");
        serverRegistry.resolve(server, database);
        ServerEntry entry = serverRegistry.server(server);

        QueryRecord record = new QueryRecord(null, user.id(), entry.name(),
            entry.findDatabase(database).orElse(database), queryText, UUID.randomUUID().toString(),
            QueryStatus.DRAFT, null, null, null);
        WorkspaceDetails saved = workspaceRepository.createWithQuery(record, name.trim(), null, null);

        log.info("📝 User {} saved workspace {}", user.username(), saved.workspaceId());
        return saved;
    }

    public List<WorkspaceDetails> listOwn(AppUser user) {
        return workspaceRepository.findByOwner(user.id());
    }

    /**
     * Owners see their own workspaces; administrators see any
     */
    public WorkspaceDetails get(AppUser user, long workspaceId) {
        WorkspaceDetails details = workspaceRepository.findById(workspaceId)
            .orElseThrow(() -> WorkflowStateException.notFound(workspaceId));
        if (details.ownerId() != user.id() && !user.admin()) {
            throw WorkflowStateException.forbidden("Workspace " + workspaceId + " belongs to another user");
        }
        return details;
    }

    public WorkspaceDetails update(AppUser user, long workspaceId, String name, String server, String database,
                                   String queryText) {
        requireText(queryText, "Query text");
        WorkspaceDetails details = requireOwner(user, workspaceId);
        if (details.query().status() != QueryStatus.DRAFT) {
            throw WorkflowStateException.conflict("Only draft workspaces can be edited");
        }
        serverRegistry.resolve(server, database);
        ServerEntry entry = serverRegistry.server(server);

        if (!workspaceRepository.updateQuery(workspaceId, QueryStatus.DRAFT, entry.name(),
                entry.findDatabase(database).orElse(database), queryText, name)) {
            throw WorkflowStateException.conflict("Workspace " + workspaceId + " is no longer a draft");
        }
        return workspaceRepository.findById(workspaceId)
            .orElseThrow(() -> WorkflowStateException.notFound(workspaceId));
    }

    public void delete(AppUser user, long workspaceId) {
        requireOwner(user, workspaceId);
        if (!workspaceRepository.delete(workspaceId)) {
            throw WorkflowStateException.notFound(workspaceId);
        }
    }

    public WorkspaceDetails requestApproval(AppUser user, long workspaceId) {
        WorkspaceDetails details = requireOwner(user, workspaceId);
        if (details.query().status() != QueryStatus.DRAFT) {
            throw WorkflowStateException.conflict(String.format("Workspace %d is %s, not a draft",
                workspaceId, details.query().status().dbValue()));
        }
        return approvalWorkflow.requestApproval(details, user);
    }

    private WorkspaceDetails requireOwner(AppUser user, long workspaceId) {
        WorkspaceDetails details = workspaceRepository.findById(workspaceId)
            .orElseThrow(() -> WorkflowStateException.notFound(workspaceId));
        if (details.ownerId() != user.id()) {
            throw WorkflowStateException.forbidden("Workspace " + workspaceId + " belongs to another user");
        }
        return details;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
