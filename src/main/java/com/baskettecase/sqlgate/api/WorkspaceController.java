package com.baskettecase.sqlgate.api;

import com.baskettecase.sqlgate.execution.QueryResult;
import com.baskettecase.sqlgate.security.RequestUserContext;
import com.baskettecase.sqlgate.store.WorkspaceDetails;
import com.baskettecase.sqlgate.workflow.ApprovalWorkflow;
import com.baskettecase.sqlgate.workflow.WorkspaceService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Workspace Controller
 *
 * The caller's saved queries, and execution of queries an administrator approved.
 */
@RestController
@RequestMapping("/api/v1/workspaces")
@RequiredArgsConstructor
public class WorkspaceController {

    private final WorkspaceService workspaceService;
    private final ApprovalWorkflow approvalWorkflow;

    @GetMapping
    public ResponseEntity<List<WorkspaceDetails>> list() {
        return ResponseEntity.ok(workspaceService.listOwn(RequestUserContext.getCurrentUser()));
    }

    @PostMapping
    public ResponseEntity<WorkspaceDetails> create(@Valid @RequestBody WorkspaceRequest request) {
        WorkspaceDetails created = workspaceService.create(RequestUserContext.getCurrentUser(),
            request.name(), request.server(), request.database(), request.query());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    public ResponseEntity<WorkspaceDetails> get(@PathVariable("id") long id) {
        return ResponseEntity.ok(workspaceService.get(RequestUserContext.getCurrentUser(), id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<WorkspaceDetails> update(@PathVariable("id") long id,
                                                   @Valid @RequestBody WorkspaceRequest request) {
        return ResponseEntity.ok(workspaceService.update(RequestUserContext.getCurrentUser(), id,
            request.name(), request.server(), request.database(), request.query()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        workspaceService.delete(RequestUserContext.getCurrentUser(), id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/request-approval")
    public ResponseEntity<WorkspaceDetails> requestApproval(@PathVariable("id") long id) {
        return ResponseEntity.ok(workspaceService.requestApproval(RequestUserContext.getCurrentUser(), id));
    }

    @PostMapping("/{id}/execute")
    public ResponseEntity<QueryResult> execute(@PathVariable("id") long id) {
        return ResponseEntity.ok(approvalWorkflow.executeApproved(id, RequestUserContext.getCurrentUser()));
    }

    public record WorkspaceRequest(
        @NotBlank String name,
        @NotBlank String server,
        @NotBlank String database,
        @NotBlank String query
    ) {}
}
