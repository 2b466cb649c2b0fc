package com.baskettecase.sqlgate.api;

import com.baskettecase.sqlgate.db.ServerEntry;
import com.baskettecase.sqlgate.db.ServerRegistry;
import com.baskettecase.sqlgate.db.Technology;
import com.baskettecase.sqlgate.execution.QueryResult;
import com.baskettecase.sqlgate.security.RequestUserContext;
import com.baskettecase.sqlgate.store.AppUser;
import com.baskettecase.sqlgate.store.AppUserRepository;
import com.baskettecase.sqlgate.store.ExecutionLogEntry;
import com.baskettecase.sqlgate.store.ExecutionLogRepository;
import com.baskettecase.sqlgate.store.WorkspaceDetails;
import com.baskettecase.sqlgate.workflow.ApprovalWorkflow;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Admin Controller
 *
 * Approval decisions, database registration, users and the execution log. Requires ROLE_ADMIN.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private static final int MAX_LOG_ENTRIES = 500;

    private final ApprovalWorkflow approvalWorkflow;
    private final ServerRegistry serverRegistry;
    private final AppUserRepository userRepository;
    private final ExecutionLogRepository executionLogRepository;

    @GetMapping("/approvals")
    public ResponseEntity<List<WorkspaceDetails>> pendingApprovals() {
        return ResponseEntity.ok(approvalWorkflow.listPendingApprovals(RequestUserContext.getCurrentUser()));
    }

    @PostMapping("/approvals/{id}/preview")
    public ResponseEntity<QueryResult> preview(@PathVariable("id") long id) {
        return ResponseEntity.ok(approvalWorkflow.preview(id, RequestUserContext.getCurrentUser()));
    }

    @PostMapping("/approvals/{id}/approve")
    public ResponseEntity<WorkspaceDetails> approve(@PathVariable("id") long id,
                                                    @RequestBody ApprovalDecision decision) {
        return ResponseEntity.ok(approvalWorkflow.approve(id, RequestUserContext.getCurrentUser(),
            decision.showResults()));
    }

    @PostMapping("/approvals/{id}/reject")
    public ResponseEntity<WorkspaceDetails> reject(@PathVariable("id") long id) {
        return ResponseEntity.ok(approvalWorkflow.reject(id, RequestUserContext.getCurrentUser()));
    }

    @PostMapping("/databases")
    public ResponseEntity<QueryController.ServerSummary> addDatabase(
            @Valid @RequestBody DatabaseRegistration request) {
        ServerEntry entry = serverRegistry.addDatabase(request.server(), request.database(),
            Technology.fromName(request.technology()));
        log.info("🗄️ Admin {} registered database {}/{}", RequestUserContext.getCurrentUser().username(),
            entry.name(), request.database());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new QueryController.ServerSummary(entry.name(), entry.technology(), entry.databases()));
    }

    @PostMapping("/users")
    public ResponseEntity<AppUser> createUser(@Valid @RequestBody UserRequest request) {
        if (userRepository.findByUsername(request.username()).isPresent()) {
            throw new IllegalArgumentException("User already exists: " + request.username());
        }
        AppUser saved = userRepository.save(new AppUser(null, request.username(), request.email(),
            request.admin(), true, null));
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    @GetMapping("/users")
    public ResponseEntity<List<AppUser>> users() {
        return ResponseEntity.ok(userRepository.findAll());
    }

    @GetMapping("/executions")
    public ResponseEntity<List<ExecutionLogEntry>> executions(
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        return ResponseEntity.ok(executionLogRepository.findRecent(Math.max(1, Math.min(limit, MAX_LOG_ENTRIES))));
    }

    public record ApprovalDecision(boolean showResults) {}

    public record DatabaseRegistration(
        @NotBlank String server,
        @NotBlank String database,
        @NotNull String technology
    ) {}

    public record UserRequest(
        @NotBlank String username,
        String email,
        boolean admin
    ) {}
}
