package com.baskettecase.sqlgate.api;

import com.baskettecase.sqlgate.db.ServerRegistry;
import com.baskettecase.sqlgate.db.Technology;
import com.baskettecase.sqlgate.security.RequestUserContext;
import com.baskettecase.sqlgate.workflow.ApprovalWorkflow;
import com.baskettecase.sqlgate.workflow.SubmissionResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Query Controller
 *
 * Runs queries as the calling user. Risky queries come back as 202 with the workspace
 * they were saved to.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class QueryController {

    private final ApprovalWorkflow approvalWorkflow;
    private final ServerRegistry serverRegistry;

    @PostMapping("/query")
    public ResponseEntity<SubmissionResult> submit(@Valid @RequestBody QueryRequest request) {
        SubmissionResult result = approvalWorkflow.submit(RequestUserContext.getCurrentUser(),
            request.server(), request.database(), request.query());
        HttpStatus status = result.outcome() == SubmissionResult.Outcome.SENT_FOR_APPROVAL
            ? HttpStatus.ACCEPTED
            : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    @PostMapping("/query/batch")
    public ResponseEntity<List<SubmissionResult>> submitBatch(@Valid @RequestBody BatchRequest request) {
        return ResponseEntity.ok(approvalWorkflow.submitBatch(RequestUserContext.getCurrentUser(),
            request.server(), request.database(), request.queries()));
    }

    @GetMapping("/servers")
    public ResponseEntity<List<ServerSummary>> servers() {
        List<ServerSummary> servers = serverRegistry.listServers().stream()
            .map(entry -> new ServerSummary(entry.name(), entry.technology(), entry.databases()))
            .toList();
        return ResponseEntity.ok(servers);
    }

    public record QueryRequest(
        @NotBlank String server,
        @NotBlank String database,
        @NotBlank String query
    ) {}

    public record BatchRequest(
        @NotBlank String server,
        @NotBlank String database,
        @NotEmpty List<String> queries
    ) {}

    public record ServerSummary(String name, Technology technology, List<String> databases) {}
}
