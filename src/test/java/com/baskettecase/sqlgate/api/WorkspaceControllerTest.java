package com.baskettecase.sqlgate.api;

import com.baskettecase.sqlgate.error.WorkflowStateException;
import com.baskettecase.sqlgate.execution.QueryResult;
import com.baskettecase.sqlgate.store.AppUser;
import com.baskettecase.sqlgate.web.GlobalExceptionHandler;
import com.baskettecase.sqlgate.workflow.ApprovalWorkflow;
import com.baskettecase.sqlgate.workflow.WorkspaceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for WorkspaceController
 */
@ExtendWith(MockitoExtension.class)
class WorkspaceControllerTest {

    private static final AppUser ALICE = new AppUser(7L, "alice", null, false, true, Instant.EPOCH);

    @Mock
    private WorkspaceService workspaceService;

    @Mock
    private ApprovalWorkflow approvalWorkflow;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WorkspaceController(workspaceService, approvalWorkflow))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void testExecuteApprovedQuery() throws Exception {
        when(approvalWorkflow.executeApproved(3L, ALICE)).thenReturn(QueryResult.updated(12));

        mockMvc.perform(post("/api/v1/workspaces/3/execute").requestAttr("appUser", ALICE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.updateCount").value(12))
            .andExpect(jsonPath("$.message").value("12 rows affected"));
    }

    @Test
    void testExecuteBeforeApprovalIsAConflict() throws Exception {
        when(approvalWorkflow.executeApproved(3L, ALICE)).thenThrow(WorkflowStateException.notApproved(3L));

        mockMvc.perform(post("/api/v1/workspaces/3/execute").requestAttr("appUser", ALICE))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("NOT_APPROVED"));
    }

    @Test
    void testDeleteReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/v1/workspaces/3").requestAttr("appUser", ALICE))
            .andExpect(status().isNoContent());

        verify(workspaceService).delete(ALICE, 3L);
    }

    @Test
    void testDeleteOfAnotherUsersWorkspaceIsForbidden() throws Exception {
        doThrow(WorkflowStateException.forbidden("Workspace 3 belongs to another user"))
            .when(workspaceService).delete(ALICE, 3L);

        mockMvc.perform(delete("/api/v1/workspaces/3").requestAttr("appUser", ALICE))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }
}
