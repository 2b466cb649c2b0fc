package com.baskettecase.sqlgate.api;

import com.baskettecase.sqlgate.db.ServerEntry;
import com.baskettecase.sqlgate.db.ServerRegistry;
import com.baskettecase.sqlgate.db.Technology;
import com.baskettecase.sqlgate.store.AppUser;
import com.baskettecase.sqlgate.store.AppUserRepository;
import com.baskettecase.sqlgate.store.ExecutionLogRepository;
import com.baskettecase.sqlgate.web.GlobalExceptionHandler;
import com.baskettecase.sqlgate.workflow.ApprovalWorkflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for AdminController
 */
@ExtendWith(MockitoExtension.class)
class AdminControllerTest {

    private static final AppUser ADMIN = new AppUser(1L, "root", null, true, true, Instant.EPOCH);

    @Mock
    private ApprovalWorkflow approvalWorkflow;

    @Mock
    private ServerRegistry serverRegistry;

    @Mock
    private AppUserRepository userRepository;

    @Mock
    private ExecutionLogRepository executionLogRepository;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AdminController controller = new AdminController(approvalWorkflow, serverRegistry,
            userRepository, executionLogRepository);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void testApprovePassesResultVisibility() throws Exception {
        mockMvc.perform(post("/api/v1/admin/approvals/3/approve")
                .requestAttr("appUser", ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"showResults\": true}"))
            .andExpect(status().isOk());

        verify(approvalWorkflow).approve(3L, ADMIN, true);
    }

    @Test
    void testRegisterDatabase() throws Exception {
        when(serverRegistry.addDatabase("reporting-sql01", "Audit", Technology.MSSQL))
            .thenReturn(new ServerEntry("reporting-sql01", Technology.MSSQL, "sql01.internal", 1433,
                List.of("Sales", "Audit"), Map.of("encrypt", "true")));

        mockMvc.perform(post("/api/v1/admin/databases")
                .requestAttr("appUser", ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"server": "reporting-sql01", "database": "Audit", "technology": "sqlserver"}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.databases[1]").value("Audit"))
            .andExpect(jsonPath("$.properties").doesNotExist());
    }

    @Test
    void testUnknownTechnologyIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/admin/databases")
                .requestAttr("appUser", ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"server": "reporting-sql01", "database": "Audit", "technology": "oracle"}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        verifyNoInteractions(serverRegistry);
    }

    @Test
    void testDuplicateUserIsRejected() throws Exception {
        when(userRepository.findByUsername("alice"))
            .thenReturn(Optional.of(new AppUser(7L, "alice", null, false, true, Instant.EPOCH)));

        mockMvc.perform(post("/api/v1/admin/users")
                .requestAttr("appUser", ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\": \"alice\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("User already exists: alice"));

        verify(userRepository, never()).save(any());
    }

    @Test
    void testExecutionLogLimitIsClamped() throws Exception {
        when(executionLogRepository.findRecent(500)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/admin/executions")
                .param("limit", "100000")
                .requestAttr("appUser", ADMIN))
            .andExpect(status().isOk());

        verify(executionLogRepository).findRecent(500);
    }
}
