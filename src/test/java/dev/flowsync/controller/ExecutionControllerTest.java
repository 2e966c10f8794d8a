package dev.flowsync.controller;

import dev.flowsync.config.SecurityConfig;
import dev.flowsync.domain.enums.ExecutionStatus;
import dev.flowsync.domain.enums.ExportFormat;
import dev.flowsync.domain.execution.PerformanceMetrics;
import dev.flowsync.dto.request.CommandRequest;
import dev.flowsync.exception.ExecutionAlreadyActiveException;
import dev.flowsync.service.WorkflowExecutionService;
import dev.flowsync.streaming.ExecutionSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ExecutionController.class)
@Import(SecurityConfig.class)
@WithMockUser(username = "alice")
class ExecutionControllerTest {

    private static final String BASE = "/sessions/s1/executions";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WorkflowExecutionService executionService;

    @Test
    @DisplayName("starting a run answers 202 with the new execution, started by the caller")
    void start() throws Exception {
        when(executionService.start(eq("s1"), any(), eq("alice")))
                .thenReturn(CompletableFuture.completedFuture(snapshot(ExecutionStatus.STARTING)));

        MvcResult result = mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"executionId\": \"x1\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value("x1"))
                .andExpect(jsonPath("$.status").value("STARTING"));
    }

    @Test
    @DisplayName("a second start while one is active is a 409")
    void alreadyActive() throws Exception {
        when(executionService.start(eq("s1"), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new ExecutionAlreadyActiveException("x1")));

        MvcResult result = mockMvc.perform(post(BASE).contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(result)).andExpect(status().isConflict());
    }

    @Test
    @DisplayName("no current execution is a 404")
    void noCurrent() throws Exception {
        when(executionService.current("s1")).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        MvcResult result = mockMvc.perform(get(BASE + "/current")).andReturn();

        mockMvc.perform(asyncDispatch(result)).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("the log downloads as an attachment in the requested format")
    void exportCsv() throws Exception {
        when(executionService.exportLog("s1", ExportFormat.CSV))
                .thenReturn(CompletableFuture.completedFuture("Timestamp,Type,Content,StepId,ExecutionTime"));

        MvcResult result = mockMvc.perform(get(BASE + "/current/log").param("format", "csv")).andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"execution-log.csv\""));
    }

    @Test
    @DisplayName("commands are routed to the named execution")
    void command() throws Exception {
        when(executionService.command(eq("s1"), eq("x1"), any(CommandRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(null));

        MvcResult result = mockMvc.perform(post(BASE + "/x1/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\": \"pause\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(result)).andExpect(status().isOk());
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private static ExecutionSnapshot snapshot(ExecutionStatus status) {
        return new ExecutionSnapshot("x1", "wf-1", "Import Orders", "s1", "alice",
                Instant.parse("2025-01-01T00:00:00Z"), null, 0, null, 2, status,
                PerformanceMetrics.initial(2), null, 1, 200);
    }
}
