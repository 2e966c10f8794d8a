package dev.flowsync.controller;

import dev.flowsync.domain.enums.ExportFormat;
import dev.flowsync.domain.execution.ConversationalMessage;
import dev.flowsync.dto.request.CommandRequest;
import dev.flowsync.dto.request.StartExecutionRequest;
import dev.flowsync.dto.response.CommandResponse;
import dev.flowsync.service.WorkflowExecutionService;
import dev.flowsync.streaming.ExecutionSnapshot;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/sessions/{sessionId}/executions")
public class ExecutionController {
    private final WorkflowExecutionService executionService;

    public ExecutionController(WorkflowExecutionService executionService) { this.executionService = executionService; }

    @PostMapping
    public CompletableFuture<ResponseEntity<ExecutionSnapshot>> start(@PathVariable String sessionId,
            @RequestBody(required = false) StartExecutionRequest request, Principal principal) {
        return executionService.start(sessionId, request, principal != null ? principal.getName() : null)
                .thenApply(started -> ResponseEntity.status(HttpStatus.ACCEPTED).body(started));
    }

    @GetMapping("/current")
    public CompletableFuture<ResponseEntity<ExecutionSnapshot>> current(@PathVariable String sessionId) {
        return executionService.current(sessionId)
                .thenApply(current -> current.map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build()));
    }

    @GetMapping("/current/messages")
    public CompletableFuture<List<ConversationalMessage>> messages(@PathVariable String sessionId) {
        return executionService.messages(sessionId);
    }

    @GetMapping("/current/log")
    public CompletableFuture<ResponseEntity<String>> exportLog(@PathVariable String sessionId,
            @RequestParam(defaultValue = "json") String format) {
        ExportFormat exportFormat = ExportFormat.fromWire(format);
        return executionService.exportLog(sessionId, exportFormat)
                .thenApply(body -> ResponseEntity.ok()
                        .contentType(MediaType.parseMediaType(exportFormat.contentType()))
                        .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"execution-log."
                                + exportFormat.name().toLowerCase(Locale.ROOT) + "\"")
                        .body(body));
    }

    @PostMapping("/{executionId}/commands")
    public CompletableFuture<CommandResponse> command(@PathVariable String sessionId, @PathVariable String executionId,
                                                      @RequestBody CommandRequest request) {
        return executionService.command(sessionId, executionId, request);
    }
}
