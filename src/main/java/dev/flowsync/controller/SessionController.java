package dev.flowsync.controller;

import dev.flowsync.dto.request.OpenSessionRequest;
import dev.flowsync.dto.response.SessionResponse;
import dev.flowsync.service.WorkflowSyncService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/sessions")
public class SessionController {
    private final WorkflowSyncService syncService;

    public SessionController(WorkflowSyncService syncService) { this.syncService = syncService; }

    @PutMapping("/{sessionId}")
    public CompletableFuture<SessionResponse> open(@PathVariable String sessionId,
                                                   @RequestBody(required = false) OpenSessionRequest request) {
        return syncService.open(sessionId, request);
    }

    @GetMapping("/{sessionId}")
    public CompletableFuture<SessionResponse> get(@PathVariable String sessionId) {
        return syncService.describe(sessionId);
    }

    @DeleteMapping("/{sessionId}")
    public CompletableFuture<ResponseEntity<Void>> close(@PathVariable String sessionId) {
        return syncService.close(sessionId).thenApply(ignored -> ResponseEntity.noContent().build());
    }
}
