package dev.flowsync.controller;

import dev.flowsync.domain.conflict.ConflictStats;
import dev.flowsync.domain.enums.ChangeSource;
import dev.flowsync.dto.request.ChangeRequest;
import dev.flowsync.dto.request.ChatRequest;
import dev.flowsync.dto.request.ResolveConflictRequest;
import dev.flowsync.dto.response.ChatResponse;
import dev.flowsync.service.ChatGatewayService;
import dev.flowsync.service.WorkflowSyncService;
import dev.flowsync.sync.ChangeOutcome;
import dev.flowsync.sync.SyncSnapshot;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.concurrent.CompletableFuture;

/**
 * Synchronization surface of a session. A change that raises a conflict is still a
 * 200: the conflict is part of the returned outcome and waits for a resolution.
 */
@RestController
@RequestMapping("/sessions/{sessionId}")
public class SyncController {
    private final WorkflowSyncService syncService;
    private final ChatGatewayService chatGateway;

    public SyncController(WorkflowSyncService syncService, ChatGatewayService chatGateway) {
        this.syncService = syncService;
        this.chatGateway = chatGateway;
    }

    @PostMapping("/sync/enable")
    public CompletableFuture<SyncSnapshot> enable(@PathVariable String sessionId) {
        return syncService.enable(sessionId);
    }

    @PostMapping("/sync/disable")
    public CompletableFuture<SyncSnapshot> disable(@PathVariable String sessionId) {
        return syncService.disable(sessionId);
    }

    @GetMapping("/sync")
    public CompletableFuture<SyncSnapshot> state(@PathVariable String sessionId) {
        return syncService.state(sessionId);
    }

    @PostMapping("/changes/visual")
    public CompletableFuture<ChangeOutcome> visualChange(@PathVariable String sessionId,
                                                         @RequestBody ChangeRequest request) {
        return syncService.recordChange(sessionId, ChangeSource.VISUAL, request);
    }

    @PostMapping("/changes/chat")
    public CompletableFuture<ChangeOutcome> chatChange(@PathVariable String sessionId,
                                                       @RequestBody ChangeRequest request) {
        return syncService.recordChange(sessionId, ChangeSource.CHAT, request);
    }

    @PostMapping("/conflicts/{conflictId}/resolve")
    public CompletableFuture<SyncSnapshot> resolve(@PathVariable String sessionId, @PathVariable String conflictId,
                                                   @RequestBody ResolveConflictRequest request) {
        return syncService.resolve(sessionId, conflictId, request.resolution());
    }

    @GetMapping("/conflicts/stats")
    public CompletableFuture<ConflictStats> conflictStats(@PathVariable String sessionId) {
        return syncService.conflictStats(sessionId);
    }

    @PostMapping("/chat")
    public CompletableFuture<ChatResponse> chat(@PathVariable String sessionId, @RequestBody ChatRequest request,
                                                Principal principal) {
        return chatGateway.handleMessage(sessionId, request.text(), principal != null ? principal.getName() : null);
    }
}
