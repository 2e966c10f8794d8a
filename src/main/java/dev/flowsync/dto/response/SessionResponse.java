package dev.flowsync.dto.response;

import dev.flowsync.streaming.ExecutionSnapshot;
import dev.flowsync.sync.SyncSnapshot;

import java.time.Instant;

public record SessionResponse(String sessionId, String workflowId, int blockCount, int connectionCount,
                              Instant openedAt, SyncSnapshot sync, ExecutionSnapshot currentExecution) {}
