package dev.flowsync.dto.response;

import dev.flowsync.domain.execution.ConversationalMessage;
import dev.flowsync.streaming.ExecutionSnapshot;

public record CommandResponse(ConversationalMessage message, ExecutionSnapshot execution) {}
