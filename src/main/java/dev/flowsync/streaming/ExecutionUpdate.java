package dev.flowsync.streaming;

import dev.flowsync.domain.execution.ConversationalMessage;

/**
 * Delivered to streamer subscribers once per appended message.
 */
public record ExecutionUpdate(ExecutionSnapshot execution, ConversationalMessage message) {}
