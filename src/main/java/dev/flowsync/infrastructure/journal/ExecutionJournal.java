package dev.flowsync.infrastructure.journal;

import dev.flowsync.domain.execution.ConversationalMessage;

/**
 * Append-only sink for every conversational message an execution produces. Unlike the
 * bounded in-memory buffer it never evicts.
 */
public interface ExecutionJournal {
    void append(String sessionId, String executionId, ConversationalMessage message);
}
