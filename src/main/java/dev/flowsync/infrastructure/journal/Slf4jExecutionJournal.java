package dev.flowsync.infrastructure.journal;

import dev.flowsync.domain.execution.ConversationalMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes journal entries to the {@code flowsync.journal} logger so the logging backend
 * decides where they are retained.
 */
@Component
public class Slf4jExecutionJournal implements ExecutionJournal {

    private static final Logger journal = LoggerFactory.getLogger("flowsync.journal");

    @Override
    public void append(String sessionId, String executionId, ConversationalMessage message) {
        if (!journal.isInfoEnabled()) return;
        journal.info("session={} execution={} message={} type={} step={} content={}",
                sessionId, executionId, message.id(), message.type(), message.metadata().stepId(),
                message.content().replace('\n', ' '));
    }
}
