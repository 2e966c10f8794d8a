package dev.flowsync.domain.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.flowsync.domain.enums.MessageType;

import java.time.Instant;
import java.util.UUID;

/**
 * One chat-visible line of execution output. Immutable and append-only.
 */
public record ConversationalMessage(
        String id,
        MessageType type,
        String content,
        Instant timestamp,
        Metadata metadata
) {
    public ConversationalMessage {
        if (metadata == null) metadata = Metadata.EMPTY;
    }

    public static ConversationalMessage of(MessageType type, String content, Instant timestamp, Metadata metadata) {
        return new ConversationalMessage("msg_" + UUID.randomUUID(), type, content, timestamp, metadata);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Metadata(
            String stepId,
            Long executionTime,
            Boolean userActionRequired,
            Boolean canRetry,
            Boolean canSkip,
            Boolean canDebug,
            Progress progressData
    ) {
        public static final Metadata EMPTY = new Metadata(null, null, null, null, null, null, null);

        public static Metadata step(String stepId) {
            return new Metadata(stepId, null, null, null, null, null, null);
        }

        public static Metadata progress(String stepId, Progress progress) {
            return new Metadata(stepId, null, null, null, null, null, progress);
        }

        public static Metadata completed(String stepId, Long executionTime, Progress progress) {
            return new Metadata(stepId, executionTime, null, null, null, null, progress);
        }

        public static Metadata actionRequired(String stepId, boolean canRetry, boolean canSkip, boolean canDebug) {
            return new Metadata(stepId, null, true, canRetry, canSkip, canDebug, null);
        }
    }
}
