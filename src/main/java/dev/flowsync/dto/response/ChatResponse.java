package dev.flowsync.dto.response;

import dev.flowsync.domain.enums.CommandType;
import dev.flowsync.domain.execution.ConversationalMessage;
import dev.flowsync.streaming.ExecutionSnapshot;
import dev.flowsync.sync.ChangeOutcome;

/**
 * What a free-text chat message turned into. {@code command} is null when the text was
 * not a command. Edits fill {@code change}; execution controls fill {@code execution} and
 * {@code message}, plus {@code change} when a pause, resume or stop went through sync.
 */
public record ChatResponse(CommandType command, ChangeOutcome change, ExecutionSnapshot execution,
                           ConversationalMessage message) {

    public static ChatResponse notACommand() {
        return new ChatResponse(null, null, null, null);
    }

    public boolean recognized() {
        return command != null;
    }
}
