package dev.flowsync.domain.enums;

import java.util.Locale;

/**
 * Interactive controls a user can issue against a running execution from chat.
 */
public enum ExecutionCommand {
    PAUSE, RESUME, STOP, RETRY, SKIP, DEBUG, STATUS;

    public static ExecutionCommand fromWire(String value) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("command required");
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown command: \"%s\". Available commands: pause, resume, stop, status, debug, skip, retry"
                            .formatted(value));
        }
    }
}
