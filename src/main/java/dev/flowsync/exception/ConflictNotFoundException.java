package dev.flowsync.exception;

public class ConflictNotFoundException extends RuntimeException {
    private final String conflictId;

    public ConflictNotFoundException(String conflictId) {
        super("Conflict not found: " + conflictId);
        this.conflictId = conflictId;
    }

    public String getConflictId() {
        return conflictId;
    }
}
