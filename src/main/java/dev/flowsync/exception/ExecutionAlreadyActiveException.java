package dev.flowsync.exception;

public class ExecutionAlreadyActiveException extends IllegalStateException {
    public ExecutionAlreadyActiveException(String executionId) {
        super("An execution is already active: " + executionId);
    }
}
