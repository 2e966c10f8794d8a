package dev.flowsync.exception;

public class ExecutionNotActiveException extends IllegalStateException {
    public ExecutionNotActiveException(String message) {
        super(message);
    }
}
