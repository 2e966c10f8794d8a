package dev.flowsync.exception;

/**
 * The execution engine could not be reached. Streamers turn this into a failed
 * execution rather than letting it escape to the caller.
 */
public class ExecutionEngineException extends RuntimeException {
    public ExecutionEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
