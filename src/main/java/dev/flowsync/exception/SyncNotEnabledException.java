package dev.flowsync.exception;

public class SyncNotEnabledException extends IllegalStateException {
    public SyncNotEnabledException(String sessionId) {
        super("Synchronization is disabled for session " + sessionId);
    }
}
