package dev.flowsync.exception;

/**
 * A merge was requested for changes that overlap. The conflict stays queued and
 * must be re-resolved with the visual or chat side.
 */
public class MergeNotPossibleException extends IllegalStateException {
    public MergeNotPossibleException(String message) {
        super(message);
    }
}
