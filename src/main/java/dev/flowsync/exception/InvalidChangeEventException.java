package dev.flowsync.exception;

/**
 * Raised synchronously when a change event is missing its id, type or payload,
 * or when the payload does not match the declared type. State is left untouched.
 */
public class InvalidChangeEventException extends IllegalArgumentException {
    public InvalidChangeEventException(String message) {
        super(message);
    }
}
