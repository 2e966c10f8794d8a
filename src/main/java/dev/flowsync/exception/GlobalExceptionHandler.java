package dev.flowsync.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;
import java.util.concurrent.CompletionException;

/**
 * Global exception handler using RFC 7807 Problem Details.
 *
 * <p>Session work completes on lane threads, so failures usually arrive wrapped in a
 * {@link CompletionException}; the cause is unwrapped and mapped like a direct throw.
 *
 * <p>Messages of domain exceptions are returned to the caller; unexpected errors are
 * logged server-side with their stack trace and answered with a generic message.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CompletionException.class)
    public ProblemDetail handleAsync(CompletionException ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof SessionNotFoundException e) return handleSessionNotFound(e);
        if (cause instanceof ConflictNotFoundException e) return handleConflictNotFound(e);
        if (cause instanceof IllegalArgumentException e) return handleBadRequest(e);
        if (cause instanceof IllegalStateException e) return handleConflict(e);
        if (cause instanceof CallNotPermittedException e) return handleCircuitOpen(e);
        return handleUnexpected(cause);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request", "Invalid Request");
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ProblemDetail handleSessionNotFound(SessionNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "session-not-found", "Session Not Found");
    }

    @ExceptionHandler(ConflictNotFoundException.class)
    public ProblemDetail handleConflictNotFound(ConflictNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.NOT_FOUND, ex.getMessage(), "conflict-not-found", "Conflict Not Found");
        problem.setProperty("conflictId", ex.getConflictId());
        return problem;
    }

    @ExceptionHandler(IllegalStateException.class)
    public ProblemDetail handleConflict(IllegalStateException ex) {
        log.warn("State conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, ex.getMessage(), "state-conflict", "State Conflict");
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ProblemDetail handleCircuitOpen(CallNotPermittedException ex) {
        log.warn("Circuit breaker open: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable. Please retry later.",
                "service-unavailable", "Service Unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Throwable ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred. Please try again later.",
                "internal", "Internal Server Error");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://flowsync.dev/errors/" + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
