package dev.flowsync.exception;

/**
 * A well-formed change that cannot be applied to the current graph
 * (unknown node, duplicate id, dangling connection).
 */
public class GraphMutationException extends IllegalStateException {
    public GraphMutationException(String message) {
        super(message);
    }
}
