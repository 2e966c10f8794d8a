package dev.flowsync.sync;

/**
 * Handle returned by {@code subscribe}. Unsubscribing is synchronous: once it returns
 * the callback is never invoked again.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
