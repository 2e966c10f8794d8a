package dev.flowsync.sync;

import dev.flowsync.domain.change.ChangeEvent;

/**
 * Notified after a change has been committed to the canonical graph, either directly
 * or as the winning half of a resolved conflict.
 */
@FunctionalInterface
public interface ChangeApplicationListener {
    void onApplied(ChangeEvent change);
}
