package dev.flowsync.domain.enums;

/**
 * Lifecycle: DISABLED → IDLE ⇄ SYNCING → IDLE | CONFLICT; IDLE/SYNCING/CONFLICT → ERROR → IDLE
 */
public enum SyncStatus {
    DISABLED, IDLE, SYNCING, CONFLICT, ERROR
}
