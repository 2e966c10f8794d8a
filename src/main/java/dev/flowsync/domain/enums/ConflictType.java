package dev.flowsync.domain.enums;

/**
 * Classification order matters: the detector returns the first matching type.
 */
public enum ConflictType {
    CONCURRENT_BLOCK_MODIFICATION,
    CONCURRENT_CONNECTION_CHANGE,
    EXECUTION_STATE_CONFLICT,
    STRUCTURAL_CONFLICT
}
