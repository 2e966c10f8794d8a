package dev.flowsync.domain.enums;

/**
 * Two-phase apply: every change starts PENDING and ends APPLIED or REJECTED.
 */
public enum ChangeStatus {
    PENDING, APPLIED, REJECTED
}
