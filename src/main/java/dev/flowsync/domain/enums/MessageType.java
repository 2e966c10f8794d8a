package dev.flowsync.domain.enums;

public enum MessageType {
    SYSTEM, PROGRESS, RESULT, ERROR, WARNING
}
