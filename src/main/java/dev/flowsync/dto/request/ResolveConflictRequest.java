package dev.flowsync.dto.request;

public record ResolveConflictRequest(String resolution) {}
