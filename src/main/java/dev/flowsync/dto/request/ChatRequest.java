package dev.flowsync.dto.request;

public record ChatRequest(String text) {}
