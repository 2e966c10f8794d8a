package dev.flowsync.domain.execution;

/**
 * Optional resource figures an engine may attach to a step event. responseTimeMs is the
 * mean response time of the {@code requestCount} requests it reports.
 */
public record ResourceSample(Long memoryBytes, Long requestCount, Long bytesTransferred, Double responseTimeMs) {}
