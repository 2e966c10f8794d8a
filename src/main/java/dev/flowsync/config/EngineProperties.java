package dev.flowsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Execution engine transport. Queues are only used outside the {@code local} profile;
 * callbackSecret signs engine callbacks posted over HTTP.
 */
@ConfigurationProperties(prefix = "flowsync.engine")
public record EngineProperties(String eventQueue, String controlQueue, String callbackSecret) {}
