package dev.flowsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "flowsync.streaming")
public record StreamingProperties(int maxMessages, Duration completedRetention) {
    public StreamingProperties {
        if (maxMessages <= 0) maxMessages = 200;
        if (completedRetention == null || completedRetention.isNegative()) completedRetention = Duration.ofMinutes(5);
    }

    public static StreamingProperties defaults() {
        return new StreamingProperties(0, null);
    }
}
