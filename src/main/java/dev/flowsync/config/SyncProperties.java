package dev.flowsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Synchronization tuning. conflictWindow is the maximum timestamp distance for two
 * opposite-source changes to count as concurrent.
 */
@ConfigurationProperties(prefix = "flowsync.sync")
public record SyncProperties(Duration conflictWindow, int recentChangeLimit, boolean autoMergeCompatible) {
    public SyncProperties {
        if (conflictWindow == null || conflictWindow.isNegative()) conflictWindow = Duration.ofMillis(2000);
        if (recentChangeLimit <= 0) recentChangeLimit = 50;
    }

    public static SyncProperties defaults() {
        return new SyncProperties(null, 0, false);
    }
}
