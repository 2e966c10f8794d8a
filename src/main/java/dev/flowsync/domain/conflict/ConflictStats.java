package dev.flowsync.domain.conflict;

import dev.flowsync.domain.enums.ConflictType;
import dev.flowsync.domain.enums.Resolution;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-session conflict counters. Snapshot-copied for readers.
 */
public record ConflictStats(
        Map<ConflictType, Long> detectedByType,
        long autoResolvable,
        Map<Resolution, Long> resolvedByStrategy,
        int pending
) {
    public ConflictStats {
        detectedByType = Map.copyOf(detectedByType);
        resolvedByStrategy = Map.copyOf(resolvedByStrategy);
    }

    public long totalDetected() {
        return detectedByType.values().stream().mapToLong(Long::longValue).sum();
    }

    public long totalResolved() {
        return resolvedByStrategy.values().stream().mapToLong(Long::longValue).sum();
    }

    /** Mutable accumulator owned by one synchronizer. */
    public static final class Tracker {
        private final Map<ConflictType, Long> detected = new EnumMap<>(ConflictType.class);
        private final Map<Resolution, Long> resolved = new EnumMap<>(Resolution.class);
        private long autoResolvable;

        public void detected(SyncConflict conflict) {
            detected.merge(conflict.type(), 1L, Long::sum);
            if (conflict.autoResolvable()) autoResolvable++;
        }

        public void resolved(Resolution resolution) {
            resolved.merge(resolution, 1L, Long::sum);
        }

        public void reset() {
            detected.clear();
            resolved.clear();
            autoResolvable = 0;
        }

        public ConflictStats snapshot(int pending) {
            return new ConflictStats(detected, autoResolvable, resolved, pending);
        }
    }
}
