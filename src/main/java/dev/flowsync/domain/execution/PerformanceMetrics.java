package dev.flowsync.domain.execution;

/**
 * Immutable performance counters for one execution. Every update is O(1); averages are
 * running means {@code (avg * (n - 1) + sample) / n}.
 *
 * <p>completedSteps + failedSteps + skippedSteps never exceeds totalSteps: a new outcome
 * that would break this is not counted.
 */
public record PerformanceMetrics(
        double averageStepTime,
        int timedSteps,
        int totalSteps,
        int completedSteps,
        int failedSteps,
        int skippedSteps,
        MemoryUsage memoryUsage,
        NetworkUsage networkUsage
) {
    public PerformanceMetrics {
        if (memoryUsage == null) memoryUsage = MemoryUsage.NONE;
        if (networkUsage == null) networkUsage = NetworkUsage.NONE;
    }

    public static PerformanceMetrics initial(int totalSteps) {
        return new PerformanceMetrics(0, 0, totalSteps, 0, 0, 0, MemoryUsage.NONE, NetworkUsage.NONE);
    }

    public int finishedSteps() {
        return completedSteps + failedSteps + skippedSteps;
    }

    /**
     * Moves one step from {@code previous} (null when the step had no outcome yet) to {@code next}.
     * Returns this instance unchanged when counting the step would exceed totalSteps.
     */
    public PerformanceMetrics withOutcome(StepOutcome previous, StepOutcome next) {
        if (previous == next) return this;
        if (previous == null && finishedSteps() >= totalSteps) return this;
        int completed = completedSteps + delta(StepOutcome.COMPLETED, previous, next);
        int failed = failedSteps + delta(StepOutcome.FAILED, previous, next);
        int skipped = skippedSteps + delta(StepOutcome.SKIPPED, previous, next);
        return new PerformanceMetrics(averageStepTime, timedSteps, totalSteps, completed, failed, skipped,
                memoryUsage, networkUsage);
    }

    public PerformanceMetrics withStepTime(long durationMs) {
        int n = timedSteps + 1;
        double average = (averageStepTime * (n - 1) + durationMs) / n;
        return new PerformanceMetrics(average, n, totalSteps, completedSteps, failedSteps, skippedSteps,
                memoryUsage, networkUsage);
    }

    public PerformanceMetrics withResources(ResourceSample sample) {
        if (sample == null) return this;
        return new PerformanceMetrics(averageStepTime, timedSteps, totalSteps, completedSteps, failedSteps,
                skippedSteps, memoryUsage.with(sample.memoryBytes()), networkUsage.with(sample));
    }

    private static int delta(StepOutcome counter, StepOutcome previous, StepOutcome next) {
        int delta = 0;
        if (previous == counter) delta--;
        if (next == counter) delta++;
        return delta;
    }

    public record MemoryUsage(long current, long peak, double average, int samples) {
        static final MemoryUsage NONE = new MemoryUsage(0, 0, 0, 0);

        MemoryUsage with(Long bytes) {
            if (bytes == null) return this;
            int n = samples + 1;
            return new MemoryUsage(bytes, Math.max(peak, bytes), (average * (n - 1) + bytes) / n, n);
        }
    }

    public record NetworkUsage(long requestCount, long totalDataTransferred, double averageResponseTime) {
        static final NetworkUsage NONE = new NetworkUsage(0, 0, 0);

        NetworkUsage with(ResourceSample sample) {
            long requests = sample.requestCount() != null ? sample.requestCount() : 0;
            long bytes = sample.bytesTransferred() != null ? sample.bytesTransferred() : 0;
            long count = requestCount + requests;
            double average = averageResponseTime;
            if (sample.responseTimeMs() != null && requests > 0) {
                average = (averageResponseTime * requestCount + sample.responseTimeMs() * requests) / count;
            }
            return new NetworkUsage(count, totalDataTransferred + bytes, average);
        }
    }
}
