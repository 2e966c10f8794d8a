package dev.flowsync.streaming;

import dev.flowsync.domain.enums.MessageType;
import dev.flowsync.domain.execution.ConversationalMessage;
import dev.flowsync.domain.execution.ConversationalMessage.Metadata;
import dev.flowsync.domain.execution.ExecutionEventDetail;
import dev.flowsync.domain.execution.JourneyDefinition;
import dev.flowsync.domain.execution.Progress;
import dev.flowsync.domain.execution.WorkflowExecution;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Renders execution progress as chat messages. Wording is user-facing; every failure
 * message ends with the next steps the engine allows.
 */
@Component
public class ConversationalMessageFactory {

    private static final int PROGRESS_BAR_WIDTH = 20;

    private static final Map<String, String> ERROR_EXPLANATIONS = new LinkedHashMap<>();

    static {
        ERROR_EXPLANATIONS.put("timeout",
                "⏰ The step took too long to complete. This might be due to a slow network connection or heavy processing.");
        ERROR_EXPLANATIONS.put("authentication", "🔐 Authentication failed. Please check your credentials or permissions.");
        ERROR_EXPLANATIONS.put("not_found", "🔍 Required resource not found. Please verify the input data.");
        ERROR_EXPLANATIONS.put("network", "🌐 Network connection error. Please check your internet connection.");
        ERROR_EXPLANATIONS.put("permission", "🚫 Permission denied. You may not have access to the required resources.");
        ERROR_EXPLANATIONS.put("validation", "📝 Input validation failed. Please check the data format.");
    }

    private final Clock clock;

    public ConversationalMessageFactory(Clock clock) {
        this.clock = clock;
    }

    public ConversationalMessage started(JourneyDefinition journey) {
        return message(MessageType.SYSTEM,
                "🚀 Starting workflow execution: **%s**\n\nI'll walk you through each step and keep you updated on the progress. You can ask questions or control the execution at any time."
                        .formatted(journey.title()),
                Metadata.EMPTY);
    }

    public ConversationalMessage stepStarted(String stepId, String stepName, Progress progress) {
        return message(MessageType.PROGRESS,
                "🔄 **Step %d/%d**: Starting %s\n\n%s".formatted(progress.currentStep(), progress.totalSteps(),
                        stepName, progressBar(progress.percentComplete())),
                Metadata.progress(stepId, progress));
    }

    public ConversationalMessage stepCompleted(String stepId, String stepName, Object result, Long durationMs,
                                               Progress progress) {
        String summary = resultSummary(result);
        return message(MessageType.RESULT,
                "✅ **Completed**: Completed %s\n%s\n\n%s".formatted(stepName, summary,
                        progressBar(progress.percentComplete())),
                Metadata.completed(stepId, durationMs, progress));
    }

    public ConversationalMessage stepFailed(String stepId, String stepName, int stepNumber,
                                            ExecutionEventDetail.StepFailed failure) {
        StringBuilder content = new StringBuilder()
                .append("❌ **Error in Step ").append(stepNumber).append("**: Failed at ").append(stepName)
                .append("\n\n").append(explainError(failure.error()));
        String options = nextSteps(failure.canRetry(), failure.canSkip(), failure.canDebug());
        if (!options.isEmpty()) content.append("\n\n💡 You can try ").append(options).append('.');
        return message(MessageType.ERROR, content.toString(),
                Metadata.actionRequired(stepId, failure.canRetry(), failure.canSkip(), failure.canDebug()));
    }

    public ConversationalMessage stepSkipped(String stepId, String stepName, String reason, Progress progress) {
        String suffix = reason != null && !reason.isBlank() ? " (" + reason + ")" : "";
        return message(MessageType.PROGRESS,
                "⏭️ **Skipped**: %s%s\n\n%s".formatted(stepName, suffix, progressBar(progress.percentComplete())),
                Metadata.progress(stepId, progress));
    }

    public ConversationalMessage workflowCompleted(WorkflowExecution execution, Duration totalTime) {
        int steps = execution.getJourney().steps().size();
        int completed = execution.getPerformanceMetrics().completedSteps();
        return message(MessageType.RESULT,
                "🎉 **Workflow Completed Successfully!**\n\n**%s** completed with %d/%d steps executed successfully.\n\n⏱️ Total execution time: %s\n\n✨ All %d steps completed successfully. Great work!"
                        .formatted(execution.getJourney().title(), completed, steps, formatDuration(totalTime), steps),
                Metadata.EMPTY);
    }

    public ConversationalMessage workflowFailed(String error) {
        return message(MessageType.ERROR,
                "🚨 **Workflow Failed**\n\nThe workflow encountered a critical error and cannot continue:\n\n%s\n\n🔧 You can review the execution history and try running the workflow again after addressing any issues."
                        .formatted(error != null ? error : "Unknown error"),
                Metadata.EMPTY);
    }

    public ConversationalMessage paused() {
        return message(MessageType.SYSTEM,
                "⏸️ **Workflow Paused**\n\nExecution has been paused. Use \"resume\" to continue or \"stop\" to end the workflow.",
                Metadata.EMPTY);
    }

    public ConversationalMessage resumed() {
        return message(MessageType.SYSTEM,
                "▶️ **Workflow Resumed**\n\nExecution is continuing from where it left off...", Metadata.EMPTY);
    }

    public ConversationalMessage stopped(String reason) {
        String detail = reason != null && !reason.isBlank() ? reason : "Execution has been stopped by user request.";
        return message(MessageType.SYSTEM, "🛑 **Workflow Stopped**\n\n" + detail, Metadata.EMPTY);
    }

    public ConversationalMessage retrying(String stepId) {
        return message(MessageType.SYSTEM, "🔄 **Retrying Step**\n\nAttempting to execute the current step again...",
                Metadata.step(stepId));
    }

    public ConversationalMessage skipping(String stepId) {
        return message(MessageType.SYSTEM, "⏭️ **Step Skipped**\n\nMoving to the next step in the workflow...",
                Metadata.step(stepId));
    }

    public ConversationalMessage status(WorkflowExecution execution) {
        int total = execution.getJourney().steps().size();
        Progress progress = Progress.of(execution.getCurrentStep(), total);
        Duration running = Duration.between(execution.getStartTime(),
                execution.getEndTime() != null ? execution.getEndTime() : clock.instant());
        return message(MessageType.SYSTEM,
                "📊 **Workflow Status**\n\n**Name**: %s\n**Progress**: %d/%d steps (%.0f%%)\n**Status**: %s\n**Running time**: %s\n\n%s"
                        .formatted(execution.getJourney().title(), execution.getCurrentStep(), total,
                                progress.percentComplete(), execution.getStatus(), formatDuration(running),
                                progressBar(progress.percentComplete())),
                Metadata.progress(execution.getCurrentStepId(), progress));
    }

    public ConversationalMessage debug(String stepId, String debugJson) {
        return message(MessageType.SYSTEM,
                "🔧 **Debug Information**\n\n```json\n%s\n```\n\nThis shows the technical details of the current step."
                        .formatted(debugJson),
                Metadata.step(stepId));
    }

    public ConversationalMessage warning(String content, String stepId) {
        return message(MessageType.WARNING, "⚠️ " + content, Metadata.step(stepId));
    }

    public ConversationalMessage engineFailure(String action, String error) {
        return message(MessageType.ERROR,
                "🚨 **Execution Engine Unavailable**\n\nCould not %s the workflow: %s\n\nThe execution has been marked as failed."
                        .formatted(action, error),
                Metadata.EMPTY);
    }

    // ── Formatting ─────────────────────────────────────────────────

    static String progressBar(double percentComplete) {
        double clamped = Math.max(0, Math.min(100, percentComplete));
        int filled = (int) Math.round(clamped / 100 * PROGRESS_BAR_WIDTH);
        return "[" + "█".repeat(filled) + "░".repeat(PROGRESS_BAR_WIDTH - filled) + "] "
                + String.format(Locale.ROOT, "%.0f%%", clamped);
    }

    static String formatDuration(Duration duration) {
        long seconds = Math.max(0, duration.toSeconds());
        long minutes = seconds / 60;
        long hours = minutes / 60;
        if (hours > 0) return "%dh %dm %ds".formatted(hours, minutes % 60, seconds % 60);
        if (minutes > 0) return "%dm %ds".formatted(minutes, seconds % 60);
        return seconds + "s";
    }

    static String explainError(String error) {
        if (error == null || error.isBlank()) return "An unknown error occurred";
        String lower = error.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : ERROR_EXPLANATIONS.entrySet()) {
            if (lower.contains(entry.getKey())) return entry.getValue();
        }
        return "⚠️ " + error;
    }

    static String resultSummary(Object result) {
        if (result instanceof Collection<?> items) return "📊 Processed " + items.size() + " items";
        if (!(result instanceof Map<?, ?> data)) return "";
        if (Boolean.TRUE.equals(data.get("success"))) return "✅ Operation completed successfully";
        if (data.get("count") != null) return "📈 " + data.get("count") + " items processed";
        if (data.get("message") != null) return "💬 " + data.get("message");
        return "📋 Step completed with results";
    }

    private static String nextSteps(boolean canRetry, boolean canSkip, boolean canDebug) {
        StringBuilder options = new StringBuilder();
        if (canRetry) options.append("\"retry\" to attempt this step again");
        if (canSkip) {
            if (options.length() > 0) options.append(", ");
            options.append("\"skip\" to move to the next step");
        }
        if (canDebug) {
            if (options.length() > 0) options.append(", or ");
            options.append("\"debug\" to get more details");
        }
        return options.toString();
    }

    private ConversationalMessage message(MessageType type, String content, Metadata metadata) {
        return ConversationalMessage.of(type, content, clock.instant(), metadata);
    }
}
