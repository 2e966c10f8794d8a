package dev.flowsync.domain.execution;

public record Progress(int currentStep, int totalSteps, double percentComplete) {

    public static Progress of(int currentStep, int totalSteps) {
        double percent = totalSteps > 0 ? Math.min(100.0, currentStep * 100.0 / totalSteps) : 0;
        return new Progress(currentStep, totalSteps, percent);
    }
}
