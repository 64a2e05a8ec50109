package com.pipeline.refinery.model;

/**
 * 单个步骤的执行结果
 */
public final class StepOutcome {
    private final String stepId;
    private final StepStatus status;
    private final long elapsedMs;
    private final String errorMessage;

    public StepOutcome(String stepId, StepStatus status, long elapsedMs, String errorMessage) {
        this.stepId = stepId;
        this.status = status;
        this.elapsedMs = elapsedMs;
        this.errorMessage = errorMessage;
    }

    public String getStepId() { return stepId; }
    public StepStatus getStatus() { return status; }
    public long getElapsedMs() { return elapsedMs; }
    public String getErrorMessage() { return errorMessage; }

    @Override
    public String toString() {
        return stepId + "=" + status + (errorMessage != null ? " (" + errorMessage + ")" : "");
    }
}
