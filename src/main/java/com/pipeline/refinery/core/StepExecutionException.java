package com.pipeline.refinery.core;

/**
 * 必选步骤抛出受检异常时的包装，保留原始异常作为cause
 */
public class StepExecutionException extends RuntimeException {

    private final String stepId;

    public StepExecutionException(String stepId, Throwable cause) {
        super("Step '" + stepId + "' failed: " + cause.getMessage(), cause);
        this.stepId = stepId;
    }

    public String getStepId() { return stepId; }
}
