package com.pipeline.refinery.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次流水线运行的汇总，按执行顺序记录每个步骤的结果
 */
public class PipelineRunReport {
    private final List<StepOutcome> outcomes = new ArrayList<>();
    private String stopReason;

    public void record(StepOutcome outcome) {
        outcomes.add(outcome);
    }

    public List<StepOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    /**
     * @return 指定步骤的结果；该步骤不在本次运行范围内时返回null
     */
    public StepOutcome getOutcome(String stepId) {
        for (StepOutcome outcome : outcomes) {
            if (outcome.getStepId().equals(stepId)) {
                return outcome;
            }
        }
        return null;
    }

    public long count(StepStatus status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    public String getStopReason() { return stopReason; }
    public void setStopReason(String stopReason) { this.stopReason = stopReason; }

    @Override
    public String toString() {
        return "PipelineRunReport" + outcomes;
    }
}
