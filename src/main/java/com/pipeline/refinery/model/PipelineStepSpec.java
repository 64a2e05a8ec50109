package com.pipeline.refinery.model;

import com.pipeline.refinery.core.PipelineStep;

/**
 * 流水线中单个步骤的定义
 */
public final class PipelineStepSpec {
    /** 步骤唯一标识，预留给按步骤重跑，目前不附带其他行为 */
    private final String id;
    private final PipelineStep step;
    /** 日志中展示的步骤名称 */
    private final String label;
    /** 必选步骤失败会中止整次运行；可选步骤失败只记录日志 */
    private final boolean required;

    public PipelineStepSpec(String id, PipelineStep step, String label) {
        this(id, step, label, true);
    }

    public PipelineStepSpec(String id, PipelineStep step, String label, boolean required) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Step id must not be null or blank");
        }
        if (step == null) {
            throw new IllegalArgumentException("Step must not be null for id: " + id);
        }
        this.id = id;
        this.step = step;
        this.label = label != null ? label : id;
        this.required = required;
    }

    public String getId() { return id; }
    public PipelineStep getStep() { return step; }
    public String getLabel() { return label; }
    public boolean isRequired() { return required; }

    @Override
    public String toString() {
        return "PipelineStepSpec{id='" + id + "', label='" + label + "', required=" + required + "}";
    }
}
