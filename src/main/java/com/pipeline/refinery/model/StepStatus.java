package com.pipeline.refinery.model;

/**
 * 步骤执行状态
 */
public enum StepStatus {
    /** 执行成功 */
    COMPLETED,
    /** 执行失败（可选步骤失败后流水线继续） */
    FAILED,
    /** 未执行：有步骤请求停止流水线 */
    SKIPPED
}
