package com.pipeline.refinery.core;

import com.pipeline.refinery.model.PipelineRunReport;
import com.pipeline.refinery.model.PipelineStepSpec;

import java.util.List;

/**
 * 步骤编排器接口：按声明顺序依次执行步骤。
 *
 * 执行语义：
 * - 每个步骤执行前后记录 "[i/n] 步骤名称" 进度日志
 * - 必选步骤失败：中止整次运行，将该步骤的错误原样抛给调用方
 * - 可选步骤失败：记录错误日志后继续下一个步骤
 * - 步骤请求停止：剩余步骤记为跳过
 */
public interface PipelineStepSequencer {

    /**
     * 执行全部步骤
     */
    PipelineRunReport run(List<PipelineStepSpec> steps, PipelineContext context);

    /**
     * 执行下标区间 [fromStep, toStep) 内的步骤，区间外的步骤不出现在报告中。
     *
     * @param fromStep 起始下标（含）
     * @param toStep   结束下标（不含），大于步骤数时按步骤数处理
     * @throws IllegalArgumentException 区间非法
     */
    PipelineRunReport run(List<PipelineStepSpec> steps, PipelineContext context, int fromStep, int toStep);
}
