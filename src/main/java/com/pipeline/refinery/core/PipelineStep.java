package com.pipeline.refinery.core;

/**
 * 流水线步骤接口：顺序编排的最小执行单元。
 *
 * 步骤之间不直接传递数据，约定通过结果目录中的文件交接：
 * 前一个步骤写出的文件由后一个步骤读取。
 *
 * 实现约定：
 * - 步骤通过 {@link PipelineContext} 读取参数，不自行读取全局配置
 * - 失败时直接抛出异常，由 {@link PipelineStepSequencer} 按必选/可选区分处理
 * - 需要提前结束整次运行时调用 {@link PipelineContext#requestStop(String)}
 */
public interface PipelineStep {

    /**
     * 执行步骤。
     *
     * @param context 流水线上下文，提供运行参数和停止信号
     * @throws Exception 步骤失败
     */
    void execute(PipelineContext context) throws Exception;
}
