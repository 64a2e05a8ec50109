package com.pipeline.refinery.core;

import java.nio.file.Path;

/**
 * 流水线上下文接口：步骤与运行环境交互的唯一桥梁。
 *
 * 提供两个能力：
 * 1. 读取运行参数（结果目录、规则文件路径、字段覆盖等）
 * 2. 请求停止后续步骤
 */
public interface PipelineContext {

    /** 结果目录参数名 */
    String RESULT_DIR = "result_dir";

    /**
     * 获取指定名称的参数，支持泛型类型安全转换。
     *
     * @param paramName    参数名称
     * @param defaultValue 参数不存在时的默认值，同时用于推断返回类型
     * @param <T>          参数值类型
     * @return 参数值；参数不存在时返回defaultValue
     */
    <T> T getParameter(String paramName, T defaultValue);

    /**
     * 步骤间交接文件所在的结果目录
     */
    Path getResultDir();

    /**
     * 请求停止：当前步骤正常返回后，剩余步骤不再执行，记为跳过。
     *
     * @param reason 停止原因，写入日志和运行报告
     */
    void requestStop(String reason);

    boolean isStopRequested();

    String getStopReason();
}
