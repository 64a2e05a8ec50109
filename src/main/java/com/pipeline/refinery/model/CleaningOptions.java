package com.pipeline.refinery.model;

import java.io.Serializable;

/**
 * 清洗选项，对应配置中的 {@code options} 节
 */
public final class CleaningOptions implements Serializable {
    private final CleaningPolicy onParseFailure;
    /** 分类前去掉纯数字值末尾的 ".0" */
    private final boolean removeDecimalZero;
    /** 逐值记录处理决策 */
    private final boolean logDetails;
    private final OutputMode outputMode;

    public CleaningOptions(CleaningPolicy onParseFailure, boolean removeDecimalZero,
                           boolean logDetails, OutputMode outputMode) {
        this.onParseFailure = onParseFailure != null ? onParseFailure : CleaningPolicy.KEEP_ORIGINAL;
        this.removeDecimalZero = removeDecimalZero;
        this.logDetails = logDetails;
        this.outputMode = outputMode != null ? outputMode : OutputMode.REPLACE;
    }

    public static CleaningOptions defaults() {
        return new CleaningOptions(CleaningPolicy.KEEP_ORIGINAL, true, false, OutputMode.REPLACE);
    }

    public CleaningPolicy getOnParseFailure() { return onParseFailure; }
    public boolean isRemoveDecimalZero() { return removeDecimalZero; }
    public boolean isLogDetails() { return logDetails; }
    public OutputMode getOutputMode() { return outputMode; }

    @Override
    public String toString() {
        return "CleaningOptions{onParseFailure=" + onParseFailure
                + ", removeDecimalZero=" + removeDecimalZero
                + ", logDetails=" + logDetails
                + ", outputMode=" + outputMode + "}";
    }
}
