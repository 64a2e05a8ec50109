package com.pipeline.refinery.model;

/**
 * 清洗结果的写回方式
 */
public enum OutputMode {
    /** 原地覆盖匹配到的列 */
    REPLACE("replace"),
    /** 追加派生列，原列保持不变 */
    ADD_COLUMN("add_column");

    /** 派生列名后缀 */
    public static final String DERIVED_COLUMN_SUFFIX = "_cleaned";

    private final String configValue;

    OutputMode(String configValue) {
        this.configValue = configValue;
    }

    public String getConfigValue() { return configValue; }

    public static OutputMode fromConfigValue(String value) {
        for (OutputMode mode : values()) {
            if (mode.configValue.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        return null;
    }
}
