package com.pipeline.refinery.model;

/**
 * 无法解析的值的兜底处理策略，整次运行全局生效。
 */
public enum CleaningPolicy {
    /** 保留原始文本 */
    KEEP_ORIGINAL("keep_original"),
    /** 置为空值 */
    SET_NULL("set_null"),
    /** 删除所在行 */
    DROP_ROW("drop_row");

    private final String configValue;

    CleaningPolicy(String configValue) {
        this.configValue = configValue;
    }

    public String getConfigValue() { return configValue; }

    /**
     * 按配置文件中的取值查找策略。
     *
     * @return 对应策略；取值不合法时返回null
     */
    public static CleaningPolicy fromConfigValue(String value) {
        for (CleaningPolicy policy : values()) {
            if (policy.configValue.equalsIgnoreCase(value)) {
                return policy;
            }
        }
        return null;
    }
}
