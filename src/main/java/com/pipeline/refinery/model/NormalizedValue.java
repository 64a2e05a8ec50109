package com.pipeline.refinery.model;

/**
 * 单个原始值的规范化结果。
 * 解码失败时 {@code value} 与 {@code ruleName} 均为null。
 */
public final class NormalizedValue {
    private final String rawValue;
    private final String value;
    private final String ruleName;

    private NormalizedValue(String rawValue, String value, String ruleName) {
        this.rawValue = rawValue;
        this.value = value;
        this.ruleName = ruleName;
    }

    public static NormalizedValue success(String rawValue, String value, String ruleName) {
        return new NormalizedValue(rawValue, value, ruleName);
    }

    public static NormalizedValue unparsable(String rawValue) {
        return new NormalizedValue(rawValue, null, null);
    }

    public boolean isSuccess() { return value != null; }
    public String getRawValue() { return rawValue; }
    public String getValue() { return value; }
    public String getRuleName() { return ruleName; }

    @Override
    public String toString() {
        return isSuccess()
                ? "NormalizedValue{'" + rawValue + "' -> '" + value + "' by " + ruleName + "}"
                : "NormalizedValue{'" + rawValue + "' unparsable}";
    }
}
