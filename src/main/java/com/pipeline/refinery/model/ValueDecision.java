package com.pipeline.refinery.model;

/**
 * 决策日志中的一条记录：某行某列的原始值、命中的规则和最终动作
 */
public final class ValueDecision {
    /** 未命中任何规则时记录的规则名 */
    public static final String NO_RULE = "none";

    private final int rowIndex;
    private final String column;
    private final String rawValue;
    private final String ruleName;
    private final CleaningAction action;
    private final String outputValue;

    public ValueDecision(int rowIndex, String column, String rawValue, String ruleName,
                         CleaningAction action, String outputValue) {
        this.rowIndex = rowIndex;
        this.column = column;
        this.rawValue = rawValue;
        this.ruleName = ruleName != null ? ruleName : NO_RULE;
        this.action = action;
        this.outputValue = outputValue;
    }

    /** 原表中的行号（从0开始，不含表头） */
    public int getRowIndex() { return rowIndex; }
    public String getColumn() { return column; }
    public String getRawValue() { return rawValue; }
    public String getRuleName() { return ruleName; }
    public CleaningAction getAction() { return action; }
    public String getOutputValue() { return outputValue; }

    @Override
    public String toString() {
        return "row=" + rowIndex + ", column='" + column + "', raw='" + rawValue
                + "', rule=" + ruleName + ", action=" + action;
    }
}
