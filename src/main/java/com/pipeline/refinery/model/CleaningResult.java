package com.pipeline.refinery.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 单张表的清洗结果：更新后的表、逐值决策日志及汇总计数
 */
public class CleaningResult {
    private final TableSnapshot table;
    private final List<ValueDecision> decisions;
    /** 字段名 -> 实际匹配到的列名 */
    private final Map<String, String> resolvedColumns;
    /** 本表中找不到对应列的字段 */
    private final List<String> skippedFields;
    private final int inputRowCount;

    public CleaningResult(TableSnapshot table, List<ValueDecision> decisions,
                          Map<String, String> resolvedColumns, List<String> skippedFields,
                          int inputRowCount) {
        this.table = table;
        this.decisions = Collections.unmodifiableList(new ArrayList<>(decisions));
        this.resolvedColumns = Collections.unmodifiableMap(resolvedColumns);
        this.skippedFields = Collections.unmodifiableList(new ArrayList<>(skippedFields));
        this.inputRowCount = inputRowCount;
    }

    public Map<CleaningAction, Integer> countByAction() {
        Map<CleaningAction, Integer> counts = new EnumMap<>(CleaningAction.class);
        for (ValueDecision decision : decisions) {
            counts.merge(decision.getAction(), 1, Integer::sum);
        }
        return counts;
    }

    public int count(CleaningAction action) {
        return countByAction().getOrDefault(action, 0);
    }

    public int getDroppedRowCount() { return inputRowCount - table.getRowCount(); }
    public TableSnapshot getTable() { return table; }
    public List<ValueDecision> getDecisions() { return decisions; }
    public Map<String, String> getResolvedColumns() { return resolvedColumns; }
    public List<String> getSkippedFields() { return skippedFields; }
    public int getInputRowCount() { return inputRowCount; }
}
