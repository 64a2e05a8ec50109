package com.pipeline.refinery.normalize;

import com.pipeline.refinery.model.CleaningAction;
import com.pipeline.refinery.model.CleaningPolicy;
import com.pipeline.refinery.model.TableSnapshot;
import com.pipeline.refinery.model.ValueDecision;

import java.util.BitSet;

/**
 * 清洗策略引擎：决定无法解析的值如何处置，并汇总行级删除决定。
 *
 * 删除是延迟执行的：所有日期字段都评估完一行之后才真正过滤，
 * 避免后面字段的非删除结果被部分写入一条已标记删除的行。
 */
public class CleaningPolicyEngine {

    private final CleaningPolicy policy;

    public CleaningPolicyEngine(CleaningPolicy policy) {
        this.policy = policy != null ? policy : CleaningPolicy.KEEP_ORIGINAL;
    }

    /**
     * 为一个无法解析的值做出决定。
     * DROP_ROW 时只在 rowsToDrop 中登记，输出值保留原文。
     *
     * @param rowsToDrop 待删除行的登记表，由调用方在整张表处理完后统一应用
     */
    public ValueDecision onUnparsable(int rowIndex, String column, String rawValue, BitSet rowsToDrop) {
        switch (policy) {
            case SET_NULL:
                return new ValueDecision(rowIndex, column, rawValue, null, CleaningAction.SET_NULL, null);
            case DROP_ROW:
                rowsToDrop.set(rowIndex);
                return new ValueDecision(rowIndex, column, rawValue, null, CleaningAction.DROPPED_ROW, rawValue);
            case KEEP_ORIGINAL:
            default:
                return new ValueDecision(rowIndex, column, rawValue, null, CleaningAction.KEPT_ORIGINAL, rawValue);
        }
    }

    /**
     * 应用汇总后的删除决定
     *
     * @return 删除的行数
     */
    public int applyRowDrops(TableSnapshot table, BitSet rowsToDrop) {
        return table.removeRows(rowsToDrop);
    }

    public CleaningPolicy getPolicy() { return policy; }
}
