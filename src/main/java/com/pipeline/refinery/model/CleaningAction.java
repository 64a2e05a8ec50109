package com.pipeline.refinery.model;

/**
 * 单个值的处理结果
 */
public enum CleaningAction {
    /** 被某条规则解码并改写为规范格式 */
    NORMALIZED,
    /** 空值，原样保留 */
    SKIPPED_BLANK,
    /** 无法解析，保留原值 */
    KEPT_ORIGINAL,
    /** 无法解析，置空 */
    SET_NULL,
    /** 无法解析，整行删除 */
    DROPPED_ROW
}
