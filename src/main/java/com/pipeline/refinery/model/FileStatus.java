package com.pipeline.refinery.model;

/**
 * 批处理中单个文件的处理状态
 */
public enum FileStatus {
    /** 已处理并发布输出 */
    COMPLETED,
    /** 读取、清洗或写出失败，未产生输出 */
    FAILED,
    /** 批处理被取消时尚未开始，未产生输出 */
    CANCELLED
}
