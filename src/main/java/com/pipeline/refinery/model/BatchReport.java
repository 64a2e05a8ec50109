package com.pipeline.refinery.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 多文件批处理的汇总，按输入顺序记录每个文件的结果（与实际完成顺序无关）
 */
public class BatchReport {
    private final List<FileOutcome> outcomes;

    public BatchReport(List<FileOutcome> outcomes) {
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public static BatchReport empty() {
        return new BatchReport(Collections.emptyList());
    }

    public List<FileOutcome> getOutcomes() { return outcomes; }

    public long count(FileStatus status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    public int size() { return outcomes.size(); }

    @Override
    public String toString() {
        return "BatchReport" + outcomes;
    }
}
