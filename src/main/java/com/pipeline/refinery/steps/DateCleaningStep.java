package com.pipeline.refinery.steps;

import com.pipeline.refinery.core.BatchExecutor;
import com.pipeline.refinery.core.PipelineContext;
import com.pipeline.refinery.core.PipelineStep;
import com.pipeline.refinery.model.FileOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 日期清洗步骤：清洗上游合并步骤在结果目录中留下的交接文件。
 *
 * 输入选择：
 * - 存在 merge_cleaned.csv：原地清洗（上游已经做过其他清洗）
 * - 否则存在 merge.csv：清洗结果写入 merge_cleaned.csv
 * - 都不存在：记录警告后返回，不视为失败
 */
public class DateCleaningStep implements PipelineStep {

    private static final Logger log = LoggerFactory.getLogger(DateCleaningStep.class);

    public static final String STEP_ID = "date_clean";

    /** 上下文参数：只清洗这些字段，多个字段用中英文逗号或分号分隔 */
    public static final String COLUMNS = "date_clean_columns";

    static final String MERGED_FILE = "merge.csv";
    static final String CLEANED_FILE = "merge_cleaned.csv";

    private static final Pattern COLUMN_SEPARATOR = Pattern.compile("[,，;；]");

    private final BatchExecutor executor;

    public DateCleaningStep(BatchExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("BatchExecutor must not be null");
        }
        this.executor = executor;
    }

    @Override
    public void execute(PipelineContext context) throws Exception {
        if (!executor.getConfig().isEnabled()) {
            log.info("Date cleaning is disabled, step skipped.");
            return;
        }

        Path resultDir = context.getResultDir();
        Path cleaned = resultDir.resolve(CLEANED_FILE);
        Path merged = resultDir.resolve(MERGED_FILE);

        Path input;
        if (Files.isRegularFile(cleaned)) {
            input = cleaned;
        } else if (Files.isRegularFile(merged)) {
            input = merged;
        } else {
            log.warn("Neither {} nor {} found in '{}', nothing to clean.", CLEANED_FILE, MERGED_FILE, resultDir);
            return;
        }

        List<String> columns = splitColumns(context.getParameter(COLUMNS, ""));
        if (!columns.isEmpty()) {
            log.info("Restricting date cleaning to fields {}", columns);
        }
        FileOutcome outcome = executor.processFile(input, cleaned, columns);
        log.info("Date cleaning of '{}' finished: {} rows in, {} rows out.",
                input.getFileName(), outcome.getInputRows(), outcome.getOutputRows());
    }

    static List<String> splitColumns(String raw) {
        List<String> columns = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return columns;
        }
        for (String part : COLUMN_SEPARATOR.split(raw)) {
            if (!part.isBlank()) {
                columns.add(part.strip());
            }
        }
        return columns;
    }
}
