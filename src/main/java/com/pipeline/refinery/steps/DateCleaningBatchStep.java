package com.pipeline.refinery.steps;

import com.pipeline.refinery.core.BatchExecutor;
import com.pipeline.refinery.core.PipelineContext;
import com.pipeline.refinery.core.PipelineStep;
import com.pipeline.refinery.model.BatchReport;
import com.pipeline.refinery.model.FileStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 目录批量日期清洗步骤。
 * 处理输入目录下全部CSV文件，输出到同名文件；未指定输出目录时写入结果目录。
 * 部分文件失败时步骤本身仍视为成功，失败明细记录在日志中。
 */
public class DateCleaningBatchStep implements PipelineStep {

    private static final Logger log = LoggerFactory.getLogger(DateCleaningBatchStep.class);

    public static final String STEP_ID = "date_clean_batch";

    public static final String BATCH_INPUT_DIR = "batch_input_dir";
    public static final String BATCH_OUTPUT_DIR = "batch_output_dir";

    private final BatchExecutor executor;

    public DateCleaningBatchStep(BatchExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("BatchExecutor must not be null");
        }
        this.executor = executor;
    }

    @Override
    public void execute(PipelineContext context) throws IOException {
        String inputDir = context.getParameter(BATCH_INPUT_DIR, "");
        if (inputDir.isBlank()) {
            log.warn("No batch input directory configured, step skipped.");
            return;
        }
        String outputDir = context.getParameter(BATCH_OUTPUT_DIR, "");
        Path output = outputDir.isBlank() ? context.getResultDir() : Paths.get(outputDir);

        BatchReport report = executor.processDirectory(Paths.get(inputDir), output);
        if (report.count(FileStatus.FAILED) > 0) {
            log.warn("{} of {} files failed date cleaning: {}",
                    report.count(FileStatus.FAILED), report.size(), report);
        }
    }
}
