package com.pipeline.refinery.steps;

import com.pipeline.refinery.config.DateCleaningConfigLoader;
import com.pipeline.refinery.core.PipelineContext;
import com.pipeline.refinery.core.impl.DefaultBatchExecutor;
import com.pipeline.refinery.core.impl.DefaultPipelineContext;
import com.pipeline.refinery.model.DateCleaningConfig;
import com.pipeline.refinery.storage.CsvTableStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DateCleaningStepTest {

    private static final String MERGED = "订单号,创建时间,日期\nA1,45119,2024年1月2日\n";

    @TempDir
    Path resultDir;

    private DefaultBatchExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new DefaultBatchExecutor(new DateCleaningConfigLoader().loadDefault(), new CsvTableStore(), 1);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private PipelineContext context(String columns) {
        Map<String, Object> params = new HashMap<>();
        params.put(PipelineContext.RESULT_DIR, resultDir);
        params.put(DateCleaningStep.COLUMNS, columns);
        return new DefaultPipelineContext(params);
    }

    private String read(String name) throws Exception {
        return Files.readString(resultDir.resolve(name), StandardCharsets.UTF_8);
    }

    @Test
    void cleansMergedFileIntoCleanedFile() throws Exception {
        Files.writeString(resultDir.resolve(DateCleaningStep.MERGED_FILE), MERGED, StandardCharsets.UTF_8);

        new DateCleaningStep(executor).execute(context(""));

        assertEquals(MERGED, read(DateCleaningStep.MERGED_FILE));
        assertEquals("订单号,创建时间,日期\nA1,2023-07-12 00:00:00,2024-01-02\n", read(DateCleaningStep.CLEANED_FILE));
    }

    @Test
    void prefersAlreadyCleanedFileInPlace() throws Exception {
        Files.writeString(resultDir.resolve(DateCleaningStep.MERGED_FILE), MERGED, StandardCharsets.UTF_8);
        Files.writeString(resultDir.resolve(DateCleaningStep.CLEANED_FILE),
                "订单号,创建时间\nB2,2023年2月\n", StandardCharsets.UTF_8);

        new DateCleaningStep(executor).execute(context(""));

        assertEquals("订单号,创建时间\nB2,2023-02-01 00:00:00\n", read(DateCleaningStep.CLEANED_FILE));
        assertEquals(MERGED, read(DateCleaningStep.MERGED_FILE));
    }

    @Test
    void columnOverrideRestrictsFields() throws Exception {
        Files.writeString(resultDir.resolve(DateCleaningStep.MERGED_FILE), MERGED, StandardCharsets.UTF_8);

        new DateCleaningStep(executor).execute(context("日期"));

        assertEquals("订单号,创建时间,日期\nA1,45119,2024-01-02\n", read(DateCleaningStep.CLEANED_FILE));
    }

    @Test
    void missingHandOffFilesAreNotAnError() throws Exception {
        new DateCleaningStep(executor).execute(context(""));

        assertFalse(Files.exists(resultDir.resolve(DateCleaningStep.CLEANED_FILE)));
    }

    @Test
    void disabledConfigLeavesFilesUntouched() throws Exception {
        String yaml = "date_cleaning:\n"
                + "  enabled: false\n"
                + "  parse_formats:\n"
                + "    - name: serial\n"
                + "      regex_pattern: '^\\d{1,5}$'\n"
                + "      is_excel_serial: true\n";
        DateCleaningConfig disabled = new DateCleaningConfigLoader().load(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "disabled");
        Files.writeString(resultDir.resolve(DateCleaningStep.MERGED_FILE), MERGED, StandardCharsets.UTF_8);

        try (DefaultBatchExecutor disabledExecutor = new DefaultBatchExecutor(disabled, new CsvTableStore(), 1)) {
            new DateCleaningStep(disabledExecutor).execute(context(""));
        }

        assertFalse(Files.exists(resultDir.resolve(DateCleaningStep.CLEANED_FILE)));
    }

    @Test
    void splitsColumnsOnLatinAndFullWidthSeparators() {
        assertEquals(Arrays.asList("创建时间", "日期", "更新时间", "x"),
                DateCleaningStep.splitColumns(" 创建时间，日期; 更新时间；x,,"));
        assertTrue(DateCleaningStep.splitColumns("  ").isEmpty());
    }
}
