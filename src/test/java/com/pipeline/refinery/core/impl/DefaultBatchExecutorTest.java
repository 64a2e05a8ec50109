package com.pipeline.refinery.core.impl;

import com.pipeline.refinery.config.DateCleaningConfigLoader;
import com.pipeline.refinery.model.BatchReport;
import com.pipeline.refinery.model.CleaningAction;
import com.pipeline.refinery.model.CleaningOptions;
import com.pipeline.refinery.model.CleaningPolicy;
import com.pipeline.refinery.model.CleaningResult;
import com.pipeline.refinery.model.DateCleaningConfig;
import com.pipeline.refinery.model.FileOutcome;
import com.pipeline.refinery.model.FileStatus;
import com.pipeline.refinery.model.OutputMode;
import com.pipeline.refinery.model.TableSnapshot;
import com.pipeline.refinery.model.ValueDecision;
import com.pipeline.refinery.storage.CsvTableStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultBatchExecutorTest {

    private static final String RULES = "date_cleaning:\n"
            + "  date_fields:\n"
            + "    - name: 创建时间\n"
            + "      aliases: [create_time]\n"
            + "      has_time: true\n"
            + "    - name: 发货日期\n"
            + "      aliases: [ship_date]\n"
            + "      has_time: false\n"
            + "    - name: 退货日期\n"
            + "      has_time: false\n"
            + "  parse_formats:\n"
            + "    - name: excel_serial\n"
            + "      regex_pattern: '^\\d{1,5}(\\.0)?$'\n"
            + "      is_excel_serial: true\n"
            + "    - name: cjk_year_month_day\n"
            + "      template: \"uuuu'年'M'月'd'日'\"\n"
            + "      regex_pattern: '^\\d{4}年\\d{1,2}月\\d{1,2}日$'\n"
            + "    - name: iso_date\n"
            + "      template: uuuu-M-d\n"
            + "      regex_pattern: '^\\d{4}-\\d{1,2}-\\d{1,2}$'\n";

    @TempDir
    Path tempDir;

    private final List<DefaultBatchExecutor> executors = new ArrayList<>();

    @AfterEach
    void closeExecutors() {
        for (DefaultBatchExecutor executor : executors) {
            executor.close();
        }
    }

    private static DateCleaningConfig rules() {
        return new DateCleaningConfigLoader().load(
                new ByteArrayInputStream(RULES.getBytes(StandardCharsets.UTF_8)), "test rules");
    }

    private DefaultBatchExecutor executor(CleaningPolicy policy, OutputMode mode) {
        DateCleaningConfig config = rules().withOptions(new CleaningOptions(policy, true, false, mode));
        DefaultBatchExecutor executor = new DefaultBatchExecutor(config, new CsvTableStore(), 2);
        executors.add(executor);
        return executor;
    }

    private static TableSnapshot orders() {
        return TableSnapshot.fromRows(Arrays.asList("id", "create_time", "SHIP_DATE "), Arrays.asList(
                Arrays.asList("1", "45119.0", "2024年1月2日"),
                Arrays.asList("2", "bad", "2024-03-05"),
                Arrays.asList("3", "2023-07-11", "never"),
                Arrays.asList("4", "", "2024-03-05"),
                Arrays.asList("5", "45118", "")));
    }

    @Test
    void replacesResolvedColumnsWithNormalizedValues() {
        CleaningResult result = executor(CleaningPolicy.KEEP_ORIGINAL, OutputMode.REPLACE).cleanTable(orders());
        TableSnapshot table = result.getTable();

        assertEquals(Arrays.asList("id", "create_time", "SHIP_DATE "), table.getColumnNames());
        assertEquals(Arrays.asList("2023-07-12 00:00:00", "bad", "2023-07-11 00:00:00", "", "2023-07-11 00:00:00"),
                table.getColumn("create_time"));
        assertEquals(Arrays.asList("2024-01-02", "2024-03-05", "never", "2024-03-05", ""),
                table.getColumn("SHIP_DATE "));
        assertEquals("create_time", result.getResolvedColumns().get("创建时间"));
        assertEquals("SHIP_DATE ", result.getResolvedColumns().get("发货日期"));
        assertEquals(Collections.singletonList("退货日期"), result.getSkippedFields());
    }

    @Test
    void keepOriginalRecordsEveryDecision() {
        CleaningResult result = executor(CleaningPolicy.KEEP_ORIGINAL, OutputMode.REPLACE).cleanTable(orders());

        assertEquals(10, result.getDecisions().size());
        assertEquals(6, result.count(CleaningAction.NORMALIZED));
        assertEquals(2, result.count(CleaningAction.KEPT_ORIGINAL));
        assertEquals(2, result.count(CleaningAction.SKIPPED_BLANK));

        ValueDecision first = result.getDecisions().get(0);
        assertEquals("create_time", first.getColumn());
        assertEquals("45119.0", first.getRawValue());
        assertEquals("excel_serial", first.getRuleName());
        assertEquals("2023-07-12 00:00:00", first.getOutputValue());

        ValueDecision failed = result.getDecisions().get(1);
        assertEquals(ValueDecision.NO_RULE, failed.getRuleName());
        assertEquals(CleaningAction.KEPT_ORIGINAL, failed.getAction());
    }

    @Test
    void setNullClearsUnparsableCellsOnly() {
        TableSnapshot table = executor(CleaningPolicy.SET_NULL, OutputMode.REPLACE).cleanTable(orders()).getTable();

        assertEquals(5, table.getRowCount());
        assertNull(table.getCell(1, 1));
        assertNull(table.getCell(2, 2));
        assertEquals("", table.getCell(3, 1));
        assertEquals("2024-03-05", table.getCell(1, 2));
    }

    @Test
    void dropRowRemovesRowsWithAnyUnparsableField() {
        CleaningResult result = executor(CleaningPolicy.DROP_ROW, OutputMode.REPLACE).cleanTable(orders());
        TableSnapshot table = result.getTable();

        assertEquals(3, table.getRowCount());
        assertEquals(Arrays.asList("1", "4", "5"), table.getColumn("id"));
        assertEquals(2, result.getDroppedRowCount());
        assertEquals(5, result.getInputRowCount());
        assertEquals(2, result.count(CleaningAction.DROPPED_ROW));
        assertEquals(Arrays.asList("2024-01-02", "2024-03-05", ""), table.getColumn("SHIP_DATE "));
    }

    @Test
    void blankCellsNeverTriggerDropRow() {
        TableSnapshot table = TableSnapshot.fromRows(Arrays.asList("create_time"), Arrays.asList(
                Arrays.asList(""), Arrays.asList("   "), Collections.singletonList((String) null)));

        CleaningResult result = executor(CleaningPolicy.DROP_ROW, OutputMode.REPLACE).cleanTable(table);

        assertEquals(3, result.getTable().getRowCount());
        assertEquals(3, result.count(CleaningAction.SKIPPED_BLANK));
        assertEquals("   ", result.getTable().getCell(1, 0));
        assertNull(result.getTable().getCell(2, 0));
    }

    @Test
    void addColumnKeepsOriginalValues() {
        TableSnapshot table = executor(CleaningPolicy.SET_NULL, OutputMode.ADD_COLUMN).cleanTable(orders()).getTable();

        assertEquals(Arrays.asList("id", "create_time", "SHIP_DATE ", "create_time_cleaned", "SHIP_DATE _cleaned"),
                table.getColumnNames());
        assertEquals("45119.0", table.getCell(0, 1));
        assertEquals("2023-07-12 00:00:00", table.getCell(0, 3));
        assertEquals("bad", table.getCell(1, 1));
        assertNull(table.getCell(1, 3));
    }

    @Test
    void addColumnNeverOverwritesExistingDerivedName() {
        TableSnapshot input = TableSnapshot.fromRows(Arrays.asList("create_time", "create_time_cleaned"),
                Collections.singletonList(Arrays.asList("2023-07-11", "user data")));

        TableSnapshot table = executor(CleaningPolicy.KEEP_ORIGINAL, OutputMode.ADD_COLUMN).cleanTable(input).getTable();

        assertEquals(Arrays.asList("create_time", "create_time_cleaned", "create_time_cleaned_2"),
                table.getColumnNames());
        assertEquals(Arrays.asList("2023-07-11", "user data", "2023-07-11 00:00:00"), table.getRow(0));
    }

    @Test
    void inputTableIsNotModified() {
        TableSnapshot input = orders();

        executor(CleaningPolicy.DROP_ROW, OutputMode.ADD_COLUMN).cleanTable(input);

        assertEquals(5, input.getRowCount());
        assertEquals(3, input.getColumnCount());
        assertEquals("45119.0", input.getCell(0, 1));
    }

    @Test
    void fieldFilterLimitsCleanedColumns() {
        CleaningResult result = executor(CleaningPolicy.KEEP_ORIGINAL, OutputMode.REPLACE)
                .cleanTable(orders(), Collections.singletonList(" 发货日期 "));

        assertEquals(Collections.singleton("发货日期"), result.getResolvedColumns().keySet());
        assertEquals("45119.0", result.getTable().getCell(0, 1));
        assertEquals("2024-01-02", result.getTable().getCell(0, 2));
    }

    @Test
    void processesFileThroughTableStore() throws Exception {
        Path input = tempDir.resolve("orders.csv");
        Files.writeString(input, "id,create_time\n1,2024年1月2日\n2,oops\n", StandardCharsets.UTF_8);
        Path output = tempDir.resolve("out").resolve("orders.csv");

        FileOutcome outcome = executor(CleaningPolicy.DROP_ROW, OutputMode.REPLACE).processFile(input, output);

        assertEquals(FileStatus.COMPLETED, outcome.getStatus());
        assertEquals(2, outcome.getInputRows());
        assertEquals(1, outcome.getOutputRows());
        assertEquals("id,create_time\n1,2024-01-02 00:00:00\n", Files.readString(output, StandardCharsets.UTF_8));
    }

    @Test
    void failedFileDoesNotStopTheBatch() throws Exception {
        Path inDir = Files.createDirectories(tempDir.resolve("in"));
        Path outDir = tempDir.resolve("out");
        Files.writeString(inDir.resolve("a.csv"), "create_time\n45119\n", StandardCharsets.UTF_8);
        Files.writeString(inDir.resolve("b.csv"), "create_time\n45118,extra\n", StandardCharsets.UTF_8);
        Files.writeString(inDir.resolve("c.csv"), "create_time\n2024-1-2\n", StandardCharsets.UTF_8);
        Files.writeString(inDir.resolve("notes.txt"), "ignored", StandardCharsets.UTF_8);

        DefaultBatchExecutor executor = executor(CleaningPolicy.KEEP_ORIGINAL, OutputMode.REPLACE);
        BatchReport report = executor.processDirectory(inDir, outDir);

        assertEquals(3, report.size());
        assertEquals(2, report.count(FileStatus.COMPLETED));
        assertEquals(FileStatus.FAILED, report.getOutcomes().get(1).getStatus());
        assertNotNull(report.getOutcomes().get(1).getErrorMessage());
        assertEquals("create_time\n2023-07-12 00:00:00\n",
                Files.readString(outDir.resolve("a.csv"), StandardCharsets.UTF_8));
        assertEquals("create_time\n2024-01-02 00:00:00\n",
                Files.readString(outDir.resolve("c.csv"), StandardCharsets.UTF_8));
        assertFalse(Files.exists(outDir.resolve("b.csv")));
        assertEquals(2, executor.getTotalProcessed());
        assertEquals(1, executor.getTotalFailed());
    }

    @Test
    void duplicateOutputNameFailsTheLaterInput() throws Exception {
        Path first = Files.createDirectories(tempDir.resolve("x")).resolve("same.csv");
        Path second = Files.createDirectories(tempDir.resolve("y")).resolve("same.csv");
        Files.writeString(first, "create_time\n45119\n", StandardCharsets.UTF_8);
        Files.writeString(second, "create_time\n45118\n", StandardCharsets.UTF_8);
        Path outDir = tempDir.resolve("out");

        BatchReport report = executor(CleaningPolicy.KEEP_ORIGINAL, OutputMode.REPLACE)
                .processFiles(Arrays.asList(first, second), outDir);

        assertEquals(FileStatus.COMPLETED, report.getOutcomes().get(0).getStatus());
        assertEquals(FileStatus.FAILED, report.getOutcomes().get(1).getStatus());
        assertEquals("create_time\n2023-07-12 00:00:00\n",
                Files.readString(outDir.resolve("same.csv"), StandardCharsets.UTF_8));
    }

    @Test
    void cancelledBatchLeavesNoOutputs() throws Exception {
        Path inDir = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(inDir.resolve("a.csv"), "create_time\n45119\n", StandardCharsets.UTF_8);
        Files.writeString(inDir.resolve("b.csv"), "create_time\n45118\n", StandardCharsets.UTF_8);
        Path outDir = tempDir.resolve("out");

        DefaultBatchExecutor executor = executor(CleaningPolicy.KEEP_ORIGINAL, OutputMode.REPLACE);
        executor.cancel();
        BatchReport report = executor.processDirectory(inDir, outDir);

        assertTrue(executor.isCancelled());
        assertEquals(2, report.count(FileStatus.CANCELLED));
        assertFalse(Files.exists(outDir.resolve("a.csv")));
    }

    @Test
    void disabledConfigSkipsDirectory() throws Exception {
        DateCleaningConfig disabled = new DateCleaningConfigLoader().load(new ByteArrayInputStream(
                RULES.replace("date_cleaning:\n", "date_cleaning:\n  enabled: false\n")
                        .getBytes(StandardCharsets.UTF_8)), "disabled rules");
        Path inDir = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(inDir.resolve("a.csv"), "create_time\n45119\n", StandardCharsets.UTF_8);

        DefaultBatchExecutor executor = new DefaultBatchExecutor(disabled, new CsvTableStore(), 1);
        executors.add(executor);
        BatchReport report = executor.processDirectory(inDir, tempDir.resolve("out"));

        assertEquals(0, report.size());
        assertFalse(Files.exists(tempDir.resolve("out")));
    }
}
