package com.pipeline.refinery.core.impl;

import com.pipeline.refinery.core.BatchExecutor;
import com.pipeline.refinery.core.TableStore;
import com.pipeline.refinery.model.BatchReport;
import com.pipeline.refinery.model.CleaningAction;
import com.pipeline.refinery.model.CleaningOptions;
import com.pipeline.refinery.model.CleaningResult;
import com.pipeline.refinery.model.DateCleaningConfig;
import com.pipeline.refinery.model.FieldSpec;
import com.pipeline.refinery.model.FileOutcome;
import com.pipeline.refinery.model.FileStatus;
import com.pipeline.refinery.model.NormalizedValue;
import com.pipeline.refinery.model.OutputMode;
import com.pipeline.refinery.model.TableSnapshot;
import com.pipeline.refinery.model.ValueDecision;
import com.pipeline.refinery.normalize.CleaningPolicyEngine;
import com.pipeline.refinery.normalize.DateNormalizer;
import com.pipeline.refinery.normalize.FieldAliasResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 批处理执行器默认实现。
 * 使用工作窃取线程池实现文件级并行，每个文件在单个工作线程内完成一次完整处理。
 * 所有文件共享同一份只读的规则注册表和字段定义。
 */
public class DefaultBatchExecutor implements BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultBatchExecutor.class);

    private static final String CSV_SUFFIX = ".csv";

    private final DateCleaningConfig config;
    private final TableStore tableStore;
    private final FieldAliasResolver aliasResolver = new FieldAliasResolver();
    private final DateNormalizer normalizer;
    private final CleaningPolicyEngine policyEngine;

    /** 工作窃取线程池，自动平衡各线程负载 */
    private final ForkJoinPool workerPool;

    /** 正在写出的目标文件 -> 输入文件，防止并发批次写同一个输出 */
    private final ConcurrentHashMap<Path, Path> runningOutputs = new ConcurrentHashMap<>();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** 执行统计 */
    private final AtomicInteger totalProcessed = new AtomicInteger(0);
    private final AtomicInteger totalFailed = new AtomicInteger(0);

    public DefaultBatchExecutor(DateCleaningConfig config, TableStore tableStore, int parallelism) {
        if (config == null || tableStore == null) {
            throw new IllegalArgumentException("Config and table store must not be null");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
        }
        this.config = config;
        this.tableStore = tableStore;
        this.normalizer = new DateNormalizer(config);
        this.policyEngine = new CleaningPolicyEngine(config.getOptions().getOnParseFailure());

        this.workerPool = new ForkJoinPool(
                parallelism,
                ForkJoinPool.defaultForkJoinWorkerThreadFactory,
                (t, e) -> log.error("Uncaught exception in worker thread {}: {}",
                        t.getName(), e.getMessage(), e),
                true
        );

        log.info("BatchExecutor initialized. Parallelism: {}, {}", parallelism, config);
    }

    public DefaultBatchExecutor(DateCleaningConfig config, TableStore tableStore) {
        this(config, tableStore, Runtime.getRuntime().availableProcessors());
    }

    @Override
    public CleaningResult cleanTable(TableSnapshot table) {
        return cleanTable(table, null);
    }

    @Override
    public CleaningResult cleanTable(TableSnapshot table, Collection<String> onlyFields) {
        if (table == null) {
            throw new IllegalArgumentException("Table must not be null");
        }
        CleaningOptions options = config.getOptions();
        TableSnapshot output = table.copy();
        List<String> header = table.getColumnNames();

        List<ValueDecision> decisions = new ArrayList<>();
        Map<String, String> resolvedColumns = new LinkedHashMap<>();
        List<String> skippedFields = new ArrayList<>();
        Set<String> claimedColumns = new HashSet<>();
        // 删除决定在全部字段处理完之后统一应用
        BitSet rowsToDrop = new BitSet(table.getRowCount());

        for (FieldSpec field : selectFields(onlyFields)) {
            Optional<String> resolved = aliasResolver.resolve(header, field);
            if (resolved.isEmpty()) {
                log.info("Date field '{}' not found in columns {}, skipped.", field.getName(), header);
                skippedFields.add(field.getName());
                continue;
            }
            String column = resolved.get();
            if (!claimedColumns.add(column)) {
                log.warn("Column '{}' is already cleaned by another date field, skipping field '{}'.",
                        column, field.getName());
                skippedFields.add(field.getName());
                continue;
            }
            resolvedColumns.put(field.getName(), column);

            List<String> cleaned = cleanColumn(table.getColumn(column), column, field,
                    decisions, rowsToDrop);
            if (options.getOutputMode() == OutputMode.ADD_COLUMN) {
                output.addColumn(derivedColumnName(output, column), cleaned);
            } else {
                output.replaceColumn(output.indexOf(column), cleaned);
            }
        }

        int dropped = policyEngine.applyRowDrops(output, rowsToDrop);
        if (dropped > 0) {
            log.info("Dropped {} of {} rows with unparsable dates.", dropped, table.getRowCount());
        }
        return new CleaningResult(output, decisions, resolvedColumns, skippedFields, table.getRowCount());
    }

    /**
     * 派生列名为 {@code <列名>_cleaned}；输入已有同名列时依次尝试 {@code _cleaned_2}、{@code _cleaned_3}……
     */
    private static String derivedColumnName(TableSnapshot table, String column) {
        String base = column + OutputMode.DERIVED_COLUMN_SUFFIX;
        if (table.indexOf(base) < 0) {
            return base;
        }
        String candidate;
        int n = 2;
        do {
            candidate = base + "_" + n++;
        } while (table.indexOf(candidate) >= 0);
        log.warn("Column '{}' already exists, cleaned values of '{}' written to '{}'.", base, column, candidate);
        return candidate;
    }

    /**
     * 规范化一列：每个不同的非空值只解码一次，再按行展开。
     */
    private List<String> cleanColumn(List<String> values, String column, FieldSpec field,
                                     List<ValueDecision> decisions, BitSet rowsToDrop) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String value : values) {
            if (!isBlank(value)) {
                distinct.add(value);
            }
        }
        Map<String, NormalizedValue> normalized = normalizer.normalizeAll(distinct, field);

        boolean logDetails = config.getOptions().isLogDetails();
        List<String> cleaned = new ArrayList<>(values.size());
        int success = 0;
        int failed = 0;
        for (int row = 0; row < values.size(); row++) {
            String raw = values.get(row);
            ValueDecision decision;
            if (isBlank(raw)) {
                decision = new ValueDecision(row, column, raw, null, CleaningAction.SKIPPED_BLANK, raw);
            } else {
                NormalizedValue result = normalized.get(raw);
                if (result.isSuccess()) {
                    decision = new ValueDecision(row, column, raw, result.getRuleName(),
                            CleaningAction.NORMALIZED, result.getValue());
                    success++;
                } else {
                    decision = policyEngine.onUnparsable(row, column, raw, rowsToDrop);
                    failed++;
                }
            }
            if (logDetails) {
                log.info("{} -> '{}'", decision, decision.getOutputValue());
            }
            decisions.add(decision);
            cleaned.add(decision.getOutputValue());
        }

        log.info("Date field '{}' (column '{}'): {} distinct values, {} cells normalized, {} unparsable ({}).",
                field.getName(), column, distinct.size(), success, failed, policyEngine.getPolicy());
        return cleaned;
    }

    private List<FieldSpec> selectFields(Collection<String> onlyFields) {
        List<FieldSpec> all = config.getDateFields();
        if (onlyFields == null || onlyFields.isEmpty()) {
            return all;
        }
        Set<String> wanted = new LinkedHashSet<>();
        for (String name : onlyFields) {
            wanted.add(FieldAliasResolver.normalize(name));
        }
        List<FieldSpec> selected = new ArrayList<>();
        for (FieldSpec field : all) {
            if (wanted.remove(FieldAliasResolver.normalize(field.getName()))) {
                selected.add(field);
            }
        }
        if (!wanted.isEmpty()) {
            log.warn("Requested date fields {} are not configured, ignored.", wanted);
        }
        return selected;
    }

    @Override
    public FileOutcome processFile(Path inputFile, Path outputFile) throws IOException {
        return processFile(inputFile, outputFile, null);
    }

    @Override
    public FileOutcome processFile(Path inputFile, Path outputFile, Collection<String> onlyFields)
            throws IOException {
        long startTime = System.currentTimeMillis();
        TableSnapshot table = tableStore.read(inputFile);
        CleaningResult result = cleanTable(table, onlyFields);

        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        tableStore.write(result.getTable(), outputFile);

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Cleaned '{}' -> '{}' in {}ms: {} rows in, {} rows out, actions {}",
                inputFile.getFileName(), outputFile.getFileName(), elapsed,
                result.getInputRowCount(), result.getTable().getRowCount(), result.countByAction());
        return FileOutcome.completed(inputFile, outputFile,
                result.getInputRowCount(), result.getTable().getRowCount());
    }

    @Override
    public BatchReport processFiles(List<Path> inputFiles, Path outputDir) {
        if (inputFiles == null || outputDir == null) {
            throw new IllegalArgumentException("Input files and output directory must not be null");
        }
        // 按输入顺序保存结果
        List<Future<FileOutcome>> slots = new ArrayList<>(inputFiles.size());
        Map<Path, Path> claimedOutputs = new HashMap<>();

        for (Path inputFile : inputFiles) {
            Path outputFile = outputDir.resolve(inputFile.getFileName().toString());
            Path firstInput = claimedOutputs.putIfAbsent(outputFile, inputFile);
            if (firstInput != null) {
                String message = "Output file " + outputFile + " is already produced by " + firstInput;
                log.error("Skipping '{}': {}", inputFile, message);
                totalFailed.incrementAndGet();
                slots.add(CompletableFuture.completedFuture(FileOutcome.failed(inputFile, outputFile, message)));
                continue;
            }
            slots.add(workerPool.submit(() -> processOne(inputFile, outputFile)));
        }

        List<FileOutcome> outcomes = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            outcomes.add(await(slots.get(i), inputFiles.get(i), outputDir));
        }

        BatchReport report = new BatchReport(outcomes);
        log.info("Batch finished: {} files, {} completed, {} failed, {} cancelled.",
                report.size(), report.count(FileStatus.COMPLETED),
                report.count(FileStatus.FAILED), report.count(FileStatus.CANCELLED));
        return report;
    }

    private FileOutcome await(Future<FileOutcome> slot, Path inputFile, Path outputDir) {
        Path outputFile = outputDir.resolve(inputFile.getFileName().toString());
        try {
            return slot.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return FileOutcome.cancelled(inputFile, outputFile);
        } catch (ExecutionException e) {
            totalFailed.incrementAndGet();
            log.error("File '{}' failed: {}", inputFile, e.getCause().getMessage(), e.getCause());
            return FileOutcome.failed(inputFile, outputFile, String.valueOf(e.getCause().getMessage()));
        }
    }

    /**
     * 在工作线程中处理单个文件，异常不向外传播
     */
    private FileOutcome processOne(Path inputFile, Path outputFile) {
        if (cancelled.get()) {
            log.info("Batch cancelled, '{}' not processed.", inputFile.getFileName());
            return FileOutcome.cancelled(inputFile, outputFile);
        }
        Path outputKey = outputFile.toAbsolutePath().normalize();
        Path owner = runningOutputs.putIfAbsent(outputKey, inputFile);
        if (owner != null) {
            totalFailed.incrementAndGet();
            String message = "Output file " + outputFile + " is being written for " + owner;
            log.error("Skipping '{}': {}", inputFile, message);
            return FileOutcome.failed(inputFile, outputFile, message);
        }
        try {
            FileOutcome outcome = processFile(inputFile, outputFile);
            totalProcessed.incrementAndGet();
            return outcome;

        } catch (IOException | RuntimeException e) {
            totalFailed.incrementAndGet();
            log.error("File '{}' failed: {}", inputFile, e.getMessage(), e);
            return FileOutcome.failed(inputFile, outputFile, e.getMessage());
        } finally {
            runningOutputs.remove(outputKey);
        }
    }

    @Override
    public BatchReport processDirectory(Path inputDir, Path outputDir) throws IOException {
        if (!config.isEnabled()) {
            log.info("Date cleaning is disabled, directory '{}' not processed.", inputDir);
            return BatchReport.empty();
        }
        if (!Files.isDirectory(inputDir)) {
            throw new NotDirectoryException(inputDir.toString());
        }
        List<Path> inputFiles;
        try (Stream<Path> entries = Files.list(inputDir)) {
            inputFiles = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(CSV_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        }
        if (inputFiles.isEmpty()) {
            log.warn("No CSV files found in '{}'.", inputDir);
            return BatchReport.empty();
        }
        log.info("Processing {} CSV files from '{}' into '{}'.", inputFiles.size(), inputDir, outputDir);
        return processFiles(inputFiles, outputDir);
    }

    @Override
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Batch cancellation requested, pending files will not be processed.");
        }
    }

    @Override
    public boolean isCancelled() { return cancelled.get(); }

    @Override
    public void close() {
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within 30s, forcing shutdown.");
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
        log.info("BatchExecutor closed. Processed: {}, failed: {}", totalProcessed.get(), totalFailed.get());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public DateCleaningConfig getConfig() { return config; }

    /** 获取执行统计 */
    public int getTotalProcessed() { return totalProcessed.get(); }
    public int getTotalFailed() { return totalFailed.get(); }
    public int getActiveFileCount() { return runningOutputs.size(); }
}
