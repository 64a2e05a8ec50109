package com.pipeline.refinery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的流水线级参数，日期清洗规则本身在单独的YAML文件中。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    // ---- 流水线 ----
    private String resultDir = "Result_files";

    // ---- 日期清洗 ----
    /** 规则文件路径，为空时使用类路径上的默认规则 */
    private String dateCleaningConfig = "";
    /** 只清洗这些字段，为空表示全部 */
    private String dateCleaningColumns = "";

    // ---- 目录批处理 ----
    private String batchInputDir = "";
    private String batchOutputDir = "";
    private int workerParallelism = Runtime.getRuntime().availableProcessors();

    public static AppConfig load(String configPath) {
        AppConfig config = new AppConfig();
        Path path = Paths.get(configPath);
        if (!Files.isRegularFile(path)) {
            log.warn("Config file {} not found, using defaults.", configPath);
            return config;
        }
        try (InputStream input = Files.newInputStream(path)) {
            Properties props = new Properties();
            props.load(input);
            config.apply(props);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
            return new AppConfig();
        }
        return config;
    }

    static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();
        config.apply(props);
        return config;
    }

    private void apply(Properties props) {
        resultDir = props.getProperty("pipeline.result.dir", "Result_files").strip();
        dateCleaningConfig = props.getProperty("date.cleaning.config", "").strip();
        dateCleaningColumns = props.getProperty("date.cleaning.columns", "").strip();
        batchInputDir = props.getProperty("batch.input.dir", "").strip();
        batchOutputDir = props.getProperty("batch.output.dir", "").strip();
        workerParallelism = Integer.parseInt(props.getProperty("worker.parallelism",
                String.valueOf(Runtime.getRuntime().availableProcessors())).strip());
        if (workerParallelism < 1) {
            throw new IllegalArgumentException("worker.parallelism must be positive: " + workerParallelism);
        }
    }

    // ---- Getters ----
    public String getResultDir() { return resultDir; }
    public String getDateCleaningConfig() { return dateCleaningConfig; }
    public String getDateCleaningColumns() { return dateCleaningColumns; }
    public String getBatchInputDir() { return batchInputDir; }
    public String getBatchOutputDir() { return batchOutputDir; }
    public int getWorkerParallelism() { return workerParallelism; }

    @Override
    public String toString() {
        return "AppConfig{resultDir='" + resultDir + "'"
                + ", dateCleaningConfig='" + dateCleaningConfig + "'"
                + ", columns='" + dateCleaningColumns + "'"
                + ", batchInputDir='" + batchInputDir + "'"
                + ", parallelism=" + workerParallelism + "}";
    }
}
