package com.pipeline.refinery;

import com.pipeline.refinery.config.ConfigException;
import com.pipeline.refinery.config.DateCleaningConfigLoader;
import com.pipeline.refinery.core.PipelineContext;
import com.pipeline.refinery.core.impl.DefaultBatchExecutor;
import com.pipeline.refinery.core.impl.DefaultPipelineContext;
import com.pipeline.refinery.core.impl.DefaultPipelineStepSequencer;
import com.pipeline.refinery.model.DateCleaningConfig;
import com.pipeline.refinery.model.PipelineRunReport;
import com.pipeline.refinery.model.PipelineStepSpec;
import com.pipeline.refinery.steps.DateCleaningBatchStep;
import com.pipeline.refinery.steps.DateCleaningStep;
import com.pipeline.refinery.storage.CsvTableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 系统启动引导类。
 * 一条命令完成全部初始化：加载配置、校验清洗规则、组装步骤、顺序执行。
 *
 * 用法：java -jar pipeline-refinery.jar [配置文件路径]
 */
public class RefineryApplication {

    private static final Logger log = LoggerFactory.getLogger(RefineryApplication.class);

    public PipelineRunReport run(AppConfig config) {
        log.info("=== Pipeline Refinery: date field cleaning ===");
        log.info("Starting with config: {}", config);

        // 1. 加载并校验日期清洗规则，配置错误在处理任何文件之前中止
        DateCleaningConfigLoader loader = new DateCleaningConfigLoader();
        DateCleaningConfig cleaningConfig = config.getDateCleaningConfig().isEmpty()
                ? loader.loadDefault()
                : loader.load(Paths.get(config.getDateCleaningConfig()));

        // 2. 初始化执行器
        try (DefaultBatchExecutor executor = new DefaultBatchExecutor(
                cleaningConfig, new CsvTableStore(), config.getWorkerParallelism())) {

            // 注册JVM关闭钩子，中断时不再开始新的文件
            Thread hook = new Thread(executor::cancel, "shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);

            // 3. 组装步骤
            List<PipelineStepSpec> steps = new ArrayList<>();
            steps.add(new PipelineStepSpec(DateCleaningStep.STEP_ID,
                    new DateCleaningStep(executor), "日期清洗", false));
            if (!config.getBatchInputDir().isEmpty()) {
                steps.add(new PipelineStepSpec(DateCleaningBatchStep.STEP_ID,
                        new DateCleaningBatchStep(executor), "目录日期清洗", false));
            }

            // 4. 顺序执行
            try {
                PipelineRunReport report = new DefaultPipelineStepSequencer().run(steps, createContext(config));
                log.info("=== Pipeline finished ===");
                return report;
            } finally {
                removeShutdownHook(hook);
            }
        }
    }

    /**
     * @return 钩子是否仍处于注册状态并已移除
     */
    static boolean removeShutdownHook(Thread hook) {
        try {
            return Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM已在关闭中，钩子由运行时负责
            log.debug("Shutdown in progress, hook left to the runtime");
            return false;
        }
    }

    static PipelineContext createContext(AppConfig config) {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put(PipelineContext.RESULT_DIR, Paths.get(config.getResultDir()));
        parameters.put(DateCleaningStep.COLUMNS, config.getDateCleaningColumns());
        parameters.put(DateCleaningBatchStep.BATCH_INPUT_DIR, config.getBatchInputDir());
        parameters.put(DateCleaningBatchStep.BATCH_OUTPUT_DIR, config.getBatchOutputDir());
        return new DefaultPipelineContext(parameters);
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String configPath = (args.length > 0) ? args[0] : "config/application.properties";

        AppConfig config = AppConfig.load(configPath);
        try {
            new RefineryApplication().run(config);
        } catch (ConfigException e) {
            log.error("Configuration rejected:");
            for (String error : e.getErrors()) {
                log.error("  {}", error);
            }
            System.exit(2);
        } catch (RuntimeException e) {
            log.error("Pipeline aborted: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
