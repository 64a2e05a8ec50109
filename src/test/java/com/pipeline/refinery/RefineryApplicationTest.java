package com.pipeline.refinery;

import com.pipeline.refinery.config.ConfigException;
import com.pipeline.refinery.model.PipelineRunReport;
import com.pipeline.refinery.model.StepStatus;
import com.pipeline.refinery.steps.DateCleaningBatchStep;
import com.pipeline.refinery.steps.DateCleaningStep;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RefineryApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void runsDateCleaningOverResultDirectory() throws Exception {
        Path results = Files.createDirectories(tempDir.resolve("results"));
        Files.writeString(results.resolve("merge.csv"), "create_time,备注\n45119.0,ok\n", StandardCharsets.UTF_8);
        Properties props = new Properties();
        props.setProperty("pipeline.result.dir", results.toString());
        props.setProperty("worker.parallelism", "1");

        PipelineRunReport report = new RefineryApplication().run(AppConfig.fromProperties(props));

        assertEquals(StepStatus.COMPLETED, report.getOutcome(DateCleaningStep.STEP_ID).getStatus());
        assertNull(report.getOutcome(DateCleaningBatchStep.STEP_ID));
        assertEquals("create_time,备注\n2023-07-12 00:00:00,ok\n",
                Files.readString(results.resolve("merge_cleaned.csv"), StandardCharsets.UTF_8));
    }

    @Test
    void failingOptionalBatchStepDoesNotFailTheRun() throws Exception {
        Properties props = new Properties();
        props.setProperty("pipeline.result.dir", tempDir.resolve("results").toString());
        props.setProperty("batch.input.dir", tempDir.resolve("missing").toString());

        PipelineRunReport report = new RefineryApplication().run(AppConfig.fromProperties(props));

        assertEquals(StepStatus.COMPLETED, report.getOutcome(DateCleaningStep.STEP_ID).getStatus());
        assertEquals(StepStatus.FAILED, report.getOutcome(DateCleaningBatchStep.STEP_ID).getStatus());
    }

    @Test
    void malformedMergeFileDoesNotStopTheBatchStep() throws Exception {
        Path results = Files.createDirectories(tempDir.resolve("results"));
        Files.writeString(results.resolve("merge.csv"), "create_time\n45119,extra\n", StandardCharsets.UTF_8);
        Path input = Files.createDirectories(tempDir.resolve("input"));
        Files.writeString(input.resolve("orders.csv"), "create_time\n20230712\n", StandardCharsets.UTF_8);
        Path output = tempDir.resolve("output");
        Properties props = new Properties();
        props.setProperty("pipeline.result.dir", results.toString());
        props.setProperty("batch.input.dir", input.toString());
        props.setProperty("batch.output.dir", output.toString());
        props.setProperty("worker.parallelism", "1");

        PipelineRunReport report = new RefineryApplication().run(AppConfig.fromProperties(props));

        assertEquals(StepStatus.FAILED, report.getOutcome(DateCleaningStep.STEP_ID).getStatus());
        assertEquals(StepStatus.COMPLETED, report.getOutcome(DateCleaningBatchStep.STEP_ID).getStatus());
        assertFalse(Files.exists(results.resolve("merge_cleaned.csv")));
        assertEquals("create_time\n2023-07-12 00:00:00\n",
                Files.readString(output.resolve("orders.csv"), StandardCharsets.UTF_8));
    }

    @Test
    void invalidRuleFileAbortsBeforeProcessing() throws Exception {
        Path results = Files.createDirectories(tempDir.resolve("results"));
        Files.writeString(results.resolve("merge.csv"), "create_time\n45119\n", StandardCharsets.UTF_8);
        Path rules = tempDir.resolve("rules.yaml");
        Files.writeString(rules, "date_cleaning:\n  parse_formats: []\n", StandardCharsets.UTF_8);
        Properties props = new Properties();
        props.setProperty("pipeline.result.dir", results.toString());
        props.setProperty("date.cleaning.config", rules.toString());

        assertThrows(ConfigException.class, () -> new RefineryApplication().run(AppConfig.fromProperties(props)));
        assertFalse(Files.exists(results.resolve("merge_cleaned.csv")));
    }

    @Test
    void shutdownHookIsRemovedExactlyOnce() {
        Thread hook = new Thread(() -> { }, "test-hook");
        Runtime.getRuntime().addShutdownHook(hook);

        assertTrue(RefineryApplication.removeShutdownHook(hook));
        assertFalse(RefineryApplication.removeShutdownHook(hook));
    }
}
