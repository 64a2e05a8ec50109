package com.pipeline.refinery.core.impl;

import com.pipeline.refinery.core.PipelineContext;
import com.pipeline.refinery.core.PipelineStepSequencer;
import com.pipeline.refinery.core.StepExecutionException;
import com.pipeline.refinery.model.PipelineRunReport;
import com.pipeline.refinery.model.PipelineStepSpec;
import com.pipeline.refinery.model.StepOutcome;
import com.pipeline.refinery.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 步骤编排器默认实现。
 * 在调用线程上顺序执行，不引入额外并发。
 */
public class DefaultPipelineStepSequencer implements PipelineStepSequencer {

    private static final Logger log = LoggerFactory.getLogger(DefaultPipelineStepSequencer.class);

    @Override
    public PipelineRunReport run(List<PipelineStepSpec> steps, PipelineContext context) {
        return run(steps, context, 0, steps.size());
    }

    @Override
    public PipelineRunReport run(List<PipelineStepSpec> steps, PipelineContext context, int fromStep, int toStep) {
        if (steps == null || context == null) {
            throw new IllegalArgumentException("Steps and context must not be null");
        }
        int end = Math.min(toStep, steps.size());
        if (fromStep < 0 || fromStep > end) {
            throw new IllegalArgumentException("Invalid step range [" + fromStep + ", " + toStep
                    + ") for " + steps.size() + " steps");
        }

        PipelineRunReport report = new PipelineRunReport();
        for (int i = fromStep; i < end; i++) {
            PipelineStepSpec spec = steps.get(i);

            if (context.isStopRequested()) {
                log.warn("Pipeline stopped ({}), skipping step '{}'", context.getStopReason(), spec.getId());
                report.record(new StepOutcome(spec.getId(), StepStatus.SKIPPED, 0, null));
                continue;
            }

            log.info("[{}/{}] {}...", i + 1, steps.size(), spec.getLabel());
            long startTime = System.currentTimeMillis();
            try {
                spec.getStep().execute(context);
                long elapsed = System.currentTimeMillis() - startTime;
                report.record(new StepOutcome(spec.getId(), StepStatus.COMPLETED, elapsed, null));
                log.info("Step '{}' completed in {}ms", spec.getId(), elapsed);

            } catch (Exception e) {
                long elapsed = System.currentTimeMillis() - startTime;
                report.record(new StepOutcome(spec.getId(), StepStatus.FAILED, elapsed, e.getMessage()));
                log.error("Step '{}' failed: {}", spec.getId(), e.getMessage(), e);

                if (spec.isRequired()) {
                    // 必选步骤失败，中止整次运行
                    if (e instanceof RuntimeException) {
                        throw (RuntimeException) e;
                    }
                    throw new StepExecutionException(spec.getId(), e);
                }
            }
        }

        if (context.isStopRequested()) {
            report.setStopReason(context.getStopReason());
        }
        log.info("Pipeline finished: {}", report);
        return report;
    }
}
