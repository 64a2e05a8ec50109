package com.pipeline.refinery.core.impl;

import com.pipeline.refinery.core.PipelineContext;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * 流水线上下文默认实现。
 * 参数在启动时一次性装入，停止信号由步骤在运行中设置。
 */
public class DefaultPipelineContext implements PipelineContext {

    private final Map<String, Object> parameters;

    private volatile boolean stopRequested = false;
    private volatile String stopReason;

    public DefaultPipelineContext(Map<String, Object> parameters) {
        this.parameters = parameters != null ? new HashMap<>(parameters) : new HashMap<>();
    }

    public DefaultPipelineContext(Path resultDir) {
        this(Map.of(RESULT_DIR, resultDir));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getParameter(String paramName, T defaultValue) {
        Object value = parameters.get(paramName);
        if (value == null) {
            return defaultValue;
        }

        try {
            if (defaultValue != null) {
                Class<?> targetType = defaultValue.getClass();
                // 数值类型转换
                if (targetType == Integer.class && value instanceof Number) {
                    return (T) Integer.valueOf(((Number) value).intValue());
                }
                if (targetType == Long.class && value instanceof Number) {
                    return (T) Long.valueOf(((Number) value).longValue());
                }
                // 属性文件中的参数都是字符串
                if (targetType == Boolean.class && value instanceof String) {
                    return (T) Boolean.valueOf(((String) value).strip());
                }
                if (targetType == Integer.class && value instanceof String) {
                    return (T) Integer.valueOf(((String) value).strip());
                }
                if (defaultValue instanceof Path && value instanceof String) {
                    return (T) Paths.get((String) value);
                }
                if (targetType == String.class && !(value instanceof String)) {
                    return (T) value.toString();
                }
                if (!targetType.isInstance(value) && !(defaultValue instanceof Path && value instanceof Path)) {
                    return defaultValue;
                }
            }
            return (T) value;
        } catch (ClassCastException | NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public Path getResultDir() {
        return getParameter(RESULT_DIR, Paths.get("Result_files"));
    }

    @Override
    public void requestStop(String reason) {
        this.stopReason = reason;
        this.stopRequested = true;
    }

    @Override
    public boolean isStopRequested() { return stopRequested; }

    @Override
    public String getStopReason() { return stopReason; }
}
