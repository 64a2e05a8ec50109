package com.pipeline.refinery.config;

import java.util.Collections;
import java.util.List;

/**
 * 配置缺失或不合法。在加载阶段抛出，运行在处理任何文件之前中止。
 * 每条错误以出错的配置路径开头。
 */
public class ConfigException extends RuntimeException {

    private final List<String> errors;

    public ConfigException(String source, List<String> errors) {
        super("Invalid date cleaning configuration '" + source + "': " + String.join("; ", errors));
        this.errors = Collections.unmodifiableList(errors);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.errors = Collections.singletonList(message);
    }

    public List<String> getErrors() { return errors; }
}
