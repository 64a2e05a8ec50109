package com.pipeline.refinery.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 配置校验结果。
 * 每条错误和警告都以配置路径开头，例如 {@code date_cleaning.parse_formats[2].regex_pattern}。
 */
public class ValidationResult implements Serializable {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void addError(String path, String message) {
        errors.add(path + ": " + message);
    }

    public void addWarning(String path, String message) {
        warnings.add(path + ": " + message);
    }

    public boolean isValid() { return errors.isEmpty(); }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }
}
