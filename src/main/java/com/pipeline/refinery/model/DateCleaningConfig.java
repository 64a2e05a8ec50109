package com.pipeline.refinery.model;

import com.pipeline.refinery.normalize.FormatRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 日期清洗配置，加载时完成校验，运行期间只读。
 */
public final class DateCleaningConfig {

    public static final String DEFAULT_OUTPUT_FORMAT = "uuuu-MM-dd HH:mm:ss";
    public static final String DEFAULT_OUTPUT_FORMAT_DATE_ONLY = "uuuu-MM-dd";

    private final boolean enabled;
    private final String outputFormat;
    private final String outputFormatDateOnly;
    private final List<FieldSpec> dateFields;
    private final FormatRegistry formatRegistry;
    private final CleaningOptions options;

    public DateCleaningConfig(boolean enabled, String outputFormat, String outputFormatDateOnly,
                              List<FieldSpec> dateFields, FormatRegistry formatRegistry,
                              CleaningOptions options) {
        if (formatRegistry == null) {
            throw new IllegalArgumentException("FormatRegistry must not be null");
        }
        this.enabled = enabled;
        this.outputFormat = outputFormat != null ? outputFormat : DEFAULT_OUTPUT_FORMAT;
        this.outputFormatDateOnly = outputFormatDateOnly != null
                ? outputFormatDateOnly : DEFAULT_OUTPUT_FORMAT_DATE_ONLY;
        this.dateFields = dateFields == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(dateFields));
        this.formatRegistry = formatRegistry;
        this.options = options != null ? options : CleaningOptions.defaults();
    }

    /**
     * 追加一条自定义规则（优先级最低），返回新的配置，原配置不变。
     * 只能在开始处理之前调用。
     */
    public DateCleaningConfig withAdditionalFormat(FormatRule rule) {
        FormatRegistry extended = formatRegistry.toBuilder().add(rule).build();
        return new DateCleaningConfig(enabled, outputFormat, outputFormatDateOnly, dateFields, extended, options);
    }

    public DateCleaningConfig withOptions(CleaningOptions newOptions) {
        return new DateCleaningConfig(enabled, outputFormat, outputFormatDateOnly, dateFields,
                formatRegistry, newOptions);
    }

    public boolean isEnabled() { return enabled; }
    public String getOutputFormat() { return outputFormat; }
    public String getOutputFormatDateOnly() { return outputFormatDateOnly; }
    public List<FieldSpec> getDateFields() { return dateFields; }
    public FormatRegistry getFormatRegistry() { return formatRegistry; }
    public CleaningOptions getOptions() { return options; }

    @Override
    public String toString() {
        return "DateCleaningConfig{enabled=" + enabled
                + ", fields=" + dateFields.size()
                + ", formats=" + formatRegistry.size()
                + ", " + options + "}";
    }
}
