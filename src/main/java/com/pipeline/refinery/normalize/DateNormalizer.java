package com.pipeline.refinery.normalize;

import com.pipeline.refinery.model.DateCleaningConfig;
import com.pipeline.refinery.model.DecodedDate;
import com.pipeline.refinery.model.FieldSpec;
import com.pipeline.refinery.model.NormalizedValue;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 日期规范化器。
 *
 * 处理流程：预处理 → 交给 {@link FormatRegistry} 识别解码 → 按所属字段的 hasTime 选择输出模板。
 * 输出形态只由字段决定，与命中规则是否带时间无关：
 * - hasTime=true：无时间部分的值补 00:00:00 后按完整模板输出
 * - hasTime=false：丢弃时间部分后按纯日期模板输出
 */
public class DateNormalizer {

    /** 数字之间 "." 或 "/" 后的多余空白，如 "2024. 1. 4" */
    private static final Pattern SEPARATOR_GAP = Pattern.compile("(?<=\\d)([./])\\s+(?=\\d)");
    /** 纯数字加 ".0" 后缀，如 "45119.0" */
    private static final Pattern TRAILING_DECIMAL_ZERO = Pattern.compile("^(\\d+)\\.0$");

    private final FormatRegistry registry;
    private final DateTimeFormatter outputFormatter;
    private final DateTimeFormatter dateOnlyFormatter;
    private final boolean stripTrailingDecimalZero;

    public DateNormalizer(FormatRegistry registry, String outputFormat, String outputFormatDateOnly,
                          boolean stripTrailingDecimalZero) {
        if (registry == null) {
            throw new IllegalArgumentException("FormatRegistry must not be null");
        }
        this.registry = registry;
        this.outputFormatter = DateTimeFormatter.ofPattern(outputFormat);
        this.dateOnlyFormatter = DateTimeFormatter.ofPattern(outputFormatDateOnly);
        this.stripTrailingDecimalZero = stripTrailingDecimalZero;
    }

    public DateNormalizer(DateCleaningConfig config) {
        this(config.getFormatRegistry(), config.getOutputFormat(), config.getOutputFormatDateOnly(),
                config.getOptions().isRemoveDecimalZero());
    }

    /**
     * 分类前的文本预处理：去首尾空白，去掉分隔符后的空白，按需去掉 ".0" 后缀
     */
    public String preprocess(String raw) {
        if (raw == null) {
            return null;
        }
        String value = SEPARATOR_GAP.matcher(raw.strip()).replaceAll("$1");
        if (stripTrailingDecimalZero) {
            value = TRAILING_DECIMAL_ZERO.matcher(value).replaceFirst("$1");
        }
        return value;
    }

    public NormalizedValue normalize(String raw, FieldSpec field) {
        FormatRegistry.RuleMatch match = registry.decode(preprocess(raw));
        if (match == null) {
            return NormalizedValue.unparsable(raw);
        }
        return NormalizedValue.success(raw, format(match.getDate(), field.hasTime()), match.getRule().getName());
    }

    /**
     * 批量规范化一组去重后的原始值。
     * 预处理后相同的值只解码一次。
     *
     * @return 原始值 -> 规范化结果，包含每个非null输入
     */
    public Map<String, NormalizedValue> normalizeAll(Collection<String> rawValues, FieldSpec field) {
        Map<String, String> preprocessed = new LinkedHashMap<>();
        for (String raw : rawValues) {
            if (raw != null) {
                preprocessed.put(raw, preprocess(raw));
            }
        }
        Map<String, FormatRegistry.RuleMatch> matches = registry.decodeAll(preprocessed.values());

        Map<String, NormalizedValue> results = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : preprocessed.entrySet()) {
            FormatRegistry.RuleMatch match = matches.get(entry.getValue());
            if (match == null) {
                results.put(entry.getKey(), NormalizedValue.unparsable(entry.getKey()));
            } else {
                results.put(entry.getKey(), NormalizedValue.success(entry.getKey(),
                        format(match.getDate(), field.hasTime()), match.getRule().getName()));
            }
        }
        return results;
    }

    public String format(DecodedDate date, boolean hasTime) {
        if (hasTime) {
            DecodedDate withTime = date.hasTime() ? date : date.withTime(LocalTime.MIDNIGHT);
            return withTime.format(outputFormatter);
        }
        return date.withoutTime().format(dateOnlyFormatter);
    }

    public FormatRegistry getRegistry() { return registry; }
}
