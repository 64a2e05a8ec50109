package com.pipeline.refinery.model;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * 模板解码规则。
 * 模板为 {@link DateTimeFormatter} 模式串（年份使用 {@code uuuu}），按严格模式解析，
 * 模板中缺失的月、日取各自的第一个合法值（1）。
 */
public final class TemplateFormatRule extends FormatRule {

    private final String template;
    private final DateTimeFormatter formatter;

    public TemplateFormatRule(String name, String regex, String template, String description) {
        super(name, regex, description);
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Template is required for rule: " + name);
        }
        this.template = template;
        this.formatter = compile(template);
    }

    /**
     * 编译模板，模板非法时抛出IllegalArgumentException
     */
    public static DateTimeFormatter compile(String template) {
        return new DateTimeFormatterBuilder()
                .appendPattern(template)
                .parseDefaulting(ChronoField.MONTH_OF_YEAR, 1)
                .parseDefaulting(ChronoField.DAY_OF_MONTH, 1)
                .toFormatter()
                .withResolverStyle(ResolverStyle.STRICT);
    }

    @Override
    public DecodedDate decode(String value) {
        try {
            TemporalAccessor parsed = formatter.parse(value);
            if (hasUnresolvedTime(parsed)) {
                return null;
            }
            LocalDate date = LocalDate.from(parsed);
            if (parsed.isSupported(ChronoField.HOUR_OF_DAY)) {
                return DecodedDate.of(LocalDateTime.of(date, LocalTime.from(parsed)));
            }
            return DecodedDate.of(date);
        } catch (DateTimeException e) {
            return null;
        }
    }

    /**
     * 解析出了时间字段却没能得到一天中的时刻，例如 {@code hh} 缺少上下午标记 {@code a}
     */
    public static boolean hasUnresolvedTime(TemporalAccessor parsed) {
        if (parsed.isSupported(ChronoField.HOUR_OF_DAY)) {
            return false;
        }
        return parsed.isSupported(ChronoField.HOUR_OF_AMPM)
                || parsed.isSupported(ChronoField.CLOCK_HOUR_OF_AMPM)
                || parsed.isSupported(ChronoField.MINUTE_OF_HOUR)
                || parsed.isSupported(ChronoField.SECOND_OF_MINUTE);
    }

    @Override
    public Kind getKind() {
        return Kind.TEMPLATE;
    }

    public String getTemplate() { return template; }
}
