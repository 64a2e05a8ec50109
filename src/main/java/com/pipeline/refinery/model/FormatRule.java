package com.pipeline.refinery.model;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 日期识别与解码规则。
 *
 * 每条规则由两部分组成：
 * 1. 识别谓词：正则表达式，按整串匹配（不是子串查找）
 * 2. 解码器：模板解码（{@link TemplateFormatRule}）或序列日期解码（{@link SerialDateFormatRule}）
 *
 * 规则的优先级即其在 {@code FormatRegistry} 中的位置。规则加载后不可变，可在多线程间共享。
 */
public abstract class FormatRule {

    /** 解码器种类 */
    public enum Kind {
        /** 按位置描述年月日时分秒的模板 */
        TEMPLATE,
        /** 以固定纪元为起点的天数 */
        SERIAL_NUMBER
    }

    private final String name;
    private final String description;
    private final Pattern recognitionPattern;

    protected FormatRule(String name, String regex, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Format rule name must not be null or blank");
        }
        if (regex == null || regex.isBlank()) {
            throw new IllegalArgumentException("Recognition pattern is required for rule: " + name);
        }
        this.name = name;
        this.description = description != null ? description : "";
        try {
            this.recognitionPattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid recognition pattern for rule '" + name + "': "
                    + e.getDescription(), e);
        }
    }

    /**
     * 识别谓词，整串匹配。
     */
    public boolean matches(String value) {
        return value != null && recognitionPattern.matcher(value).matches();
    }

    /**
     * 解码一个已被识别谓词接受的值。
     *
     * @param value 预处理后的文本
     * @return 解码结果；结构匹配但语义非法（如2月30日）时返回null
     */
    public abstract DecodedDate decode(String value);

    public abstract Kind getKind();

    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getRecognitionPattern() { return recognitionPattern.pattern(); }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', pattern='" + recognitionPattern.pattern() + "'}";
    }
}
