package com.pipeline.refinery.normalize;

import com.pipeline.refinery.model.DecodedDate;
import com.pipeline.refinery.model.FormatRule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 日期格式注册表：由配置一次性构建的有序、不可变规则列表。
 *
 * 对每个值按优先级（列表位置）依次尝试规则：
 * - 识别谓词不匹配：尝试下一条
 * - 识别谓词匹配且解码成功：采用该结果
 * - 识别谓词匹配但解码失败：默认继续尝试下一条规则；
 *   关闭 fallthrough 时直接判定为无法解析
 *
 * 所有规则都未产出结果时，值被判定为无法解析。
 * 注册表构建后只读，可被所有字段、所有文件和所有工作线程共享。
 */
public final class FormatRegistry {

    private final List<FormatRule> rules;
    private final boolean fallthroughOnDecodeFailure;

    private FormatRegistry(List<FormatRule> rules, boolean fallthroughOnDecodeFailure) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        this.fallthroughOnDecodeFailure = fallthroughOnDecodeFailure;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 以当前规则为起点创建新的构建器，用于在处理开始前追加自定义规则
     */
    public Builder toBuilder() {
        Builder builder = new Builder().fallthroughOnDecodeFailure(fallthroughOnDecodeFailure);
        for (FormatRule rule : rules) {
            builder.add(rule);
        }
        return builder;
    }

    /**
     * 解码单个值。
     *
     * @param value 预处理后的文本
     * @return 命中的规则和解码结果；无法解析时返回null
     */
    public RuleMatch decode(String value) {
        if (value == null) {
            return null;
        }
        for (FormatRule rule : rules) {
            if (!rule.matches(value)) {
                continue;
            }
            DecodedDate decoded = rule.decode(value);
            if (decoded != null) {
                return new RuleMatch(rule, decoded);
            }
            if (!fallthroughOnDecodeFailure) {
                return null;
            }
        }
        return null;
    }

    /**
     * 批量解码一组去重后的值。
     * 每条规则只对尚未确定结果的子集求值一次，语义与逐个调用 {@link #decode(String)} 相同。
     *
     * @param values 待解码的值，null被忽略
     * @return 值 -> 命中结果；无法解析的值不在结果中
     */
    public Map<String, RuleMatch> decodeAll(Collection<String> values) {
        Map<String, RuleMatch> decoded = new LinkedHashMap<>();
        Set<String> remaining = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null) {
                remaining.add(value);
            }
        }

        for (FormatRule rule : rules) {
            if (remaining.isEmpty()) {
                break;
            }
            Iterator<String> it = remaining.iterator();
            while (it.hasNext()) {
                String value = it.next();
                if (!rule.matches(value)) {
                    continue;
                }
                DecodedDate date = rule.decode(value);
                if (date != null) {
                    decoded.put(value, new RuleMatch(rule, date));
                    it.remove();
                } else if (!fallthroughOnDecodeFailure) {
                    it.remove();
                }
            }
        }
        return decoded;
    }

    public List<FormatRule> getRules() { return rules; }
    public int size() { return rules.size(); }
    public boolean isFallthroughOnDecodeFailure() { return fallthroughOnDecodeFailure; }

    /**
     * 命中结果：采用的规则及其解码值
     */
    public static final class RuleMatch {
        private final FormatRule rule;
        private final DecodedDate date;

        RuleMatch(FormatRule rule, DecodedDate date) {
            this.rule = rule;
            this.date = date;
        }

        public FormatRule getRule() { return rule; }
        public DecodedDate getDate() { return date; }
    }

    public static final class Builder {
        private final List<FormatRule> rules = new ArrayList<>();
        private final Set<String> names = new HashSet<>();
        private boolean fallthroughOnDecodeFailure = true;

        private Builder() {}

        /**
         * 追加一条规则，优先级低于已添加的规则
         *
         * @throws IllegalArgumentException 规则名重复时抛出
         */
        public Builder add(FormatRule rule) {
            if (rule == null) {
                throw new IllegalArgumentException("Format rule must not be null");
            }
            if (!names.add(rule.getName())) {
                throw new IllegalArgumentException("Duplicate format rule name: " + rule.getName());
            }
            rules.add(rule);
            return this;
        }

        public Builder fallthroughOnDecodeFailure(boolean fallthrough) {
            this.fallthroughOnDecodeFailure = fallthrough;
            return this;
        }

        public FormatRegistry build() {
            return new FormatRegistry(rules, fallthroughOnDecodeFailure);
        }
    }
}
