package com.pipeline.refinery.normalize;

import com.pipeline.refinery.model.FieldSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 字段别名解析器：把逻辑字段映射到某张表中的实际列。
 *
 * 列名与别名统一归一化后比较：去掉首尾空白和开头的字节序标记，再转小写
 * （中文等表意文字不受大小写转换影响）。
 * 解析结果只对当前表有效，不同表头的文件需要各自解析。
 */
public class FieldAliasResolver {

    private static final Logger log = LoggerFactory.getLogger(FieldAliasResolver.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * 解析字段对应的列。
     * 候选名按 [规范名称] + 别名 的声明顺序尝试，返回第一个存在的列。
     * 若多列归一化后相同，以第一次出现的列为准。
     *
     * @param tableColumns 表头中的原始列名
     * @param field        字段定义
     * @return 原始列名；未匹配时为空
     */
    public Optional<String> resolve(List<String> tableColumns, FieldSpec field) {
        Map<String, String> lookup = buildLookup(tableColumns);
        for (String candidate : field.candidates()) {
            String column = lookup.get(normalize(candidate));
            if (column != null) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    /**
     * 构建 归一化列名 -> 原始列名 的查找表
     */
    Map<String, String> buildLookup(List<String> tableColumns) {
        Map<String, String> lookup = new HashMap<>();
        for (String column : tableColumns) {
            if (column == null) {
                continue;
            }
            String key = normalize(column);
            String existing = lookup.putIfAbsent(key, column);
            if (existing != null) {
                log.warn("Columns '{}' and '{}' normalize to the same name '{}', keeping the first.",
                        existing, column, key);
            }
        }
        return lookup;
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String value = name.strip();
        int start = 0;
        while (start < value.length() && value.charAt(start) == BYTE_ORDER_MARK) {
            start++;
        }
        return value.substring(start).strip().toLowerCase(Locale.ROOT);
    }
}
