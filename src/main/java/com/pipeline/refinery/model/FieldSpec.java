package com.pipeline.refinery.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 日期字段定义：一个逻辑字段及其所有列名别名。
 *
 * 规范名称隐式作为第一个别名，别名按声明顺序尝试。
 * 加载完成后不可变，可在多个文件、多个线程之间共享。
 */
public final class FieldSpec implements Serializable {
    private final String name;
    private final List<String> aliases;
    /** 输出是否带时间部分 */
    private final boolean hasTime;

    public FieldSpec(String name, List<String> aliases, boolean hasTime) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be null or blank");
        }
        this.name = name;
        this.aliases = aliases == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(aliases));
        this.hasTime = hasTime;
    }

    /**
     * 按尝试顺序返回候选列名：规范名称在前，随后是去掉与规范名称重复项后的别名。
     */
    public List<String> candidates() {
        Set<String> ordered = new LinkedHashSet<>();
        ordered.add(name);
        for (String alias : aliases) {
            if (alias != null && !alias.equals(name)) {
                ordered.add(alias);
            }
        }
        return new ArrayList<>(ordered);
    }

    public String getName() { return name; }
    public List<String> getAliases() { return aliases; }
    public boolean hasTime() { return hasTime; }

    @Override
    public String toString() {
        return "FieldSpec{name='" + name + "', aliases=" + aliases + ", hasTime=" + hasTime + "}";
    }
}
