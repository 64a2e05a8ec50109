package com.pipeline.refinery.model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * 内存中的矩形表：有序的命名列，各列按行位置对齐，单元格均为字符串（可为null）。
 *
 * 生命周期：读取输入文件时创建 → 列替换/追加 → 完成后序列化 → 丢弃。
 * 非线程安全，同一时刻只归一个文件处理流程所有。
 */
public class TableSnapshot {

    private final List<String> columnNames;
    /** 按列存储，便于整列替换 */
    private final List<List<String>> columns;
    private int rowCount;

    public TableSnapshot(List<String> columnNames) {
        if (columnNames == null) {
            throw new IllegalArgumentException("Column names must not be null");
        }
        this.columnNames = new ArrayList<>(columnNames);
        this.columns = new ArrayList<>(columnNames.size());
        for (int i = 0; i < columnNames.size(); i++) {
            columns.add(new ArrayList<>());
        }
        this.rowCount = 0;
    }

    /**
     * 由表头和行数据构造。比表头短的行以空串补齐，比表头长的行视为非法。
     */
    public static TableSnapshot fromRows(List<String> header, List<List<String>> rows) {
        TableSnapshot table = new TableSnapshot(header);
        int rowNo = 0;
        for (List<String> row : rows) {
            rowNo++;
            if (row.size() > header.size()) {
                throw new IllegalArgumentException("Row " + rowNo + " has " + row.size()
                        + " cells but the header has " + header.size() + " columns");
            }
            table.appendRow(row);
        }
        return table;
    }

    public void appendRow(List<String> row) {
        for (int c = 0; c < columns.size(); c++) {
            columns.get(c).add(c < row.size() ? row.get(c) : "");
        }
        rowCount++;
    }

    public List<String> getColumnNames() {
        return Collections.unmodifiableList(columnNames);
    }

    public int getColumnCount() { return columnNames.size(); }
    public int getRowCount() { return rowCount; }

    /**
     * @return 列下标；不存在时返回-1（同名列取第一个）
     */
    public int indexOf(String columnName) {
        return columnNames.indexOf(columnName);
    }

    public List<String> getColumn(int index) {
        return Collections.unmodifiableList(columns.get(index));
    }

    public List<String> getColumn(String columnName) {
        int index = indexOf(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + columnName);
        }
        return getColumn(index);
    }

    public String getCell(int row, int column) {
        return columns.get(column).get(row);
    }

    public List<String> getRow(int row) {
        List<String> values = new ArrayList<>(columns.size());
        for (List<String> column : columns) {
            values.add(column.get(row));
        }
        return values;
    }

    /**
     * 整列替换，新列长度必须与行数一致
     */
    public void replaceColumn(int index, List<String> values) {
        checkLength(values);
        columns.set(index, new ArrayList<>(values));
    }

    /**
     * 追加一列；同名列已存在时拒绝，不覆盖已有数据
     */
    public void addColumn(String columnName, List<String> values) {
        checkLength(values);
        if (indexOf(columnName) >= 0) {
            throw new IllegalArgumentException("Column already exists: " + columnName);
        }
        columnNames.add(columnName);
        columns.add(new ArrayList<>(values));
    }

    /**
     * 删除标记的行，其余行保持原有顺序
     *
     * @return 实际删除的行数
     */
    public int removeRows(BitSet rowsToRemove) {
        if (rowsToRemove == null || rowsToRemove.isEmpty()) {
            return 0;
        }
        int removed = rowsToRemove.get(0, rowCount).cardinality();
        for (int c = 0; c < columns.size(); c++) {
            List<String> source = columns.get(c);
            List<String> kept = new ArrayList<>(source.size() - removed);
            for (int r = 0; r < source.size(); r++) {
                if (!rowsToRemove.get(r)) {
                    kept.add(source.get(r));
                }
            }
            columns.set(c, kept);
        }
        rowCount -= removed;
        return removed;
    }

    public TableSnapshot copy() {
        TableSnapshot copy = new TableSnapshot(columnNames);
        for (int c = 0; c < columns.size(); c++) {
            copy.columns.set(c, new ArrayList<>(columns.get(c)));
        }
        copy.rowCount = rowCount;
        return copy;
    }

    private void checkLength(List<String> values) {
        if (values == null || values.size() != rowCount) {
            throw new IllegalArgumentException("Column length " + (values == null ? 0 : values.size())
                    + " does not match row count " + rowCount);
        }
    }

    @Override
    public String toString() {
        return "TableSnapshot{columns=" + columnNames + ", rows=" + rowCount + "}";
    }
}
