package com.pipeline.refinery.storage;

import com.pipeline.refinery.core.TableStore;
import com.pipeline.refinery.model.TableSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV表存储实现。
 *
 * 读取：UTF-8，支持带引号的字段、双写引号转义、字段内换行，CRLF/LF均可。
 * 首行为表头，列名原样保留（包括字节序标记）。空行被忽略，比表头短的行以空串补齐，
 * 比表头长的行视为格式错误。
 *
 * 写出：含逗号、引号或换行的单元格加引号，null写为空。
 * 先写入同目录下的临时文件，完成后原子移动到目标位置。
 */
public class CsvTableStore implements TableStore {

    private static final Logger log = LoggerFactory.getLogger(CsvTableStore.class);

    private static final char DELIM = ',';
    private static final char QUOTE = '"';
    private static final String LINE_SEPARATOR = "\n";

    @Override
    public TableSnapshot read(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        List<List<String>> records = parse(content, file);
        if (records.isEmpty()) {
            throw new IOException("File is empty: " + file);
        }
        List<String> header = records.get(0);
        try {
            return TableSnapshot.fromRows(header, records.subList(1, records.size()));
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed CSV " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * 解析全部记录
     */
    List<List<String>> parse(String content, Path file) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> record = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        // 当前字段是否出现过引号，用于区分空行和 "" 字段
        boolean quoted = false;
        int line = 1;

        for (int i = 0, n = content.length(); i < n; i++) {
            char ch = content.charAt(i);
            if (inQuotes) {
                if (ch == QUOTE) {
                    if (i + 1 < n && content.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    if (ch == '\n') {
                        line++;
                    }
                    field.append(ch);
                }
                continue;
            }

            if (ch == QUOTE) {
                inQuotes = true;
                quoted = true;
            } else if (ch == DELIM) {
                record.add(field.toString());
                field.setLength(0);
                quoted = false;
            } else if (ch == '\r' || ch == '\n') {
                if (ch == '\r' && i + 1 < n && content.charAt(i + 1) == '\n') {
                    i++;
                }
                endRecord(records, record, field, quoted);
                record = new ArrayList<>();
                field.setLength(0);
                quoted = false;
                line++;
            } else {
                field.append(ch);
            }
        }

        if (inQuotes) {
            throw new IOException("Unterminated quoted field starting before line " + line + " in " + file);
        }
        if (field.length() > 0 || quoted || !record.isEmpty()) {
            endRecord(records, record, field, quoted);
        }
        return records;
    }

    private void endRecord(List<List<String>> records, List<String> record, StringBuilder field, boolean quoted) {
        if (record.isEmpty() && field.length() == 0 && !quoted) {
            // 空行
            return;
        }
        record.add(field.toString());
        records.add(record);
    }

    @Override
    public void write(TableSnapshot table, Path file) throws IOException {
        Path target = file.toAbsolutePath();
        Path tempFile = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
                writeRecord(writer, table.getColumnNames());
                for (int row = 0; row < table.getRowCount(); row++) {
                    writeRecord(writer, table.getRow(row));
                }
            }
            publish(tempFile, target);
        } finally {
            if (Files.deleteIfExists(tempFile)) {
                log.warn("Discarded incomplete output for '{}'", target);
            }
        }
    }

    private void publish(Path tempFile, Path target) throws IOException {
        try {
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for '{}', falling back to plain move", target);
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void writeRecord(BufferedWriter writer, List<String> values) throws IOException {
        if (values.size() == 1 && format(values.get(0)).isEmpty()) {
            // 单列空值写成 ""，否则读回时会被当作空行
            writer.write(QUOTE);
            writer.write(QUOTE);
            writer.write(LINE_SEPARATOR);
            return;
        }
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(DELIM);
            }
            writer.write(format(values.get(i)));
        }
        writer.write(LINE_SEPARATOR);
    }

    static String format(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        boolean needsQuote = false;
        for (int i = 0, n = value.length(); i < n && !needsQuote; i++) {
            char ch = value.charAt(i);
            if (ch == QUOTE || ch == '\n' || ch == '\r' || ch == DELIM) {
                needsQuote = true;
            }
        }
        if (!needsQuote) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(QUOTE);
        for (int i = 0, n = value.length(); i < n; i++) {
            char ch = value.charAt(i);
            if (ch == QUOTE) {
                sb.append(QUOTE).append(QUOTE);
            } else {
                sb.append(ch);
            }
        }
        sb.append(QUOTE);
        return sb.toString();
    }
}
