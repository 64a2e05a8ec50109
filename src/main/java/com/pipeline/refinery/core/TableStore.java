package com.pipeline.refinery.core;

import com.pipeline.refinery.model.TableSnapshot;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 表存储接口：表格文件与 {@link TableSnapshot} 之间的转换。
 */
public interface TableStore {

    /**
     * 读取文件。首行为表头。
     *
     * @throws IOException 文件不存在、为空或格式非法
     */
    TableSnapshot read(Path file) throws IOException;

    /**
     * 写出文件。先写入目标目录下的临时文件，完成后原子替换目标文件，
     * 失败时不会留下写了一半的目标文件。
     */
    void write(TableSnapshot table, Path file) throws IOException;
}
