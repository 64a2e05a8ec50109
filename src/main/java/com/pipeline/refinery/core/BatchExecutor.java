package com.pipeline.refinery.core;

import com.pipeline.refinery.model.BatchReport;
import com.pipeline.refinery.model.CleaningResult;
import com.pipeline.refinery.model.DateCleaningConfig;
import com.pipeline.refinery.model.FileOutcome;
import com.pipeline.refinery.model.TableSnapshot;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * 批处理执行器接口：把字段识别、日期规范化和清洗策略应用到整张表，
 * 并驱动单个文件或整批文件的处理。
 *
 * 处理流程（单表）：
 *   识别各字段对应的列 → 按列规范化 → 汇总删除决定 → 写回列
 *
 * 文件之间不共享可变状态，可并行处理，输出顺序不作保证。
 * 单个文件失败只记录在报告中，不影响其余文件。
 */
public interface BatchExecutor extends AutoCloseable {

    /**
     * 按全部已配置字段清洗一张表。输入表不被修改，结果中返回新表。
     */
    CleaningResult cleanTable(TableSnapshot table);

    /**
     * 只清洗指定的字段。
     *
     * @param onlyFields 字段规范名称，按大小写和空白不敏感匹配；为null或空时处理全部字段
     */
    CleaningResult cleanTable(TableSnapshot table, Collection<String> onlyFields);

    /**
     * 读取、清洗并写出单个文件。输出先写入临时文件，完成后再原子替换到目标位置。
     *
     * @throws IOException 读写失败或文件格式非法
     */
    FileOutcome processFile(Path inputFile, Path outputFile) throws IOException;

    /**
     * 同 {@link #processFile(Path, Path)}，只清洗指定的字段。输入输出可以是同一个文件。
     */
    FileOutcome processFile(Path inputFile, Path outputFile, Collection<String> onlyFields) throws IOException;

    /**
     * 并行处理一组文件，输出文件与输入文件同名，写入 outputDir。
     */
    BatchReport processFiles(List<Path> inputFiles, Path outputDir);

    /**
     * 处理目录下全部 *.csv 文件（不递归）
     *
     * @throws IOException 输入目录无法列出
     */
    BatchReport processDirectory(Path inputDir, Path outputDir) throws IOException;

    /**
     * 请求取消：尚未开始的文件记为已取消，正在处理的文件照常完成。
     */
    void cancel();

    boolean isCancelled();

    DateCleaningConfig getConfig();

    /**
     * 释放工作线程池
     */
    @Override
    void close();
}
