package com.pipeline.refinery.model;

import java.nio.file.Path;

/**
 * 批处理中单个文件的处理结果
 */
public final class FileOutcome {
    private final Path inputFile;
    private final Path outputFile;
    private final FileStatus status;
    private final int inputRows;
    private final int outputRows;
    private final String errorMessage;

    private FileOutcome(Path inputFile, Path outputFile, FileStatus status,
                        int inputRows, int outputRows, String errorMessage) {
        this.inputFile = inputFile;
        this.outputFile = outputFile;
        this.status = status;
        this.inputRows = inputRows;
        this.outputRows = outputRows;
        this.errorMessage = errorMessage;
    }

    public static FileOutcome completed(Path input, Path output, int inputRows, int outputRows) {
        return new FileOutcome(input, output, FileStatus.COMPLETED, inputRows, outputRows, null);
    }

    public static FileOutcome failed(Path input, Path output, String errorMessage) {
        return new FileOutcome(input, output, FileStatus.FAILED, 0, 0, errorMessage);
    }

    public static FileOutcome cancelled(Path input, Path output) {
        return new FileOutcome(input, output, FileStatus.CANCELLED, 0, 0, null);
    }

    public Path getInputFile() { return inputFile; }
    public Path getOutputFile() { return outputFile; }
    public FileStatus getStatus() { return status; }
    public int getInputRows() { return inputRows; }
    public int getOutputRows() { return outputRows; }
    public String getErrorMessage() { return errorMessage; }

    @Override
    public String toString() {
        return inputFile.getFileName() + "=" + status
                + (errorMessage != null ? " (" + errorMessage + ")" : "");
    }
}
