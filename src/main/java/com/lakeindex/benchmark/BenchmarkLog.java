package com.lakeindex.benchmark;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * 追加写入的基准日志，每轮一行 JSON，写入后立即刷盘。
 */
public final class BenchmarkLog implements AutoCloseable {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Path logFile;
    private final BufferedWriter writer;

    private BenchmarkLog(Path logFile, BufferedWriter writer) {
        this.logFile = logFile;
        this.writer = writer;
    }

    /**
     * 创建新日志文件，已存在时截断。
     */
    public static BenchmarkLog create(Path logFile) throws IOException {
        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BufferedWriter writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return new BenchmarkLog(logFile, writer);
    }

    public void append(RoundRecord record) {
        try {
            writer.write(OBJECT_MAPPER.writeValueAsString(record));
            writer.newLine();
            writer.flush();
        } catch (IOException ioException) {
            throw new UncheckedIOException("写入基准日志失败: " + logFile, ioException);
        }
    }

    /**
     * 读取日志中的全部轮次记录。
     */
    public static List<RoundRecord> read(Path logFile) throws IOException {
        try (MappingIterator<RoundRecord> iterator = OBJECT_MAPPER.readerFor(RoundRecord.class).readValues(logFile.toFile())) {
            return iterator.readAll();
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
