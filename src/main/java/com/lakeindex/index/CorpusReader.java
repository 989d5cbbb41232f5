package com.lakeindex.index;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * 流式读取 JSON Lines 语料，每行形如 {@code {"doc_id": 1, "text": "..."}}。
 *
 * <p>只能迭代一次，用完须关闭。
 */
public final class CorpusReader implements Iterable<CorpusDocument>, AutoCloseable {
    private static final ObjectReader CORPUS_READER = new ObjectMapper().readerFor(CorpusDocument.class);

    private final Path corpusFile;
    private final MappingIterator<CorpusDocument> iterator;
    private boolean consumed;

    private CorpusReader(Path corpusFile, MappingIterator<CorpusDocument> iterator) {
        this.corpusFile = corpusFile;
        this.iterator = iterator;
    }

    public static CorpusReader open(Path corpusFile) throws IOException {
        if (!Files.isRegularFile(corpusFile)) {
            throw new IOException("语料文件不存在: " + corpusFile.toAbsolutePath());
        }
        return new CorpusReader(corpusFile, CORPUS_READER.readValues(corpusFile.toFile()));
    }

    @Override
    public Iterator<CorpusDocument> iterator() {
        if (consumed) {
            throw new IllegalStateException("语料只能迭代一次: " + corpusFile);
        }
        consumed = true;
        return iterator;
    }

    @Override
    public void close() throws IOException {
        iterator.close();
    }
}
