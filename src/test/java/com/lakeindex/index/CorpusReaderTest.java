package com.lakeindex.index;

import com.lakeindex.StoreFixtures;
import com.lakeindex.storage.StatisticsStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CorpusReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadJsonLines() throws IOException {
        Path corpusFile = tempDir.resolve("corpus.jsonl");
        Files.writeString(corpusFile, """
            {"doc_id": 1, "text": "first document"}
            {"doc_id": 2, "text": "second"}
            {"text": "no id"}
            """);

        List<CorpusDocument> documents = new ArrayList<>();
        try (CorpusReader reader = CorpusReader.open(corpusFile)) {
            reader.forEach(documents::add);
            assertThrows(IllegalStateException.class, reader::iterator);
        }

        assertEquals(3, documents.size());
        assertEquals(CorpusDocument.of(1, "first document"), documents.get(0));
        assertNull(documents.get(2).docId());
    }

    @Test
    void testBuildFromResourceCorpus() throws IOException, URISyntaxException {
        Path corpusFile = Path.of(Objects.requireNonNull(getClass().getResource("/corpus-small.jsonl")).toURI());

        try (StatisticsStore store = StatisticsStore.open(tempDir.resolve("corpus.db"));
             CorpusReader reader = CorpusReader.open(corpusFile)) {
            BuildReport report = new IndexBuilder(store).build(reader);

            assertEquals(5, report.indexedDocuments());
            assertEquals(2, StoreFixtures.df(store, "cat"));
            assertEquals(0, StoreFixtures.documentLength(store, 5).orElseThrow());
        }
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> CorpusReader.open(tempDir.resolve("missing.jsonl")));
    }
}
