package com.lakeindex.benchmark;

import com.lakeindex.index.MutationEngine;
import com.lakeindex.storage.StatisticsStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QueryWorkloadTest {

    @TempDir
    Path tempDir;

    @Test
    void testGenerateSamplesActiveTerms() {
        try (StatisticsStore store = StatisticsStore.open(tempDir.resolve("workload.db"))) {
            MutationEngine mutationEngine = new MutationEngine(store);
            mutationEngine.insert(1, "apple banana cherry date");
            mutationEngine.insert(2, "elder fig");
            mutationEngine.delete(2);

            QueryWorkload workload = QueryWorkload.generate(store, 50, 3L);

            assertEquals(50, workload.size());
            Set<String> active = Set.of("apple", "banana", "cherry", "date");
            for (String query : workload.queries()) {
                String[] terms = query.split(" ");
                assertTrue(terms.length >= 1 && terms.length <= 3, query);
                assertEquals(terms.length, Set.of(terms).size(), "查询词不重复: " + query);
                assertTrue(active.containsAll(List.of(terms)), query);
            }
            assertEquals(workload.queries(), QueryWorkload.generate(store, 50, 3L).queries());
        }
    }

    @Test
    void testGenerateRequiresTerms() {
        try (StatisticsStore store = StatisticsStore.open(tempDir.resolve("empty.db"))) {
            assertThrows(IllegalStateException.class, () -> QueryWorkload.generate(store, 5, 1L));
            assertThrows(IllegalArgumentException.class, () -> QueryWorkload.generate(store, 0, 1L));
        }
    }

    @Test
    void testSaveAndLoadWithHeader() throws IOException {
        Path queryFile = tempDir.resolve("queries/queries.csv");
        QueryWorkload workload = new QueryWorkload(List.of("cat", "cat dog", "a, b"));

        workload.save(queryFile);

        assertEquals("query", Files.readAllLines(queryFile).get(0));
        assertEquals(workload.queries(), QueryWorkload.load(queryFile).queries());
    }

    @Test
    void testLoadWithoutHeader() throws IOException {
        Path queryFile = tempDir.resolve("plain.csv");
        Files.writeString(queryFile, "cat sat\n\ndog\n");

        assertEquals(List.of("cat sat", "dog"), QueryWorkload.load(queryFile).queries());

        Path onlyHeader = tempDir.resolve("header.csv");
        Files.writeString(onlyHeader, "query\n");
        assertThrows(IOException.class, () -> QueryWorkload.load(onlyHeader));
    }

    @Test
    void testSample() {
        QueryWorkload workload = new QueryWorkload(List.of("a", "b", "c", "d"));

        assertEquals(4, workload.sample(0, new Random(1)).size());
        assertEquals(4, workload.sample(10, new Random(1)).size());
        List<String> sampled = workload.sample(2, new Random(1));
        assertEquals(2, sampled.size());
        assertTrue(workload.queries().containsAll(sampled));
    }
}
