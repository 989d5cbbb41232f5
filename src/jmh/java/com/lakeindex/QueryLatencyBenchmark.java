package com.lakeindex;

import com.lakeindex.config.EngineConfig;
import com.lakeindex.index.CorpusDocument;
import com.lakeindex.index.IndexBuilder;
import com.lakeindex.index.MutationEngine;
import com.lakeindex.query.EvaluatorType;
import com.lakeindex.query.QueryEngine;
import com.lakeindex.query.QueryEvaluator;
import com.lakeindex.query.QueryMode;
import com.lakeindex.storage.StatisticsStore;
import com.lakeindex.text.AlphabeticTokenizer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 查询延迟随墓碑占比变化的微基准
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class QueryLatencyBenchmark {

    private static final int DOCUMENTS = 10000;

    @Param({"0", "30", "60"})
    int tombstonedPct;

    @Param({"SQL", "IN_MEMORY"})
    EvaluatorType evaluator;

    Path tempDir;
    StatisticsStore store;
    QueryEngine queryEngine;

    @Setup
    public void setup() throws IOException {
        tempDir = Files.createTempDirectory("lake-benchmark");
        store = StatisticsStore.open(tempDir.resolve("bench.db"));

        List<CorpusDocument> corpus = new ArrayList<>(DOCUMENTS);
        for (int i = 1; i <= DOCUMENTS; i++) {
            String topic = i % 10 == 0 ? "java programming"
                : i % 10 == 1 ? "python data science"
                : i % 10 == 2 ? "machine learning"
                : "general content";
            corpus.add(CorpusDocument.of(i, "document about " + topic + " with various keywords for search testing"));
        }
        new IndexBuilder(store).build(corpus);

        // 每 100 篇中删除前 tombstonedPct 篇，使墓碑均匀分布
        List<Integer> victims = new ArrayList<>();
        for (int i = 1; i <= DOCUMENTS; i++) {
            if ((i - 1) % 100 < tombstonedPct) {
                victims.add(i);
            }
        }
        new MutationEngine(store).deleteAll(victims);

        EngineConfig config = EngineConfig.defaults();
        queryEngine = new QueryEngine(store, new AlphabeticTokenizer(), config, QueryEvaluator.of(evaluator));
    }

    @TearDown
    public void tearDown() throws IOException {
        if (store != null) {
            store.close();
        }
        try (Stream<Path> paths = Files.walk(tempDir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    @Benchmark
    public int singleTerm() {
        return queryEngine.search("java", QueryMode.DISJUNCTIVE, 10).totalMatches();
    }

    @Benchmark
    public int disjunctive() {
        return queryEngine.search("machine python search", QueryMode.DISJUNCTIVE, 10).totalMatches();
    }

    @Benchmark
    public int conjunctive() {
        return queryEngine.search("java programming", QueryMode.CONJUNCTIVE, 10).totalMatches();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(QueryLatencyBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
