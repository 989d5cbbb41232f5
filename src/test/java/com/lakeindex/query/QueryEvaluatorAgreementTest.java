package com.lakeindex.query;

import com.lakeindex.config.EngineConfig;
import com.lakeindex.index.MutationEngine;
import com.lakeindex.storage.StatisticsStore;
import com.lakeindex.text.AlphabeticTokenizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * SQL 下推与内存合并两种求值方式在随机语料上的一致性，以及查询单调性。
 */
class QueryEvaluatorAgreementTest {

    private static final List<String> VOCABULARY = List.of(
        "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta", "iota", "kappa", "lambda", "mu");

    @TempDir
    Path tempDir;

    private StatisticsStore store;
    private QueryEngine sqlEngine;
    private QueryEngine memoryEngine;
    private Random random;

    @BeforeEach
    void setUp() {
        store = StatisticsStore.open(tempDir.resolve("agreement.db"));
        random = new Random(7);
        MutationEngine mutationEngine = new MutationEngine(store);
        for (int docId = 1; docId <= 120; docId++) {
            mutationEngine.insert(docId, randomText(1 + random.nextInt(15)));
        }
        for (int docId = 1; docId <= 120; docId += 4) {
            mutationEngine.delete(docId);
        }
        for (int docId = 2; docId <= 120; docId += 9) {
            if (docId % 4 != 1) {
                mutationEngine.modify(docId, randomText(1 + random.nextInt(15)));
            }
        }
        sqlEngine = engine(EvaluatorType.SQL);
        memoryEngine = engine(EvaluatorType.IN_MEMORY);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("两种求值方式返回相同的文档与分值")
    void testEvaluatorsAgree() {
        for (int round = 0; round < 40; round++) {
            Set<String> terms = randomTerms(1 + random.nextInt(3));
            for (QueryMode mode : QueryMode.values()) {
                SearchResult fromSql = sqlEngine.search(terms, mode, 200);
                SearchResult fromMemory = memoryEngine.search(terms, mode, 200);

                assertEquals(fromSql.totalMatches(), fromMemory.totalMatches(), terms + " " + mode);
                assertEquals(fromSql.hits().size(), fromMemory.hits().size());
                for (int index = 0; index < fromSql.hits().size(); index++) {
                    SearchHit left = fromSql.hits().get(index);
                    SearchHit right = fromMemory.hits().get(index);
                    assertEquals(left.score(), right.score(), 1e-9, terms + " " + mode);
                }
                assertEquals(new HashSet<>(QueryEngineTest.docIds(fromSql)),
                    new HashSet<>(QueryEngineTest.docIds(fromMemory)));
            }
        }
    }

    @Test
    @DisplayName("析取查询增加词项不减少候选，合取查询增加词项不增加候选")
    void testMonotonicity() {
        for (int round = 0; round < 30; round++) {
            List<String> terms = new ArrayList<>(randomTerms(3));
            Set<String> smaller = Set.of(terms.get(0), terms.get(1));
            Set<String> larger = Set.copyOf(terms);

            Set<Integer> disjunctiveSmall = candidates(smaller, QueryMode.DISJUNCTIVE);
            Set<Integer> disjunctiveLarge = candidates(larger, QueryMode.DISJUNCTIVE);
            assertTrue(disjunctiveLarge.containsAll(disjunctiveSmall));

            Set<Integer> conjunctiveSmall = candidates(smaller, QueryMode.CONJUNCTIVE);
            Set<Integer> conjunctiveLarge = candidates(larger, QueryMode.CONJUNCTIVE);
            assertTrue(conjunctiveSmall.containsAll(conjunctiveLarge));
        }
    }

    private Set<Integer> candidates(Set<String> terms, QueryMode mode) {
        return new HashSet<>(QueryEngineTest.docIds(sqlEngine.search(terms, mode, Integer.MAX_VALUE)));
    }

    private QueryEngine engine(EvaluatorType evaluatorType) {
        EngineConfig config = EngineConfig.defaults();
        config.setEvaluator(evaluatorType);
        return new QueryEngine(store, new AlphabeticTokenizer(), config);
    }

    private String randomText(int length) {
        StringBuilder builder = new StringBuilder();
        for (int index = 0; index < length; index++) {
            builder.append(VOCABULARY.get(random.nextInt(VOCABULARY.size()))).append(' ');
        }
        return builder.toString();
    }

    private Set<String> randomTerms(int count) {
        Set<String> terms = new HashSet<>();
        while (terms.size() < count) {
            terms.add(VOCABULARY.get(random.nextInt(VOCABULARY.size())));
        }
        return terms;
    }
}
