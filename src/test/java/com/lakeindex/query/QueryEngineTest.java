package com.lakeindex.query;

import com.lakeindex.config.EngineConfig;
import com.lakeindex.index.MutationEngine;
import com.lakeindex.scoring.IdfVariant;
import com.lakeindex.storage.StatisticsStore;
import com.lakeindex.text.AlphabeticTokenizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 查询引擎测试，两种求值方式跑同一组用例。
 */
class QueryEngineTest {

    @TempDir
    Path tempDir;

    private StatisticsStore store;
    private MutationEngine mutationEngine;

    @BeforeEach
    void setUp() {
        store = StatisticsStore.open(tempDir.resolve("query.db"));
        mutationEngine = new MutationEngine(store);
        mutationEngine.insert(1, "the cat sat");
        mutationEngine.insert(2, "the dog sat");
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @ParameterizedTest
    @EnumSource(EvaluatorType.class)
    @DisplayName("单词析取查询只命中包含该词的文档，经典 IDF 下 df=N/2 得分为 0")
    void testSingleTermDisjunctive(EvaluatorType evaluatorType) {
        SearchResult result = engine(evaluatorType, IdfVariant.CLASSIC).search(Set.of("cat"), QueryMode.DISJUNCTIVE, 10);

        assertEquals(1, result.hits().size());
        assertEquals(1, result.hits().get(0).docId());
        assertEquals(0.0, result.hits().get(0).score(), 1e-12);
    }

    @ParameterizedTest
    @EnumSource(EvaluatorType.class)
    @DisplayName("Lucene IDF 下同一查询得分为正")
    void testSingleTermDisjunctiveLucene(EvaluatorType evaluatorType) {
        SearchResult result = engine(evaluatorType, IdfVariant.LUCENE).search(Set.of("cat"), QueryMode.DISJUNCTIVE, 10);

        assertEquals(1, result.hits().size());
        assertEquals(1, result.hits().get(0).docId());
        assertTrue(result.hits().get(0).score() > 0);
    }

    @ParameterizedTest
    @EnumSource(EvaluatorType.class)
    @DisplayName("合取查询要求文档包含全部词项")
    void testConjunctive(EvaluatorType evaluatorType) {
        QueryEngine engine = engine(evaluatorType, IdfVariant.CLASSIC);

        assertTrue(engine.search(Set.of("cat", "dog"), QueryMode.CONJUNCTIVE, 10).hits().isEmpty());
        SearchResult both = engine.search(Set.of("cat", "sat"), QueryMode.CONJUNCTIVE, 10);
        assertEquals(List.of(1), docIds(both));
    }

    @ParameterizedTest
    @EnumSource(EvaluatorType.class)
    @DisplayName("未知词项：析取时忽略，合取时结果为空")
    void testUnknownTerms(EvaluatorType evaluatorType) {
        QueryEngine engine = engine(evaluatorType, IdfVariant.LUCENE);

        assertEquals(List.of(1), docIds(engine.search(Set.of("cat", "zebra"), QueryMode.DISJUNCTIVE, 10)));
        assertTrue(engine.search(Set.of("cat", "zebra"), QueryMode.CONJUNCTIVE, 10).hits().isEmpty());
        assertTrue(engine.search(Set.of("zebra"), QueryMode.DISJUNCTIVE, 10).hits().isEmpty());
    }

    @ParameterizedTest
    @EnumSource(EvaluatorType.class)
    @DisplayName("墓碑文档不出现在结果中，df 为 0 的词项不命中")
    void testTombstonesExcluded(EvaluatorType evaluatorType) {
        mutationEngine.delete(1);
        QueryEngine engine = engine(evaluatorType, IdfVariant.CLASSIC);

        assertTrue(engine.search(Set.of("cat"), QueryMode.DISJUNCTIVE, 10).hits().isEmpty());
        assertEquals(List.of(2), docIds(engine.search(Set.of("sat"), QueryMode.DISJUNCTIVE, 10)));
    }

    @ParameterizedTest
    @EnumSource(EvaluatorType.class)
    @DisplayName("同分按 docId 升序，topK 截断")
    void testTieBreakAndTopK(EvaluatorType evaluatorType) {
        QueryEngine engine = engine(evaluatorType, IdfVariant.LUCENE);

        SearchResult all = engine.search(Set.of("sat"), QueryMode.DISJUNCTIVE, 10);
        assertEquals(List.of(1, 2), docIds(all));
        assertEquals(all.hits().get(0).score(), all.hits().get(1).score(), 1e-12);

        SearchResult top1 = engine.search(Set.of("sat"), QueryMode.DISJUNCTIVE, 1);
        assertEquals(List.of(1), docIds(top1));
        assertEquals(2, top1.totalMatches());
        assertTrue(engine.search(Set.of("sat"), QueryMode.DISJUNCTIVE, 0).hits().isEmpty());
    }

    @Test
    @DisplayName("结果按分值降序")
    void testDescendingScores() {
        mutationEngine.insert(3, "cat cat cat");
        mutationEngine.insert(4, "a long document that mentions the cat only once among many other words");
        QueryEngine engine = engine(EvaluatorType.SQL, IdfVariant.LUCENE);

        SearchResult result = engine.search(Set.of("cat"), QueryMode.DISJUNCTIVE, 10);

        assertEquals(3, result.hits().get(0).docId());
        for (int index = 1; index < result.hits().size(); index++) {
            assertTrue(result.hits().get(index - 1).score() >= result.hits().get(index).score());
        }
    }

    @Test
    @DisplayName("空查询返回空结果；null 输入与 null 模式报错")
    void testEmptyAndInvalidQueries() {
        QueryEngine engine = new QueryEngine(store);

        SearchResult empty = engine.search(Set.of(), QueryMode.DISJUNCTIVE, 10);
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.totalMatches());
        assertTrue(engine.search("  123 !!", QueryMode.CONJUNCTIVE, 10).isEmpty());

        assertThrows(InvalidQueryException.class, () -> engine.search((String) null, QueryMode.DISJUNCTIVE, 10));
        assertThrows(InvalidQueryException.class, () -> engine.search(Set.of("cat"), null, 10));
    }

    @Test
    @DisplayName("原始查询文本按建索引的规则分词并小写化")
    void testRawQueryNormalized() {
        QueryEngine engine = engine(EvaluatorType.IN_MEMORY, IdfVariant.LUCENE);

        SearchResult result = engine.search("CAT, Sat!", QueryMode.CONJUNCTIVE, 10);

        assertEquals(List.of("cat", "sat"), result.terms());
        assertEquals(QueryMode.CONJUNCTIVE, result.mode());
        assertEquals(List.of(1), docIds(result));
        assertEquals(List.of(1), docIds(engine.search(List.of("CAT ", "cat"), QueryMode.DISJUNCTIVE, 10)));
    }

    @Test
    @DisplayName("空索引查询返回空结果")
    void testEmptyIndex() {
        mutationEngine.deleteAll(List.of(1, 2));

        assertTrue(new QueryEngine(store).search(Set.of("sat"), QueryMode.DISJUNCTIVE, 10).isEmpty());
    }

    @Test
    @DisplayName("存储已关闭时查询降级为空结果")
    void testStorageFailureDegradesToEmpty() {
        QueryEngine engine = new QueryEngine(store);
        store.close();

        SearchResult result = engine.search(Set.of("cat"), QueryMode.DISJUNCTIVE, 10);

        assertTrue(result.isEmpty());
        store = StatisticsStore.open(tempDir.resolve("query.db"));
    }

    private QueryEngine engine(EvaluatorType evaluatorType, IdfVariant idfVariant) {
        EngineConfig config = EngineConfig.defaults();
        config.setEvaluator(evaluatorType);
        config.setIdfVariant(idfVariant);
        return new QueryEngine(store, new AlphabeticTokenizer(), config);
    }

    static List<Integer> docIds(SearchResult result) {
        return result.hits().stream().map(SearchHit::docId).toList();
    }
}
