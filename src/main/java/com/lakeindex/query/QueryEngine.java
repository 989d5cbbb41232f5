package com.lakeindex.query;

import com.lakeindex.config.EngineConfig;
import com.lakeindex.document.CorpusStatistics;
import com.lakeindex.scoring.BM25Scorer;
import com.lakeindex.storage.StatisticsStore;
import com.lakeindex.storage.StorageTransactionFailedException;
import com.lakeindex.text.AlphabeticTokenizer;
import com.lakeindex.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * BM25 排序查询。每次查询在单个读快照内现算 N 与 avgdl，结果不受墓碑是否已压缩影响。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private static final Comparator<SearchHit> RANKING = Comparator
        .comparingDouble(SearchHit::score).reversed()
        .thenComparingInt(SearchHit::docId);

    private final StatisticsStore store;
    private final Tokenizer tokenizer;
    private final QueryEvaluator evaluator;
    private final EngineConfig config;

    /**
     * 使用默认配置构造查询引擎。
     */
    public QueryEngine(StatisticsStore store) {
        this(store, new AlphabeticTokenizer(), EngineConfig.defaults());
    }

    /**
     * 使用 EngineConfig 注入 BM25 参数与求值方式构造查询引擎。
     */
    public QueryEngine(StatisticsStore store, Tokenizer tokenizer, EngineConfig config) {
        this(store, tokenizer, config, QueryEvaluator.of(config.getEvaluator()));
    }

    public QueryEngine(StatisticsStore store, Tokenizer tokenizer, EngineConfig config, QueryEvaluator evaluator) {
        this.store = store;
        this.tokenizer = tokenizer;
        this.config = config;
        this.evaluator = evaluator;
    }

    /**
     * 对原始查询文本分词后检索，分词规则与建索引一致。
     */
    public SearchResult search(String rawQuery, QueryMode mode, int topK) {
        if (rawQuery == null) {
            throw new InvalidQueryException("查询文本不能为null");
        }
        return search(new LinkedHashSet<>(tokenizer.terms(rawQuery)), mode, topK);
    }

    /**
     * 按词项集合检索。
     *
     * @param queryTerms 查询词，大小写不敏感，空集合返回空结果
     * @param mode 候选集语义
     * @param topK 返回条数上限，不大于 0 时返回空列表
     * @return 按分值降序、docId 升序排列的结果
     * @throws InvalidQueryException 词项集合或模式为 null
     */
    public SearchResult search(Collection<String> queryTerms, QueryMode mode, int topK) {
        long startNanos = System.nanoTime();
        if (queryTerms == null) {
            throw new InvalidQueryException("查询词集合不能为null");
        }
        if (mode == null) {
            throw new InvalidQueryException("查询模式不能为null");
        }
        List<String> terms = normalize(queryTerms);
        if (terms.isEmpty()) {
            return SearchResult.empty(terms, mode, elapsedMillis(startNanos));
        }

        Map<Integer, Double> scores;
        try {
            scores = store.readSnapshot(transaction -> {
                CorpusStatistics statistics = transaction.documents().liveStatistics();
                if (statistics.liveDocuments() == 0) {
                    return Map.<Integer, Double>of();
                }
                BM25Scorer scorer = new BM25Scorer(statistics.liveDocuments(), statistics.averageLength(),
                    config.getBm25K1(), config.getBm25B(), config.getIdfVariant());
                return evaluator.evaluate(transaction, terms, mode, scorer);
            });
        } catch (StorageTransactionFailedException storageException) {
            logger.warn("查询读取失败，返回空结果: terms={}", terms, storageException);
            return SearchResult.empty(terms, mode, elapsedMillis(startNanos));
        }

        List<SearchHit> hits = topK <= 0 ? List.of() : scores.entrySet().stream()
            .map(entry -> new SearchHit(entry.getKey(), entry.getValue()))
            .sorted(RANKING)
            .limit(topK)
            .toList();
        long elapsedMs = elapsedMillis(startNanos);
        logger.debug("查询完成: terms={}, mode={}, matches={}, elapsed={}ms", terms, mode, scores.size(), elapsedMs);
        return new SearchResult(hits, scores.size(), elapsedMs, terms, mode);
    }

    /**
     * 为结果中的每条命中附上文档原文。原文读取失败时按无原文返回，不影响排序结果。
     */
    public SearchResult withContents(SearchResult result) {
        if (result.isEmpty()) {
            return result;
        }
        List<Integer> docIds = result.hits().stream().map(SearchHit::docId).toList();
        Map<Integer, String> texts;
        try {
            texts = store.readSnapshot(transaction -> transaction.contents().findTexts(docIds));
        } catch (StorageTransactionFailedException storageException) {
            logger.warn("读取原文失败: docIds={}", docIds, storageException);
            return result;
        }
        List<SearchHit> hits = result.hits().stream()
            .map(hit -> hit.withContent(texts.get(hit.docId())))
            .toList();
        return new SearchResult(hits, result.totalMatches(), result.elapsedMs(), result.terms(), result.mode());
    }

    private List<String> normalize(Collection<String> queryTerms) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String term : queryTerms) {
            if (term == null || term.isBlank()) {
                continue;
            }
            normalized.add(term.trim().toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(normalized);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
