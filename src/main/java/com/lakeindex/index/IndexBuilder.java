package com.lakeindex.index;

import com.lakeindex.config.Constants;
import com.lakeindex.document.DocumentRecord;
import com.lakeindex.storage.StatisticsStore;
import com.lakeindex.storage.StoreTransaction;
import com.lakeindex.storage.TermEntry;
import com.lakeindex.text.AlphabeticTokenizer;
import com.lakeindex.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 全量构建与增量导入。语料按批流式处理，内存占用受批大小约束。
 */
public class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    private final StatisticsStore store;
    private final Tokenizer tokenizer;
    private final MutationEngine mutationEngine;
    private final int batchSize;

    public IndexBuilder(StatisticsStore store) {
        this(store, new AlphabeticTokenizer(), Constants.DEFAULT_BATCH_SIZE);
    }

    public IndexBuilder(StatisticsStore store, Tokenizer tokenizer, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("批大小必须大于0: " + batchSize);
        }
        this.store = store;
        this.tokenizer = tokenizer;
        this.batchSize = batchSize;
        this.mutationEngine = new MutationEngine(store, tokenizer, null);
    }

    /**
     * 全量构建：清空现有索引与原文后重新索引语料。整个构建是一个事务，失败时原索引保持不变。
     *
     * <p>同一输入中重复出现的 docId 以最后一次为准。df 在流式结束后由内存中的词项计数一次写入。
     */
    public BuildReport build(Iterable<CorpusDocument> corpus) {
        long startNanos = System.nanoTime();
        List<BuildReport.FailedDocument> failures = new ArrayList<>();
        int[] counters = store.inTransaction(transaction -> {
            clearIndex(transaction);
            return rebuild(transaction, corpus.iterator(), failures);
        });
        BuildReport report = new BuildReport(counters[0], counters[1], failures, elapsedMillis(startNanos));
        logger.info("全量构建完成: 文档 {}，批次 {}，失败 {}，耗时 {}ms",
            report.indexedDocuments(), report.batches(), failures.size(), report.elapsedMs());
        return report;
    }

    /**
     * 从已存储的原文重建索引，存活文档保持原ID，墓碑文档随重建一并清除。
     *
     * @throws IllegalStateException 存在没有原文的存活文档，此时索引保持不变
     */
    public BuildReport reindex() {
        long startNanos = System.nanoTime();
        List<BuildReport.FailedDocument> failures = new ArrayList<>();
        int[] counters = store.inTransaction(transaction -> {
            int missing = transaction.contents().countLiveWithoutContent();
            if (missing > 0) {
                throw new IllegalStateException("有 " + missing + " 篇存活文档缺少原文，无法重建索引");
            }
            List<CorpusDocument> documents = new ArrayList<>();
            for (Map.Entry<Integer, String> entry : transaction.contents().liveTexts().entrySet()) {
                documents.add(CorpusDocument.of(entry.getKey(), entry.getValue()));
            }
            clearIndex(transaction);
            return rebuild(transaction, documents.iterator(), failures);
        });
        BuildReport report = new BuildReport(counters[0], counters[1], failures, elapsedMillis(startNanos));
        logger.info("重建索引完成: 文档 {}，批次 {}，失败 {}，耗时 {}ms",
            report.indexedDocuments(), report.batches(), failures.size(), report.elapsedMs());
        return report;
    }

    /**
     * 增量导入：每批一个事务，存活文档按新内容重建，墓碑文档复活，其余插入。
     */
    public BuildReport importDelta(Iterable<CorpusDocument> corpus) {
        long startNanos = System.nanoTime();
        List<BuildReport.FailedDocument> failures = new ArrayList<>();
        int indexed = 0;
        int batches = 0;
        Iterator<CorpusDocument> iterator = corpus.iterator();
        while (iterator.hasNext()) {
            List<TokenizedDocument> batch = nextBatch(iterator, failures);
            store.inTransaction(transaction -> {
                for (TokenizedDocument document : batch) {
                    int docId = document.docId() == null ? transaction.documents().nextDocId() : document.docId();
                    mutationEngine.upsertDocument(transaction, docId, document.text(), document.terms());
                }
                return null;
            });
            indexed += batch.size();
            batches++;
            logger.debug("增量批次 {} 已提交: {} 篇", batches, batch.size());
        }
        BuildReport report = new BuildReport(indexed, batches, failures, elapsedMillis(startNanos));
        logger.info("增量导入完成: 文档 {}，批次 {}，失败 {}，耗时 {}ms",
            indexed, batches, failures.size(), report.elapsedMs());
        return report;
    }

    private void clearIndex(StoreTransaction transaction) throws SQLException {
        transaction.postings().clear();
        transaction.contents().clear();
        transaction.documents().clear();
        transaction.terms().clear();
    }

    /**
     * 在已清空的表上流式写入语料，返回 {已索引文档数, 批次数}。
     */
    private int[] rebuild(StoreTransaction transaction, Iterator<CorpusDocument> iterator,
                          List<BuildReport.FailedDocument> failures) throws SQLException {
        int[] counters = new int[2];
        Map<Integer, Integer> documentCountByTermId = new HashMap<>();
        while (iterator.hasNext()) {
            List<TokenizedDocument> batch = nextBatch(iterator, failures);
            for (TokenizedDocument document : batch) {
                int docId = document.docId() == null ? transaction.documents().nextDocId() : document.docId();
                writeBuildDocument(transaction, docId, document, documentCountByTermId);
            }
            counters[0] += batch.size();
            counters[1]++;
            logger.debug("构建批次 {} 完成: {} 篇", counters[1], batch.size());
        }
        transaction.terms().assignDocumentFrequencies(documentCountByTermId);
        return counters;
    }

    private List<TokenizedDocument> nextBatch(Iterator<CorpusDocument> iterator,
                                              List<BuildReport.FailedDocument> failures) {
        List<TokenizedDocument> batch = new ArrayList<>(batchSize);
        while (batch.size() < batchSize && iterator.hasNext()) {
            CorpusDocument document = iterator.next();
            if (document == null) {
                continue;
            }
            if (document.text() == null) {
                failures.add(new BuildReport.FailedDocument(document.docId(), "文档文本为空"));
                logger.warn("跳过无文本文档: docId={}", document.docId());
                continue;
            }
            if (document.docId() != null && document.docId() < 0) {
                failures.add(new BuildReport.FailedDocument(document.docId(), "文档ID不能为负"));
                logger.warn("跳过非法ID文档: docId={}", document.docId());
                continue;
            }
            try {
                batch.add(new TokenizedDocument(document.docId(), document.text(), tokenizer.terms(document.text())));
            } catch (RuntimeException tokenizeException) {
                failures.add(new BuildReport.FailedDocument(document.docId(), tokenizeException.getMessage()));
                logger.warn("文档分词失败，已跳过: docId={}", document.docId(), tokenizeException);
            }
        }
        return batch;
    }

    private void writeBuildDocument(StoreTransaction transaction, int docId, TokenizedDocument document,
                                    Map<Integer, Integer> documentCountByTermId) throws SQLException {
        List<String> terms = document.terms();
        Optional<DocumentRecord> previous = transaction.documents().findById(docId);
        if (previous.isPresent()) {
            // 输入内重复ID：撤销前一版本的倒排与词项计数
            for (Integer termId : transaction.postings().termFrequencies(docId).keySet()) {
                documentCountByTermId.merge(termId, -1, Integer::sum);
            }
            transaction.postings().deleteForDocument(docId);
            transaction.documents().markLive(docId, terms.size());
        } else {
            transaction.documents().insert(DocumentRecord.live(docId, terms.size()));
        }
        transaction.contents().put(docId, document.text());

        Map<Integer, Integer> termFrequencyByTermId = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : MutationEngine.countTerms(terms).entrySet()) {
            TermEntry termEntry = transaction.terms().getOrCreate(entry.getKey());
            termFrequencyByTermId.put(termEntry.termId(), entry.getValue());
            documentCountByTermId.merge(termEntry.termId(), 1, Integer::sum);
        }
        transaction.postings().insertAll(docId, termFrequencyByTermId);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private record TokenizedDocument(Integer docId, String text, List<String> terms) {
    }
}
