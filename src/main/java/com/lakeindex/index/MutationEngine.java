package com.lakeindex.index;

import com.lakeindex.document.DocumentRecord;
import com.lakeindex.storage.StatisticsStore;
import com.lakeindex.storage.StoreTransaction;
import com.lakeindex.storage.TermEntry;
import com.lakeindex.text.AlphabeticTokenizer;
import com.lakeindex.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 增量变更：插入、删除、修改。每个操作是一个存储事务，df 与文档长度在事务内即时维护，
 * 墓碑文档的倒排留待 {@link Compactor} 物理回收。
 */
public class MutationEngine {
    private static final Logger logger = LoggerFactory.getLogger(MutationEngine.class);

    private final StatisticsStore store;
    private final Tokenizer tokenizer;
    private final Compactor compactor;

    public MutationEngine(StatisticsStore store) {
        this(store, new AlphabeticTokenizer(), null);
    }

    /**
     * @param compactor 变更后用于执行阈值压缩策略，可为 null
     */
    public MutationEngine(StatisticsStore store, Tokenizer tokenizer, Compactor compactor) {
        this.store = store;
        this.tokenizer = tokenizer;
        this.compactor = compactor;
    }

    /**
     * 以自动分配的ID插入文档。
     */
    public int insert(String text) {
        return insert(null, text);
    }

    /**
     * 插入文档。
     *
     * @param docId 文档ID，null 时分配 MAX(doc_id)+1
     * @param text 文档文本，分词为空时写入长度为 0 的存活文档
     * @return 文档ID
     * @throws DuplicateLiveDocumentException docId 已被存活文档占用
     */
    public int insert(Integer docId, String text) {
        List<String> terms = tokenizer.terms(text);
        int assignedId = store.inTransaction(transaction -> {
            int targetId = docId == null ? transaction.documents().nextDocId() : docId;
            insertDocument(transaction, targetId, text, terms);
            return targetId;
        });
        logger.debug("文档已插入: docId={}, length={}", assignedId, terms.size());
        return assignedId;
    }

    /**
     * 删除存活文档：df 即时扣减，文档置为墓碑。
     *
     * @throws UnknownDocumentException 不存在该存活文档
     */
    public void delete(int docId) {
        store.inTransaction(transaction -> {
            tombstoneDocument(transaction, docId);
            return null;
        });
        logger.debug("文档已删除: docId={}", docId);
        afterDeletion();
    }

    /**
     * 在一个事务中删除一批存活文档，任一ID不是存活文档则整体不生效。重复ID只处理一次。
     *
     * @return 实际删除的文档数
     */
    public int deleteAll(Collection<Integer> docIds) {
        Set<Integer> distinctIds = new LinkedHashSet<>(docIds);
        if (distinctIds.isEmpty()) {
            return 0;
        }
        store.inTransaction(transaction -> {
            for (int docId : distinctIds) {
                tombstoneDocument(transaction, docId);
            }
            return null;
        });
        logger.debug("批量删除完成: {} 篇", distinctIds.size());
        afterDeletion();
        return distinctIds.size();
    }

    /**
     * 以新文本替换存活文档，ID 不变。删除与重新插入在同一事务内完成，读者看不到文档缺失的中间状态。
     *
     * @throws UnknownDocumentException 不存在该存活文档
     */
    public void modify(int docId, String newText) {
        List<String> terms = tokenizer.terms(newText);
        store.inTransaction(transaction -> {
            tombstoneDocument(transaction, docId);
            insertDocument(transaction, docId, newText, terms);
            return null;
        });
        logger.debug("文档已修改: docId={}, length={}", docId, terms.size());
        afterDeletion();
    }

    /**
     * 增量导入使用的写入原语：存活文档原位重建，墓碑文档复活，不存在则插入。
     */
    void upsertDocument(StoreTransaction transaction, int docId, String text, List<String> terms) throws SQLException {
        Optional<DocumentRecord> existing = transaction.documents().findById(docId);
        if (existing.isPresent() && existing.get().isLive()) {
            tombstoneDocument(transaction, docId);
        }
        insertDocument(transaction, docId, text, terms);
    }

    /**
     * 写入文档目录行、原文与倒排，并为文档中每个不同词项 df+1。
     */
    void insertDocument(StoreTransaction transaction, int docId, String text, List<String> terms) throws SQLException {
        Optional<DocumentRecord> existing = transaction.documents().findById(docId);
        if (existing.isPresent()) {
            if (existing.get().isLive()) {
                throw new DuplicateLiveDocumentException(docId);
            }
            // 复活墓碑ID：旧倒排尚未压缩，先物理清除
            transaction.postings().deleteForDocument(docId);
            transaction.documents().markLive(docId, terms.size());
        } else {
            transaction.documents().insert(DocumentRecord.live(docId, terms.size()));
        }
        transaction.contents().put(docId, text);

        Map<Integer, Integer> termFrequencyByTermId = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : countTerms(terms).entrySet()) {
            TermEntry termEntry = transaction.terms().getOrCreate(entry.getKey());
            termFrequencyByTermId.put(termEntry.termId(), entry.getValue());
        }
        transaction.postings().insertAll(docId, termFrequencyByTermId);

        Map<Integer, Integer> increments = new HashMap<>();
        for (Integer termId : termFrequencyByTermId.keySet()) {
            increments.put(termId, 1);
        }
        transaction.terms().adjustDocumentFrequencies(increments);
    }

    /**
     * 按文档当前倒排为每个词项 df-1，并把文档置为墓碑。
     */
    void tombstoneDocument(StoreTransaction transaction, int docId) throws SQLException {
        Optional<DocumentRecord> existing = transaction.documents().findById(docId);
        if (existing.isEmpty() || !existing.get().isLive()) {
            throw new UnknownDocumentException(docId);
        }
        Map<Integer, Integer> decrements = new HashMap<>();
        for (Integer termId : transaction.postings().termFrequencies(docId).keySet()) {
            decrements.put(termId, -1);
        }
        transaction.terms().adjustDocumentFrequencies(decrements);
        transaction.documents().markTombstoned(List.of(docId));
    }

    static Map<String, Integer> countTerms(List<String> terms) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String term : terms) {
            counts.merge(term, 1, Integer::sum);
        }
        return counts;
    }

    private void afterDeletion() {
        if (compactor != null) {
            compactor.compactIfNeeded();
        }
    }
}
