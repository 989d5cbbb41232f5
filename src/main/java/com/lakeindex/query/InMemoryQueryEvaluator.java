package com.lakeindex.query;

import com.lakeindex.scoring.BM25Scorer;
import com.lakeindex.storage.PostingList;
import com.lakeindex.storage.StoreTransaction;
import com.lakeindex.storage.TermEntry;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把每个查询词的存活倒排读成按 docId 有序的 {@link PostingList}，在内存中求并集或交集。
 */
public class InMemoryQueryEvaluator implements QueryEvaluator {

    @Override
    public Map<Integer, Double> evaluate(StoreTransaction transaction, Collection<String> terms, QueryMode mode,
                                         BM25Scorer scorer) throws SQLException {
        Map<String, TermEntry> entries = transaction.terms().findAll(terms);
        if (entries.isEmpty() || (mode == QueryMode.CONJUNCTIVE && entries.size() < terms.size())) {
            return Map.of();
        }
        List<TermPostings> termPostings = new ArrayList<>(entries.size());
        for (TermEntry entry : entries.values()) {
            PostingList postings = transaction.postings().livePostings(entry.termId());
            if (postings.isEmpty() && mode == QueryMode.CONJUNCTIVE) {
                return Map.of();
            }
            termPostings.add(new TermPostings(entry.documentFrequency(), postings));
        }
        return mode == QueryMode.CONJUNCTIVE
            ? intersect(termPostings, scorer)
            : union(termPostings, scorer);
    }

    private Map<Integer, Double> union(List<TermPostings> termPostings, BM25Scorer scorer) {
        Map<Integer, Double> scores = new HashMap<>();
        for (TermPostings current : termPostings) {
            PostingList postings = current.postings();
            for (int index = 0; index < postings.size(); index++) {
                double contribution = scorer.score(postings.termFreq(index), current.documentFrequency(),
                    postings.docLength(index));
                scores.merge(postings.docId(index), contribution, Double::sum);
            }
        }
        return scores;
    }

    private Map<Integer, Double> intersect(List<TermPostings> termPostings, BM25Scorer scorer) {
        // 以最短列表驱动，其余列表二分查找
        List<TermPostings> ordered = new ArrayList<>(termPostings);
        ordered.sort(Comparator.comparingInt(current -> current.postings().size()));
        TermPostings driver = ordered.get(0);
        Map<Integer, Double> scores = new HashMap<>();
        candidates:
        for (int index = 0; index < driver.postings().size(); index++) {
            int docId = driver.postings().docId(index);
            int docLength = driver.postings().docLength(index);
            double total = scorer.score(driver.postings().termFreq(index), driver.documentFrequency(), docLength);
            for (int other = 1; other < ordered.size(); other++) {
                TermPostings current = ordered.get(other);
                int position = current.postings().indexOf(docId);
                if (position < 0) {
                    continue candidates;
                }
                total += scorer.score(current.postings().termFreq(position), current.documentFrequency(), docLength);
            }
            scores.put(docId, total);
        }
        return scores;
    }

    private record TermPostings(int documentFrequency, PostingList postings) {
    }
}
