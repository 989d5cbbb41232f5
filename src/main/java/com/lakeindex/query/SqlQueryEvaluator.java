package com.lakeindex.query;

import com.lakeindex.scoring.BM25Scorer;
import com.lakeindex.storage.StoreTransaction;
import com.lakeindex.storage.TermEntry;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 将并集/交集与存活过滤交给 SQLite，Java 侧只做逐项 BM25 累加。
 */
public class SqlQueryEvaluator implements QueryEvaluator {

    @Override
    public Map<Integer, Double> evaluate(StoreTransaction transaction, Collection<String> terms, QueryMode mode,
                                         BM25Scorer scorer) throws SQLException {
        Map<String, TermEntry> entries = transaction.terms().findAll(terms);
        if (entries.isEmpty() || (mode == QueryMode.CONJUNCTIVE && entries.size() < terms.size())) {
            return Map.of();
        }
        Map<Integer, Integer> documentFrequencyByTermId = new HashMap<>();
        for (TermEntry entry : entries.values()) {
            documentFrequencyByTermId.put(entry.termId(), entry.documentFrequency());
        }

        String placeholders = entries.values().stream().map(entry -> "?").collect(Collectors.joining(", "));
        StringBuilder sql = new StringBuilder("""
                SELECT p.doc_id, p.term_id, p.term_frequency, d.length
                FROM postings p
                JOIN documents d ON d.doc_id = p.doc_id
                WHERE d.status = 'LIVE' AND p.term_id IN (""").append(placeholders).append(')');
        if (mode == QueryMode.CONJUNCTIVE) {
            sql.append("""
                     AND p.doc_id IN (
                        SELECT p2.doc_id
                        FROM postings p2
                        JOIN documents d2 ON d2.doc_id = p2.doc_id
                        WHERE d2.status = 'LIVE' AND p2.term_id IN (""").append(placeholders).append(")\n")
                .append("        GROUP BY p2.doc_id HAVING COUNT(DISTINCT p2.term_id) = ?)");
        }

        Map<Integer, Double> scores = new HashMap<>();
        try (PreparedStatement preparedStatement = transaction.connection().prepareStatement(sql.toString())) {
            int parameterIndex = 1;
            for (int termId : documentFrequencyByTermId.keySet()) {
                preparedStatement.setInt(parameterIndex++, termId);
            }
            if (mode == QueryMode.CONJUNCTIVE) {
                for (int termId : documentFrequencyByTermId.keySet()) {
                    preparedStatement.setInt(parameterIndex++, termId);
                }
                preparedStatement.setInt(parameterIndex, documentFrequencyByTermId.size());
            }
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next()) {
                    int docId = resultSet.getInt(1);
                    int termId = resultSet.getInt(2);
                    int termFrequency = resultSet.getInt(3);
                    int docLength = resultSet.getInt(4);
                    double contribution = scorer.score(termFrequency, documentFrequencyByTermId.get(termId), docLength);
                    scores.merge(docId, contribution, Double::sum);
                }
            }
        }
        return scores;
    }
}
