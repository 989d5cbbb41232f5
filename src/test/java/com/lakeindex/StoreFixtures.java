package com.lakeindex;

import com.lakeindex.storage.StatisticsStore;

import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 测试辅助：直接读取各关系表的全部行，用于比较存储状态。
 */
public final class StoreFixtures {

    private StoreFixtures() {
    }

    /**
     * 以可比较的字符串形式导出 terms、documents、postings、contents 的全部物理行。
     */
    public static List<String> dump(StatisticsStore store) {
        return store.readSnapshot(transaction -> {
            List<String> rows = new ArrayList<>();
            try (Statement statement = transaction.connection().createStatement()) {
                try (ResultSet resultSet = statement.executeQuery(
                    "SELECT term_id, term, document_frequency FROM terms ORDER BY term_id")) {
                    while (resultSet.next()) {
                        rows.add("T|" + resultSet.getInt(1) + "|" + resultSet.getString(2) + "|" + resultSet.getInt(3));
                    }
                }
                try (ResultSet resultSet = statement.executeQuery(
                    "SELECT doc_id, length, status FROM documents ORDER BY doc_id")) {
                    while (resultSet.next()) {
                        rows.add("D|" + resultSet.getInt(1) + "|" + resultSet.getInt(2) + "|" + resultSet.getString(3));
                    }
                }
                try (ResultSet resultSet = statement.executeQuery(
                    "SELECT term_id, doc_id, term_frequency FROM postings ORDER BY term_id, doc_id")) {
                    while (resultSet.next()) {
                        rows.add("P|" + resultSet.getInt(1) + "|" + resultSet.getInt(2) + "|" + resultSet.getInt(3));
                    }
                }
                try (ResultSet resultSet = statement.executeQuery("SELECT doc_id, text FROM contents ORDER BY doc_id")) {
                    while (resultSet.next()) {
                        rows.add("C|" + resultSet.getInt(1) + "|" + resultSet.getString(2));
                    }
                }
            }
            return rows;
        });
    }

    /**
     * 读取词项 df，词项不存在时返回 -1。
     */
    public static int df(StatisticsStore store, String term) {
        return store.readSnapshot(transaction -> transaction.terms().find(term)
            .map(entry -> entry.documentFrequency())
            .orElse(-1));
    }

    public static Optional<Integer> documentLength(StatisticsStore store, int docId) {
        return store.readSnapshot(transaction -> transaction.documents().findById(docId)
            .map(document -> document.length()));
    }

    /**
     * 绕过引擎直接执行 SQL，用于构造损坏状态。
     */
    public static void execute(StatisticsStore store, String sql) {
        store.inTransaction(transaction -> {
            try (Statement statement = transaction.connection().createStatement()) {
                statement.executeUpdate(sql);
            }
            return null;
        });
    }

    /**
     * 读取文档原文，墓碑文档在压缩前同样可读。
     */
    public static Optional<String> content(StatisticsStore store, int docId) {
        return store.readSnapshot(transaction -> Optional.ofNullable(
            transaction.contents().findTexts(List.of(docId)).get(docId)));
    }
}
