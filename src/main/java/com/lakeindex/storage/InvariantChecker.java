package com.lakeindex.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * 以 SQL 校验统计存储的一致性约束：df、文档长度、引用完整性与墓碑隔离。
 */
public final class InvariantChecker {

    private static final String DF_MISMATCH_SQL = """
            SELECT t.term_id, t.term, t.document_frequency, COUNT(d.doc_id) AS live_docs
            FROM terms t
            LEFT JOIN postings p ON p.term_id = t.term_id
            LEFT JOIN documents d ON d.doc_id = p.doc_id AND d.status = 'LIVE'
            GROUP BY t.term_id, t.term, t.document_frequency
            HAVING t.document_frequency <> COUNT(d.doc_id)
            ORDER BY t.term_id
            """;

    private static final String LENGTH_MISMATCH_SQL = """
            SELECT d.doc_id, d.length, COALESCE(SUM(p.term_frequency), 0) AS token_sum
            FROM documents d
            LEFT JOIN postings p ON p.doc_id = d.doc_id
            WHERE d.status = 'LIVE'
            GROUP BY d.doc_id, d.length
            HAVING d.length <> COALESCE(SUM(p.term_frequency), 0)
            ORDER BY d.doc_id
            """;

    private static final String ORPHAN_TERM_SQL = """
            SELECT p.term_id, p.doc_id FROM postings p
            LEFT JOIN terms t ON t.term_id = p.term_id
            WHERE t.term_id IS NULL
            ORDER BY p.term_id, p.doc_id
            """;

    private static final String ORPHAN_DOCUMENT_SQL = """
            SELECT p.term_id, p.doc_id FROM postings p
            LEFT JOIN documents d ON d.doc_id = p.doc_id
            WHERE d.doc_id IS NULL
            ORDER BY p.term_id, p.doc_id
            """;

    private static final String INVALID_STATUS_SQL =
        "SELECT doc_id, status FROM documents WHERE status NOT IN ('LIVE', 'TOMBSTONED') ORDER BY doc_id";

    private static final String NEGATIVE_DF_SQL =
        "SELECT term_id, term, document_frequency FROM terms WHERE document_frequency < 0 ORDER BY term_id";

    private final StatisticsStore store;

    public InvariantChecker(StatisticsStore store) {
        this.store = store;
    }

    /**
     * 在同一快照内执行全部校验。
     */
    public InvariantReport check() {
        return store.readSnapshot(this::check);
    }

    /**
     * 在调用方已持有的事务内执行全部校验，可看到该事务尚未提交的写入。
     */
    public InvariantReport check(StoreTransaction transaction) throws SQLException {
        Connection connection = transaction.connection();
        List<String> violations = new ArrayList<>();
        collect(connection, DF_MISMATCH_SQL, violations, resultSet ->
            "词条 df 不一致: term_id=" + resultSet.getInt(1) + ", term=" + resultSet.getString(2)
                + ", df=" + resultSet.getInt(3) + ", 存活文档数=" + resultSet.getInt(4));
        collect(connection, NEGATIVE_DF_SQL, violations, resultSet ->
            "词条 df 为负: term_id=" + resultSet.getInt(1) + ", term=" + resultSet.getString(2)
                + ", df=" + resultSet.getInt(3));
        collect(connection, LENGTH_MISMATCH_SQL, violations, resultSet ->
            "文档长度不一致: doc_id=" + resultSet.getInt(1) + ", length=" + resultSet.getInt(2)
                + ", 词频之和=" + resultSet.getLong(3));
        collect(connection, ORPHAN_TERM_SQL, violations, resultSet ->
            "倒排引用了不存在的词条: term_id=" + resultSet.getInt(1) + ", doc_id=" + resultSet.getInt(2));
        collect(connection, ORPHAN_DOCUMENT_SQL, violations, resultSet ->
            "倒排引用了不存在的文档: term_id=" + resultSet.getInt(1) + ", doc_id=" + resultSet.getInt(2));
        collect(connection, INVALID_STATUS_SQL, violations, resultSet ->
            "文档状态非法: doc_id=" + resultSet.getInt(1) + ", status=" + resultSet.getString(2));
        return new InvariantReport(List.copyOf(violations));
    }

    private void collect(Connection connection, String sql, List<String> violations, RowDescriber describer)
            throws SQLException {
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                violations.add(describer.describe(resultSet));
            }
        }
    }

    @FunctionalInterface
    private interface RowDescriber {
        String describe(ResultSet resultSet) throws SQLException;
    }

    /**
     * 校验结果，violations 为空表示一致。
     */
    public record InvariantReport(List<String> violations) {
        public boolean isConsistent() {
            return violations.isEmpty();
        }
    }
}
