package com.lakeindex.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 倒排表访问。墓碑文档的倒排行在压缩前仍物理存在，所有读取均经存活过滤。
 */
public final class PostingsTable {
    private static final String LIVE_FILTER = "doc_id IN (SELECT doc_id FROM documents WHERE status = 'LIVE')";

    private final Connection connection;

    PostingsTable(Connection connection) {
        this.connection = connection;
    }

    /**
     * 写入单个文档的全部倒排项。
     *
     * @param docId 文档ID
     * @param termFrequencyByTermId termId 到词频的映射
     */
    public void insertAll(int docId, Map<Integer, Integer> termFrequencyByTermId) throws SQLException {
        if (termFrequencyByTermId.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO postings(term_id, doc_id, term_frequency) VALUES (?, ?, ?)";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            for (Map.Entry<Integer, Integer> entry : termFrequencyByTermId.entrySet()) {
                preparedStatement.setInt(1, entry.getKey());
                preparedStatement.setInt(2, docId);
                preparedStatement.setInt(3, entry.getValue());
                preparedStatement.addBatch();
            }
            preparedStatement.executeBatch();
        }
    }

    /**
     * 读取文档当前物理存在的倒排项，按 termId 升序。
     */
    public Map<Integer, Integer> termFrequencies(int docId) throws SQLException {
        String sql = "SELECT term_id, term_frequency FROM postings WHERE doc_id = ? ORDER BY term_id";
        Map<Integer, Integer> frequencies = new LinkedHashMap<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, docId);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next()) {
                    frequencies.put(resultSet.getInt(1), resultSet.getInt(2));
                }
            }
        }
        return frequencies;
    }

    /**
     * 读取某个词项在存活文档上的倒排列表，附带文档长度。
     */
    public PostingList livePostings(int termId) throws SQLException {
        String countSql = "SELECT COUNT(*) FROM postings p JOIN documents d ON d.doc_id = p.doc_id "
            + "WHERE p.term_id = ? AND d.status = 'LIVE'";
        String sql = """
                SELECT p.doc_id, p.term_frequency, d.length
                FROM postings p
                JOIN documents d ON d.doc_id = p.doc_id
                WHERE p.term_id = ? AND d.status = 'LIVE'
                ORDER BY p.doc_id
                """;
        int size;
        try (PreparedStatement preparedStatement = connection.prepareStatement(countSql)) {
            preparedStatement.setInt(1, termId);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                size = resultSet.next() ? resultSet.getInt(1) : 0;
            }
        }
        if (size == 0) {
            return PostingList.empty();
        }
        int[] docIds = new int[size];
        int[] termFreqs = new int[size];
        int[] docLengths = new int[size];
        int index = 0;
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, termId);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next() && index < size) {
                    docIds[index] = resultSet.getInt(1);
                    termFreqs[index] = resultSet.getInt(2);
                    docLengths[index] = resultSet.getInt(3);
                    index++;
                }
            }
        }
        return new PostingList(docIds, termFreqs, docLengths);
    }

    /**
     * 物理删除单个文档的倒排项，返回删除行数。
     */
    public int deleteForDocument(int docId) throws SQLException {
        String sql = "DELETE FROM postings WHERE doc_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, docId);
            return preparedStatement.executeUpdate();
        }
    }

    /**
     * 物理删除全部墓碑文档的倒排项，返回删除行数。
     */
    public int purgeTombstoned() throws SQLException {
        String sql = "DELETE FROM postings WHERE doc_id IN (SELECT doc_id FROM documents WHERE status = 'TOMBSTONED')";
        try (Statement statement = connection.createStatement()) {
            return statement.executeUpdate(sql);
        }
    }

    /**
     * 物理行数，包含待压缩的墓碑倒排。
     */
    public long count() throws SQLException {
        return queryLong("SELECT COUNT(*) FROM postings");
    }

    public long countLive() throws SQLException {
        return queryLong("SELECT COUNT(*) FROM postings WHERE " + LIVE_FILTER);
    }

    public void clear() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM postings");
        }
    }

    private long queryLong(String sql) throws SQLException {
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.next() ? resultSet.getLong(1) : 0L;
        }
    }
}
