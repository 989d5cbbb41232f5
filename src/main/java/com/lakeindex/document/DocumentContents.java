package com.lakeindex.document;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 文档原文表访问。原文随文档目录行存在，墓碑文档的原文保留到压缩时清除。
 */
public final class DocumentContents {
    private final Connection connection;

    public DocumentContents(Connection connection) {
        this.connection = connection;
    }

    /**
     * 写入或替换文档原文，null 按空串存储。
     */
    public void put(int docId, String text) throws SQLException {
        String sql = "INSERT OR REPLACE INTO contents(doc_id, text) VALUES (?, ?)";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, docId);
            preparedStatement.setString(2, text == null ? "" : text);
            preparedStatement.executeUpdate();
        }
    }

    /**
     * 批量读取原文，缺失原文的文档不出现在结果中。
     */
    public Map<Integer, String> findTexts(Collection<Integer> docIds) throws SQLException {
        Map<Integer, String> texts = new LinkedHashMap<>();
        String sql = "SELECT text FROM contents WHERE doc_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            for (Integer docId : docIds) {
                preparedStatement.setInt(1, docId);
                try (ResultSet resultSet = preparedStatement.executeQuery()) {
                    if (resultSet.next()) {
                        texts.put(docId, resultSet.getString(1));
                    }
                }
            }
        }
        return texts;
    }

    /**
     * 按 ID 升序返回全部存活文档的原文。
     */
    public Map<Integer, String> liveTexts() throws SQLException {
        String sql = """
                SELECT c.doc_id, c.text FROM contents c
                JOIN documents d ON d.doc_id = c.doc_id
                WHERE d.status = 'LIVE'
                ORDER BY c.doc_id
                """;
        Map<Integer, String> texts = new LinkedHashMap<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                texts.put(resultSet.getInt(1), resultSet.getString(2));
            }
        }
        return texts;
    }

    /**
     * 统计没有原文的存活文档数，非 0 时无法从原文重建索引。
     */
    public int countLiveWithoutContent() throws SQLException {
        return queryInt("""
                SELECT COUNT(*) FROM documents d
                WHERE d.status = 'LIVE'
                  AND NOT EXISTS (SELECT 1 FROM contents c WHERE c.doc_id = d.doc_id)
                """);
    }

    public int count() throws SQLException {
        return queryInt("SELECT COUNT(*) FROM contents");
    }

    /**
     * 删除墓碑文档的原文，须在清除墓碑目录行之前调用。
     */
    public int purgeTombstoned() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            return statement.executeUpdate(
                "DELETE FROM contents WHERE doc_id IN (SELECT doc_id FROM documents WHERE status = 'TOMBSTONED')");
        }
    }

    public void clear() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM contents");
        }
    }

    private int queryInt(String sql) throws SQLException {
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        }
    }
}
