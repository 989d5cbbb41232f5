package com.lakeindex.document;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 文档目录表访问。实例绑定到单个事务连接。
 */
public final class DocumentCatalog {
    private final Connection connection;

    public DocumentCatalog(Connection connection) {
        this.connection = connection;
    }

    /**
     * 插入文档目录行。
     */
    public void insert(DocumentRecord document) throws SQLException {
        String sql = "INSERT INTO documents(doc_id, length, status) VALUES (?, ?, ?)";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, document.docId());
            preparedStatement.setInt(2, document.length());
            preparedStatement.setString(3, document.status().name());
            preparedStatement.executeUpdate();
        }
    }

    /**
     * 以新长度将文档置为存活，用于重新索引与墓碑复活。
     */
    public void markLive(int docId, int length) throws SQLException {
        String sql = "UPDATE documents SET length = ?, status = 'LIVE' WHERE doc_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, length);
            preparedStatement.setInt(2, docId);
            preparedStatement.executeUpdate();
        }
    }

    /**
     * 将存活文档标记为墓碑，返回实际变更的行数。
     */
    public int markTombstoned(Collection<Integer> docIds) throws SQLException {
        String sql = "UPDATE documents SET status = 'TOMBSTONED' WHERE doc_id = ? AND status = 'LIVE'";
        int updated = 0;
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            for (Integer docId : docIds) {
                preparedStatement.setInt(1, docId);
                updated += preparedStatement.executeUpdate();
            }
        }
        return updated;
    }

    /**
     * 按 ID 查找文档，墓碑文档同样返回。
     */
    public Optional<DocumentRecord> findById(int docId) throws SQLException {
        String sql = "SELECT doc_id, length, status FROM documents WHERE doc_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, docId);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(readDocument(resultSet));
            }
        }
    }

    /**
     * 获取下一个可用文档 ID。墓碑行同样占用 ID，直至被压缩清除。
     */
    public int nextDocId() throws SQLException {
        return queryInt("SELECT COALESCE(MAX(doc_id), 0) + 1 FROM documents");
    }

    /**
     * 按 ID 升序返回全部存活文档ID。
     */
    public List<Integer> liveDocIds() throws SQLException {
        String sql = "SELECT doc_id FROM documents WHERE status = 'LIVE' ORDER BY doc_id";
        List<Integer> docIds = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                docIds.add(resultSet.getInt(1));
            }
        }
        return docIds;
    }

    /**
     * 从存活文档现算 N 与 avgdl。
     */
    public CorpusStatistics liveStatistics() throws SQLException {
        String sql = "SELECT COUNT(*), AVG(length) FROM documents WHERE status = 'LIVE'";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            if (!resultSet.next()) {
                return new CorpusStatistics(0, 0.0);
            }
            int liveDocuments = resultSet.getInt(1);
            double averageLength = resultSet.getDouble(2);
            return new CorpusStatistics(liveDocuments, resultSet.wasNull() ? 0.0 : averageLength);
        }
    }

    public int countLive() throws SQLException {
        return queryInt("SELECT COUNT(*) FROM documents WHERE status = 'LIVE'");
    }

    public int countTombstoned() throws SQLException {
        return queryInt("SELECT COUNT(*) FROM documents WHERE status = 'TOMBSTONED'");
    }

    /**
     * 物理删除全部墓碑行，调用前须先清除其倒排项。
     */
    public int purgeTombstoned() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            return statement.executeUpdate("DELETE FROM documents WHERE status = 'TOMBSTONED'");
        }
    }

    public void clear() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM documents");
        }
    }

    private int queryInt(String sql) throws SQLException {
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        }
    }

    private DocumentRecord readDocument(ResultSet resultSet) throws SQLException {
        return new DocumentRecord(
            resultSet.getInt("doc_id"),
            resultSet.getInt("length"),
            DocumentStatus.valueOf(resultSet.getString("status"))
        );
    }
}
