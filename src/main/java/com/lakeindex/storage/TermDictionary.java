package com.lakeindex.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 词典表访问。实例绑定到单个事务，不可跨事务复用。
 */
public final class TermDictionary {
    private final Connection connection;
    private int nextTermId = -1;

    TermDictionary(Connection connection) {
        this.connection = connection;
    }

    public Optional<TermEntry> find(String term) throws SQLException {
        String sql = "SELECT term_id, term, document_frequency FROM terms WHERE term = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, term);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(readEntry(resultSet));
            }
        }
    }

    public Optional<TermEntry> findById(int termId) throws SQLException {
        String sql = "SELECT term_id, term, document_frequency FROM terms WHERE term_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, termId);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(readEntry(resultSet));
            }
        }
    }

    /**
     * 批量解析词项，词典中不存在的词项不出现在结果中。
     */
    public Map<String, TermEntry> findAll(Collection<String> terms) throws SQLException {
        Map<String, TermEntry> entries = new HashMap<>();
        for (String term : terms) {
            find(term).ifPresent(entry -> entries.put(entry.term(), entry));
        }
        return entries;
    }

    /**
     * 返回词项对应的词条，首次出现时以 df=0 创建。
     */
    public TermEntry getOrCreate(String term) throws SQLException {
        Optional<TermEntry> existing = find(term);
        if (existing.isPresent()) {
            return existing.get();
        }
        int termId = allocateTermId();
        String sql = "INSERT INTO terms(term_id, term, document_frequency) VALUES (?, ?, 0)";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, termId);
            preparedStatement.setString(2, term);
            preparedStatement.executeUpdate();
        }
        return new TermEntry(termId, term, 0);
    }

    /**
     * 按 termId 批量调整文档频率，delta 可为负。
     */
    public void adjustDocumentFrequencies(Map<Integer, Integer> deltaByTermId) throws SQLException {
        if (deltaByTermId.isEmpty()) {
            return;
        }
        String sql = "UPDATE terms SET document_frequency = document_frequency + ? WHERE term_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            for (Map.Entry<Integer, Integer> entry : deltaByTermId.entrySet()) {
                preparedStatement.setInt(1, entry.getValue());
                preparedStatement.setInt(2, entry.getKey());
                preparedStatement.addBatch();
            }
            preparedStatement.executeBatch();
        }
    }

    /**
     * 以绝对值覆盖文档频率，用于全量构建结束时的汇总写入。
     */
    public void assignDocumentFrequencies(Map<Integer, Integer> documentFrequencyByTermId) throws SQLException {
        if (documentFrequencyByTermId.isEmpty()) {
            return;
        }
        String sql = "UPDATE terms SET document_frequency = ? WHERE term_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            for (Map.Entry<Integer, Integer> entry : documentFrequencyByTermId.entrySet()) {
                preparedStatement.setInt(1, entry.getValue());
                preparedStatement.setInt(2, entry.getKey());
                preparedStatement.addBatch();
            }
            preparedStatement.executeBatch();
        }
    }

    /**
     * 按 term_id 顺序返回 df&gt;0 的词项。
     */
    public List<String> activeTerms() throws SQLException {
        String sql = "SELECT term FROM terms WHERE document_frequency > 0 ORDER BY term_id";
        List<String> terms = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                terms.add(resultSet.getString(1));
            }
        }
        return terms;
    }

    public int count() throws SQLException {
        return queryInt("SELECT COUNT(*) FROM terms");
    }

    public int countActive() throws SQLException {
        return queryInt("SELECT COUNT(*) FROM terms WHERE document_frequency > 0");
    }

    public void clear() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM terms");
        }
        nextTermId = -1;
    }

    private int allocateTermId() throws SQLException {
        if (nextTermId < 0) {
            nextTermId = queryInt("SELECT COALESCE(MAX(term_id), 0) + 1 FROM terms");
        }
        return nextTermId++;
    }

    private int queryInt(String sql) throws SQLException {
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        }
    }

    private TermEntry readEntry(ResultSet resultSet) throws SQLException {
        return new TermEntry(
            resultSet.getInt("term_id"),
            resultSet.getString("term"),
            resultSet.getInt("document_frequency")
        );
    }
}
