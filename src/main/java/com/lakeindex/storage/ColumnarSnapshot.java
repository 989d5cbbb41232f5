package com.lakeindex.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 按关系导出/恢复列式快照：每张表一个 JSON 文件，列名与数据模型字段一致。
 *
 * <p>用于批量引导与恢复。导出在单一读快照内完成，恢复在单一事务内整体替换全部表，
 * 提交前校验一致性约束。原文文件可缺省，缺省时恢复后的索引没有原文。
 */
public final class ColumnarSnapshot {
    private static final Logger logger = LoggerFactory.getLogger(ColumnarSnapshot.class);

    public static final String TERMS_FILE = "terms.json";
    public static final String DOCUMENTS_FILE = "documents.json";
    public static final String POSTINGS_FILE = "postings.json";
    public static final String CONTENTS_FILE = "contents.json";

    private static final List<String> TERM_COLUMNS = List.of("term_id", "term", "document_frequency");
    private static final List<String> DOCUMENT_COLUMNS = List.of("doc_id", "length", "status");
    private static final List<String> POSTING_COLUMNS = List.of("term_id", "doc_id", "term_frequency");
    private static final List<String> CONTENT_COLUMNS = List.of("doc_id", "text");
    private static final Set<String> TEXT_COLUMNS = Set.of("term", "status", "text");

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final StatisticsStore store;

    public ColumnarSnapshot(StatisticsStore store) {
        this.store = store;
    }

    /**
     * 将全部关系表写入目标目录，已有快照文件被覆盖。
     *
     * @param directory 快照目录
     * @return 各关系导出的行数
     * @throws IOException 写入失败时抛出
     */
    public SnapshotSummary export(Path directory) throws IOException {
        Files.createDirectories(directory);
        Instant exportedAt = Instant.now();
        List<RelationSnapshot> relations = store.readSnapshot(transaction -> List.of(
            readRelation(transaction.connection(), "terms", TERM_COLUMNS, "term_id", exportedAt),
            readRelation(transaction.connection(), "documents", DOCUMENT_COLUMNS, "doc_id", exportedAt),
            readRelation(transaction.connection(), "postings", POSTING_COLUMNS, "term_id, doc_id", exportedAt),
            readRelation(transaction.connection(), "contents", CONTENT_COLUMNS, "doc_id", exportedAt)
        ));
        writeRelation(directory.resolve(TERMS_FILE), relations.get(0));
        writeRelation(directory.resolve(DOCUMENTS_FILE), relations.get(1));
        writeRelation(directory.resolve(POSTINGS_FILE), relations.get(2));
        writeRelation(directory.resolve(CONTENTS_FILE), relations.get(3));
        SnapshotSummary summary = new SnapshotSummary(relations.get(0).rowCount(), relations.get(1).rowCount(),
            relations.get(2).rowCount(), relations.get(3).rowCount());
        logger.info("列式快照已导出: {} ({})", directory.toAbsolutePath(), summary);
        return summary;
    }

    /**
     * 用快照目录中的关系表整体替换当前存储。
     *
     * @param directory 快照目录
     * @return 各关系恢复的行数
     * @throws IOException 快照文件缺失、格式损坏或数据违反一致性约束时抛出，此时存储不变
     */
    public SnapshotSummary restore(Path directory) throws IOException {
        RelationSnapshot terms = readRelationFile(directory.resolve(TERMS_FILE), "terms", TERM_COLUMNS);
        RelationSnapshot documents = readRelationFile(directory.resolve(DOCUMENTS_FILE), "documents", DOCUMENT_COLUMNS);
        RelationSnapshot postings = readRelationFile(directory.resolve(POSTINGS_FILE), "postings", POSTING_COLUMNS);
        Path contentsFile = directory.resolve(CONTENTS_FILE);
        RelationSnapshot contents = null;
        if (Files.exists(contentsFile)) {
            contents = readRelationFile(contentsFile, "contents", CONTENT_COLUMNS);
        } else {
            logger.warn("快照不含原文文件，恢复后无法从原文重建索引: {}", contentsFile.toAbsolutePath());
        }

        RelationSnapshot restoredContents = contents;
        InvariantChecker checker = new InvariantChecker(store);
        try {
            store.inTransaction(transaction -> {
                transaction.postings().clear();
                transaction.contents().clear();
                transaction.documents().clear();
                transaction.terms().clear();
                Connection connection = transaction.connection();
                insertRows(connection, "terms", TERM_COLUMNS, terms);
                insertRows(connection, "documents", DOCUMENT_COLUMNS, documents);
                insertRows(connection, "postings", POSTING_COLUMNS, postings);
                if (restoredContents != null) {
                    insertRows(connection, "contents", CONTENT_COLUMNS, restoredContents);
                }
                InvariantChecker.InvariantReport report = checker.check(transaction);
                if (!report.isConsistent()) {
                    throw new InconsistentSnapshotException(report.violations());
                }
                return null;
            });
        } catch (InconsistentSnapshotException inconsistent) {
            throw new IOException("快照违反一致性约束，未恢复: " + directory.toAbsolutePath()
                + " " + inconsistent.getMessage(), inconsistent);
        }
        SnapshotSummary summary = new SnapshotSummary(terms.rowCount(), documents.rowCount(), postings.rowCount(),
            restoredContents == null ? 0 : restoredContents.rowCount());
        logger.info("列式快照已恢复: {} ({})", directory.toAbsolutePath(), summary);
        return summary;
    }

    private RelationSnapshot readRelation(Connection connection, String relation, List<String> columnNames,
                                          String orderBy, Instant exportedAt) throws SQLException {
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (String columnName : columnNames) {
            columns.put(columnName, new ArrayList<>());
        }
        String sql = "SELECT " + String.join(", ", columnNames) + " FROM " + relation + " ORDER BY " + orderBy;
        int rowCount = 0;
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                for (String columnName : columnNames) {
                    columns.get(columnName).add(resultSet.getObject(columnName));
                }
                rowCount++;
            }
        }
        return new RelationSnapshot(relation, exportedAt, rowCount, columns);
    }

    private void writeRelation(Path file, RelationSnapshot snapshot) throws IOException {
        try {
            OBJECT_MAPPER.writeValue(file.toFile(), snapshot);
        } catch (IOException exception) {
            throw new IOException("写入快照文件失败: " + file.toAbsolutePath(), exception);
        }
    }

    private RelationSnapshot readRelationFile(Path file, String relation, List<String> columnNames) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("快照文件不存在: " + file.toAbsolutePath());
        }
        RelationSnapshot snapshot;
        try {
            snapshot = OBJECT_MAPPER.readValue(file.toFile(), RelationSnapshot.class);
        } catch (IOException exception) {
            throw new IOException("读取快照文件失败: " + file.toAbsolutePath(), exception);
        }
        if (!relation.equals(snapshot.relation())) {
            throw new IOException("快照关系名不匹配: 期望 " + relation + ", 实际 " + snapshot.relation());
        }
        for (String columnName : columnNames) {
            List<Object> values = snapshot.columns() == null ? null : snapshot.columns().get(columnName);
            if (values == null) {
                throw new IOException("快照缺少列: " + relation + "." + columnName);
            }
            if (values.size() != snapshot.rowCount()) {
                throw new IOException("快照列长度与行数不一致: " + relation + "." + columnName
                    + ", rows=" + snapshot.rowCount() + ", values=" + values.size());
            }
            boolean textColumn = TEXT_COLUMNS.contains(columnName);
            for (int row = 0; row < values.size(); row++) {
                Object value = values.get(row);
                boolean valid = textColumn ? value instanceof String : isIntegral(value);
                if (!valid) {
                    throw new IOException("快照值类型非法: " + relation + "." + columnName
                        + "[" + row + "]=" + value + ", 期望" + (textColumn ? "字符串" : "整数"));
                }
            }
        }
        return snapshot;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long;
    }

    private void insertRows(Connection connection, String relation, List<String> columnNames,
                            RelationSnapshot snapshot) throws SQLException {
        String placeholders = String.join(", ", columnNames.stream().map(name -> "?").toList());
        String sql = "INSERT INTO " + relation + "(" + String.join(", ", columnNames) + ") VALUES (" + placeholders + ")";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            for (int row = 0; row < snapshot.rowCount(); row++) {
                for (int column = 0; column < columnNames.size(); column++) {
                    Object value = snapshot.columns().get(columnNames.get(column)).get(row);
                    if (value instanceof Number number) {
                        preparedStatement.setLong(column + 1, number.longValue());
                    } else {
                        preparedStatement.setObject(column + 1, value);
                    }
                }
                preparedStatement.addBatch();
            }
            preparedStatement.executeBatch();
        }
    }

    /**
     * 单个关系的列式快照文件内容。
     */
    public record RelationSnapshot(
        @JsonProperty("relation") String relation,
        @JsonProperty("exported_at") Instant exportedAt,
        @JsonProperty("row_count") int rowCount,
        @JsonProperty("columns") Map<String, List<Object>> columns
    ) {
    }

    public record SnapshotSummary(int terms, int documents, int postings, int contents) {
    }

    private static final class InconsistentSnapshotException extends RuntimeException {
        InconsistentSnapshotException(List<String> violations) {
            super(String.join("; ", violations));
        }
    }
}
