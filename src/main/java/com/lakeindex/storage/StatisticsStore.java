package com.lakeindex.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 统计存储会话：词典、文档目录、倒排与原文四张关系表的唯一访问入口。
 *
 * <p>生命周期为 {@code open -> use -> close}。同一实例内的事务由写锁串行化；
 * 并发读者应各自打开实例，借助 WAL 日志读取最近一次提交的快照。
 */
public final class StatisticsStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StatisticsStore.class);

    private static final String CREATE_TERMS_SQL = """
            CREATE TABLE IF NOT EXISTS terms (
                term_id            INTEGER PRIMARY KEY,
                term               TEXT UNIQUE NOT NULL,
                document_frequency INTEGER NOT NULL DEFAULT 0
            )
            """;

    private static final String CREATE_DOCUMENTS_SQL = """
            CREATE TABLE IF NOT EXISTS documents (
                doc_id INTEGER PRIMARY KEY,
                length INTEGER NOT NULL,
                status TEXT NOT NULL
            )
            """;

    private static final String CREATE_POSTINGS_SQL = """
            CREATE TABLE IF NOT EXISTS postings (
                term_id        INTEGER NOT NULL REFERENCES terms(term_id),
                doc_id         INTEGER NOT NULL REFERENCES documents(doc_id),
                term_frequency INTEGER NOT NULL,
                PRIMARY KEY (term_id, doc_id)
            )
            """;

    private static final String CREATE_CONTENTS_SQL = """
            CREATE TABLE IF NOT EXISTS contents (
                doc_id INTEGER PRIMARY KEY REFERENCES documents(doc_id),
                text   TEXT NOT NULL
            )
            """;

    private static final String CREATE_IDX_STATUS_SQL = "CREATE INDEX IF NOT EXISTS idx_documents_status ON documents(status)";
    private static final String CREATE_IDX_POSTINGS_DOC_SQL = "CREATE INDEX IF NOT EXISTS idx_postings_doc ON postings(doc_id)";
    private static final String ENABLE_WAL_SQL = "PRAGMA journal_mode=WAL";
    private static final String ENABLE_FOREIGN_KEYS_SQL = "PRAGMA foreign_keys=ON";
    private static final String BUSY_TIMEOUT_SQL = "PRAGMA busy_timeout=5000";

    private final Path databasePath;
    private final Connection connection;
    private final ReentrantLock writeLock = new ReentrantLock();

    private StatisticsStore(Path databasePath, Connection connection) {
        this.databasePath = databasePath;
        this.connection = connection;
    }

    /**
     * 打开（必要时创建）指定路径的统计存储。
     */
    public static StatisticsStore open(Path databasePath) {
        Path absolutePath = databasePath.toAbsolutePath();
        try {
            Path parent = absolutePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException ioException) {
            throw new IllegalStateException("创建索引目录失败: " + absolutePath, ioException);
        }
        try {
            Connection connection = DriverManager.getConnection("jdbc:sqlite:" + absolutePath);
            StatisticsStore store = new StatisticsStore(absolutePath, connection);
            store.initializeSchema();
            logger.debug("统计存储已打开: {}", absolutePath);
            return store;
        } catch (SQLException sqlException) {
            throw new StorageTransactionFailedException("初始化统计存储失败: " + absolutePath, sqlException);
        }
    }

    public Path databasePath() {
        return databasePath;
    }

    /**
     * 在单个事务内执行写操作：全部提交或全部回滚。
     *
     * <p>{@link SQLException} 包装为 {@link StorageTransactionFailedException}，
     * 其他运行时异常与 {@link Error} 在回滚后原样抛出。恢复自动提交之前必须先回滚，
     * 否则 {@code setAutoCommit(true)} 会提交未完成的写入。
     */
    public <T> T inTransaction(TransactionWork<T> work) {
        rejectNested();
        writeLock.lock();
        try {
            connection.setAutoCommit(false);
            try {
                T result = work.execute(new StoreTransaction(connection));
                connection.commit();
                return result;
            } catch (SQLException sqlException) {
                rollback(sqlException);
                throw new StorageTransactionFailedException("存储事务失败，已回滚: " + sqlException.getMessage(), sqlException);
            } catch (RuntimeException | Error unchecked) {
                rollback(unchecked);
                throw unchecked;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException sqlException) {
            throw new StorageTransactionFailedException("切换事务模式失败", sqlException);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 在只读快照内执行读取，多条 SELECT 观察到同一提交版本。
     */
    public <T> T readSnapshot(TransactionWork<T> work) {
        return inTransaction(work);
    }

    /**
     * 物理重写数据库文件，回收已删除行占用的页面。不能在事务内调用。
     */
    public void rewriteStorage() {
        rejectNested();
        writeLock.lock();
        try (Statement statement = connection.createStatement()) {
            statement.execute("VACUUM");
            statement.execute("PRAGMA wal_checkpoint(TRUNCATE)");
        } catch (SQLException sqlException) {
            throw new StorageTransactionFailedException("重写存储文件失败: " + databasePath, sqlException);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 汇总当前提交版本的存储统计。
     */
    public IndexStatistics statistics() {
        return readSnapshot(transaction -> new IndexStatistics(
            transaction.documents().countLive(),
            transaction.documents().countTombstoned(),
            transaction.documents().liveStatistics().averageLength(),
            transaction.terms().count(),
            transaction.terms().countActive(),
            transaction.postings().count(),
            transaction.postings().countLive()
        ));
    }

    /**
     * 读取当前连接的 journal_mode。
     */
    public String journalMode() {
        writeLock.lock();
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("PRAGMA journal_mode")) {
            return resultSet.next() ? resultSet.getString(1) : "";
        } catch (SQLException sqlException) {
            throw new StorageTransactionFailedException("读取 journal_mode 失败", sqlException);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            connection.close();
            logger.debug("统计存储已关闭: {}", databasePath);
        } catch (SQLException sqlException) {
            throw new StorageTransactionFailedException("关闭数据库连接失败: " + databasePath, sqlException);
        } finally {
            writeLock.unlock();
        }
    }

    private void initializeSchema() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(ENABLE_WAL_SQL);
            statement.execute(ENABLE_FOREIGN_KEYS_SQL);
            statement.execute(BUSY_TIMEOUT_SQL);
        }

        connection.setAutoCommit(false);
        try (Statement statement = connection.createStatement()) {
            statement.execute(CREATE_TERMS_SQL);
            statement.execute(CREATE_DOCUMENTS_SQL);
            statement.execute(CREATE_POSTINGS_SQL);
            statement.execute(CREATE_CONTENTS_SQL);
            statement.execute(CREATE_IDX_STATUS_SQL);
            statement.execute(CREATE_IDX_POSTINGS_DOC_SQL);
            connection.commit();
        } catch (SQLException sqlException) {
            connection.rollback();
            throw sqlException;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    private void rejectNested() {
        if (writeLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("不支持嵌套事务: " + databasePath);
        }
    }

    private void rollback(Throwable cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackException) {
            cause.addSuppressed(rollbackException);
            logger.error("事务回滚失败: {}", databasePath, rollbackException);
        }
    }
}
