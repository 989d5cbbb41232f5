package com.lakeindex.index;

import com.lakeindex.config.Constants;
import com.lakeindex.storage.IndexStatistics;
import com.lakeindex.storage.StatisticsStore;
import com.lakeindex.storage.StorageTransactionFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 墓碑压缩：物理清除墓碑文档及其倒排并重写存储文件。
 *
 * <p>只回收空间，不修改任何统计量。同一进程内针对同一数据库文件的所有实例共享运行标志，
 * 同时只允许一次压缩；跨进程由 SQLite 文件锁串行化。压缩与变更共用存储写锁。
 *
 * <p>清除在事务内提交后才重写文件。重写失败不回滚清除结果，只在报告中标记，并在下次压缩时重试。
 */
public class Compactor {
    private static final Logger logger = LoggerFactory.getLogger(Compactor.class);

    private static final ConcurrentMap<Path, AtomicBoolean> RUNNING_BY_DATABASE = new ConcurrentHashMap<>();

    private final StatisticsStore store;
    private final double autoCompactThreshold;
    private final Runnable storageRewrite;
    private final AtomicBoolean running;
    private volatile int compactionsRun;
    private volatile boolean rewritePending;

    public Compactor(StatisticsStore store) {
        this(store, Constants.DEFAULT_AUTO_COMPACT_THRESHOLD);
    }

    /**
     * @param autoCompactThreshold 墓碑占比阈值，0 表示关闭自动压缩
     */
    public Compactor(StatisticsStore store, double autoCompactThreshold) {
        this(store, autoCompactThreshold, store::rewriteStorage);
    }

    Compactor(StatisticsStore store, double autoCompactThreshold, Runnable storageRewrite) {
        if (autoCompactThreshold < 0.0 || autoCompactThreshold > 1.0) {
            throw new IllegalArgumentException("自动压缩阈值必须在[0,1]之间: " + autoCompactThreshold);
        }
        this.store = store;
        this.autoCompactThreshold = autoCompactThreshold;
        this.storageRewrite = storageRewrite;
        this.running = RUNNING_BY_DATABASE.computeIfAbsent(store.databasePath(), path -> new AtomicBoolean(false));
    }

    /**
     * 执行一次压缩。没有墓碑时不做任何写入，因此连续调用是幂等的。
     *
     * @throws CompactionInProgressException 已有压缩在执行
     */
    public CompactionReport compact() {
        if (!running.compareAndSet(false, true)) {
            throw new CompactionInProgressException("压缩正在执行: " + store.databasePath());
        }
        try {
            return runCompaction();
        } finally {
            running.set(false);
        }
    }

    /**
     * 墓碑占比达到阈值时压缩；阈值为 0 或已有压缩在执行时跳过。
     */
    public Optional<CompactionReport> compactIfNeeded() {
        if (autoCompactThreshold <= 0.0) {
            return Optional.empty();
        }
        if (running.get()) {
            logger.debug("已有压缩在执行，跳过自动压缩");
            return Optional.empty();
        }
        IndexStatistics statistics = store.statistics();
        if (statistics.tombstonedDocuments() == 0 || statistics.tombstonedFraction() < autoCompactThreshold) {
            return Optional.empty();
        }
        if (!running.compareAndSet(false, true)) {
            logger.debug("已有压缩在执行，跳过自动压缩");
            return Optional.empty();
        }
        try {
            logger.info("墓碑占比 {} 达到阈值 {}，触发自动压缩",
                String.format("%.3f", statistics.tombstonedFraction()), autoCompactThreshold);
            return Optional.of(runCompaction());
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int compactionsRun() {
        return compactionsRun;
    }

    private CompactionReport runCompaction() {
        long startNanos = System.nanoTime();
        int[] purged = store.inTransaction(transaction -> {
            int postings = transaction.postings().purgeTombstoned();
            transaction.contents().purgeTombstoned();
            int documents = transaction.documents().purgeTombstoned();
            return new int[] {documents, postings};
        });
        boolean rewritten = false;
        if (purged[0] > 0 || purged[1] > 0 || rewritePending) {
            rewritten = rewriteStorage();
        }
        compactionsRun++;
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        CompactionReport report = new CompactionReport(purged[0], purged[1], rewritten, elapsedMs);
        logger.info("压缩完成: 清除文档 {}，清除倒排 {}，重写存储 {}，耗时 {}ms",
            report.purgedDocuments(), report.purgedPostings(), rewritten, elapsedMs);
        return report;
    }

    private boolean rewriteStorage() {
        try {
            storageRewrite.run();
            rewritePending = false;
            return true;
        } catch (StorageTransactionFailedException rewriteException) {
            rewritePending = true;
            logger.warn("墓碑已清除，但存储文件重写失败，空间将在下次压缩时回收: {}",
                store.databasePath(), rewriteException);
            return false;
        }
    }
}
