package com.lakeindex.benchmark;

import com.lakeindex.index.Compactor;
import com.lakeindex.index.MutationEngine;
import com.lakeindex.query.QueryEngine;
import com.lakeindex.storage.StatisticsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 延迟-墓碑累积曲线的测量循环：每轮先跑查询批次计时，再删除一批文档，按检查点决定是否压缩。
 *
 * <p>循环只影响压缩发生的时机，不改变任何查询语义。
 */
public class BenchmarkHarness {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkHarness.class);

    private final StatisticsStore store;
    private final QueryEngine queryEngine;
    private final MutationEngine mutationEngine;
    private final Compactor compactor;

    public BenchmarkHarness(StatisticsStore store, QueryEngine queryEngine, MutationEngine mutationEngine,
                            Compactor compactor) {
        this.store = store;
        this.queryEngine = queryEngine;
        this.mutationEngine = mutationEngine;
        this.compactor = compactor;
    }

    /**
     * 运行基准循环，达到轮数或全部文档成为墓碑时结束。
     *
     * @throws IOException 日志文件无法创建
     */
    public BenchmarkReport run(QueryWorkload workload, BenchmarkSettings settings) throws IOException {
        long startNanos = System.nanoTime();
        List<Integer> liveDocIds = store.readSnapshot(transaction -> transaction.documents().liveDocIds());
        int originalDocuments = liveDocIds.size();
        DeletionCursor cursor = new DeletionCursor(liveDocIds, settings.randomOrder(), settings.seed());
        Random querySampler = new Random(settings.seed());
        logger.info("基准开始: 文档 {}，轮数 {}，删除批 {}，查询 {}，检查点 {}%",
            originalDocuments, settings.rounds(), settings.deleteBatchSize(), workload.size(), settings.checkpointPct());

        List<RoundRecord> records = new ArrayList<>();
        int compactions = 0;
        double nextCheckpointPct = settings.checkpointPct();
        BenchmarkLog log = settings.logFile() == null ? null : BenchmarkLog.create(settings.logFile());
        try {
            for (int round = 1; round <= settings.rounds() && !cursor.isExhausted(); round++) {
                List<Double> latencies = runQueries(workload.sample(settings.queryBatchSize(), querySampler), settings);

                mutationEngine.deleteAll(cursor.next(settings.deleteBatchSize()));
                int cumulativeDeleted = cursor.consumed();
                double pctDeleted = cumulativeDeleted * 100.0 / originalDocuments;
                if (settings.compactionEnabled() && pctDeleted >= nextCheckpointPct) {
                    compactor.compact();
                    compactions++;
                    nextCheckpointPct += settings.checkpointPct();
                }

                RoundRecord record = new RoundRecord(round, cumulativeDeleted, compactions, latencies);
                records.add(record);
                if (log != null) {
                    log.append(record);
                }
                logger.info("第 {} 轮: 已删除 {} ({}%)，平均延迟 {}ms，压缩 {} 次", round, cumulativeDeleted,
                    String.format("%.2f", pctDeleted), String.format("%.3f", record.averageLatencyMs()), compactions);
            }
        } finally {
            if (log != null) {
                log.close();
            }
        }
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        return new BenchmarkReport(originalDocuments, records, compactions, elapsedMs);
    }

    private List<Double> runQueries(List<String> queries, BenchmarkSettings settings) {
        List<Double> latencies = new ArrayList<>(queries.size());
        for (String query : queries) {
            long queryStart = System.nanoTime();
            queryEngine.search(query, settings.mode(), settings.topK());
            latencies.add((System.nanoTime() - queryStart) / 1_000_000.0);
        }
        return latencies;
    }
}
