package com.lakeindex.benchmark;

import java.util.List;

/**
 * 一次基准运行的汇总。
 */
public record BenchmarkReport(
        int originalDocuments,
        List<RoundRecord> rounds,
        int compactionsRun,
        long elapsedMs
) {
    public BenchmarkReport {
        rounds = List.copyOf(rounds);
    }

    public int cumulativeDeleted() {
        return rounds.isEmpty() ? 0 : rounds.get(rounds.size() - 1).cumulativeDeleted();
    }

    /**
     * 第 round 轮结束时已删除文档占初始文档数的比例。
     */
    public double deletedFractionAfter(int round) {
        if (originalDocuments == 0 || round < 1 || round > rounds.size()) {
            return 0.0;
        }
        return (double) rounds.get(round - 1).cumulativeDeleted() / originalDocuments;
    }
}
