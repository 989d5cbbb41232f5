package com.lakeindex.benchmark;

import com.lakeindex.query.QueryMode;

import java.nio.file.Path;

/**
 * 基准循环参数。
 *
 * @param rounds 最大轮数
 * @param deleteBatchSize 每轮删除的文档数
 * @param queryBatchSize 每轮抽样的查询数，0 表示每轮执行完整查询集
 * @param topK 每个查询返回条数
 * @param mode 查询模式
 * @param randomOrder 删除顺序是否为固定种子的随机排列
 * @param seed 随机种子
 * @param checkpointPct 每删除该百分比触发一次压缩，0 表示不压缩
 * @param logFile 轮次日志文件，可为 null
 */
public record BenchmarkSettings(
        int rounds,
        int deleteBatchSize,
        int queryBatchSize,
        int topK,
        QueryMode mode,
        boolean randomOrder,
        long seed,
        double checkpointPct,
        Path logFile
) {
    public BenchmarkSettings {
        if (rounds <= 0) {
            throw new IllegalArgumentException("轮数必须大于0: " + rounds);
        }
        if (deleteBatchSize <= 0) {
            throw new IllegalArgumentException("删除批大小必须大于0: " + deleteBatchSize);
        }
        if (queryBatchSize < 0) {
            throw new IllegalArgumentException("查询批大小不能为负: " + queryBatchSize);
        }
        if (checkpointPct < 0.0 || checkpointPct > 100.0) {
            throw new IllegalArgumentException("压缩检查点百分比必须在[0,100]之间: " + checkpointPct);
        }
        if (mode == null) {
            mode = QueryMode.DISJUNCTIVE;
        }
    }

    public boolean compactionEnabled() {
        return checkpointPct > 0.0;
    }
}
