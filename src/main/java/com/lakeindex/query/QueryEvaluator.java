package com.lakeindex.query;

import com.lakeindex.scoring.BM25Scorer;
import com.lakeindex.storage.StoreTransaction;

import java.sql.SQLException;
import java.util.Collection;
import java.util.Map;

/**
 * 候选集选择与逐文档打分。实现之间只能在求值机制上不同，结果必须一致。
 */
public interface QueryEvaluator {

    /**
     * 在给定读快照内计算候选文档的 BM25 分值。
     *
     * @param transaction 读快照
     * @param terms 已归一化、去重的查询词
     * @param mode 候选集语义
     * @param scorer 以当前存活文档统计构造的打分器
     * @return docId 到分值的映射，无候选时为空
     */
    Map<Integer, Double> evaluate(StoreTransaction transaction, Collection<String> terms, QueryMode mode,
                                  BM25Scorer scorer) throws SQLException;

    static QueryEvaluator of(EvaluatorType type) {
        return switch (type) {
            case SQL -> new SqlQueryEvaluator();
            case IN_MEMORY -> new InMemoryQueryEvaluator();
        };
    }
}
