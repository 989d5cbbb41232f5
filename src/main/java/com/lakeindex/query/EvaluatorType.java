package com.lakeindex.query;

/**
 * 候选集求值方式。
 */
public enum EvaluatorType {
    /** 候选集合并与存活过滤下推到 SQL。 */
    SQL,
    /** 倒排列表载入内存后在 Java 中合并。 */
    IN_MEMORY
}
