package com.lakeindex.storage;

import java.sql.SQLException;

/**
 * 在单个存储事务内执行的工作单元。
 */
@FunctionalInterface
public interface TransactionWork<T> {
    T execute(StoreTransaction transaction) throws SQLException;
}
