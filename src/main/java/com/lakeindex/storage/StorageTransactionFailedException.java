package com.lakeindex.storage;

/**
 * 底层存储中止了事务。抛出时事务已回滚，三张关系表保持调用前状态。
 */
public class StorageTransactionFailedException extends IllegalStateException {
    public StorageTransactionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
