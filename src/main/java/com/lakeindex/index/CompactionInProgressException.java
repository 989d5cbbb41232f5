package com.lakeindex.index;

/**
 * 已有压缩在执行，新的压缩请求被拒绝而不排队。
 */
public class CompactionInProgressException extends RuntimeException {
    public CompactionInProgressException(String message) {
        super(message);
    }
}
