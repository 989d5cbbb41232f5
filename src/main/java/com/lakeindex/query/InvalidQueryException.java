package com.lakeindex.query;

/**
 * 查询输入本身不合法（例如不支持的模式或空引用）。缺失的查询词不属于此类错误。
 */
public class InvalidQueryException extends RuntimeException {
    public InvalidQueryException(String message) {
        super(message);
    }
}
