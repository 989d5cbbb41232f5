package com.lakeindex.document;

/**
 * 文档目录行。
 *
 * @param docId 插入时分配、此后稳定的文档ID
 * @param length 最近一次（重新）索引时的词项数
 * @param status 生命周期状态
 */
public record DocumentRecord(int docId, int length, DocumentStatus status) {
    public DocumentRecord {
        if (length < 0) {
            throw new IllegalArgumentException("文档长度不能为负数, docId=" + docId + ", length=" + length);
        }
        if (status == null) {
            throw new IllegalArgumentException("文档状态不能为null, docId=" + docId);
        }
    }

    public static DocumentRecord live(int docId, int length) {
        return new DocumentRecord(docId, length, DocumentStatus.LIVE);
    }

    public boolean isLive() {
        return status == DocumentStatus.LIVE;
    }
}
