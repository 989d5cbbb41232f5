package com.lakeindex.index;

/**
 * 插入时指定的文档ID已被存活文档占用。
 */
public class DuplicateLiveDocumentException extends RuntimeException {
    private final int docId;

    public DuplicateLiveDocumentException(int docId) {
        super("文档ID已存在存活文档: docId=" + docId);
        this.docId = docId;
    }

    public int getDocId() {
        return docId;
    }
}
