package com.lakeindex.index;

/**
 * 变更引用了不存在或已成为墓碑的文档。
 */
public class UnknownDocumentException extends RuntimeException {
    private final int docId;

    public UnknownDocumentException(int docId) {
        super("不存在存活文档: docId=" + docId);
        this.docId = docId;
    }

    public int getDocId() {
        return docId;
    }
}
