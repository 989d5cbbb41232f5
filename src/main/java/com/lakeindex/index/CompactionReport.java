package com.lakeindex.index;

/**
 * 一次压缩的结果。
 *
 * @param storageRewritten 存储文件是否已重写；清除已提交但重写失败时为 false，下次压缩会重试重写
 */
public record CompactionReport(
        int purgedDocuments,
        int purgedPostings,
        boolean storageRewritten,
        long elapsedMs
) {
    public boolean isNoop() {
        return purgedDocuments == 0 && purgedPostings == 0 && !storageRewritten;
    }

    /**
     * 墓碑行已物理清除，但文件空间尚未回收。
     */
    public boolean rewritePending() {
        return (purgedDocuments > 0 || purgedPostings > 0) && !storageRewritten;
    }
}
