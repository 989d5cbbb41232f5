package com.lakeindex.index;

import java.util.List;

/**
 * 一次构建或增量导入的结果。失败文档被跳过，不影响其余文档入库。
 */
public record BuildReport(
        int indexedDocuments,
        int batches,
        List<FailedDocument> failures,
        long elapsedMs
) {
    public BuildReport {
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * 未能入库的文档及原因。
     */
    public record FailedDocument(Integer docId, String reason) {
    }
}
