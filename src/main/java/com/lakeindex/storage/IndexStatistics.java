package com.lakeindex.storage;

/**
 * 存储统计快照。
 *
 * @param liveDocuments 存活文档数 N
 * @param tombstonedDocuments 等待压缩的墓碑文档数
 * @param averageLength 存活文档平均长度 avgdl
 * @param termCount 词典总词条数（含 df=0）
 * @param activeTermCount df&gt;0 的词条数
 * @param physicalPostings 物理倒排行数
 * @param livePostings 可被查询读取的倒排行数
 */
public record IndexStatistics(
    int liveDocuments,
    int tombstonedDocuments,
    double averageLength,
    int termCount,
    int activeTermCount,
    long physicalPostings,
    long livePostings
) {
    /**
     * 墓碑文档占目录总行数的比例，目录为空时为 0。
     */
    public double tombstonedFraction() {
        int total = liveDocuments + tombstonedDocuments;
        return total == 0 ? 0.0 : (double) tombstonedDocuments / total;
    }
}
