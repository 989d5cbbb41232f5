package com.lakeindex.document;

/**
 * 查询时从存活文档现算的语料聚合量。
 *
 * @param liveDocuments N
 * @param averageLength avgdl，无存活文档时为 0
 */
public record CorpusStatistics(int liveDocuments, double averageLength) {
}
