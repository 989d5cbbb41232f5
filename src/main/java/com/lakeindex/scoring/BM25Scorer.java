package com.lakeindex.scoring;

import com.lakeindex.config.Constants;

/**
 * BM25 打分器。N 与 avgdl 在查询时由存活文档计算后传入，实例只在单次查询内有效。
 */
public class BM25Scorer {
    private final int totalDocs;
    private final double avgDocLength;
    private final double k1;
    private final double b;
    private final IdfVariant idfVariant;

    public BM25Scorer(int totalDocs, double avgDocLength) {
        this(totalDocs, avgDocLength, Constants.BM25_K1, Constants.BM25_B, IdfVariant.CLASSIC);
    }

    public BM25Scorer(int totalDocs, double avgDocLength, double k1, double b, IdfVariant idfVariant) {
        if (totalDocs < 0) {
            throw new IllegalArgumentException("文档总数不能为负: " + totalDocs);
        }
        this.totalDocs = totalDocs;
        this.avgDocLength = avgDocLength;
        this.k1 = k1;
        this.b = b;
        this.idfVariant = idfVariant == null ? IdfVariant.CLASSIC : idfVariant;
    }

    public double computeIDF(int docFrequency) {
        return idfVariant.compute(totalDocs, docFrequency);
    }

    /**
     * 单个词项对文档的贡献。
     *
     * @param termFrequency 词项在文档中的出现次数
     * @param docFrequency 词项的存活文档频率
     * @param docLength 文档长度（词元数）
     * @return 贡献分值，tf 为 0 时为 0
     */
    public double score(int termFrequency, int docFrequency, int docLength) {
        if (termFrequency <= 0) {
            return 0.0;
        }
        return computeIDF(docFrequency) * termFrequencyWeight(termFrequency, docLength);
    }

    private double termFrequencyWeight(int termFrequency, int docLength) {
        // avgdl 为 0 时所有存活文档长度都为 0，长度归一项退化为 1
        double lengthRatio = avgDocLength <= 0 ? 1.0 : Math.max(docLength, 0) / avgDocLength;
        double norm = 1 - b + b * lengthRatio;
        return termFrequency * (k1 + 1) / (termFrequency + k1 * norm);
    }
}
