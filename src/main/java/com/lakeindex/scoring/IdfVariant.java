package com.lakeindex.scoring;

/**
 * IDF 计算方式。
 */
public enum IdfVariant {
    /**
     * 经典 Robertson-Spärck Jones 形式 {@code ln((N-df+0.5)/(df+0.5))}，不截断，高频词可为负。
     */
    CLASSIC {
        @Override
        double compute(int totalDocs, int docFrequency) {
            return Math.log((totalDocs - docFrequency + 0.5) / (docFrequency + 0.5));
        }
    },
    /**
     * Lucene 形式 {@code ln(1 + (N-df+0.5)/(df+0.5))}，恒为正。
     */
    LUCENE {
        @Override
        double compute(int totalDocs, int docFrequency) {
            return Math.log(1 + (totalDocs - docFrequency + 0.5) / (docFrequency + 0.5));
        }
    };

    abstract double compute(int totalDocs, int docFrequency);
}
