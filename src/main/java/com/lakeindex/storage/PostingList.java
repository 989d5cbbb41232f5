package com.lakeindex.storage;

import java.util.Arrays;

/**
 * 经存活过滤后的倒排列表：文档ID、词频与文档长度三列对齐。
 *
 * @param docIds 递增文档ID数组
 * @param termFreqs 与docIds同长度的词频数组
 * @param docLengths 与docIds同长度的文档长度数组
 */
public record PostingList(int[] docIds, int[] termFreqs, int[] docLengths) {
    private static final PostingList EMPTY = new PostingList(new int[0], new int[0], new int[0]);

    /**
     * 构造时执行校验并复制输入数据，避免外部修改。
     */
    public PostingList {
        if (docIds == null || termFreqs == null || docLengths == null) {
            throw new IllegalArgumentException("docIds、termFreqs与docLengths不能为null");
        }
        if (docIds.length != termFreqs.length || docIds.length != docLengths.length) {
            throw new IllegalArgumentException("倒排列数组长度不一致: " + docIds.length + " / "
                + termFreqs.length + " / " + docLengths.length);
        }
        for (int index = 0; index < docIds.length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
            if (termFreqs[index] <= 0) {
                throw new IllegalArgumentException("termFreq必须为正数，位置=" + index + ", value=" + termFreqs[index]);
            }
            if (docLengths[index] < termFreqs[index]) {
                throw new IllegalArgumentException("docLength小于termFreq，位置=" + index + ", value=" + docLengths[index]);
            }
            if (index > 0 && docIds[index] <= docIds[index - 1]) {
                throw new IllegalArgumentException("docIds必须严格递增，位置=" + index + ", current=" + docIds[index]);
            }
        }
        docIds = Arrays.copyOf(docIds, docIds.length);
        termFreqs = Arrays.copyOf(termFreqs, termFreqs.length);
        docLengths = Arrays.copyOf(docLengths, docLengths.length);
    }

    public static PostingList empty() {
        return EMPTY;
    }

    public int size() {
        return docIds.length;
    }

    public boolean isEmpty() {
        return docIds.length == 0;
    }

    public int docId(int index) {
        return docIds[index];
    }

    public int termFreq(int index) {
        return termFreqs[index];
    }

    public int docLength(int index) {
        return docLengths[index];
    }

    /**
     * 二分查找文档在列表中的下标，不存在时返回负数。
     */
    public int indexOf(int docId) {
        return Arrays.binarySearch(docIds, docId);
    }

    @Override
    public int[] docIds() {
        return Arrays.copyOf(docIds, docIds.length);
    }

    @Override
    public int[] termFreqs() {
        return Arrays.copyOf(termFreqs, termFreqs.length);
    }

    @Override
    public int[] docLengths() {
        return Arrays.copyOf(docLengths, docLengths.length);
    }
}
