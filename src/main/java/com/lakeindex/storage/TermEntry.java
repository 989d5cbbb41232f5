package com.lakeindex.storage;

/**
 * 词典词条。term_id 一经分配永不回收，document_frequency 只统计存活文档。
 */
public record TermEntry(int termId, String term, int documentFrequency) {
}
