package com.lakeindex.index;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 语料中的一条文档。docId 为 null 时由索引分配。
 */
public record CorpusDocument(
        @JsonProperty("doc_id") Integer docId,
        @JsonProperty("text") String text
) {
    public static CorpusDocument of(int docId, String text) {
        return new CorpusDocument(docId, text);
    }
}
