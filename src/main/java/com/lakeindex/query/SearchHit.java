package com.lakeindex.query;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 单条命中。content 仅在请求回显原文时填充。
 */
public record SearchHit(
        int docId,
        double score,
        @JsonInclude(JsonInclude.Include.NON_NULL) String content
) {
    public SearchHit(int docId, double score) {
        this(docId, score, null);
    }

    public SearchHit withContent(String text) {
        return new SearchHit(docId, score, text);
    }
}
