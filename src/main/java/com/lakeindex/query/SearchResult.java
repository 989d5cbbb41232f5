package com.lakeindex.query;

import java.util.List;

public record SearchResult(
        List<SearchHit> hits,
        int totalMatches,
        long elapsedMs,
        List<String> terms,
        QueryMode mode
) {
    public static SearchResult empty(List<String> terms, QueryMode mode, long elapsedMs) {
        return new SearchResult(List.of(), 0, elapsedMs, List.copyOf(terms), mode);
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
