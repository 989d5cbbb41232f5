package com.lakeindex.text;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 停用词表。默认关闭：BM25 的 idf 本身会压低高频词权重。
 */
public final class StopWords {

    private static final Set<String> ENGLISH_WORDS = Set.of(
        "the", "a", "an", "is", "are", "was", "were", "be", "been",
        "has", "have", "had", "do", "does", "did", "will", "would",
        "could", "should", "may", "might", "can", "and", "or", "but",
        "not", "in", "on", "at", "to", "for", "of", "with", "by",
        "from", "as", "into", "it", "its", "this", "that", "which",
        "if", "so", "no", "up", "out", "all", "just", "also", "very"
    );

    private static final StopWords NONE = new StopWords(Set.of());
    private static final StopWords ENGLISH = new StopWords(ENGLISH_WORDS);

    private final Set<String> words;

    private StopWords(Set<String> words) {
        this.words = words;
    }

    public static StopWords none() {
        return NONE;
    }

    public static StopWords english() {
        return ENGLISH;
    }

    /**
     * 使用自定义词表，词项按 {@link Locale#ROOT} 小写化后保存。
     */
    public static StopWords of(Collection<String> customWords) {
        Set<String> normalized = new HashSet<>();
        for (String word : customWords) {
            if (word != null && !word.isBlank()) {
                normalized.add(word.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new StopWords(Set.copyOf(normalized));
    }

    /**
     * 判断规范化后的词项是否为停用词。
     */
    public boolean contains(String term) {
        if (term == null || term.isEmpty()) {
            return false;
        }
        return words.contains(term);
    }

    public int size() {
        return words.size();
    }
}
