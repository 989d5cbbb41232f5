package com.lakeindex.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 字母分词器：提取连续的 ASCII 字母串并统一转为小写，数字与标点均视为分隔符。
 *
 * <p>例如 {@code "AI-driven systems (2025)!"} 切分为 {@code [ai, driven, systems]}。
 */
public class AlphabeticTokenizer implements Tokenizer {

    private static final Pattern WORD_PATTERN = Pattern.compile("[A-Za-z]+");

    private final StopWords stopWords;

    /**
     * 创建不过滤停用词的分词器。
     */
    public AlphabeticTokenizer() {
        this(StopWords.none());
    }

    /**
     * 创建字母分词器，命中停用词表的词项不输出。
     */
    public AlphabeticTokenizer(StopWords stopWords) {
        this.stopWords = stopWords == null ? StopWords.none() : stopWords;
    }

    @Override
    public List<String> terms(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<String> terms = new ArrayList<>();
        Matcher wordMatcher = WORD_PATTERN.matcher(text);
        while (wordMatcher.find()) {
            String normalizedTerm = wordMatcher.group().toLowerCase(Locale.ROOT);
            if (stopWords.contains(normalizedTerm)) {
                continue;
            }
            terms.add(normalizedTerm);
        }
        return List.copyOf(terms);
    }
}
