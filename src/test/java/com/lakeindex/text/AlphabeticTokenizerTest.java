package com.lakeindex.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlphabeticTokenizerTest {

    @Test
    @DisplayName("字母串小写化，数字与标点作为分隔符")
    void testTokenizeLettersOnly() {
        AlphabeticTokenizer tokenizer = new AlphabeticTokenizer();

        assertEquals(List.of("ai", "driven", "systems"), tokenizer.terms("AI-driven systems (2025)!"));
    }

    @Test
    @DisplayName("重复词项保留出现次数")
    void testRepeatedTermsKept() {
        AlphabeticTokenizer tokenizer = new AlphabeticTokenizer();

        assertEquals(List.of("the", "cat", "the", "hat"), tokenizer.terms("The cat, the HAT"));
    }

    @Test
    @DisplayName("非 ASCII 字母不产生词项，小写化与区域设置无关")
    void testLocaleIndependent() {
        AlphabeticTokenizer tokenizer = new AlphabeticTokenizer();

        assertEquals(List.of("caf", "title", "i"), tokenizer.terms("café TITLE I"));
    }

    @Test
    @DisplayName("空文本与 null 返回空列表")
    void testEmptyInput() {
        AlphabeticTokenizer tokenizer = new AlphabeticTokenizer();

        assertTrue(tokenizer.terms(null).isEmpty());
        assertTrue(tokenizer.terms("").isEmpty());
        assertTrue(tokenizer.terms("123 456 !!!").isEmpty());
    }

    @Test
    @DisplayName("启用英文停用词表时停用词被过滤")
    void testStopWordsSkipped() {
        AlphabeticTokenizer tokenizer = new AlphabeticTokenizer(StopWords.english());

        assertEquals(List.of("quick", "fox", "dog"), tokenizer.terms("The quick fox and the dog"));
    }

    @Test
    @DisplayName("自定义停用词表按小写匹配")
    void testCustomStopWords() {
        StopWords stopWords = StopWords.of(List.of("Cat", " ", "SAT"));
        AlphabeticTokenizer tokenizer = new AlphabeticTokenizer(stopWords);

        assertEquals(2, stopWords.size());
        assertEquals(List.of("the"), tokenizer.terms("the cat sat"));
    }
}
