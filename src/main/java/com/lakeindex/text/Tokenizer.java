package com.lakeindex.text;

import java.util.List;

/**
 * 分词器：纯函数，将文本切分为有序的规范化词项序列。
 */
@FunctionalInterface
public interface Tokenizer {

    /**
     * 将输入文本切分为词项列表，顺序与原文一致，重复词项逐次保留。
     */
    List<String> terms(String text);
}
