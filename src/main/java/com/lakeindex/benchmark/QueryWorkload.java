package com.lakeindex.benchmark;

import com.lakeindex.config.Constants;
import com.lakeindex.storage.StatisticsStore;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * 基准查询集。查询文件为单列 CSV，首行表头为 {@code query}。
 */
public final class QueryWorkload {
    static final String HEADER = "query";

    private final List<String> queries;

    public QueryWorkload(List<String> queries) {
        if (queries == null || queries.isEmpty()) {
            throw new IllegalArgumentException("查询集不能为空");
        }
        this.queries = List.copyOf(queries);
    }

    /**
     * 从词典中 df&gt;0 的词项随机抽取 1~3 个不重复词项组成每条查询。
     *
     * @throws IllegalStateException 词典中没有可用词项
     */
    public static QueryWorkload generate(StatisticsStore store, int count, long seed) {
        if (count <= 0) {
            throw new IllegalArgumentException("查询数量必须大于0: " + count);
        }
        List<String> dictionary = store.readSnapshot(transaction -> transaction.terms().activeTerms());
        if (dictionary.isEmpty()) {
            throw new IllegalStateException("词典为空，无法生成查询: " + store.databasePath());
        }
        Random random = new Random(seed);
        List<String> queries = new ArrayList<>(count);
        int span = Constants.MAX_QUERY_TERMS - Constants.MIN_QUERY_TERMS + 1;
        for (int index = 0; index < count; index++) {
            int wanted = Math.min(Constants.MIN_QUERY_TERMS + random.nextInt(span), dictionary.size());
            Set<String> terms = new LinkedHashSet<>();
            while (terms.size() < wanted) {
                terms.add(dictionary.get(random.nextInt(dictionary.size())));
            }
            queries.add(String.join(" ", terms));
        }
        return new QueryWorkload(queries);
    }

    /**
     * 读取查询文件。首行不是表头时按数据处理，空行忽略。
     */
    public static QueryWorkload load(Path queryFile) throws IOException {
        List<String> queries = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(queryFile, StandardCharsets.UTF_8)) {
            String line;
            boolean first = true;
            while ((line = reader.readLine()) != null) {
                String value = unquote(line.trim());
                if (first) {
                    first = false;
                    if (HEADER.equals(value)) {
                        continue;
                    }
                }
                if (!value.isEmpty()) {
                    queries.add(value);
                }
            }
        }
        if (queries.isEmpty()) {
            throw new IOException("查询文件中没有查询: " + queryFile.toAbsolutePath());
        }
        return new QueryWorkload(queries);
    }

    public void save(Path queryFile) throws IOException {
        Path parent = queryFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(queryFile, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.newLine();
            for (String query : queries) {
                writer.write(quote(query));
                writer.newLine();
            }
        }
    }

    /**
     * 按给定随机源抽样 size 条查询，size 不小于查询总数时返回全部。
     */
    public List<String> sample(int size, Random random) {
        if (size <= 0 || size >= queries.size()) {
            return queries;
        }
        List<String> shuffled = new ArrayList<>(queries);
        Collections.shuffle(shuffled, random);
        return List.copyOf(shuffled.subList(0, size));
    }

    public List<String> queries() {
        return queries;
    }

    public int size() {
        return queries.size();
    }

    private static String quote(String value) {
        if (value.contains(",") || value.contains("\"")) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\"\"", "\"");
        }
        return value;
    }
}
