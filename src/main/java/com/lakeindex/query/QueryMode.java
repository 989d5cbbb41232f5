package com.lakeindex.query;

import java.util.Locale;

/**
 * 多词查询的候选集语义。
 */
public enum QueryMode {
    /** 文档须包含全部查询词（交集）。 */
    CONJUNCTIVE,
    /** 文档包含任一查询词即可（并集）。 */
    DISJUNCTIVE;

    /**
     * 解析命令行或配置中的模式名称，大小写不敏感。
     *
     * @throws InvalidQueryException 不支持的模式名称
     */
    public static QueryMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidQueryException("查询模式不能为空");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "conjunctive", "and" -> CONJUNCTIVE;
            case "disjunctive", "or" -> DISJUNCTIVE;
            default -> throw new InvalidQueryException("不支持的查询模式: " + value);
        };
    }
}
