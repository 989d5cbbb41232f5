package com.lakeindex.config;

/**
 * 全局常量定义
 * 
 * 包含 BM25 参数、构建批次参数、压缩阈值、基准测试默认值与 CLI 限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== BM25参数 ====================
    /** 词频饱和系数 */
    public static final double BM25_K1 = 1.2;
    /** 长度归一化系数 */
    public static final double BM25_B = 0.75;

    // ==================== 索引构建参数 ====================
    /** 流式构建时每批处理的文档数 */
    public static final int DEFAULT_BATCH_SIZE = 1000;
    /** 默认返回结果数量 */
    public static final int DEFAULT_QUERY_LIMIT = 10;

    // ==================== 压缩参数 ====================
    /** 自动压缩阈值（墓碑文档占比），0 表示关闭自动压缩 */
    public static final double DEFAULT_AUTO_COMPACT_THRESHOLD = 0.0;

    // ==================== 基准测试参数 ====================
    /** 默认基准轮数 */
    public static final int DEFAULT_BENCHMARK_ROUNDS = 10;
    /** 每轮默认删除文档数 */
    public static final int DEFAULT_DELETE_BATCH = 100;
    /** 默认生成查询数量 */
    public static final int DEFAULT_QUERY_COUNT = 100;
    /** 随机查询最少词项数 */
    public static final int MIN_QUERY_TERMS = 1;
    /** 随机查询最多词项数 */
    public static final int MAX_QUERY_TERMS = 3;
    /** 默认随机种子，保证删除顺序与查询集可复现 */
    public static final long DEFAULT_SEED = 42L;

    // ==================== CLI 限制 ====================
    /** 查询结果数量上限 */
    public static final int MAX_SEARCH_LIMIT = 1000;
    /** 查询字符串长度上限 */
    public static final int MAX_QUERY_LENGTH = 1024;
}
