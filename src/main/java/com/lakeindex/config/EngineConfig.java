package com.lakeindex.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lakeindex.query.EvaluatorType;
import com.lakeindex.scoring.IdfVariant;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 引擎运行时配置
 * 
 * 支持从CLI参数或 JSON 配置文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(JsonParser.Feature.ALLOW_COMMENTS)
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private Path databasePath = Paths.get("./index/lake-index.db");
    private int batchSize = Constants.DEFAULT_BATCH_SIZE;
    private int queryLimit = Constants.DEFAULT_QUERY_LIMIT;
    private double bm25K1 = Constants.BM25_K1;
    private double bm25B = Constants.BM25_B;
    private IdfVariant idfVariant = IdfVariant.CLASSIC;
    private EvaluatorType evaluator = EvaluatorType.SQL;
    private double autoCompactThreshold = Constants.DEFAULT_AUTO_COMPACT_THRESHOLD;
    private boolean stopWordsEnabled = false;

    public Path getDatabasePath() {
        return databasePath;
    }

    public void setDatabasePath(Path databasePath) {
        this.databasePath = databasePath;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize 必须为正数: " + batchSize);
        }
        this.batchSize = batchSize;
    }

    public int getQueryLimit() {
        return queryLimit;
    }

    public void setQueryLimit(int queryLimit) {
        this.queryLimit = queryLimit;
    }

    public double getBm25K1() {
        return bm25K1;
    }

    public void setBm25K1(double bm25K1) {
        this.bm25K1 = bm25K1;
    }

    public double getBm25B() {
        return bm25B;
    }

    public void setBm25B(double bm25B) {
        this.bm25B = bm25B;
    }

    public IdfVariant getIdfVariant() {
        return idfVariant;
    }

    public void setIdfVariant(IdfVariant idfVariant) {
        this.idfVariant = idfVariant;
    }

    public EvaluatorType getEvaluator() {
        return evaluator;
    }

    public void setEvaluator(EvaluatorType evaluator) {
        this.evaluator = evaluator;
    }

    public double getAutoCompactThreshold() {
        return autoCompactThreshold;
    }

    public void setAutoCompactThreshold(double autoCompactThreshold) {
        if (autoCompactThreshold < 0 || autoCompactThreshold > 1) {
            throw new IllegalArgumentException("autoCompactThreshold 必须位于 [0, 1]: " + autoCompactThreshold);
        }
        this.autoCompactThreshold = autoCompactThreshold;
    }

    public boolean isStopWordsEnabled() {
        return stopWordsEnabled;
    }

    public void setStopWordsEnabled(boolean stopWordsEnabled) {
        this.stopWordsEnabled = stopWordsEnabled;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从 JSON 配置文件加载，未出现的字段保持默认值。
     *
     * @param configFile 配置文件路径
     * @return 加载后的配置
     * @throws IOException 文件不可读或包含未知字段时抛出
     */
    public static EngineConfig load(Path configFile) throws IOException {
        if (configFile == null) {
            throw new IllegalArgumentException("配置文件路径不能为空");
        }
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("配置文件不存在: " + configFile.toAbsolutePath());
        }
        try {
            return OBJECT_MAPPER.readValue(configFile.toFile(), EngineConfig.class);
        } catch (IOException exception) {
            throw new IOException("读取配置文件失败: " + configFile.toAbsolutePath(), exception);
        }
    }
}
