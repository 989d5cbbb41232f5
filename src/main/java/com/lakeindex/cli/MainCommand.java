package com.lakeindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lakeindex.benchmark.BenchmarkHarness;
import com.lakeindex.benchmark.BenchmarkReport;
import com.lakeindex.benchmark.BenchmarkSettings;
import com.lakeindex.benchmark.QueryWorkload;
import com.lakeindex.benchmark.RoundRecord;
import com.lakeindex.config.Constants;
import com.lakeindex.config.EngineConfig;
import com.lakeindex.index.BuildReport;
import com.lakeindex.index.CompactionReport;
import com.lakeindex.index.Compactor;
import com.lakeindex.index.CorpusReader;
import com.lakeindex.index.IndexBuilder;
import com.lakeindex.index.MutationEngine;
import com.lakeindex.query.QueryEngine;
import com.lakeindex.query.QueryMode;
import com.lakeindex.query.SearchHit;
import com.lakeindex.query.SearchResult;
import com.lakeindex.storage.ColumnarSnapshot;
import com.lakeindex.storage.IndexStatistics;
import com.lakeindex.storage.InvariantChecker;
import com.lakeindex.storage.StatisticsStore;
import com.lakeindex.text.AlphabeticTokenizer;
import com.lakeindex.text.StopWords;
import com.lakeindex.text.Tokenizer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "lki",
    description = "支持增量更新与墓碑压缩的 BM25 倒排索引",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.BuildSubcommand.class,
        MainCommand.ImportSubcommand.class,
        MainCommand.ReindexSubcommand.class,
        MainCommand.InsertSubcommand.class,
        MainCommand.DeleteSubcommand.class,
        MainCommand.ModifySubcommand.class,
        MainCommand.QuerySubcommand.class,
        MainCommand.CompactSubcommand.class,
        MainCommand.StatusSubcommand.class,
        MainCommand.VerifySubcommand.class,
        MainCommand.ExportSubcommand.class,
        MainCommand.RestoreSubcommand.class,
        MainCommand.PerfTestSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--db"}, description = "索引数据库文件路径，覆盖配置文件")
    private Path databasePath;

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("支持增量更新与墓碑压缩的 BM25 倒排索引");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    EngineConfig resolveConfig() throws IOException {
        EngineConfig config = configFile == null ? EngineConfig.defaults() : EngineConfig.load(configFile);
        if (databasePath != null) {
            config.setDatabasePath(databasePath);
        }
        return config;
    }

    static Tokenizer tokenizer(EngineConfig config) {
        return new AlphabeticTokenizer(config.isStopWordsEnabled() ? StopWords.english() : StopWords.none());
    }

    static MutationEngine mutationEngine(StatisticsStore store, EngineConfig config) {
        return new MutationEngine(store, tokenizer(config), new Compactor(store, config.getAutoCompactThreshold()));
    }

    private int sanitizeSearchLimit(int rawLimit) {
        if (rawLimit < 0) {
            System.err.printf("limit=%d 非法，已使用 0%n", rawLimit);
            return 0;
        }
        if (rawLimit > Constants.MAX_SEARCH_LIMIT) {
            System.err.printf("limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_SEARCH_LIMIT);
            return Constants.MAX_SEARCH_LIMIT;
        }
        return rawLimit;
    }

    private String sanitizeQuery(String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        String trimmed = rawQuery.trim();
        if (trimmed.length() > Constants.MAX_QUERY_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        return trimmed;
    }

    @Command(name = "build", description = "从 JSON Lines 语料全量构建索引（替换现有索引）")
    static class BuildSubcommand implements Callable<Integer> {

        @Parameters(description = "语料文件，每行 {\"doc_id\": ..., \"text\": ...}", arity = "1")
        private Path corpusFile;

        @Option(names = {"--batch-size"}, description = "每批文档数，默认取配置")
        private Integer batchSize;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                int effectiveBatchSize = batchSize == null ? config.getBatchSize() : batchSize;
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath());
                     CorpusReader corpus = CorpusReader.open(corpusFile)) {
                    BuildReport report = new IndexBuilder(store, tokenizer(config), effectiveBatchSize).build(corpus);
                    printBuildReport("构建完成", report);
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("构建失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "import", description = "导入增量语料，已存在的文档按新内容更新")
    static class ImportSubcommand implements Callable<Integer> {

        @Parameters(description = "增量语料文件（JSON Lines）", arity = "1")
        private Path corpusFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath());
                     CorpusReader corpus = CorpusReader.open(corpusFile)) {
                    BuildReport report = new IndexBuilder(store, tokenizer(config), config.getBatchSize())
                        .importDelta(corpus);
                    printBuildReport("导入完成", report);
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("导入失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "reindex", description = "从已存储的原文重建索引，同时清除墓碑")
    static class ReindexSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath())) {
                    BuildReport report = new IndexBuilder(store, tokenizer(config), config.getBatchSize()).reindex();
                    printBuildReport("重建完成", report);
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("重建失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "insert", description = "插入一篇文档")
    static class InsertSubcommand implements Callable<Integer> {

        @Parameters(description = "文档文本", arity = "1")
        private String text;

        @Option(names = {"--id"}, description = "文档ID，省略时自动分配")
        private Integer docId;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath())) {
                    int assignedId = mutationEngine(store, config).insert(docId, text);
                    System.out.println("已插入文档: " + assignedId);
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("插入失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "delete", description = "删除文档（多个ID在同一事务内删除）")
    static class DeleteSubcommand implements Callable<Integer> {

        @Parameters(description = "文档ID", arity = "1..*")
        private List<Integer> docIds;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath())) {
                    MutationEngine mutationEngine = mutationEngine(store, config);
                    if (docIds.size() == 1) {
                        mutationEngine.delete(docIds.get(0));
                        System.out.println("已删除文档: " + docIds.get(0));
                    } else {
                        int deleted = mutationEngine.deleteAll(docIds);
                        System.out.println("已删除文档: " + deleted + " 篇");
                    }
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("删除失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "modify", description = "以新文本替换文档内容，ID 不变")
    static class ModifySubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "文档ID")
        private int docId;

        @Parameters(index = "1", description = "新文本")
        private String text;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath())) {
                    mutationEngine(store, config).modify(docId, text);
                    System.out.println("已修改文档: " + docId);
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("修改失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "query", description = "执行 BM25 查询")
    static class QuerySubcommand implements Callable<Integer> {
        private static final int CONTENT_PREVIEW_LENGTH = 160;

        @Parameters(description = "查询文本", arity = "1")
        private String query;

        @Option(names = {"-m", "--mode"}, description = "查询模式 (conjunctive|disjunctive)", defaultValue = "disjunctive")
        private String mode;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量限制，默认取配置")
        private Integer limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--show-content"}, description = "在结果中回显文档原文")
        private boolean showContent;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                QueryMode queryMode = QueryMode.parse(mode);
                String safeQuery = main.sanitizeQuery(query);
                int safeLimit = main.sanitizeSearchLimit(limit == null ? config.getQueryLimit() : limit);
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath())) {
                    QueryEngine engine = new QueryEngine(store, tokenizer(config), config);
                    SearchResult result = engine.search(safeQuery, queryMode, safeLimit);
                    if (showContent) {
                        result = engine.withContents(result);
                    }
                    if ("json".equalsIgnoreCase(format)) {
                        printJsonResult(result);
                    } else {
                        printTextResult(result);
                    }
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("查询失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(SearchResult result) {
            System.out.println("查询词: " + result.terms() + " (" + result.mode() + ")");
            if (result.isEmpty()) {
                System.out.println("未找到匹配结果");
                return;
            }
            int rank = 1;
            for (SearchHit hit : result.hits()) {
                System.out.printf("%d. doc %d (score: %.4f)%n", rank++, hit.docId(), hit.score());
                if (showContent && hit.content() != null) {
                    System.out.println("   " + contentPreview(hit.content()));
                }
            }
            System.out.println("共 " + result.totalMatches() + " 条匹配，用时 " + result.elapsedMs() + "ms");
        }

        private static String contentPreview(String content) {
            String preview = content.length() > CONTENT_PREVIEW_LENGTH
                ? content.substring(0, CONTENT_PREVIEW_LENGTH) : content;
            return preview.replace("\n", " ");
        }

        private void printJsonResult(SearchResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "compact", description = "物理清除墓碑文档并重写存储")
    static class CompactSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath())) {
                    CompactionReport report = new Compactor(store).compact();
                    if (report.isNoop()) {
                        System.out.println("没有墓碑需要清除");
                        return 0;
                    }
                    System.out.println("压缩完成: 清除文档 " + report.purgedDocuments()
                        + "，清除倒排 " + report.purgedPostings() + "，用时 " + report.elapsedMs() + "ms");
                    if (report.rewritePending()) {
                        System.err.println("警告: 墓碑已清除，但存储重写失败，下次压缩时重试");
                    }
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("压缩失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "查看索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath())) {
                    IndexStatistics statistics = store.statistics();
                    System.out.println("索引状态");
                    System.out.println("数据库: " + store.databasePath());
                    System.out.println("存活文档: " + statistics.liveDocuments());
                    System.out.println("墓碑文档: " + statistics.tombstonedDocuments()
                        + String.format(" (%.2f%%)", statistics.tombstonedFraction() * 100));
                    System.out.printf("平均长度: %.2f%n", statistics.averageLength());
                    System.out.println("词条总数: " + statistics.termCount() + "（df>0: " + statistics.activeTermCount() + "）");
                    System.out.println("倒排行数: " + statistics.physicalPostings() + "（存活: " + statistics.livePostings() + "）");
                    System.out.println("文件大小: " + formatBytes(Files.size(store.databasePath())));
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
        }
    }

    @Command(name = "verify", description = "校验 df、文档长度与引用完整性")
    static class VerifySubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath())) {
                    InvariantChecker.InvariantReport report = new InvariantChecker(store).check();
                    if (report.isConsistent()) {
                        System.out.println("索引一致");
                        return 0;
                    }
                    report.violations().forEach(violation -> System.out.println("不一致: " + violation));
                    return 1;
                }
            } catch (Exception exception) {
                System.err.println("校验失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "export", description = "导出列式快照")
    static class ExportSubcommand implements Callable<Integer> {

        @Parameters(description = "快照目录", arity = "1")
        private Path directory;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath())) {
                    ColumnarSnapshot.SnapshotSummary summary = new ColumnarSnapshot(store).export(directory);
                    System.out.println("已导出: " + summary);
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("导出失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "restore", description = "从列式快照恢复（替换现有索引）")
    static class RestoreSubcommand implements Callable<Integer> {

        @Parameters(description = "快照目录", arity = "1")
        private Path directory;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath())) {
                    ColumnarSnapshot.SnapshotSummary summary = new ColumnarSnapshot(store).restore(directory);
                    System.out.println("已恢复: " + summary);
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("恢复失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "perf-test", description = "测量查询延迟随墓碑累积的变化（会删除索引中的文档）")
    static class PerfTestSubcommand implements Callable<Integer> {

        @Option(names = {"--rounds"}, description = "最大轮数", defaultValue = "" + Constants.DEFAULT_BENCHMARK_ROUNDS)
        private int rounds;

        @Option(names = {"--delete-batch"}, description = "每轮删除文档数", defaultValue = "" + Constants.DEFAULT_DELETE_BATCH)
        private int deleteBatch;

        @Option(names = {"--query-count"}, description = "生成的查询数", defaultValue = "" + Constants.DEFAULT_QUERY_COUNT)
        private int queryCount;

        @Option(names = {"--query-batch"}, description = "每轮抽样查询数，0 表示全部", defaultValue = "0")
        private int queryBatch;

        @Option(names = {"--top"}, description = "每个查询返回条数", defaultValue = "" + Constants.DEFAULT_QUERY_LIMIT)
        private int top;

        @Option(names = {"--mode"}, description = "查询模式 (conjunctive|disjunctive)", defaultValue = "disjunctive")
        private String mode;

        @Option(names = {"--random"}, description = "按随机排列删除", defaultValue = "false")
        private boolean random;

        @Option(names = {"--seed"}, description = "随机种子", defaultValue = "" + Constants.DEFAULT_SEED)
        private long seed;

        @Option(names = {"--checkpoint-pct"}, description = "每删除该百分比压缩一次，0 表示不压缩", defaultValue = "0")
        private double checkpointPct;

        @Option(names = {"--queries-file"}, description = "复用已有查询文件（跳过生成）")
        private Path queriesFile;

        @Option(names = {"--save-queries"}, description = "保存生成的查询")
        private Path saveQueries;

        @Option(names = {"--log-file"}, description = "轮次日志（JSON Lines）")
        private Path logFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                BenchmarkSettings settings = new BenchmarkSettings(rounds, deleteBatch, queryBatch, top,
                    QueryMode.parse(mode), random, seed, checkpointPct, logFile);
                try (StatisticsStore store = StatisticsStore.open(config.getDatabasePath())) {
                    QueryWorkload workload = queriesFile != null
                        ? QueryWorkload.load(queriesFile)
                        : QueryWorkload.generate(store, queryCount, seed);
                    if (queriesFile == null && saveQueries != null) {
                        workload.save(saveQueries);
                    }
                    Tokenizer tokenizer = tokenizer(config);
                    BenchmarkHarness harness = new BenchmarkHarness(store,
                        new QueryEngine(store, tokenizer, config),
                        new MutationEngine(store, tokenizer, null),
                        new Compactor(store));
                    BenchmarkReport report = harness.run(workload, settings);
                    for (RoundRecord record : report.rounds()) {
                        System.out.printf("第 %d 轮 | 已删除 %d | 压缩 %d | 平均 %.3fms%n", record.round(),
                            record.cumulativeDeleted(), record.compactions(), record.averageLatencyMs());
                    }
                    System.out.println("完成: 初始文档 " + report.originalDocuments() + "，压缩 "
                        + report.compactionsRun() + " 次，用时 " + report.elapsedMs() + "ms");
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("基准测试失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    private static void printBuildReport(String title, BuildReport report) {
        System.out.println(title + ": 文档 " + report.indexedDocuments() + "，批次 " + report.batches()
            + "，用时 " + report.elapsedMs() + "ms");
        for (BuildReport.FailedDocument failure : report.failures()) {
            System.out.println("失败: docId=" + failure.docId() + " (" + failure.reason() + ")");
        }
    }
}
