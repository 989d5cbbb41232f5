package com.lakeindex.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.lakeindex.query.QueryMode;
import com.lakeindex.query.SearchResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errorBuffer = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;
    private Path databasePath;

    @BeforeEach
    void captureStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errorBuffer, true, StandardCharsets.UTF_8));
        databasePath = tempDir.resolve("cli.db");
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void testCallWithoutSubcommand() {
        assertEquals(0, new MainCommand().call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        assertEquals(0, new CommandLine(new MainCommand()).execute("--help"));
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--db", databasePath.toString(), "query", "-m", "and", "cat");

        assertNotNull(parseResult.subcommand());
        assertEquals("query", parseResult.subcommand().commandSpec().name());
    }

    @Test
    void testBuildQueryDeleteAndVerify() throws IOException {
        Path corpus = copyResource("/corpus-small.jsonl");

        assertEquals(0, execute("build", corpus.toString(), "--batch-size", "2"));
        assertTrue(output().contains("文档 5"), output());

        assertEquals(0, execute("query", "cat"));
        String queryOutput = output();
        assertTrue(queryOutput.contains("doc 1"), queryOutput);
        assertTrue(queryOutput.contains("doc 3"), queryOutput);

        assertEquals(0, execute("delete", "3"));
        assertEquals(0, execute("query", "-m", "conjunctive", "cat", "dog"));
        assertTrue(output().contains("未找到匹配结果"), output());

        assertEquals(0, execute("status"));
        assertTrue(output().contains("存活文档: 4"), output());
        assertTrue(output().contains("墓碑文档: 1"), output());

        assertEquals(0, execute("compact"));
        assertEquals(0, execute("verify"));
        assertTrue(output().contains("索引一致"), output());
    }

    @Test
    void testInsertModifyAndJsonQuery() {
        assertEquals(0, execute("insert", "--id", "7", "lake river"));
        assertTrue(output().contains("已插入文档: 7"));
        assertEquals(0, execute("insert", "quiet lake"));
        assertTrue(output().contains("已插入文档: 8"));

        assertEquals(0, execute("modify", "7", "mountain"));
        assertEquals(0, execute("query", "-f", "json", "lake"));
        String json = output();
        assertTrue(json.contains("\"docId\" : 8"), json);
        assertFalse(json.contains("\"docId\" : 7"), json);
    }

    @Test
    void testQueryShowContent() {
        assertEquals(0, execute("insert", "--id", "1", "lake shore\nsecond line"));
        assertEquals(0, execute("insert", "--id", "2", "lake " + "word ".repeat(60)));

        assertEquals(0, execute("query", "lake"));
        assertFalse(output().contains("   lake"), output());

        assertEquals(0, execute("query", "--show-content", "lake"));
        String text = output();
        assertTrue(text.contains("   lake shore second line"), text);
        String preview = text.lines().filter(line -> line.startsWith("   lake word")).findFirst().orElseThrow();
        assertEquals(3 + 160, preview.length());

        assertEquals(0, execute("query", "-f", "json", "lake"));
        assertFalse(output().contains("\"content\""), output());
        assertEquals(0, execute("query", "-f", "json", "--show-content", "lake"));
        assertTrue(output().contains("\"content\" : \"lake shore\\nsecond line\""), output());
    }

    @Test
    void testReindexSubcommand() {
        assertEquals(0, execute("insert", "--id", "1", "alpha beta"));
        assertEquals(0, execute("insert", "--id", "2", "gamma"));
        assertEquals(0, execute("delete", "2"));

        assertEquals(0, execute("reindex"));
        assertTrue(output().contains("重建完成: 文档 1"), output());

        assertEquals(0, execute("status"));
        assertTrue(output().contains("存活文档: 1"), output());
        assertTrue(output().contains("墓碑文档: 0"), output());
        assertEquals(0, execute("query", "alpha"));
        assertTrue(output().contains("doc 1"), output());
        assertEquals(0, execute("verify"));
        assertTrue(output().contains("索引一致"), output());
    }

    @Test
    void testCompactWithoutTombstones() {
        assertEquals(0, execute("insert", "--id", "1", "alpha"));

        assertEquals(0, execute("compact"));
        assertTrue(output().contains("没有墓碑需要清除"), output());
    }

    @Test
    void testFailuresReturnOne() {
        assertEquals(0, execute("insert", "--id", "1", "alpha"));

        assertEquals(1, execute("insert", "--id", "1", "beta"));
        assertEquals(1, execute("delete", "99"));
        assertEquals(1, execute("query", "-m", "xor", "alpha"));
        assertTrue(errorBuffer.toString(StandardCharsets.UTF_8).contains("查询失败"));
    }

    @Test
    void testExportAndRestore() {
        assertEquals(0, execute("insert", "--id", "1", "alpha beta"));
        Path snapshot = tempDir.resolve("snapshot");
        assertEquals(0, execute("export", snapshot.toString()));
        assertTrue(Files.exists(snapshot.resolve("postings.json")));

        assertEquals(0, execute("delete", "1"));
        assertEquals(0, execute("restore", snapshot.toString()));
        assertEquals(0, execute("query", "alpha"));
        assertTrue(output().contains("doc 1"), output());
    }

    @Test
    void testPerfTestWritesLog() throws IOException {
        Path corpus = copyResource("/corpus-small.jsonl");
        assertEquals(0, execute("build", corpus.toString()));
        Path logFile = tempDir.resolve("perf.jsonl");
        Path queries = tempDir.resolve("queries.csv");

        assertEquals(0, execute("perf-test", "--rounds", "3", "--delete-batch", "2", "--query-count", "4",
            "--checkpoint-pct", "50", "--log-file", logFile.toString(), "--save-queries", queries.toString()));

        assertEquals(3, Files.readAllLines(logFile).size());
        assertEquals(5, Files.readAllLines(queries).size());
        assertTrue(output().contains("初始文档 5"), output());
    }

    @Test
    void testStatusSubcommandFormatBytesBranches() throws Exception {
        MainCommand.StatusSubcommand statusSubcommand = new MainCommand.StatusSubcommand();
        Method formatBytesMethod = MainCommand.StatusSubcommand.class.getDeclaredMethod("formatBytes", long.class);
        formatBytesMethod.setAccessible(true);

        assertEquals("512 B", formatBytesMethod.invoke(statusSubcommand, 512L));
        assertEquals("2.00 KB", formatBytesMethod.invoke(statusSubcommand, 2048L));
        assertEquals("3.00 MB", formatBytesMethod.invoke(statusSubcommand, 3L * 1024 * 1024));
    }

    @Test
    void testQuerySubcommandPrintTextResultWhenNoHits() throws Exception {
        MainCommand.QuerySubcommand querySubcommand = new MainCommand.QuerySubcommand();
        SearchResult emptyResult = SearchResult.empty(List.of("none"), QueryMode.DISJUNCTIVE, 2L);
        Method printTextResultMethod = MainCommand.QuerySubcommand.class.getDeclaredMethod("printTextResult", SearchResult.class);
        printTextResultMethod.setAccessible(true);

        printTextResultMethod.invoke(querySubcommand, emptyResult);

        assertTrue(output().contains("未找到匹配结果"));
    }

    private int execute(String... args) {
        outputBuffer.reset();
        String[] fullArgs = new String[args.length + 2];
        fullArgs[0] = "--db";
        fullArgs[1] = databasePath.toString();
        System.arraycopy(args, 0, fullArgs, 2, args.length);
        return new CommandLine(new MainCommand()).execute(fullArgs);
    }

    private String output() {
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }

    private Path copyResource(String resource) throws IOException {
        Path target = tempDir.resolve(resource.substring(1));
        try (InputStream inputStream = MainCommandTest.class.getResourceAsStream(resource)) {
            Files.copy(inputStream, target);
        }
        return target;
    }
}
