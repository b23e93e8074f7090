package com.diskindex.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.diskindex.config.Constants;
import com.diskindex.config.EngineConfig;
import com.diskindex.query.SearchHit;
import com.diskindex.query.SearchResult;
import com.diskindex.text.TokenizerType;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testCallPrintsUsageHint() {
        MainCommand command = new MainCommand();
        assertEquals(0, command.call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        MainCommand mainCommand = new MainCommand();
        CommandLine commandLine = new CommandLine(mainCommand);
        ParseResult parseResult = commandLine.parseArgs(
            "--threads", "6", "--tokenizer", "WHITESPACE", "--no-stop-words", "status");

        assertNotNull(parseResult.subcommand());
        assertEquals("status", parseResult.subcommand().commandSpec().name());
    }

    @Test
    void testResolveConfigAppliesCommandLineOverrides() throws Exception {
        MainCommand mainCommand = new MainCommand();
        new CommandLine(mainCommand).parseArgs(
            "--index-dir", tempDir.toString(), "--threads", "500", "--tokenizer", "BIGRAM", "--no-stop-words");

        EngineConfig config = mainCommand.resolveConfig();
        assertEquals(tempDir, config.getIndexDir());
        assertEquals(Constants.MAX_INDEX_THREADS, config.getIndexThreads());
        assertEquals(TokenizerType.BIGRAM, config.getTokenizerType());
        assertFalse(config.isStopWordsEnabled());
    }

    @Test
    void testSanitizeSearchLimitAndQuery() {
        MainCommand mainCommand = new MainCommand();
        assertEquals(0, mainCommand.sanitizeSearchLimit(-3));
        assertEquals(20, mainCommand.sanitizeSearchLimit(20));
        assertEquals(Constants.MAX_SEARCH_LIMIT, mainCommand.sanitizeSearchLimit(Constants.MAX_SEARCH_LIMIT + 1));

        assertEquals("", mainCommand.sanitizeQuery(null));
        assertEquals("java", mainCommand.sanitizeQuery("  java  "));
        String oversized = "x".repeat(Constants.MAX_QUERY_LENGTH + 1);
        assertThrows(CommandLine.ParameterException.class, () -> mainCommand.sanitizeQuery(oversized));
    }

    @Test
    void testRebuildSubcommandWithoutConfirmReturnsOne() {
        MainCommand.RebuildSubcommand rebuildSubcommand = new MainCommand.RebuildSubcommand();
        assertEquals(1, rebuildSubcommand.call());
    }

    @Test
    void testStatusSubcommandFormatBytesBranches() throws Exception {
        MainCommand.StatusSubcommand statusSubcommand = new MainCommand.StatusSubcommand();
        Method formatBytesMethod = MainCommand.StatusSubcommand.class.getDeclaredMethod("formatBytes", long.class);
        formatBytesMethod.setAccessible(true);

        assertEquals("512 B", formatBytesMethod.invoke(statusSubcommand, 512L));
        assertEquals(String.format("%.2f KB", 2.0), formatBytesMethod.invoke(statusSubcommand, 2048L));
        assertEquals(String.format("%.2f MB", 3.0), formatBytesMethod.invoke(statusSubcommand, 3L * 1024 * 1024));
        assertEquals(String.format("%.2f GB", 4.0), formatBytesMethod.invoke(statusSubcommand, 4L * 1024 * 1024 * 1024));
    }

    @Test
    void testSearchSubcommandPrintTextResultWhenNoHits() throws Exception {
        MainCommand.SearchSubcommand searchSubcommand = new MainCommand.SearchSubcommand();
        SearchResult emptyResult = SearchResult.empty("none", 2L);
        Method printTextResultMethod = MainCommand.SearchSubcommand.class
            .getDeclaredMethod("printTextResult", SearchResult.class, int.class);
        printTextResultMethod.setAccessible(true);

        String outputText = captureStdout(() -> printTextResultMethod.invoke(searchSubcommand, emptyResult, 10));
        assertTrue(outputText.contains("未找到匹配结果"));
    }

    @Test
    void testSearchSubcommandPrintTextResultBestFirst() throws Exception {
        MainCommand.SearchSubcommand searchSubcommand = new MainCommand.SearchSubcommand();
        SearchResult searchResult = new SearchResult("demo", List.of(
            new SearchHit(1, "low.txt", "default", -0.5),
            new SearchHit(0, "high.txt", "default", 1.25)
        ), 1, 3L);
        Method printTextResultMethod = MainCommand.SearchSubcommand.class
            .getDeclaredMethod("printTextResult", SearchResult.class, int.class);
        printTextResultMethod.setAccessible(true);

        String outputText = captureStdout(() -> printTextResultMethod.invoke(searchSubcommand, searchResult, 1));
        assertTrue(outputText.contains("high.txt"));
        assertFalse(outputText.contains("low.txt"));
    }

    @Test
    void testSearchSubcommandPrintJsonResult() throws Exception {
        MainCommand.SearchSubcommand searchSubcommand = new MainCommand.SearchSubcommand();
        SearchHit hit = new SearchHit(1, "demo.txt", "notes", 1.5);
        SearchResult searchResult = new SearchResult("demo", List.of(hit), 1, 5L);

        Method printJsonResultMethod = MainCommand.SearchSubcommand.class
            .getDeclaredMethod("printJsonResult", SearchResult.class, int.class);
        printJsonResultMethod.setAccessible(true);

        String outputText = captureStdout(() -> printJsonResultMethod.invoke(searchSubcommand, searchResult, 10));
        assertTrue(outputText.contains("\"totalMatches\""));
        assertTrue(outputText.contains("\"query\""));
        assertTrue(outputText.contains("demo.txt"));
        assertTrue(outputText.contains("\"category\""));
    }

    @Test
    void testSubcommandsHappyPath() throws Exception {
        Path indexDir = tempDir.resolve("index");
        Path sourceDir = tempDir.resolve("source");
        Files.createDirectories(sourceDir.resolve("notes"));
        Files.writeString(sourceDir.resolve("doc1.md"), "hello java world");
        Files.writeString(sourceDir.resolve("notes/doc2.txt"), "hello disk index");

        MainCommand mainCommand = new MainCommand();
        setField(mainCommand, "indexDir", indexDir);
        setField(mainCommand, "threads", 2);

        MainCommand.BuildSubcommand buildSubcommand = new MainCommand.BuildSubcommand();
        setField(buildSubcommand, "main", mainCommand);
        setField(buildSubcommand, "sourcePaths", List.of(sourceDir));
        setField(buildSubcommand, "chunkMemoryBytes", 64L);
        assertEquals(0, buildSubcommand.call());
        assertTrue(Files.exists(indexDir.resolve(Constants.LEXICON_FILE)));

        // 已构建的目录不能再次构建
        assertEquals(1, buildSubcommand.call());

        MainCommand.StatusSubcommand statusSubcommand = new MainCommand.StatusSubcommand();
        setField(statusSubcommand, "main", mainCommand);
        assertEquals(0, statusSubcommand.call());

        MainCommand.SearchSubcommand searchSubcommand = new MainCommand.SearchSubcommand();
        setField(searchSubcommand, "main", mainCommand);
        setField(searchSubcommand, "query", "hello");
        setField(searchSubcommand, "limit", 5);
        setField(searchSubcommand, "format", "text");
        assertEquals(0, searchSubcommand.call());

        setField(searchSubcommand, "format", "json");
        String jsonOutput = captureStdout(() -> assertEquals(0, searchSubcommand.call()));
        assertTrue(jsonOutput.contains("\"totalMatches\" : 2"));

        MainCommand.RebuildSubcommand rebuildSubcommand = new MainCommand.RebuildSubcommand();
        setField(rebuildSubcommand, "main", mainCommand);
        setField(rebuildSubcommand, "confirmed", true);
        setField(rebuildSubcommand, "sourcePaths", List.of(sourceDir));
        assertEquals(0, rebuildSubcommand.call());
        assertTrue(Files.exists(indexDir.resolve(Constants.LEXICON_FILE)));
    }

    @Test
    void testSearchOnUnbuiltIndexReturnsOne() throws Exception {
        MainCommand mainCommand = new MainCommand();
        setField(mainCommand, "indexDir", tempDir.resolve("empty-index"));

        MainCommand.SearchSubcommand searchSubcommand = new MainCommand.SearchSubcommand();
        setField(searchSubcommand, "main", mainCommand);
        setField(searchSubcommand, "query", "hello");
        setField(searchSubcommand, "format", "text");
        assertEquals(1, searchSubcommand.call());
    }

    private static String captureStdout(ThrowingRunnable action) throws Exception {
        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        try {
            System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setOut(originalOut);
        }
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }

    private static void setField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }

    @FunctionalInterface
    private interface ThrowingRunnable {
        void run() throws Exception;
    }
}
