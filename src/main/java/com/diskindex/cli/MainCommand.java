package com.diskindex.cli;

import com.diskindex.config.Constants;
import com.diskindex.config.EngineConfig;
import com.diskindex.document.Document;
import com.diskindex.document.DocumentCollector;
import com.diskindex.index.IndexStatus;
import com.diskindex.index.InvertedIndex;
import com.diskindex.query.SearchHit;
import com.diskindex.query.SearchResult;
import com.diskindex.text.TokenizerType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "dix",
    description = "🔍 磁盘倒排索引与 BM25 检索",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.BuildSubcommand.class,
        MainCommand.SearchSubcommand.class,
        MainCommand.StatusSubcommand.class,
        MainCommand.RebuildSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--index-dir"}, description = "索引目录路径", defaultValue = "./index")
    private Path indexDir;

    @Option(names = {"--config"}, description = "JSON 配置文件")
    private File configFile;

    @Option(names = {"--threads"}, description = "索引线程数")
    private Integer threads;

    @Option(names = {"--tokenizer"}, description = "分词策略 (${COMPLETION-CANDIDATES})")
    private TokenizerType tokenizerType;

    @Option(names = {"--no-stop-words"}, description = "保留英文停用词")
    private boolean noStopWords;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 磁盘倒排索引与 BM25 检索");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 合并配置文件与命令行参数，命令行优先。
     */
    EngineConfig resolveConfig() throws IOException {
        EngineConfig config = configFile == null ? EngineConfig.defaults() : EngineConfig.readFrom(configFile);
        config.setIndexDir(indexDir);
        if (threads != null) {
            config.setIndexThreads(threads);
        }
        config.setIndexThreads(resolveThreadCount(config.getIndexThreads()));
        if (tokenizerType != null) {
            config.setTokenizerType(tokenizerType);
        }
        if (noStopWords) {
            config.setStopWordsEnabled(false);
        }
        return config;
    }

    private int resolveThreadCount(int requested) {
        if (requested <= 0) {
            System.err.printf("⚠️ 非法线程数 %d，已回退为默认值 %d%n", requested, Constants.DEFAULT_INDEX_THREADS);
            return Math.min(Constants.DEFAULT_INDEX_THREADS, Constants.MAX_INDEX_THREADS);
        }
        if (requested > Constants.MAX_INDEX_THREADS) {
            System.err.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", requested, Constants.MAX_INDEX_THREADS);
            return Constants.MAX_INDEX_THREADS;
        }
        return requested;
    }

    int sanitizeSearchLimit(int rawLimit) {
        if (rawLimit < 0) {
            System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
            return 0;
        }
        if (rawLimit > Constants.MAX_SEARCH_LIMIT) {
            System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_SEARCH_LIMIT);
            return Constants.MAX_SEARCH_LIMIT;
        }
        return rawLimit;
    }

    String sanitizeQuery(String rawQuery) {
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

    @Command(name = "build", description = "📂 从源目录构建索引")
    static class BuildSubcommand implements Callable<Integer> {

        @Parameters(description = "要索引的源目录或文件路径", arity = "1..*")
        private List<Path> sourcePaths;

        @Option(names = {"-m", "--chunk-memory"}, description = "分块内存预算（字节）")
        private Long chunkMemoryBytes;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                return buildInto(config, sourcePaths, chunkMemoryBytes);
            } catch (Exception exception) {
                System.err.println("❌ 索引失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "search", description = "🔎 执行 BM25 查询")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(description = "查询文本", arity = "1")
        private String query;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量限制")
        private Integer limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                String safeQuery = main.sanitizeQuery(query);
                int safeLimit = main.sanitizeSearchLimit(limit == null ? config.getQueryLimit() : limit);
                try (InvertedIndex index = InvertedIndex.open(config)) {
                    SearchResult result = index.search(safeQuery);

                    if ("json".equalsIgnoreCase(format)) {
                        printJsonResult(result, safeLimit);
                        return 0;
                    }
                    System.out.println("🔍 查询: \"" + safeQuery + "\"");
                    System.out.println();
                    printTextResult(result, safeLimit);
                    System.out.println();
                    System.out.println("📊 共 " + result.totalMatches() + " 条匹配，用时 " + result.elapsedMs() + "ms");
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private void printTextResult(SearchResult result, int safeLimit) {
            if (result.hits().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }

            int rank = 1;
            for (SearchHit hit : result.top(safeLimit)) {
                System.out.println("─────────────────────────────────");
                System.out.printf("%d. [%s] %s (score: %.4f)%n", rank++, hit.category(), hit.name(), hit.score());
            }
        }

        private void printJsonResult(SearchResult result, int safeLimit) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("query", result.query());
            payload.put("totalMatches", result.totalMatches());
            payload.put("elapsedMs", result.elapsedMs());
            payload.put("hits", result.top(safeLimit));
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload));
        }
    }

    @Command(name = "status", description = "📊 查看索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (InvertedIndex index = InvertedIndex.open(main.resolveConfig())) {
                IndexStatus status = index.status();

                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 索引目录: " + status.indexDir());
                System.out.println("✅ 已构建: " + (status.built() ? "是" : "否"));
                System.out.println("📄 文档总数: " + status.docCount());
                System.out.println("🔤 词条总数: " + status.termCount());
                System.out.printf("📏 平均文档长度: %.2f%n", status.avgDocLength());
                System.out.println("💾 索引大小: " + formatBytes(status.indexSizeBytes()));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
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
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }

    @Command(name = "rebuild", description = "🔄 删除现有索引并重新构建")
    static class RebuildSubcommand implements Callable<Integer> {

        @Parameters(description = "要索引的源目录或文件路径", arity = "1..*")
        private List<Path> sourcePaths;

        @Option(names = {"-m", "--chunk-memory"}, description = "分块内存预算（字节）")
        private Long chunkMemoryBytes;

        @Option(names = {"--yes"}, description = "确认删除", defaultValue = "false")
        private boolean confirmed;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            if (!confirmed) {
                System.out.println("⚠️ 警告: 这将删除现有索引并重新构建");
                System.out.println("使用 --yes 确认");
                return 1;
            }
            try {
                EngineConfig config = main.resolveConfig();
                System.out.println("🔄 删除现有索引: " + config.getIndexDir());
                InvertedIndex.destroy(config.getIndexDir());
                return buildInto(config, sourcePaths, chunkMemoryBytes);
            } catch (Exception exception) {
                System.err.println("❌ 重建失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    private static int buildInto(EngineConfig config, List<Path> sourcePaths, Long chunkMemoryBytes) throws IOException {
        long budget = chunkMemoryBytes == null ? config.getChunkMemoryBytes() : chunkMemoryBytes;
        System.out.println("🚀 开始索引...");
        System.out.println("📁 索引目录: " + config.getIndexDir());
        System.out.println("📂 源路径: " + sourcePaths);
        System.out.println("🔧 线程数: " + config.getIndexThreads() + "，分词: " + config.getTokenizerType());

        List<Document> documents = DocumentCollector.collect(sourcePaths);
        try (InvertedIndex index = InvertedIndex.open(config)) {
            long start = System.currentTimeMillis();
            index.build(documents, budget);
            long elapsed = System.currentTimeMillis() - start;
            IndexStatus status = index.status();

            System.out.println("✅ 索引完成！");
            System.out.println("📊 统计:");
            System.out.println("   文档数: " + status.docCount());
            System.out.println("   词条数: " + status.termCount());
            System.out.println("   用时: " + elapsed + "ms");
            return 0;
        }
    }
}
