package com.diskindex;

import com.diskindex.config.EngineConfig;
import com.diskindex.document.Document;
import com.diskindex.index.InvertedIndex;
import com.diskindex.text.TokenizerType;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 构建与查询性能基准测试
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IndexBenchmark {

    @State(Scope.Thread)
    public static class BuildState {
        @Param({"65536", "67108864"})
        long chunkMemoryBytes;

        Path indexDir;
        InvertedIndex index;

        @Setup(Level.Invocation)
        public void setup() throws IOException {
            indexDir = Files.createTempDirectory("benchmark-build");
            EngineConfig config = EngineConfig.defaults();
            config.setIndexDir(indexDir);
            config.setIndexThreads(4);
            index = InvertedIndex.open(config);
        }

        @TearDown(Level.Invocation)
        public void tearDown() throws IOException {
            index.close();
            deleteDirectory(indexDir);
        }
    }

    @State(Scope.Benchmark)
    public static class QueryState {
        Path indexDir;
        InvertedIndex index;

        @Setup
        public void setup() throws IOException {
            indexDir = Files.createTempDirectory("benchmark-query");
            EngineConfig config = EngineConfig.defaults();
            config.setIndexDir(indexDir);
            config.setTokenizerType(TokenizerType.ENGLISH);
            index = InvertedIndex.open(config);
            index.build(generateCorpus(10000), config.getChunkMemoryBytes());
        }

        @TearDown
        public void tearDown() throws IOException {
            index.close();
            deleteDirectory(indexDir);
        }
    }

    @Benchmark
    public int buildThroughput(BuildState state) throws IOException {
        state.index.build(generateCorpus(1000), state.chunkMemoryBytes);
        return state.index.lexicon().termCount();
    }

    @Benchmark
    public int queryLatencySingleTerm(QueryState state) throws IOException {
        return state.index.search("java").totalMatches();
    }

    @Benchmark
    public int queryLatencyMultiTerm(QueryState state) throws IOException {
        return state.index.search("machine learning python data").totalMatches();
    }

    static List<Document> generateCorpus(int size) {
        List<Document> documents = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            String content = "Document " + i + " about "
                + (i % 10 == 0 ? "Java programming"
                : i % 10 == 1 ? "Python data science"
                : i % 10 == 2 ? "machine learning"
                : "general content")
                + " with various keywords for search testing. token" + (i % 97);
            documents.add(Document.ofText("doc" + i, "group" + (i % 5), content));
        }
        return documents;
    }

    static void deleteDirectory(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException exception) {
                    throw new UncheckedIOException(exception);
                }
            });
        }
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IndexBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
