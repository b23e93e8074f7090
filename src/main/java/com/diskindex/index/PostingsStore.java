package com.diskindex.index;

import com.diskindex.config.Constants;
import com.diskindex.document.Document;
import com.diskindex.storage.ChunkReader;
import com.diskindex.storage.CorruptIndexException;
import com.diskindex.storage.DocLengthsFile;
import com.diskindex.storage.PostingsWriter;
import com.diskindex.storage.TermStats;
import com.diskindex.text.DocumentTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 倒排存储的构建端：有界内存的分块构建与 k 路归并。
 *
 * 映射阶段每个工作线程持有私有累加器并写出自己的分块文件；归并阶段由单个写入器顺序写出最终倒排文件。
 */
public final class PostingsStore {
    private static final Logger logger = LoggerFactory.getLogger(PostingsStore.class);

    private static final Comparator<ChunkCursor> CURSOR_ORDER = Comparator
        .comparingInt((ChunkCursor cursor) -> cursor.reader().termId())
        .thenComparingInt(ChunkCursor::chunkIndex);

    private final Path indexDir;
    private final int workerCount;

    /**
     * @param indexDir 索引目录
     * @param workerCount 映射阶段工作线程数
     */
    public PostingsStore(Path indexDir, int workerCount) {
        if (indexDir == null) {
            throw new IllegalArgumentException("索引目录不能为空");
        }
        if (workerCount <= 0 || workerCount > Constants.MAX_INDEX_THREADS) {
            throw new IllegalArgumentException("工作线程数非法: " + workerCount);
        }
        this.indexDir = indexDir;
        this.workerCount = workerCount;
    }

    /**
     * 分块构建结果。
     *
     * @param chunkCount 写出的分块文件数
     * @param docFrequencies 分词阶段汇总的 TermID→文档频率
     */
    public record ChunkBuildResult(int chunkCount, Map<Integer, Integer> docFrequencies) {
    }

    /**
     * 按输入顺序分配 DocID，分词并累加倒排，内存估算达到预算时写出分块。
     *
     * @param documents 文档，DocID 等于其下标
     * @param memoryBudgetBytes 分块内存总预算，按工作线程均分
     * @param tokenizer 文档分词器
     * @return 分块构建结果
     * @throws IOException 读取文档或写出分块失败时抛出
     */
    public ChunkBuildResult buildChunks(List<Document> documents, long memoryBudgetBytes, DocumentTokenizer tokenizer)
            throws IOException {
        if (documents == null || tokenizer == null) {
            throw new IllegalArgumentException("文档列表与分词器不能为空");
        }
        if (memoryBudgetBytes <= 0) {
            throw new IllegalArgumentException("分块内存预算必须为正数: " + memoryBudgetBytes);
        }
        for (int docId = 0; docId < documents.size(); docId++) {
            documents.get(docId).assignDocId(docId);
        }
        if (documents.isEmpty()) {
            return new ChunkBuildResult(0, Map.of());
        }

        int effectiveWorkers = Math.min(workerCount, documents.size());
        long workerBudget = Math.max(1L, memoryBudgetBytes / effectiveWorkers);
        AtomicInteger chunkCounter = new AtomicInteger();
        int batchSize = (documents.size() + effectiveWorkers - 1) / effectiveWorkers;
        logger.info("开始分块构建: docs={}, workers={}, workerBudget={}B", documents.size(), effectiveWorkers, workerBudget);

        ExecutorService executor = Executors.newFixedThreadPool(effectiveWorkers, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("chunk-builder-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        });
        List<Future<Map<Integer, Integer>>> futures = new ArrayList<>();
        boolean completed = false;
        try {
            for (int start = 0; start < documents.size(); start += batchSize) {
                List<Document> batch = documents.subList(start, Math.min(start + batchSize, documents.size()));
                futures.add(executor.submit(() -> buildBatch(batch, workerBudget, tokenizer, chunkCounter)));
            }
            Map<Integer, Integer> docFrequencies = new HashMap<>();
            for (Future<Map<Integer, Integer>> future : futures) {
                awaitWorker(future).forEach((termId, count) -> docFrequencies.merge(termId, count, Integer::sum));
            }
            int chunkCount = chunkCounter.get();
            logger.info("分块构建完成: chunks={}, terms={}", chunkCount, docFrequencies.size());
            completed = true;
            return new ChunkBuildResult(chunkCount, docFrequencies);
        } finally {
            if (!completed) {
                for (Future<Map<Integer, Integer>> future : futures) {
                    future.cancel(true);
                }
            }
            executor.shutdownNow();
            awaitWorkersTerminated(executor);
        }
    }

    /**
     * k 路归并全部分块，写出倒排文件并向词典构建器登记每个词项的统计量。
     *
     * @param chunkCount 分块文件数
     * @param lexiconBuilder 词典构建器
     * @param expectedDocFrequencies 分词阶段汇总的文档频率，可为 null；非 null 时与归并结果逐项比对
     * @throws IOException 读写失败或分块数据损坏时抛出
     */
    public void mergeChunks(int chunkCount, LexiconBuilder lexiconBuilder, Map<Integer, Integer> expectedDocFrequencies)
            throws IOException {
        if (chunkCount < 0 || lexiconBuilder == null) {
            throw new IllegalArgumentException("归并参数非法: chunkCount=" + chunkCount);
        }
        logger.info("开始归并分块: chunks={}", chunkCount);
        PriorityQueue<ChunkCursor> queue = new PriorityQueue<>(Math.max(1, chunkCount), CURSOR_ORDER);
        List<ChunkReader> readers = new ArrayList<>(chunkCount);
        int mergedTerms = 0;
        try (PostingsWriter postingsWriter = new PostingsWriter(postingsFile())) {
            for (int chunkIndex = 0; chunkIndex < chunkCount; chunkIndex++) {
                ChunkReader reader = new ChunkReader(chunkFile(chunkIndex));
                readers.add(reader);
                if (reader.next()) {
                    queue.add(new ChunkCursor(chunkIndex, reader));
                }
            }

            while (!queue.isEmpty()) {
                int termId = queue.peek().reader().termId();
                List<long[]> parts = new ArrayList<>();
                int postingCount = 0;
                while (!queue.isEmpty() && queue.peek().reader().termId() == termId) {
                    ChunkCursor cursor = queue.poll();
                    long[] packed = pack(cursor.reader().docIds(), cursor.reader().termFreqs());
                    parts.add(packed);
                    postingCount += packed.length;
                    if (cursor.reader().next()) {
                        queue.add(cursor);
                    }
                }
                TermStats termStats = writeMergedTerm(postingsWriter, termId, parts, postingCount);
                verifyDocFrequency(termStats, expectedDocFrequencies);
                lexiconBuilder.addTermStats(termStats);
                mergedTerms++;
            }
        } finally {
            closeAll(readers);
        }
        if (expectedDocFrequencies != null && expectedDocFrequencies.size() != mergedTerms) {
            throw new CorruptIndexException("归并词项数与分词统计不一致: merged=" + mergedTerms
                + ", expected=" + expectedDocFrequencies.size(), Constants.POSTINGS_FILE);
        }
        deleteChunkFiles(chunkCount);
        logger.info("归并完成: terms={}", mergedTerms);
    }

    /**
     * 写出按 DocID 排列的文档长度表。
     *
     * @param documents DocID 等于下标的文档
     * @param target 目标文件
     * @throws IOException 写入失败时抛出
     */
    public void persistDocLengths(List<Document> documents, File target) throws IOException {
        int[] lengths = new int[documents.size()];
        for (int docId = 0; docId < documents.size(); docId++) {
            Document document = documents.get(docId);
            if (document.docId() != docId) {
                throw new IllegalStateException("文档 DocID 与顺序不一致: " + document);
            }
            lengths[docId] = document.length();
        }
        DocLengthsFile.write(target, lengths);
    }

    /**
     * 删除编号小于 chunkCount 的分块文件，以及目录中残留的分块文件。
     *
     * @throws IOException 删除失败时抛出
     */
    public void deleteChunkFiles(int chunkCount) throws IOException {
        for (int chunkIndex = 0; chunkIndex < chunkCount; chunkIndex++) {
            Files.deleteIfExists(chunkFile(chunkIndex).toPath());
        }
        File[] leftovers = indexDir.toFile().listFiles((dir, name) -> name.startsWith(Constants.CHUNK_FILE_PREFIX));
        if (leftovers != null) {
            for (File leftover : leftovers) {
                Files.deleteIfExists(leftover.toPath());
            }
        }
    }

    File chunkFile(int chunkIndex) {
        return indexDir.resolve(String.format("%s%05d", Constants.CHUNK_FILE_PREFIX, chunkIndex)).toFile();
    }

    private File postingsFile() {
        return indexDir.resolve(Constants.POSTINGS_FILE).toFile();
    }

    private Map<Integer, Integer> buildBatch(List<Document> batch, long workerBudget, DocumentTokenizer tokenizer,
                                            AtomicInteger chunkCounter) throws IOException {
        Map<Integer, Integer> docFrequencies = new HashMap<>();
        ChunkAccumulator accumulator = new ChunkAccumulator();
        for (Document document : batch) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("分块构建已取消: worker=" + Thread.currentThread().getName());
            }
            tokenizer.tokenize(document, docFrequencies);
            accumulator.add(document);
            document.clearFrequencies();
            if (accumulator.estimatedBytes() >= workerBudget) {
                flush(accumulator, chunkCounter);
            }
        }
        if (!accumulator.isEmpty()) {
            flush(accumulator, chunkCounter);
        }
        return docFrequencies;
    }

    private void flush(ChunkAccumulator accumulator, AtomicInteger chunkCounter) throws IOException {
        int chunkIndex = chunkCounter.getAndIncrement();
        int termCount = accumulator.termCount();
        accumulator.flushTo(chunkFile(chunkIndex));
        logger.debug("写出分块: index={}, terms={}", chunkIndex, termCount);
    }

    private TermStats writeMergedTerm(PostingsWriter postingsWriter, int termId, List<long[]> parts, int postingCount)
            throws IOException {
        long[] merged = new long[postingCount];
        int cursor = 0;
        for (long[] part : parts) {
            System.arraycopy(part, 0, merged, cursor, part.length);
            cursor += part.length;
        }
        Arrays.sort(merged);

        int[] docIds = new int[postingCount];
        int[] termFreqs = new int[postingCount];
        for (int index = 0; index < postingCount; index++) {
            docIds[index] = (int) (merged[index] >>> 32);
            termFreqs[index] = (int) merged[index];
            if (index > 0 && docIds[index] == docIds[index - 1]) {
                throw new CorruptIndexException("词项倒排中 DocID 重复: termId=" + termId + ", docId=" + docIds[index],
                    Constants.POSTINGS_FILE);
            }
        }
        return postingsWriter.writePostingList(termId, docIds, termFreqs);
    }

    private void verifyDocFrequency(TermStats termStats, Map<Integer, Integer> expectedDocFrequencies)
            throws CorruptIndexException {
        if (expectedDocFrequencies == null) {
            return;
        }
        Integer expected = expectedDocFrequencies.get(termStats.termId());
        if (expected == null || expected != termStats.docFrequency()) {
            throw new CorruptIndexException("文档频率不一致: termId=" + termStats.termId() + ", merged="
                + termStats.docFrequency() + ", expected=" + expected, Constants.POSTINGS_FILE);
        }
    }

    private static long[] pack(int[] docIds, int[] termFreqs) {
        long[] packed = new long[docIds.length];
        for (int index = 0; index < docIds.length; index++) {
            packed[index] = ((long) docIds[index] << 32) | (termFreqs[index] & 0xFFFFFFFFL);
        }
        return packed;
    }

    private static Map<Integer, Integer> awaitWorker(Future<Map<Integer, Integer>> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("分块构建被中断");
            interrupted.initCause(exception);
            throw interrupted;
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            if (cause instanceof UncheckedIOException uncheckedIOException) {
                throw uncheckedIOException.getCause();
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IOException("分块构建失败", cause);
        }
    }

    /**
     * 等待工作线程全部退出，失败的构建只有在此之后才能清理分块文件。
     */
    private static void awaitWorkersTerminated(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(Constants.WORKER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("分块工作线程未在 {}s 内退出", Constants.WORKER_SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            logger.warn("等待分块工作线程退出时被中断", exception);
        }
    }

    private static void closeAll(List<ChunkReader> readers) throws IOException {
        IOException failure = null;
        for (ChunkReader reader : readers) {
            try {
                reader.close();
            } catch (IOException exception) {
                if (failure == null) {
                    failure = exception;
                } else {
                    failure.addSuppressed(exception);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private record ChunkCursor(int chunkIndex, ChunkReader reader) {
    }
}
