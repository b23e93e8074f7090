package com.diskindex.index;

import com.diskindex.config.Constants;
import com.diskindex.document.Document;
import com.diskindex.storage.ChunkWriter;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * 单个工作线程私有的内存倒排累加器，按 TermID 有序，写出后清空。
 *
 * 文档须按 DocID 递增顺序加入。
 */
final class ChunkAccumulator {
    private final TreeMap<Integer, PostingsBuffer> postingsByTermId = new TreeMap<>();
    private long postingCount;
    private int lastDocId = -1;

    /**
     * 累加文档的 TermID→词频表。
     */
    void add(Document document) {
        int docId = document.docId();
        if (docId <= lastDocId) {
            throw new IllegalArgumentException("文档必须按 DocID 递增加入, last=" + lastDocId + ", current=" + docId);
        }
        for (Map.Entry<Integer, Integer> entry : document.frequencies().entrySet()) {
            postingsByTermId.computeIfAbsent(entry.getKey(), ignored -> new PostingsBuffer()).append(docId, entry.getValue());
            postingCount++;
        }
        lastDocId = docId;
    }

    /**
     * 估算的内存占用。
     */
    long estimatedBytes() {
        return postingsByTermId.size() * Constants.ACCUMULATOR_TERM_OVERHEAD_BYTES
            + postingCount * Constants.ACCUMULATOR_POSTING_BYTES;
    }

    boolean isEmpty() {
        return postingsByTermId.isEmpty();
    }

    int termCount() {
        return postingsByTermId.size();
    }

    /**
     * 写出分块文件并清空累加器。
     *
     * @param chunkFile 目标分块文件
     * @throws IOException 写入失败时抛出
     */
    void flushTo(File chunkFile) throws IOException {
        try (ChunkWriter chunkWriter = new ChunkWriter(chunkFile, postingsByTermId.size())) {
            for (Map.Entry<Integer, PostingsBuffer> entry : postingsByTermId.entrySet()) {
                PostingsBuffer buffer = entry.getValue();
                chunkWriter.writeTerm(entry.getKey(), buffer.docIds(), buffer.termFreqs());
            }
        }
        postingsByTermId.clear();
        postingCount = 0;
    }

    private static final class PostingsBuffer {
        private int[] docIds = new int[4];
        private int[] termFreqs = new int[4];
        private int size;

        void append(int docId, int termFreq) {
            if (size == docIds.length) {
                docIds = Arrays.copyOf(docIds, size * 2);
                termFreqs = Arrays.copyOf(termFreqs, size * 2);
            }
            docIds[size] = docId;
            termFreqs[size] = termFreq;
            size++;
        }

        int[] docIds() {
            return Arrays.copyOf(docIds, size);
        }

        int[] termFreqs() {
            return Arrays.copyOf(termFreqs, size);
        }
    }
}
