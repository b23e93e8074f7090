package com.diskindex.storage;

import com.diskindex.config.Constants;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;

/**
 * 倒排文件写入器，按 TermID 递增顺序写入每条倒排列表：文档数、docId 增量区和词频区。
 */
public final class PostingsWriter implements AutoCloseable {
    private final RandomAccessFile randomAccessFile;
    private final String postingsFileName;
    private int lastTermId = -1;
    private int listCount;
    private boolean closed;

    /**
     * 创建倒排写入器并写入文件头。
     *
     * @param file 倒排文件
     * @throws IOException 初始化失败时抛出
     */
    public PostingsWriter(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("倒排文件不能为空");
        }
        this.randomAccessFile = new RandomAccessFile(file, "rw");
        this.postingsFileName = file.getName();
        this.randomAccessFile.setLength(0L);
        StorageFileUtil.writeHeader(randomAccessFile, Constants.POSTINGS_MAGIC);
    }

    /**
     * 写入一条倒排列表，返回包含定位信息的词条。
     *
     * @param termId 词项ID，必须严格递增
     * @param docIds 严格递增 docId 数组
     * @param termFreqs 词频数组
     * @return 该倒排列表对应的词条
     * @throws IOException 写入失败时抛出
     */
    public TermStats writePostingList(int termId, int[] docIds, int[] termFreqs) throws IOException {
        ensureOpen();
        if (termId <= lastTermId) {
            throw new IllegalArgumentException("termId 必须严格递增，last=" + lastTermId + ", current=" + termId);
        }
        validateInput(docIds, termFreqs);

        long postingOffset = randomAccessFile.getFilePointer();
        int documentCount = docIds.length;
        StorageFileUtil.writeVarInt(randomAccessFile, documentCount);
        for (int delta : DeltaCodec.encode(docIds)) {
            StorageFileUtil.writeVarInt(randomAccessFile, delta);
        }
        for (int termFrequency : termFreqs) {
            StorageFileUtil.writeVarInt(randomAccessFile, termFrequency);
        }

        long postingLength = randomAccessFile.getFilePointer() - postingOffset;
        if (postingLength > Integer.MAX_VALUE) {
            throw new IOException("倒排列表过大: termId=" + termId + ", length=" + postingLength);
        }
        lastTermId = termId;
        listCount++;
        return new TermStats(termId, documentCount, postingOffset, (int) postingLength);
    }

    /**
     * 已写入的倒排列表数量。
     */
    public int getListCount() {
        return listCount;
    }

    /**
     * 关闭写入器并追加文件级 CRC32。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            randomAccessFile.seek(randomAccessFile.length());
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
        } catch (IOException exception) {
            throw new IOException("关闭倒排写入器失败: file=" + postingsFileName + ", lists=" + listCount, exception);
        } finally {
            randomAccessFile.close();
            closed = true;
        }
    }

    /**
     * 校验输入数据的一致性与单调性。
     */
    private void validateInput(int[] docIds, int[] termFreqs) {
        if (docIds == null || termFreqs == null) {
            throw new IllegalArgumentException("docIds 和 termFreqs 不能为空");
        }
        if (docIds.length == 0) {
            throw new IllegalArgumentException("倒排列表不能为空");
        }
        if (docIds.length != termFreqs.length) {
            throw new IllegalArgumentException("docIds 与 termFreqs 长度不一致: " + docIds.length + " vs " + termFreqs.length);
        }
        for (int termFrequency : termFreqs) {
            if (termFrequency <= 0) {
                throw new IllegalArgumentException("termFreq 必须为正数: " + termFrequency);
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("PostingsWriter 已关闭");
        }
    }
}
