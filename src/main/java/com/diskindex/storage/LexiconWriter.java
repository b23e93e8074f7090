package com.diskindex.storage;

import com.diskindex.config.Constants;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;

/**
 * 词典文件写入器：写入语料统计量，并按 TermID 严格递增写入词条，关闭时回填词条数并追加 CRC32。
 *
 * <pre>
 * magic(int) version(short) numDocs(int) avgDocLength(double) termCount(int)
 * { termId(varint) docFrequency(varint) postingsOffset(varlong) postingsLength(varint) } * termCount
 * crc32(int)
 * </pre>
 */
public final class LexiconWriter implements AutoCloseable {
    private static final long TERM_COUNT_OFFSET = StorageFileUtil.HEADER_LENGTH + Integer.BYTES + Double.BYTES;

    private final RandomAccessFile randomAccessFile;
    private final String lexiconFileName;
    private int termCount;
    private int lastTermId = -1;
    private boolean closed;

    /**
     * 创建词典写入器并写入文件头与语料统计量。
     *
     * @param file 目标词典文件
     * @param numDocs 文档总数
     * @param avgDocLength 平均文档长度
     * @throws IOException 初始化失败时抛出
     */
    public LexiconWriter(File file, int numDocs, double avgDocLength) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("词典文件不能为空");
        }
        if (numDocs < 0 || avgDocLength < 0 || Double.isNaN(avgDocLength)) {
            throw new IllegalArgumentException("语料统计量非法: numDocs=" + numDocs + ", avgDocLength=" + avgDocLength);
        }
        this.randomAccessFile = new RandomAccessFile(file, "rw");
        this.lexiconFileName = file.getName();
        this.randomAccessFile.setLength(0L);
        StorageFileUtil.writeHeader(randomAccessFile, Constants.LEXICON_MAGIC);
        this.randomAccessFile.writeInt(numDocs);
        this.randomAccessFile.writeDouble(avgDocLength);
        this.randomAccessFile.writeInt(0);
    }

    /**
     * 写入一个词条，要求 termId 严格递增。
     *
     * @param termStats 词条
     * @throws IOException 写入失败时抛出
     */
    public void writeTermStats(TermStats termStats) throws IOException {
        ensureOpen();
        if (termStats == null) {
            throw new IllegalArgumentException("词条不能为空");
        }
        if (termStats.termId() <= lastTermId) {
            throw new IllegalArgumentException("termId 必须严格递增，last=" + lastTermId + ", current=" + termStats.termId());
        }
        if (termStats.docFrequency() <= 0 || termStats.postingsOffset() < 0 || termStats.postingsLength() <= 0) {
            throw new IllegalArgumentException("词条字段非法: " + termStats);
        }

        StorageFileUtil.writeVarInt(randomAccessFile, termStats.termId());
        StorageFileUtil.writeVarInt(randomAccessFile, termStats.docFrequency());
        StorageFileUtil.writeVarLong(randomAccessFile, termStats.postingsOffset());
        StorageFileUtil.writeVarInt(randomAccessFile, termStats.postingsLength());

        termCount++;
        lastTermId = termStats.termId();
    }

    /**
     * 回填 termCount 并写入 CRC32 页脚。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            randomAccessFile.seek(TERM_COUNT_OFFSET);
            randomAccessFile.writeInt(termCount);
            randomAccessFile.seek(randomAccessFile.length());
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
        } catch (IOException exception) {
            throw new IOException("关闭词典写入器失败: file=" + lexiconFileName + ", termCount=" + termCount, exception);
        } finally {
            randomAccessFile.close();
            closed = true;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("LexiconWriter 已关闭");
        }
    }
}
