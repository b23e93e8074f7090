package com.diskindex.storage;

import com.diskindex.config.Constants;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.zip.CRC32;
import java.util.zip.CheckedOutputStream;

/**
 * 分块文件写入器，顺序写入按 TermID 递增排列的局部倒排列表。
 *
 * <pre>
 * magic(int) version(short) termCount(int)
 * { termId(varint) docCount(varint) { docIdDelta(varint) freq(varint) } * docCount } * termCount
 * crc32(int)
 * </pre>
 */
public final class ChunkWriter implements AutoCloseable {
    private final FileOutputStream fileOutputStream;
    private final CheckedOutputStream checkedOutputStream;
    private final DataOutputStream dataOutputStream;
    private final String chunkFileName;
    private final int expectedTermCount;
    private int writtenTermCount;
    private int lastTermId = -1;
    private boolean closed;

    /**
     * 创建分块写入器并写入文件头。
     *
     * @param file 分块文件
     * @param termCount 即将写入的词项数
     * @throws IOException 初始化失败时抛出
     */
    public ChunkWriter(File file, int termCount) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("分块文件不能为空");
        }
        if (termCount < 0) {
            throw new IllegalArgumentException("词项数不能为负数: " + termCount);
        }
        this.chunkFileName = file.getName();
        this.expectedTermCount = termCount;
        this.fileOutputStream = new FileOutputStream(file);
        this.checkedOutputStream = new CheckedOutputStream(new BufferedOutputStream(fileOutputStream), new CRC32());
        this.dataOutputStream = new DataOutputStream(checkedOutputStream);
        dataOutputStream.writeInt(Constants.CHUNK_MAGIC);
        dataOutputStream.writeShort(Constants.FORMAT_VERSION);
        dataOutputStream.writeInt(termCount);
    }

    /**
     * 写入一个词项的局部倒排列表。
     *
     * @param termId 词项ID，必须严格递增
     * @param docIds 严格递增的文档ID
     * @param termFreqs 词频
     * @throws IOException 写入失败时抛出
     */
    public void writeTerm(int termId, int[] docIds, int[] termFreqs) throws IOException {
        ensureOpen();
        if (termId <= lastTermId) {
            throw new IllegalArgumentException("termId 必须严格递增，last=" + lastTermId + ", current=" + termId);
        }
        if (writtenTermCount >= expectedTermCount) {
            throw new IllegalStateException("写入词项数超过声明值: " + expectedTermCount);
        }
        if (docIds.length == 0 || docIds.length != termFreqs.length) {
            throw new IllegalArgumentException("局部倒排列表非法: termId=" + termId);
        }
        int[] deltas = DeltaCodec.encode(docIds);
        VarIntCodec.writeVarInt(termId, dataOutputStream);
        VarIntCodec.writeVarInt(docIds.length, dataOutputStream);
        for (int index = 0; index < deltas.length; index++) {
            VarIntCodec.writeVarInt(deltas[index], dataOutputStream);
            VarIntCodec.writeVarInt(termFreqs[index], dataOutputStream);
        }
        lastTermId = termId;
        writtenTermCount++;
    }

    /**
     * 追加 CRC32 并刷盘关闭。
     *
     * @throws IOException 关闭失败或词项数与声明不一致时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (writtenTermCount != expectedTermCount) {
                throw new IOException("分块词项数不一致: declared=" + expectedTermCount + ", written=" + writtenTermCount);
            }
            dataOutputStream.flush();
            int crc32Value = (int) checkedOutputStream.getChecksum().getValue();
            dataOutputStream.writeInt(crc32Value);
            dataOutputStream.flush();
            fileOutputStream.getFD().sync();
        } catch (IOException exception) {
            throw new IOException("关闭分块写入器失败: file=" + chunkFileName, exception);
        } finally {
            dataOutputStream.close();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ChunkWriter 已关闭");
        }
    }
}
