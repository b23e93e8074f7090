package com.diskindex.storage;

import com.diskindex.config.Constants;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;

/**
 * 倒排文件读取器，按词条定位信息读取单条倒排列表。
 *
 * 文件在构造时按固定大小分段只读映射，读取只使用绝对位置访问映射区，
 * 不共享文件指针也不经过通道，可被多个查询线程并发调用，查询线程被中断也不会影响其它读取。
 */
public final class PostingsReader implements AutoCloseable {
    /** 单个映射段 1GB */
    static final int MAP_CHUNK_SIZE_POWER = 30;

    private final String postingsFileName;
    private final long dataLength;
    private final int chunkSizePower;
    private final MappedByteBuffer[] mappedChunks;
    private volatile boolean closed;

    /**
     * 构造读取器并完成文件头与 CRC 校验。
     *
     * @param file 倒排文件
     * @throws IOException 读取失败时抛出
     * @throws CorruptIndexException 文件损坏或版本不兼容时抛出
     */
    public PostingsReader(File file) throws IOException {
        this(file, MAP_CHUNK_SIZE_POWER);
    }

    PostingsReader(File file, int chunkSizePower) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("倒排文件不能为空");
        }
        if (chunkSizePower < 1 || chunkSizePower > MAP_CHUNK_SIZE_POWER) {
            throw new IllegalArgumentException("映射分段大小非法: 2^" + chunkSizePower);
        }
        this.postingsFileName = file.getName();
        this.chunkSizePower = chunkSizePower;
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file, "r")) {
            this.dataLength = StorageFileUtil.verifyCrc32Footer(randomAccessFile, postingsFileName);
            StorageFileUtil.verifyHeader(randomAccessFile, postingsFileName, Constants.POSTINGS_MAGIC);
            this.mappedChunks = map(randomAccessFile.getChannel(), dataLength, chunkSizePower);
        }
    }

    /**
     * 按词条定位信息读取一条倒排列表。
     *
     * @param termStats 词条
     * @return 解码后的倒排列表
     * @throws IOException 读取失败时抛出
     * @throws CorruptIndexException 定位信息越界或内容与词条不一致时抛出
     */
    public PostingList readPostingList(TermStats termStats) throws IOException {
        ensureOpen();
        long offset = termStats.postingsOffset();
        int length = termStats.postingsLength();
        if (offset < StorageFileUtil.HEADER_LENGTH || length <= 0 || offset + length > dataLength) {
            throw new CorruptIndexException("无效倒排定位: termId=" + termStats.termId()
                + ", offset=" + offset + ", length=" + length, postingsFileName);
        }
        return decode(ByteBuffer.wrap(readBytes(offset, length)), termStats);
    }

    /**
     * 释放读取器。映射区随对象回收，关闭后不再允许读取。
     */
    @Override
    public void close() {
        closed = true;
    }

    private byte[] readBytes(long offset, int length) {
        byte[] bytes = new byte[length];
        long chunkMask = (1L << chunkSizePower) - 1L;
        long position = offset;
        int copied = 0;
        while (copied < length) {
            MappedByteBuffer chunk = mappedChunks[(int) (position >>> chunkSizePower)];
            int chunkOffset = (int) (position & chunkMask);
            int count = Math.min(length - copied, chunk.limit() - chunkOffset);
            chunk.get(chunkOffset, bytes, copied, count);
            copied += count;
            position += count;
        }
        return bytes;
    }

    private PostingList decode(ByteBuffer buffer, TermStats termStats) throws IOException {
        int documentCount = VarIntCodec.readVarInt(buffer);
        if (documentCount != termStats.docFrequency()) {
            throw new CorruptIndexException("倒排块计数与词条不一致: termId=" + termStats.termId()
                + ", docCount=" + documentCount + ", docFrequency=" + termStats.docFrequency(), postingsFileName);
        }

        int[] deltas = new int[documentCount];
        for (int index = 0; index < documentCount; index++) {
            deltas[index] = VarIntCodec.readVarInt(buffer);
        }
        int[] termFreqs = new int[documentCount];
        for (int index = 0; index < documentCount; index++) {
            termFreqs[index] = VarIntCodec.readVarInt(buffer);
        }
        if (buffer.hasRemaining()) {
            throw new CorruptIndexException("倒排列表包含未解析字节: termId=" + termStats.termId(), postingsFileName);
        }
        try {
            return new PostingList(DeltaCodec.decode(deltas), termFreqs);
        } catch (IllegalArgumentException exception) {
            throw new CorruptIndexException("倒排列表内容非法: termId=" + termStats.termId(), postingsFileName, exception);
        }
    }

    private static MappedByteBuffer[] map(FileChannel channel, long length, int chunkSizePower) throws IOException {
        long chunkSize = 1L << chunkSizePower;
        int chunkCount = (int) ((length + chunkSize - 1) >>> chunkSizePower);
        MappedByteBuffer[] chunks = new MappedByteBuffer[Math.max(chunkCount, 1)];
        for (int chunkIndex = 0; chunkIndex < chunks.length; chunkIndex++) {
            long chunkStart = chunkIndex * chunkSize;
            long chunkLength = Math.min(chunkSize, length - chunkStart);
            chunks[chunkIndex] = channel.map(FileChannel.MapMode.READ_ONLY, chunkStart, Math.max(chunkLength, 0L));
        }
        return chunks;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("PostingsReader 已关闭");
        }
    }
}
