package com.diskindex.storage;

import com.diskindex.config.Constants;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.zip.CRC32;
import java.util.zip.CheckedInputStream;

/**
 * 分块文件顺序读取器，供 k 路归并逐词项推进。读到末尾时校验 CRC32。
 */
public final class ChunkReader implements AutoCloseable {
    private final CheckedInputStream checkedInputStream;
    private final DataInputStream dataInputStream;
    private final String chunkFileName;
    private final int termCount;
    private int readTermCount;
    private int currentTermId = -1;
    private int[] currentDocIds = new int[0];
    private int[] currentTermFreqs = new int[0];
    private boolean exhausted;
    private boolean closed;

    /**
     * 打开分块文件并校验文件头。
     *
     * @param file 分块文件
     * @throws IOException 打开失败或文件头损坏时抛出
     */
    public ChunkReader(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("分块文件不能为空");
        }
        this.chunkFileName = file.getName();
        this.checkedInputStream = new CheckedInputStream(new BufferedInputStream(new FileInputStream(file)), new CRC32());
        this.dataInputStream = new DataInputStream(checkedInputStream);
        try {
            int magic = dataInputStream.readInt();
            if (magic != Constants.CHUNK_MAGIC) {
                throw new CorruptIndexException("分块文件 magic 不匹配", chunkFileName);
            }
            short version = dataInputStream.readShort();
            if (version != Constants.FORMAT_VERSION) {
                throw new CorruptIndexException("分块文件版本不支持: " + version, chunkFileName);
            }
            this.termCount = dataInputStream.readInt();
            if (termCount < 0) {
                throw new CorruptIndexException("分块词项数非法: " + termCount, chunkFileName);
            }
        } catch (IOException exception) {
            dataInputStream.close();
            throw exception;
        }
    }

    /**
     * 推进到下一个词项。
     *
     * @return 还有词项返回true；读完全部词项后校验 CRC32 并返回false
     * @throws IOException 读取失败或数据损坏时抛出
     */
    public boolean next() throws IOException {
        ensureOpen();
        if (exhausted) {
            return false;
        }
        if (readTermCount == termCount) {
            verifyFooter();
            exhausted = true;
            return false;
        }
        int termId = readRequiredVarInt();
        int docCount = readRequiredVarInt();
        if (termId <= currentTermId || docCount <= 0) {
            throw new CorruptIndexException("分块词项非法: termId=" + termId + ", docCount=" + docCount, chunkFileName);
        }
        int[] deltas = new int[docCount];
        int[] termFreqs = new int[docCount];
        for (int index = 0; index < docCount; index++) {
            deltas[index] = readRequiredVarInt();
            termFreqs[index] = readRequiredVarInt();
        }
        currentTermId = termId;
        currentDocIds = DeltaCodec.decode(deltas);
        currentTermFreqs = termFreqs;
        readTermCount++;
        return true;
    }

    public int termId() {
        return currentTermId;
    }

    public int[] docIds() {
        return currentDocIds;
    }

    public int[] termFreqs() {
        return currentTermFreqs;
    }

    public String getFileName() {
        return chunkFileName;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        dataInputStream.close();
    }

    private int readRequiredVarInt() throws IOException {
        int value = VarIntCodec.readVarInt(dataInputStream);
        if (value < 0) {
            throw new CorruptIndexException("分块文件被截断或数值非法", chunkFileName);
        }
        return value;
    }

    private void verifyFooter() throws IOException {
        long actualCrc32 = checkedInputStream.getChecksum().getValue();
        long expectedCrc32;
        try {
            expectedCrc32 = Integer.toUnsignedLong(dataInputStream.readInt());
        } catch (EOFException exception) {
            throw new CorruptIndexException("分块文件缺少 CRC32 页脚", chunkFileName, exception);
        }
        if (actualCrc32 != expectedCrc32) {
            throw new CorruptIndexException("分块 CRC32 校验失败, expected=" + expectedCrc32 + ", actual=" + actualCrc32, chunkFileName);
        }
        if (dataInputStream.read() != -1) {
            throw new CorruptIndexException("分块文件包含多余字节", chunkFileName);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ChunkReader 已关闭");
        }
    }
}
