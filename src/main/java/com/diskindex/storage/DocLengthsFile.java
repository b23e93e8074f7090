package com.diskindex.storage;

import com.diskindex.config.Constants;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;

/**
 * 文档长度表读写，下标即 DocID，值为文档的 token 数。
 */
public final class DocLengthsFile {

    private DocLengthsFile() {
    }

    /**
     * 写入文档长度表。
     *
     * @param file 目标文件
     * @param lengthsByDocId 下标为 DocID 的长度数组
     * @throws IOException 写入失败时抛出
     */
    public static void write(File file, int[] lengthsByDocId) throws IOException {
        if (file == null || lengthsByDocId == null) {
            throw new IllegalArgumentException("长度表文件与长度数组不能为空");
        }
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file, "rw")) {
            randomAccessFile.setLength(0L);
            StorageFileUtil.writeHeader(randomAccessFile, Constants.DOC_LENGTHS_MAGIC);
            randomAccessFile.writeInt(lengthsByDocId.length);
            ByteBuffer body = ByteBuffer.allocate(lengthsByDocId.length * Integer.BYTES);
            for (int docId = 0; docId < lengthsByDocId.length; docId++) {
                if (lengthsByDocId[docId] < 0) {
                    throw new IllegalArgumentException("文档长度不能为负数: docId=" + docId);
                }
                body.putInt(lengthsByDocId[docId]);
            }
            randomAccessFile.write(body.array());
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
        } catch (IOException exception) {
            throw new IOException("写入文档长度表失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 读取文档长度表。
     *
     * @param file 长度表文件
     * @return 下标为 DocID 的长度数组
     * @throws IOException 读取失败时抛出
     * @throws CorruptIndexException 文件损坏时抛出
     */
    public static int[] read(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("长度表文件不能为空");
        }
        String fileName = file.getName();
        ByteBuffer buffer;
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file, "r")) {
            buffer = StorageFileUtil.readVerifiedBody(randomAccessFile, fileName, Constants.DOC_LENGTHS_MAGIC);
        }
        if (buffer.remaining() < Integer.BYTES) {
            throw new CorruptIndexException("长度表缺少文档数", fileName);
        }
        int docCount = buffer.getInt();
        if (docCount < 0 || (long) docCount * Integer.BYTES != buffer.remaining()) {
            throw new CorruptIndexException("文档数与文件长度不一致: docCount=" + docCount, fileName);
        }
        int[] lengthsByDocId = new int[docCount];
        for (int docId = 0; docId < docCount; docId++) {
            lengthsByDocId[docId] = buffer.getInt();
            if (lengthsByDocId[docId] < 0) {
                throw new CorruptIndexException("文档长度非法: docId=" + docId, fileName);
            }
        }
        return lengthsByDocId;
    }
}
