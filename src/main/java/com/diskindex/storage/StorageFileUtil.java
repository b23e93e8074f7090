package com.diskindex.storage;

import com.diskindex.config.Constants;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.util.zip.CRC32;

/**
 * 存储文件工具方法，封装文件头、VarInt 与 CRC32 页脚的随机访问读写逻辑。
 */
final class StorageFileUtil {
    /** 文件头长度：magic(int) + version(short) */
    static final long HEADER_LENGTH = Integer.BYTES + Short.BYTES;

    private StorageFileUtil() {
    }

    /**
     * 向随机访问文件写入 VarInt。
     */
    static void writeVarInt(RandomAccessFile randomAccessFile, int value) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(5);
        VarIntCodec.writeVarInt(value, buffer);
        randomAccessFile.write(buffer.toByteArray());
    }

    /**
     * 向随机访问文件写入 VarLong。
     */
    static void writeVarLong(RandomAccessFile randomAccessFile, long value) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(10);
        VarIntCodec.writeVarLong(value, buffer);
        randomAccessFile.write(buffer.toByteArray());
    }

    /**
     * 写入 magic 与格式版本号。
     */
    static void writeHeader(RandomAccessFile randomAccessFile, int magic) throws IOException {
        randomAccessFile.writeInt(magic);
        randomAccessFile.writeShort(Constants.FORMAT_VERSION);
    }

    /**
     * 校验 CRC32 页脚与文件头，并将数据区（含文件头）整体读入内存。
     *
     * @param randomAccessFile 源文件
     * @param fileName 文件名（用于错误消息）
     * @param expectedMagic 期望的 magic
     * @return 定位在文件头之后的只读缓冲区，limit 为数据区末尾
     * @throws IOException 读取失败时抛出
     * @throws CorruptIndexException 文件损坏时抛出
     */
    static ByteBuffer readVerifiedBody(RandomAccessFile randomAccessFile, String fileName, int expectedMagic) throws IOException {
        long dataLength = verifyCrc32Footer(randomAccessFile, fileName);
        verifyHeader(randomAccessFile, fileName, expectedMagic);
        if (dataLength > Integer.MAX_VALUE) {
            throw new CorruptIndexException("文件过大，无法整体载入", fileName);
        }
        byte[] body = new byte[(int) dataLength];
        randomAccessFile.seek(0L);
        randomAccessFile.readFully(body);
        ByteBuffer buffer = ByteBuffer.wrap(body).asReadOnlyBuffer();
        buffer.position((int) HEADER_LENGTH);
        return buffer;
    }

    /**
     * 校验 magic 与格式版本号，完成后文件指针位于文件头之后。
     */
    static void verifyHeader(RandomAccessFile randomAccessFile, String fileName, int expectedMagic) throws IOException {
        randomAccessFile.seek(0L);
        int magic = randomAccessFile.readInt();
        if (magic != expectedMagic) {
            throw new CorruptIndexException("magic 不匹配: 0x" + Integer.toHexString(magic), fileName);
        }
        short version = randomAccessFile.readShort();
        if (version != Constants.FORMAT_VERSION) {
            throw new CorruptIndexException("文件版本不支持: " + version, fileName);
        }
    }

    /**
     * 计算指定前缀字节区间的 CRC32。
     */
    static long computeCrc32(RandomAccessFile randomAccessFile, long length) throws IOException {
        long originalPointer = randomAccessFile.getFilePointer();
        CRC32 crc32 = new CRC32();
        byte[] buffer = new byte[8 * 1024];
        long remainingBytes = length;
        randomAccessFile.seek(0L);
        while (remainingBytes > 0) {
            int chunkSize = (int) Math.min(buffer.length, remainingBytes);
            int readBytes = randomAccessFile.read(buffer, 0, chunkSize);
            if (readBytes < 0) {
                throw new EOFException("计算 CRC32 时遇到 EOF");
            }
            crc32.update(buffer, 0, readBytes);
            remainingBytes -= readBytes;
        }
        randomAccessFile.seek(originalPointer);
        return crc32.getValue();
    }

    /**
     * 在文件尾部追加 CRC32 页脚并强制刷盘。
     */
    static void appendCrc32Footer(RandomAccessFile randomAccessFile) throws IOException {
        long dataLength = randomAccessFile.length();
        long crc32Value = computeCrc32(randomAccessFile, dataLength);
        randomAccessFile.seek(dataLength);
        randomAccessFile.writeInt((int) crc32Value);
        randomAccessFile.getFD().sync();
    }

    /**
     * 验证尾部 CRC32 并返回数据区长度。
     *
     * @throws CorruptIndexException CRC 不匹配或文件过短时抛出
     */
    static long verifyCrc32Footer(RandomAccessFile randomAccessFile, String fileName) throws IOException {
        long fileLength = randomAccessFile.length();
        if (fileLength < HEADER_LENGTH + Integer.BYTES) {
            throw new CorruptIndexException("文件过短，缺少文件头或 CRC32 页脚", fileName);
        }
        long dataLength = fileLength - Integer.BYTES;
        randomAccessFile.seek(dataLength);
        long expectedCrc32 = Integer.toUnsignedLong(randomAccessFile.readInt());
        long actualCrc32 = computeCrc32(randomAccessFile, dataLength);
        if (actualCrc32 != expectedCrc32) {
            throw new CorruptIndexException("CRC32 校验失败, expected=" + expectedCrc32 + ", actual=" + actualCrc32, fileName);
        }
        return dataLength;
    }
}
