package com.diskindex.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * VarInt/VarLong变长整数编解码器
 *
 * 每字节低7位存数据，最高位为1表示后续还有字节。
 * 倒排、分块与词典文件中的计数、docId增量和偏移都使用该编码。
 */
public final class VarIntCodec {

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 将非负int编码为VarInt写入输出流
     *
     * @param value 非负整数
     * @param out 输出流
     * @throws IOException IO异常
     */
    public static void writeVarInt(int value, OutputStream out) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
        while ((value & ~0x7F) != 0) {
            out.write((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.write(value & 0x7F);
    }

    /**
     * 将非负long编码为VarLong写入输出流
     *
     * @param value 非负整数
     * @param out 输出流
     * @throws IOException IO异常
     */
    public static void writeVarLong(long value, OutputStream out) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarLong不支持负数: " + value);
        }
        while ((value & ~0x7FL) != 0) {
            out.write((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        out.write((int) (value & 0x7F));
    }

    /**
     * 从输入流读取VarInt
     *
     * @param in 输入流
     * @return 解码后的值，流在首字节处结束时返回-1
     * @throws IOException IO异常或VarInt被截断
     */
    public static int readVarInt(InputStream in) throws IOException {
        int result = 0;
        int shift = 0;
        while (shift < 32) {
            int b = in.read();
            if (b == -1) {
                if (shift == 0) {
                    return -1;
                }
                throw new IOException("VarInt被截断，已读取 " + (shift / 7) + " 字节");
            }
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new IOException("VarInt超过32位范围");
    }

    /**
     * 从ByteBuffer读取VarInt
     *
     * @param buf 字节缓冲区
     * @return 解码后的值
     * @throws IOException 缓冲区不足或格式错误
     */
    public static int readVarInt(ByteBuffer buf) throws IOException {
        int result = 0;
        int shift = 0;
        while (shift < 32) {
            if (!buf.hasRemaining()) {
                throw new IOException("ByteBuffer不足，无法读取完整VarInt");
            }
            int b = buf.get() & 0xFF;
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new IOException("VarInt超过32位范围");
    }

    /**
     * 从ByteBuffer读取VarLong
     *
     * @param buf 字节缓冲区
     * @return 解码后的值
     * @throws IOException 缓冲区不足或格式错误
     */
    public static long readVarLong(ByteBuffer buf) throws IOException {
        long result = 0;
        int shift = 0;
        while (shift < 64) {
            if (!buf.hasRemaining()) {
                throw new IOException("ByteBuffer不足，无法读取完整VarLong");
            }
            int b = buf.get() & 0xFF;
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new IOException("VarLong超过64位范围");
    }
}
