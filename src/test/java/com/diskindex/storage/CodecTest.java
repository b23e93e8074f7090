package com.diskindex.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 编解码器单元测试
 */
class CodecTest {

    @ParameterizedTest
    @CsvSource({"0, 1", "1, 1", "127, 1", "128, 2", "16383, 2", "16384, 3", "2147483647, 5"})
    @DisplayName("VarInt边界值按7位分组编码并可解码")
    void testVarIntBoundaryValues(int value, int expectedSize) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        VarIntCodec.writeVarInt(value, baos);
        assertEquals(expectedSize, baos.size());

        ByteArrayInputStream bais = new ByteArrayInputStream(baos.toByteArray());
        assertEquals(value, VarIntCodec.readVarInt(bais));
        assertEquals(-1, bais.read(), "流应该有且仅有VarInt数据");
    }

    @Test
    @DisplayName("VarInt负数应该抛出异常")
    void testVarIntNegativeValue() {
        assertThrows(IllegalArgumentException.class, () -> VarIntCodec.writeVarInt(-1, new ByteArrayOutputStream()));
    }

    @Test
    @DisplayName("流在首字节结束返回-1，中途截断抛出异常")
    void testVarIntEndOfStream() throws IOException {
        assertEquals(-1, VarIntCodec.readVarInt(new ByteArrayInputStream(new byte[0])));
        assertThrows(IOException.class, () -> VarIntCodec.readVarInt(new ByteArrayInputStream(new byte[]{(byte) 0x80})));
    }

    @Test
    @DisplayName("VarLong在ByteBuffer中连续读取")
    void testVarLongByteBuffer() throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        VarIntCodec.writeVarLong(0L, baos);
        VarIntCodec.writeVarLong(1L << 40, baos);
        VarIntCodec.writeVarInt(300, baos);

        ByteBuffer buffer = ByteBuffer.wrap(baos.toByteArray());
        assertEquals(0L, VarIntCodec.readVarLong(buffer));
        assertEquals(1L << 40, VarIntCodec.readVarLong(buffer));
        assertEquals(300, VarIntCodec.readVarInt(buffer));
        assertFalse(buffer.hasRemaining());
    }

    @Test
    @DisplayName("ByteBuffer不足时抛出IOException")
    void testVarIntByteBufferUnderflow() {
        ByteBuffer buffer = ByteBuffer.wrap(new byte[]{(byte) 0xFF});
        assertThrows(IOException.class, () -> VarIntCodec.readVarInt(buffer));
    }

    @Test
    @DisplayName("Delta编码示例")
    void testDeltaEncode() {
        assertArrayEquals(new int[]{10, 5, 5, 5}, DeltaCodec.encode(new int[]{10, 15, 20, 25}));
        assertArrayEquals(new int[]{10, 15, 20, 25}, DeltaCodec.decode(new int[]{10, 5, 5, 5}));
        assertArrayEquals(new int[0], DeltaCodec.encode(new int[0]));
    }

    @Test
    @DisplayName("Delta编码拒绝非严格递增或负数输入")
    void testDeltaEncodeRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> DeltaCodec.encode(new int[]{1, 1}));
        assertThrows(IllegalArgumentException.class, () -> DeltaCodec.encode(new int[]{5, 3}));
        assertThrows(IllegalArgumentException.class, () -> DeltaCodec.encode(new int[]{-1}));
        assertThrows(IllegalArgumentException.class, () -> DeltaCodec.encode(null));
    }
}
