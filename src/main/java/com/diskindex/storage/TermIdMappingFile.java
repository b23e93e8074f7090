package com.diskindex.storage;

import com.diskindex.config.Constants;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * TermID映射文件读写。词项按 TermID 从 0 开始顺序存储，文件中的下标即 TermID。
 *
 * <pre>
 * magic(int) version(short) termCount(int) { length(varint) utf8Bytes } * termCount crc32(int)
 * </pre>
 */
public final class TermIdMappingFile {

    private TermIdMappingFile() {
    }

    /**
     * 写入映射文件。
     *
     * @param file 目标文件
     * @param termsById 下标为 TermID 的词项列表
     * @throws IOException 写入失败时抛出
     */
    public static void write(File file, List<String> termsById) throws IOException {
        if (file == null || termsById == null) {
            throw new IllegalArgumentException("映射文件与词项列表不能为空");
        }
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file, "rw")) {
            randomAccessFile.setLength(0L);
            StorageFileUtil.writeHeader(randomAccessFile, Constants.TERM_MAPPING_MAGIC);
            randomAccessFile.writeInt(termsById.size());
            for (int termId = 0; termId < termsById.size(); termId++) {
                String term = termsById.get(termId);
                if (term == null || term.isEmpty()) {
                    throw new IllegalArgumentException("TermID " + termId + " 对应的词项为空");
                }
                byte[] termBytes = term.getBytes(StandardCharsets.UTF_8);
                StorageFileUtil.writeVarInt(randomAccessFile, termBytes.length);
                randomAccessFile.write(termBytes);
            }
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
        } catch (IOException exception) {
            throw new IOException("写入TermID映射失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 读取映射文件。
     *
     * @param file 映射文件
     * @return 下标为 TermID 的不可修改词项列表
     * @throws IOException 读取失败时抛出
     * @throws CorruptIndexException 文件损坏或词项重复时抛出
     */
    public static List<String> read(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("映射文件不能为空");
        }
        String fileName = file.getName();
        ByteBuffer buffer;
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file, "r")) {
            buffer = StorageFileUtil.readVerifiedBody(randomAccessFile, fileName, Constants.TERM_MAPPING_MAGIC);
        }
        if (buffer.remaining() < Integer.BYTES) {
            throw new CorruptIndexException("映射文件缺少词项数", fileName);
        }
        int termCount = buffer.getInt();
        if (termCount < 0) {
            throw new CorruptIndexException("词项数非法: " + termCount, fileName);
        }

        List<String> termsById = new ArrayList<>(termCount);
        Set<String> seenTerms = new HashSet<>(Math.max(16, termCount * 2));
        for (int termId = 0; termId < termCount; termId++) {
            int termLength = VarIntCodec.readVarInt(buffer);
            if (termLength <= 0 || termLength > buffer.remaining()) {
                throw new CorruptIndexException("词项长度非法: termId=" + termId + ", length=" + termLength, fileName);
            }
            byte[] termBytes = new byte[termLength];
            buffer.get(termBytes);
            String term = decodeUtf8(termBytes, termId, fileName);
            if (!seenTerms.add(term)) {
                throw new CorruptIndexException("词项重复: " + term, fileName);
            }
            termsById.add(term);
        }
        if (buffer.hasRemaining()) {
            throw new CorruptIndexException("映射文件包含未解析字节", fileName);
        }
        return List.copyOf(termsById);
    }

    private static String decodeUtf8(byte[] termBytes, int termId, String fileName) throws CorruptIndexException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(termBytes))
                .toString();
        } catch (CharacterCodingException exception) {
            throw new CorruptIndexException("词项不是合法UTF-8: termId=" + termId, fileName, exception);
        }
    }
}
