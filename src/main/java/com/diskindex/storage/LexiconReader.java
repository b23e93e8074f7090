package com.diskindex.storage;

import com.diskindex.config.Constants;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 词典文件读取器，一次性校验并载入语料统计量与全部词条。
 */
public final class LexiconReader {
    private final int numDocs;
    private final double avgDocLength;
    private final Map<Integer, TermStats> termStatsById;

    private LexiconReader(int numDocs, double avgDocLength, Map<Integer, TermStats> termStatsById) {
        this.numDocs = numDocs;
        this.avgDocLength = avgDocLength;
        this.termStatsById = termStatsById;
    }

    /**
     * 读取词典文件。
     *
     * @param file 词典文件
     * @return 载入完成的读取器
     * @throws IOException 读取失败时抛出
     * @throws CorruptIndexException 文件损坏时抛出
     */
    public static LexiconReader read(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("词典文件不能为空");
        }
        String fileName = file.getName();
        ByteBuffer buffer;
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file, "r")) {
            buffer = StorageFileUtil.readVerifiedBody(randomAccessFile, fileName, Constants.LEXICON_MAGIC);
        }
        if (buffer.remaining() < Integer.BYTES + Double.BYTES + Integer.BYTES) {
            throw new CorruptIndexException("词典文件缺少统计量区", fileName);
        }

        int numDocs = buffer.getInt();
        double avgDocLength = buffer.getDouble();
        int termCount = buffer.getInt();
        if (numDocs < 0 || termCount < 0 || avgDocLength < 0 || Double.isNaN(avgDocLength)) {
            throw new CorruptIndexException("词典统计量非法: numDocs=" + numDocs + ", avgDocLength=" + avgDocLength
                + ", termCount=" + termCount, fileName);
        }

        Map<Integer, TermStats> termStatsById = new LinkedHashMap<>(Math.max(16, termCount * 2));
        int previousTermId = -1;
        for (int index = 0; index < termCount; index++) {
            int termId = VarIntCodec.readVarInt(buffer);
            int docFrequency = VarIntCodec.readVarInt(buffer);
            long postingsOffset = VarIntCodec.readVarLong(buffer);
            int postingsLength = VarIntCodec.readVarInt(buffer);
            if (termId <= previousTermId) {
                throw new CorruptIndexException("词典词序损坏，termId 未严格递增: " + termId, fileName);
            }
            if (docFrequency <= 0 || docFrequency > numDocs || postingsOffset < 0 || postingsLength <= 0) {
                throw new CorruptIndexException("词条字段非法: termId=" + termId + ", docFrequency=" + docFrequency
                    + ", offset=" + postingsOffset + ", length=" + postingsLength, fileName);
            }
            termStatsById.put(termId, new TermStats(termId, docFrequency, postingsOffset, postingsLength));
            previousTermId = termId;
        }
        if (buffer.hasRemaining()) {
            throw new CorruptIndexException("词典文件包含未解析字节", fileName);
        }
        return new LexiconReader(numDocs, avgDocLength, Collections.unmodifiableMap(termStatsById));
    }

    public int getNumDocs() {
        return numDocs;
    }

    public double getAvgDocLength() {
        return avgDocLength;
    }

    /**
     * 返回按 TermID 递增排列的不可修改词条表。
     */
    public Map<Integer, TermStats> getTermStats() {
        return termStatsById;
    }
}
