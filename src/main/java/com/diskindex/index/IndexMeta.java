package com.diskindex.index;

import com.diskindex.config.Constants;
import com.diskindex.storage.CorruptIndexException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.File;
import java.io.IOException;
import java.time.Instant;

/**
 * 索引元数据，描述一次构建的统计信息，以 JSON 保存。
 */
public record IndexMeta(
    int docCount,
    int termCount,
    int chunkCount,
    long postingsBytes,
    String tokenizerType,
    boolean stopWordsEnabled,
    String status,
    Instant createTime
) {
    public static final String STATUS_COMPLETE = "COMPLETE";
    /** 以自定义分词器构建的索引 */
    public static final String CUSTOM_TOKENIZER = "CUSTOM";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * 将元数据写入指定 JSON 文件。
     *
     * @param file 元数据文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, this);
        } catch (IOException exception) {
            throw new IOException("写入索引元数据失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 从指定 JSON 文件读取元数据。
     *
     * @param file 元数据文件
     * @return 反序列化后的元数据
     * @throws CorruptIndexException 内容不是合法的元数据时抛出
     * @throws IOException 读取失败时抛出
     */
    public static IndexMeta readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        IndexMeta meta;
        try {
            meta = OBJECT_MAPPER.readValue(file, IndexMeta.class);
        } catch (JsonProcessingException exception) {
            throw new CorruptIndexException("索引元数据格式错误", Constants.INDEX_META_FILE, exception);
        } catch (IOException exception) {
            throw new IOException("读取索引元数据失败: " + file.getAbsolutePath(), exception);
        }
        if (meta == null || meta.tokenizerType() == null || meta.tokenizerType().isBlank()) {
            throw new CorruptIndexException("索引元数据缺少分词策略", Constants.INDEX_META_FILE);
        }
        return meta;
    }

    /**
     * 是否以自定义分词器构建。
     */
    public boolean customTokenizer() {
        return CUSTOM_TOKENIZER.equals(tokenizerType);
    }
}
