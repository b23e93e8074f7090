package com.diskindex.config;

import com.diskindex.text.TokenizerType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private Path indexDir = Paths.get("./index");
    private int indexThreads = Constants.DEFAULT_INDEX_THREADS;
    private long chunkMemoryBytes = Constants.DEFAULT_CHUNK_MEMORY_BYTES;
    private int queryLimit = 10;
    private double bm25K1 = Constants.BM25_K1;
    private double bm25B = Constants.BM25_B;
    private double bm25K3 = Constants.BM25_K3;
    private TokenizerType tokenizerType = TokenizerType.ENGLISH;
    private boolean stopWordsEnabled = true;

    public Path getIndexDir() {
        return indexDir;
    }

    public void setIndexDir(Path indexDir) {
        this.indexDir = indexDir;
    }

    public int getIndexThreads() {
        return indexThreads;
    }

    public void setIndexThreads(int indexThreads) {
        this.indexThreads = indexThreads;
    }

    public long getChunkMemoryBytes() {
        return chunkMemoryBytes;
    }

    public void setChunkMemoryBytes(long chunkMemoryBytes) {
        this.chunkMemoryBytes = chunkMemoryBytes;
    }

    public int getQueryLimit() {
        return queryLimit;
    }

    public void setQueryLimit(int queryLimit) {
        this.queryLimit = queryLimit;
    }

    public double getBm25K1() {
        return bm25K1;
    }

    public void setBm25K1(double bm25K1) {
        this.bm25K1 = bm25K1;
    }

    public double getBm25B() {
        return bm25B;
    }

    public void setBm25B(double bm25B) {
        this.bm25B = bm25B;
    }

    public double getBm25K3() {
        return bm25K3;
    }

    public void setBm25K3(double bm25K3) {
        this.bm25K3 = bm25K3;
    }

    public TokenizerType getTokenizerType() {
        return tokenizerType;
    }

    public void setTokenizerType(TokenizerType tokenizerType) {
        this.tokenizerType = tokenizerType;
    }

    public boolean isStopWordsEnabled() {
        return stopWordsEnabled;
    }

    public void setStopWordsEnabled(boolean stopWordsEnabled) {
        this.stopWordsEnabled = stopWordsEnabled;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从JSON配置文件读取配置，缺省字段沿用默认值。
     *
     * @param file 配置文件
     * @return 配置实例
     * @throws IOException 读取或解析失败时抛出
     */
    public static EngineConfig readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, EngineConfig.class);
        } catch (IOException exception) {
            throw new IOException("读取配置文件失败: " + file.getAbsolutePath(), exception);
        }
    }
}
