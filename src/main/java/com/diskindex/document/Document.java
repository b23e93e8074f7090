package com.diskindex.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 待索引或待查询的文档。
 *
 * 名称与类别由调用方提供；TermID→词频表与 token 数由分词器写入；DocID 由构建阶段按输入顺序分配。
 * 单个文档只会被一个工作线程处理，因此不做同步。
 */
public final class Document {
    public static final String DEFAULT_CATEGORY = "default";

    private final String name;
    private final String category;
    private final String text;
    private final Path path;
    private final Map<Integer, Integer> frequencies = new HashMap<>();
    private int length;
    private int docId = -1;

    private Document(String name, String category, String text, Path path) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("文档名称不能为空");
        }
        this.name = name;
        this.category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
        this.text = text;
        this.path = path;
    }

    /**
     * 以内存文本创建文档。
     */
    public static Document ofText(String name, String category, String text) {
        return new Document(name, category, text == null ? "" : text, null);
    }

    /**
     * 以文件创建文档，内容在分词时才读取。
     */
    public static Document ofFile(Path path, String category) {
        Path normalizedPath = path.toAbsolutePath().normalize();
        return new Document(normalizedPath.toString().replace('\\', '/'), category, null, normalizedPath);
    }

    /**
     * 读取文档原文。
     *
     * @return 文档文本
     * @throws IOException 文件读取失败时抛出
     */
    public String readContent() throws IOException {
        if (text != null) {
            return text;
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException exception) {
            throw new IOException("读取文档内容失败: " + path, exception);
        }
    }

    public String name() {
        return name;
    }

    public String category() {
        return category;
    }

    /**
     * 累加词项频次。
     */
    public void increment(int termId, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("频次增量必须为正数: " + count);
        }
        frequencies.merge(termId, count, Integer::sum);
    }

    /**
     * 返回 TermID→词频的只读视图。
     */
    public Map<Integer, Integer> frequencies() {
        return Collections.unmodifiableMap(frequencies);
    }

    /**
     * 清空词频表，分块累加器已消费后用于释放内存；文档长度保留。
     */
    public void clearFrequencies() {
        frequencies.clear();
    }

    public int length() {
        return length;
    }

    public void setLength(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("文档长度不能为负数: " + length);
        }
        this.length = length;
    }

    public int docId() {
        return docId;
    }

    /**
     * 分配 DocID，每个文档只能分配一次。
     */
    public void assignDocId(int docId) {
        if (docId < 0) {
            throw new IllegalArgumentException("docId 不能为负数: " + docId);
        }
        if (this.docId >= 0 && this.docId != docId) {
            throw new IllegalStateException("文档已分配 DocID: " + name + " -> " + this.docId);
        }
        this.docId = docId;
    }

    @Override
    public String toString() {
        return "Document[name=" + name + ", category=" + category + ", docId=" + docId + ", length=" + length + "]";
    }
}
