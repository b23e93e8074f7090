package com.diskindex.text;

import com.diskindex.document.Document;
import com.diskindex.index.TermIdMapping;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * 将文档内容转换为 TermID→词频表的分词契约。
 *
 * 构建期实现持有一个可分配的 TermID 空间；索引打开后会被替换为已构建索引的只读空间，
 * 此时未知词项直接丢弃。
 */
public interface DocumentTokenizer {

    /**
     * 对文档分词，写入其词频表与文档长度。
     *
     * @param document 目标文档
     * @param docFreqs 可为 null；非 null 时每个在文档中出现的词项计数加一
     * @throws IOException 读取文档内容失败时抛出
     */
    void tokenize(Document document, Map<Integer, Integer> docFreqs) throws IOException;

    /**
     * 绑定已有的 TermID 空间。
     */
    void attachTermIdMapping(TermIdMapping mapping);

    /**
     * 将当前 TermID 空间持久化到目标文件。
     *
     * @throws IOException 写入失败时抛出
     */
    void persistTermIdMapping(File target) throws IOException;

    /**
     * 当前使用的 TermID 空间。
     */
    TermIdMapping termIdMapping();

    /**
     * 内置分词策略，自定义实现返回空。索引元数据按此记录构建时的分词方式。
     */
    default Optional<TokenizerType> tokenizerType() {
        return Optional.empty();
    }

    /**
     * 是否过滤英文停用词。
     */
    default boolean stopWordsEnabled() {
        return false;
    }
}
