package com.diskindex.text;

import com.diskindex.document.Document;
import com.diskindex.index.TermIdMapping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TermFrequencyTokenizerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("分词写入词频表与文档长度，文档频率每个词项只加一")
    void testTokenizeCountsFrequencies() throws IOException {
        DocumentTokenizer tokenizer = TermFrequencyTokenizer.of(TokenizerType.WHITESPACE, true);
        Map<Integer, Integer> docFreqs = new HashMap<>();

        Document first = Document.ofText("d0", null, "a a b");
        tokenizer.tokenize(first, docFreqs);
        Document second = Document.ofText("d1", null, "a c");
        tokenizer.tokenize(second, docFreqs);

        TermIdMapping mapping = tokenizer.termIdMapping();
        int a = mapping.lookup("a").getAsInt();
        int b = mapping.lookup("b").getAsInt();
        int c = mapping.lookup("c").getAsInt();
        assertEquals(List.of(0, 1, 2), List.of(a, b, c));
        assertEquals(Map.of(a, 2, b, 1), first.frequencies());
        assertEquals(3, first.length());
        assertEquals(2, second.length());
        assertEquals(Map.of(a, 2, b, 1, c, 1), docFreqs);
    }

    @Test
    @DisplayName("绑定只读映射后未知词项被丢弃，长度仍计入全部token")
    void testReadOnlyMappingDropsUnknownTerms() throws IOException {
        DocumentTokenizer tokenizer = TermFrequencyTokenizer.of(TokenizerType.WHITESPACE, true);
        tokenizer.attachTermIdMapping(TermIdMapping.readOnly(List.of("alpha", "beta")));

        Document query = Document.ofText("q", null, "beta gamma beta");
        tokenizer.tokenize(query, null);

        assertEquals(Map.of(1, 2), query.frequencies());
        assertEquals(3, query.length());
        assertEquals(2, tokenizer.termIdMapping().size());
    }

    @Test
    @DisplayName("持久化后的映射可重新载入")
    void testPersistTermIdMapping() throws IOException {
        DocumentTokenizer tokenizer = TermFrequencyTokenizer.of(TokenizerType.ENGLISH, true);
        tokenizer.tokenize(Document.ofText("d", null, "Search engines index documents"), null);
        File target = tempDir.resolve("termid.mapping").toFile();
        tokenizer.persistTermIdMapping(target);

        TermIdMapping loaded = TermIdMapping.load(target);
        assertTrue(loaded.isReadOnly());
        assertEquals(List.of("search", "engines", "index", "documents"), loaded.termsById());
    }

    @Test
    @DisplayName("内置策略报告分词类型与停用词设置，自定义分词器报告为空")
    void testReportsTokenizerSettings() {
        DocumentTokenizer builtIn = TermFrequencyTokenizer.of(TokenizerType.MULTI, false);
        assertEquals(TokenizerType.MULTI, builtIn.tokenizerType().orElseThrow());
        assertFalse(builtIn.stopWordsEnabled());

        DocumentTokenizer custom = new TermFrequencyTokenizer(new WhitespaceTokenizer());
        assertTrue(custom.tokenizerType().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> TermFrequencyTokenizer.of(null, true));
    }
}
