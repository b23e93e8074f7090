package com.diskindex.index;

import com.diskindex.config.Constants;
import com.diskindex.storage.CorruptIndexException;
import com.diskindex.storage.LexiconReader;
import com.diskindex.storage.TermStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LexiconTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("词项必须按TermID严格递增登记")
    void testAddTermStatsRequiresIncreasingIds() {
        LexiconBuilder builder = new LexiconBuilder();
        builder.addTermStats(new TermStats(0, 1, 0, 4));
        builder.addTermStats(new TermStats(3, 1, 4, 4));
        assertThrows(IllegalArgumentException.class, () -> builder.addTermStats(new TermStats(3, 1, 8, 4)));
        assertThrows(IllegalArgumentException.class, () -> builder.addTermStats(new TermStats(1, 1, 8, 4)));
        assertThrows(IllegalArgumentException.class, () -> builder.addTermStats(null));
        assertEquals(2, builder.termCount());
        assertEquals(3, builder.getTermStats().get(1).termId());
    }

    @Test
    @DisplayName("平均文档长度，空语料为0")
    void testAverageLength() {
        assertEquals(0.0, LexiconBuilder.averageLength(new int[0]));
        assertEquals(2.5, LexiconBuilder.averageLength(new int[]{3, 2}));
        assertEquals(0.0, LexiconBuilder.averageLength(new int[]{0, 0, 0}));
    }

    @Test
    @DisplayName("词典经临时文件改名写出，不留临时文件")
    void testSaveWritesLexiconWithoutTempFile() throws IOException {
        LexiconBuilder builder = new LexiconBuilder();
        builder.addTermStats(new TermStats(0, 2, 0, 6));
        builder.addTermStats(new TermStats(1, 1, 6, 4));
        File lexiconFile = tempDir.resolve(Constants.LEXICON_FILE).toFile();

        builder.save(lexiconFile, new int[]{3, 2});

        assertTrue(lexiconFile.isFile());
        assertFalse(Files.exists(tempDir.resolve(Constants.LEXICON_FILE + LexiconBuilder.TEMP_SUFFIX)));
        LexiconReader reader = LexiconReader.read(lexiconFile);
        assertEquals(2, reader.getNumDocs());
        assertEquals(2.5, reader.getAvgDocLength(), 1e-12);
        assertEquals(new TermStats(1, 1, 6, 4), reader.getTermStats().get(1));
    }

    @Test
    @DisplayName("文档频率超过文档总数时拒绝写出")
    void testSaveRejectsDocFrequencyAboveNumDocs() {
        LexiconBuilder builder = new LexiconBuilder();
        builder.addTermStats(new TermStats(0, 3, 0, 6));
        File lexiconFile = tempDir.resolve(Constants.LEXICON_FILE).toFile();

        assertThrows(IllegalStateException.class, () -> builder.save(lexiconFile, new int[]{1, 1}));
        assertFalse(lexiconFile.exists());
    }

    @Test
    @DisplayName("没有词典文件时打开得到空词典")
    void testOpenWithoutLexiconReturnsEmpty() throws IOException {
        assertFalse(Lexicon.exists(tempDir));
        Lexicon lexicon = Lexicon.open(tempDir);

        assertSame(Lexicon.empty(), lexicon);
        assertTrue(lexicon.isEmpty());
        assertEquals(0, lexicon.numDocs());
        assertEquals(0, lexicon.termCount());
        assertFalse(lexicon.containsTerm("a"));
        assertTrue(lexicon.termStats(0).isEmpty());
        assertTrue(lexicon.document(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> lexicon.docLength(0));
        assertThrows(IndexUsageException.class, lexicon::termIdMapping);
    }

    @Test
    @DisplayName("只有词典文件而缺少其它产物时判定为损坏")
    void testOpenWithMissingArtifacts() throws IOException {
        new LexiconBuilder().save(tempDir.resolve(Constants.LEXICON_FILE).toFile(), new int[0]);
        assertTrue(Lexicon.exists(tempDir));
        assertThrows(IOException.class, () -> Lexicon.open(tempDir));
    }

    @Test
    @DisplayName("元数据以JSON往返保存，内容损坏时报告数据错误")
    void testIndexMetaRoundTrip() throws IOException {
        IndexMeta meta = new IndexMeta(2, 3, 1, 128L, "WHITESPACE", true, IndexMeta.STATUS_COMPLETE,
            Instant.parse("2024-01-01T00:00:00Z"));
        File metaFile = tempDir.resolve(Constants.INDEX_META_FILE).toFile();

        meta.writeTo(metaFile);

        assertEquals(meta, IndexMeta.readFrom(metaFile));
        assertTrue(Files.readString(metaFile.toPath()).contains("2024-01-01T00:00:00Z"));
        Files.writeString(metaFile.toPath(), "{broken");
        assertThrows(CorruptIndexException.class, () -> IndexMeta.readFrom(metaFile));
        Files.writeString(metaFile.toPath(), "{\"docCount\": 1}");
        assertThrows(CorruptIndexException.class, () -> IndexMeta.readFrom(metaFile));
    }
}
