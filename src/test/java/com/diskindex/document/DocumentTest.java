package com.diskindex.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("空类别回落为默认类别")
    void testDefaultCategory() {
        assertEquals(Document.DEFAULT_CATEGORY, Document.ofText("a", null, "x").category());
        assertEquals(Document.DEFAULT_CATEGORY, Document.ofText("a", " ", "x").category());
        assertEquals("news", Document.ofText("a", "news", "x").category());
    }

    @Test
    @DisplayName("文件文档延迟读取内容")
    void testFileDocumentReadsLazily() throws IOException {
        Path file = tempDir.resolve("note.txt");
        Document document = Document.ofFile(file, "notes");
        Files.writeString(file, "late content");
        assertEquals("late content", document.readContent());

        Document missing = Document.ofFile(tempDir.resolve("missing.txt"), null);
        assertThrows(IOException.class, missing::readContent);
    }

    @Test
    @DisplayName("词频累加与DocID只能分配一次")
    void testFrequenciesAndDocId() {
        Document document = Document.ofText("doc", null, "");
        document.increment(3, 1);
        document.increment(3, 2);
        assertEquals(3, document.frequencies().get(3));
        assertThrows(UnsupportedOperationException.class, () -> document.frequencies().put(1, 1));
        assertThrows(IllegalArgumentException.class, () -> document.increment(1, 0));

        document.assignDocId(4);
        document.assignDocId(4);
        assertThrows(IllegalStateException.class, () -> document.assignDocId(5));

        document.setLength(7);
        document.clearFrequencies();
        assertTrue(document.frequencies().isEmpty());
        assertEquals(7, document.length());
    }

    @Test
    void testBlankNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> Document.ofText(" ", null, "x"));
    }
}
