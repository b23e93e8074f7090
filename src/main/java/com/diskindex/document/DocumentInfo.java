package com.diskindex.document;

/**
 * DocID 对应的文档元数据。
 */
public record DocumentInfo(int docId, String name, String category, int tokenCount) {
}
