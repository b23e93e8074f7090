package com.diskindex.query;

/**
 * 单个命中文档及其 BM25 累计得分。
 */
public record SearchHit(
        int docId,
        String name,
        String category,
        double score
) {
}
