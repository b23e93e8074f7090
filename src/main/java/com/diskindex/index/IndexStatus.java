package com.diskindex.index;

import java.nio.file.Path;

/**
 * 索引状态快照。
 */
public record IndexStatus(
    Path indexDir,
    boolean built,
    int docCount,
    int termCount,
    double avgDocLength,
    long indexSizeBytes
) {
}
