package com.diskindex.index;

/**
 * 索引生命周期被误用：在已构建的位置再次构建，或在未构建的索引上查询。
 */
public class IndexUsageException extends RuntimeException {

    public IndexUsageException(String message) {
        super(message);
    }
}
