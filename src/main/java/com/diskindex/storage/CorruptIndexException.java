package com.diskindex.storage;

import java.io.IOException;

/**
 * 索引产物内容损坏或缺失时抛出，打开索引时即失败，调用方需丢弃并重建索引。
 */
public class CorruptIndexException extends IOException {
    private final String resource;

    public CorruptIndexException(String message, String resource) {
        super(message + " (resource=" + resource + ")");
        this.resource = resource;
    }

    public CorruptIndexException(String message, String resource, Throwable cause) {
        super(message + " (resource=" + resource + ")", cause);
        this.resource = resource;
    }

    /**
     * 返回出错的文件或资源名称。
     */
    public String getResource() {
        return resource;
    }
}
