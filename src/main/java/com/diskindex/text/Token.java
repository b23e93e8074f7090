package com.diskindex.text;

/**
 * 分词结果中的单个词项及其在原文中的位置。
 */
public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset
) {
    public Token {
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("词项不能为空");
        }
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("偏移非法: [" + startOffset + ", " + endOffset + ")");
        }
    }

    /**
     * 返回位置序号替换后的副本。
     */
    public Token withPosition(int newPosition) {
        return new Token(term, newPosition, startOffset, endOffset);
    }
}
