package com.diskindex.text;

/**
 * 内置分词策略。
 */
public enum TokenizerType {
    WHITESPACE,
    ENGLISH,
    BIGRAM,
    MULTI;

    /**
     * 创建对应的文本分词器。
     *
     * @param enableStopWords 是否过滤英文停用词，仅对 ENGLISH 与 MULTI 生效
     */
    public Tokenizer create(boolean enableStopWords) {
        return switch (this) {
            case WHITESPACE -> new WhitespaceTokenizer();
            case ENGLISH -> new EnglishTokenizer(enableStopWords);
            case BIGRAM -> new BigramTokenizer();
            case MULTI -> CompositeTokenizer.englishAndBigram(enableStopWords);
        };
    }
}
