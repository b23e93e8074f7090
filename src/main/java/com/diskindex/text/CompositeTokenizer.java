package com.diskindex.text;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 组合分词器：每个子分词器独立处理全文，结果按原文偏移合并并重新编号位置。
 */
public class CompositeTokenizer implements Tokenizer {

    private static final Comparator<Token> OFFSET_ORDER = Comparator
        .comparingInt(Token::startOffset)
        .thenComparingInt(Token::endOffset)
        .thenComparing(Token::term);

    private final List<Tokenizer> tokenizers;

    /**
     * 创建组合分词器。
     *
     * @param tokenizers 子分词器，至少一个
     */
    public CompositeTokenizer(List<Tokenizer> tokenizers) {
        if (tokenizers == null || tokenizers.isEmpty()) {
            throw new IllegalArgumentException("组合分词器至少需要一个子分词器");
        }
        this.tokenizers = List.copyOf(tokenizers);
    }

    /**
     * 英文与CJK双字的默认组合。
     */
    public static CompositeTokenizer englishAndBigram(boolean enableStopWords) {
        return new CompositeTokenizer(List.of(new EnglishTokenizer(enableStopWords), new BigramTokenizer()));
    }

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> mergedTokens = new ArrayList<>();
        for (Tokenizer tokenizer : tokenizers) {
            mergedTokens.addAll(tokenizer.tokenize(text));
        }
        mergedTokens.sort(OFFSET_ORDER);

        List<Token> renumbered = new ArrayList<>(mergedTokens.size());
        for (int position = 0; position < mergedTokens.size(); position++) {
            renumbered.add(mergedTokens.get(position).withPosition(position));
        }
        return List.copyOf(renumbered);
    }

    public List<Tokenizer> getTokenizers() {
        return tokenizers;
    }
}
