package com.diskindex.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class EnglishTokenizer implements Tokenizer {

    public static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "is", "are", "was", "were", "be", "been",
        "has", "have", "had", "do", "does", "did", "will", "would",
        "could", "should", "may", "might", "can", "and", "or", "but",
        "not", "in", "on", "at", "to", "for", "of", "with", "by",
        "from", "as", "into", "it", "its", "this", "that", "which",
        "if", "so", "no", "up", "out", "all", "just", "also", "very"
    );

    /** 默认最短词长，单字符词项不入索引 */
    public static final int DEFAULT_MIN_LENGTH = 2;

    private static final Pattern SPLIT_PATTERN = Pattern.compile("[^a-zA-Z0-9]+");

    private final boolean enableStopWords;
    private final int minLength;

    /**
     * 创建英文分词器。
     */
    public EnglishTokenizer(boolean enableStopWords) {
        this(enableStopWords, DEFAULT_MIN_LENGTH);
    }

    /**
     * 创建英文分词器并指定最短词长。
     */
    public EnglishTokenizer(boolean enableStopWords, int minLength) {
        if (minLength < 1) {
            throw new IllegalArgumentException("最短词长必须为正数: " + minLength);
        }
        this.enableStopWords = enableStopWords;
        this.minLength = minLength;
    }

    /**
     * 判断词项是否为英文停用词。
     */
    public static boolean isStopWord(String term) {
        if (term == null || term.isEmpty()) {
            return false;
        }
        return STOP_WORDS.contains(term.toLowerCase(Locale.ROOT));
    }

    /**
     * 对英文与数字文本分词，并输出原文偏移。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        Matcher delimiterMatcher = SPLIT_PATTERN.matcher(text);
        int nextPosition = 0;
        int segmentStart = 0;

        while (delimiterMatcher.find()) {
            nextPosition = appendTokenIfValid(text, segmentStart, delimiterMatcher.start(), nextPosition, tokens);
            segmentStart = delimiterMatcher.end();
        }
        appendTokenIfValid(text, segmentStart, text.length(), nextPosition, tokens);

        return List.copyOf(tokens);
    }

    /**
     * 校验并追加有效词项，返回更新后的下一个位置序号。
     */
    private int appendTokenIfValid(String sourceText, int startOffset, int endOffset, int position, List<Token> tokens) {
        if (startOffset >= endOffset) {
            return position;
        }

        String normalizedTerm = sourceText.substring(startOffset, endOffset).toLowerCase(Locale.ROOT);
        if (normalizedTerm.length() < minLength) {
            return position;
        }
        if (enableStopWords && STOP_WORDS.contains(normalizedTerm)) {
            return position;
        }

        tokens.add(new Token(normalizedTerm, position, startOffset, endOffset));
        return position + 1;
    }
}
