package com.diskindex.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 按空白切分并转小写，不做长度与停用词过滤。
 */
public class WhitespaceTokenizer implements Tokenizer {

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int cursor = 0;
        int nextPosition = 0;
        while (cursor < text.length()) {
            while (cursor < text.length() && Character.isWhitespace(text.charAt(cursor))) {
                cursor++;
            }
            int segmentStart = cursor;
            while (cursor < text.length() && !Character.isWhitespace(text.charAt(cursor))) {
                cursor++;
            }
            if (segmentStart < cursor) {
                String term = text.substring(segmentStart, cursor).toLowerCase(Locale.ROOT);
                tokens.add(new Token(term, nextPosition, segmentStart, cursor));
                nextPosition++;
            }
        }
        return List.copyOf(tokens);
    }
}
