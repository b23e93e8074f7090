package com.diskindex.text;

import java.util.ArrayList;
import java.util.List;

/**
 * CJK 双字切分。
 *
 * 以码点为单位识别连续的 CJK 片段，扩展区汉字（代理对）按一个字处理；
 * 片段内相邻两字组成一个词项，只有一个字的片段输出单字。偏移为原文中的 UTF-16 下标。
 */
public class BigramTokenizer implements Tokenizer {

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        List<Integer> segmentOffsets = new ArrayList<>();
        int offset = 0;
        while (offset <= text.length()) {
            boolean cjk = offset < text.length() && isCjk(text.codePointAt(offset));
            if (cjk) {
                segmentOffsets.add(offset);
                offset += Character.charCount(text.codePointAt(offset));
                continue;
            }
            emitSegment(text, segmentOffsets, offset, tokens);
            segmentOffsets.clear();
            offset = offset < text.length() ? offset + Character.charCount(text.codePointAt(offset)) : offset + 1;
        }
        return List.copyOf(tokens);
    }

    /**
     * 输出一个 CJK 片段。
     *
     * @param charStarts 片段内每个字在原文中的起始下标
     * @param segmentEnd 片段结束下标（不含）
     */
    private static void emitSegment(String text, List<Integer> charStarts, int segmentEnd, List<Token> tokens) {
        if (charStarts.isEmpty()) {
            return;
        }
        if (charStarts.size() == 1) {
            int start = charStarts.get(0);
            tokens.add(new Token(text.substring(start, segmentEnd), tokens.size(), start, segmentEnd));
            return;
        }
        for (int index = 0; index + 1 < charStarts.size(); index++) {
            int start = charStarts.get(index);
            int end = index + 2 < charStarts.size() ? charStarts.get(index + 2) : segmentEnd;
            tokens.add(new Token(text.substring(start, end), tokens.size(), start, end));
        }
    }

    /**
     * 码点是否属于汉字、假名或谚文。
     */
    static boolean isCjk(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        return script == Character.UnicodeScript.HAN
            || script == Character.UnicodeScript.HIRAGANA
            || script == Character.UnicodeScript.KATAKANA
            || script == Character.UnicodeScript.HANGUL;
    }
}
