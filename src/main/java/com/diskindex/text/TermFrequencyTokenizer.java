package com.diskindex.text;

import com.diskindex.document.Document;
import com.diskindex.index.TermIdMapping;

import java.io.File;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * 基于文本分词器的 {@link DocumentTokenizer} 实现，文档长度为分词产生的 token 数。
 */
public class TermFrequencyTokenizer implements DocumentTokenizer {

    private final Tokenizer tokenizer;
    private final TokenizerType type;
    private final boolean stopWordsEnabled;
    private volatile TermIdMapping mapping;

    /**
     * 以任意文本分词器创建，元数据中记为自定义分词。
     */
    public TermFrequencyTokenizer(Tokenizer tokenizer) {
        this(tokenizer, null, false);
    }

    private TermFrequencyTokenizer(Tokenizer tokenizer, TokenizerType type, boolean stopWordsEnabled) {
        if (tokenizer == null) {
            throw new IllegalArgumentException("文本分词器不能为空");
        }
        this.tokenizer = tokenizer;
        this.type = type;
        this.stopWordsEnabled = stopWordsEnabled;
        this.mapping = TermIdMapping.create();
    }

    /**
     * 按分词策略创建。
     */
    public static TermFrequencyTokenizer of(TokenizerType type, boolean enableStopWords) {
        if (type == null) {
            throw new IllegalArgumentException("分词策略不能为空");
        }
        return new TermFrequencyTokenizer(type.create(enableStopWords), type, enableStopWords);
    }

    @Override
    public void tokenize(Document document, Map<Integer, Integer> docFreqs) throws IOException {
        List<Token> tokens = tokenizer.tokenize(document.readContent());
        TermIdMapping currentMapping = mapping;
        Set<Integer> seenTermIds = docFreqs == null ? null : new HashSet<>();

        for (Token token : tokens) {
            int termId;
            if (currentMapping.isReadOnly()) {
                OptionalInt known = currentMapping.lookup(token.term());
                if (known.isEmpty()) {
                    continue;
                }
                termId = known.getAsInt();
            } else {
                termId = currentMapping.getOrAssign(token.term());
            }
            document.increment(termId, 1);
            if (seenTermIds != null && seenTermIds.add(termId)) {
                docFreqs.merge(termId, 1, Integer::sum);
            }
        }
        document.setLength(tokens.size());
    }

    @Override
    public void attachTermIdMapping(TermIdMapping termIdMapping) {
        if (termIdMapping == null) {
            throw new IllegalArgumentException("TermID 映射不能为空");
        }
        this.mapping = termIdMapping;
    }

    @Override
    public void persistTermIdMapping(File target) throws IOException {
        mapping.save(target);
    }

    @Override
    public TermIdMapping termIdMapping() {
        return mapping;
    }

    @Override
    public Optional<TokenizerType> tokenizerType() {
        return Optional.ofNullable(type);
    }

    @Override
    public boolean stopWordsEnabled() {
        return stopWordsEnabled;
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }
}
