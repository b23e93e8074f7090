package com.diskindex.scoring;

import com.diskindex.config.Constants;
import com.diskindex.document.DocumentInfo;
import com.diskindex.index.Lexicon;
import com.diskindex.query.SearchHit;
import com.diskindex.query.SearchResult;
import com.diskindex.storage.CorruptIndexException;
import com.diskindex.storage.PostingList;
import com.diskindex.storage.PostingsReader;
import com.diskindex.storage.TermStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 对查询文档的 TermID→词频表执行 BM25 累加打分。
 *
 * 无状态，可被多个查询线程共享。
 */
public class QueryScorer {
    private static final Logger logger = LoggerFactory.getLogger(QueryScorer.class);

    private final BM25Scorer scorer;

    public QueryScorer(BM25Scorer scorer) {
        if (scorer == null) {
            throw new IllegalArgumentException("BM25Scorer 不能为空");
        }
        this.scorer = scorer;
    }

    /**
     * 计算全部命中文档的得分。
     *
     * @param queryText 原始查询文本，仅用于结果展示
     * @param queryFrequencies 查询的 TermID→词频
     * @param lexicon 非空词典
     * @param postingsReader 倒排读取器
     * @return 得分升序的结果
     * @throws IOException 读取倒排失败或倒排与词典不一致时抛出
     */
    public SearchResult score(String queryText, Map<Integer, Integer> queryFrequencies, Lexicon lexicon,
                              PostingsReader postingsReader) throws IOException {
        long startNanos = System.nanoTime();
        if (queryFrequencies.isEmpty()) {
            logger.debug("查询不含可识别的词项: {}", queryText);
            return SearchResult.empty(queryText, 0);
        }
        int numDocs = lexicon.numDocs();
        double avgDocLength = lexicon.avgDocLength();
        Map<Integer, Double> scoresByDocId = new HashMap<>();
        int matchedTerms = 0;

        for (Map.Entry<Integer, Integer> entry : new TreeMap<>(queryFrequencies).entrySet()) {
            Optional<TermStats> termStats = lexicon.termStats(entry.getKey());
            if (termStats.isEmpty()) {
                continue;
            }
            TermStats stats = termStats.get();
            double idf = scorer.computeIdf(numDocs, stats.docFrequency());
            double queryWeight = scorer.queryTermWeight(entry.getValue());
            PostingList postingList = postingsReader.readPostingList(stats);
            for (int index = 0; index < postingList.size(); index++) {
                int docId = postingList.docId(index);
                if (docId >= numDocs) {
                    throw new CorruptIndexException("倒排中的 DocID 超出文档总数: termId=" + stats.termId()
                        + ", docId=" + docId, Constants.POSTINGS_FILE);
                }
                double tf = scorer.termFrequencyWeight(postingList.termFreq(index), lexicon.docLength(docId), avgDocLength);
                scoresByDocId.merge(docId, tf * idf * queryWeight, Double::sum);
            }
            matchedTerms++;
        }

        List<SearchHit> hits = new ArrayList<>(scoresByDocId.size());
        for (Map.Entry<Integer, Double> entry : scoresByDocId.entrySet()) {
            int docId = entry.getKey();
            DocumentInfo document = lexicon.document(docId)
                .orElseThrow(() -> new CorruptIndexException("文档映射缺少 DocID: " + docId, Constants.DOC_ID_MAPPING_FILE));
            hits.add(new SearchHit(docId, document.name(), document.category(), entry.getValue()));
        }
        hits.sort(SearchResult.ASCENDING);

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("查询打分完成: terms={}, matchedTerms={}, hits={}, elapsed={}ms",
            queryFrequencies.size(), matchedTerms, hits.size(), elapsedMs);
        return new SearchResult(queryText, hits, matchedTerms, elapsedMs);
    }
}
