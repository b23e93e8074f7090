package com.diskindex.scoring;

import com.diskindex.config.Constants;
import com.diskindex.config.EngineConfig;

/**
 * BM25 打分公式：贡献 = TF · IDF · QTF。
 *
 * IDF 不做截断，出现在超过半数文档中的词项得到负值。
 */
public class BM25Scorer {
    private final double k1;
    private final double b;
    private final double k3;

    public BM25Scorer() {
        this(Constants.BM25_K1, Constants.BM25_B, Constants.BM25_K3);
    }

    public BM25Scorer(double k1, double b, double k3) {
        if (k1 < 0 || b < 0 || b > 1 || k3 < 0) {
            throw new IllegalArgumentException("BM25 参数非法: k1=" + k1 + ", b=" + b + ", k3=" + k3);
        }
        this.k1 = k1;
        this.b = b;
        this.k3 = k3;
    }

    /**
     * 使用 EngineConfig 注入的参数。
     */
    public static BM25Scorer fromConfig(EngineConfig config) {
        return new BM25Scorer(config.getBm25K1(), config.getBm25B(), config.getBm25K3());
    }

    /**
     * IDF = ln((N - df + 0.5) / (df + 0.5))
     */
    public double computeIdf(int numDocs, int docFrequency) {
        return Math.log((numDocs - docFrequency + 0.5) / (docFrequency + 0.5));
    }

    /**
     * 文档侧词频权重，按文档长度与平均长度之比归一化。
     */
    public double termFrequencyWeight(int termFrequency, int docLength, double avgDocLength) {
        double lengthRatio = avgDocLength > 0 ? docLength / avgDocLength : 0.0;
        return ((k1 + 1.0) * termFrequency) / ((k1 * ((1.0 - b) + b * lengthRatio)) + termFrequency);
    }

    /**
     * 查询侧词频权重。
     */
    public double queryTermWeight(int queryTermFrequency) {
        return ((k3 + 1.0) * queryTermFrequency) / (k3 + queryTermFrequency);
    }

    /**
     * 单个 (查询词, 文档) 的得分贡献。
     */
    public double score(int termFrequency, int docLength, double avgDocLength, int numDocs, int docFrequency,
                        int queryTermFrequency) {
        return termFrequencyWeight(termFrequency, docLength, avgDocLength)
            * computeIdf(numDocs, docFrequency)
            * queryTermWeight(queryTermFrequency);
    }

    public double getK1() {
        return k1;
    }

    public double getB() {
        return b;
    }

    public double getK3() {
        return k3;
    }
}
