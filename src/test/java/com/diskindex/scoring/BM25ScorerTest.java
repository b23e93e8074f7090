package com.diskindex.scoring;

import com.diskindex.config.EngineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class BM25ScorerTest {

    private static final double EPSILON = 1e-12;

    private final BM25Scorer scorer = new BM25Scorer();

    @ParameterizedTest
    @CsvSource({
        "2, 2",
        "2, 1",
        "10, 1",
        "10, 5",
        "10, 10",
        "1000, 3"
    })
    @DisplayName("IDF = ln((N - df + 0.5) / (df + 0.5))，不做截断")
    void testIdfFormula(int numDocs, int docFrequency) {
        double expected = Math.log((numDocs - docFrequency + 0.5) / (docFrequency + 0.5));
        assertEquals(expected, scorer.computeIdf(numDocs, docFrequency), EPSILON);
    }

    @Test
    @DisplayName("出现在全部文档中的词项IDF为负")
    void testNegativeIdf() {
        assertEquals(Math.log(0.2), scorer.computeIdf(2, 2), EPSILON);
        assertTrue(scorer.computeIdf(2, 2) < 0);
    }

    @Test
    @DisplayName("文档侧与查询侧词频权重")
    void testWeights() {
        double expectedTf = (2.5 * 2) / (1.5 * (0.25 + 0.75 * 3 / 2.5) + 2);
        assertEquals(expectedTf, scorer.termFrequencyWeight(2, 3, 2.5), EPSILON);

        assertEquals(1.0, scorer.queryTermWeight(1), EPSILON);
        assertEquals(501.0 * 2 / 502.0, scorer.queryTermWeight(2), EPSILON);
    }

    @Test
    @DisplayName("贡献值为TF·IDF·QTF")
    void testScoreIsProduct() {
        double expected = scorer.termFrequencyWeight(3, 10, 8.0)
            * scorer.computeIdf(100, 7)
            * scorer.queryTermWeight(2);
        assertEquals(expected, scorer.score(3, 10, 8.0, 100, 7, 2), EPSILON);
    }

    @Test
    @DisplayName("参数由配置注入，非法参数被拒绝")
    void testConfiguredParameters() {
        EngineConfig config = EngineConfig.defaults();
        config.setBm25K1(1.2);
        config.setBm25B(0.5);
        config.setBm25K3(8);
        BM25Scorer configured = BM25Scorer.fromConfig(config);
        assertEquals(1.2, configured.getK1());
        assertEquals(0.5, configured.getB());
        assertEquals(8.0, configured.getK3());
        assertEquals(9.0 * 3 / 11.0, configured.queryTermWeight(3), EPSILON);

        assertThrows(IllegalArgumentException.class, () -> new BM25Scorer(1.5, 1.5, 500));
        assertThrows(IllegalArgumentException.class, () -> new BM25Scorer(-1, 0.75, 500));
    }
}
