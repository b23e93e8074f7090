package com.diskindex.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 一次查询的全部命中，按得分升序排列，同分按 DocID 升序。
 */
public record SearchResult(
        String query,
        List<SearchHit> hits,
        int matchedTerms,
        long elapsedMs
) {
    /** 得分升序，同分 DocID 升序 */
    public static final Comparator<SearchHit> ASCENDING = Comparator
            .comparingDouble(SearchHit::score)
            .thenComparingInt(SearchHit::docId);

    /** 得分降序，同分 DocID 升序 */
    public static final Comparator<SearchHit> DESCENDING = Comparator
            .comparingDouble(SearchHit::score).reversed()
            .thenComparingInt(SearchHit::docId);

    public SearchResult {
        hits = List.copyOf(hits);
    }

    /**
     * 空结果。
     */
    public static SearchResult empty(String query, long elapsedMs) {
        return new SearchResult(query, List.of(), 0, elapsedMs);
    }

    public int totalMatches() {
        return hits.size();
    }

    /**
     * 最优在前的视图。
     */
    public List<SearchHit> descending() {
        List<SearchHit> sorted = new ArrayList<>(hits);
        sorted.sort(DESCENDING);
        return List.copyOf(sorted);
    }

    /**
     * 得分最高的 k 个命中，最优在前。
     */
    public List<SearchHit> top(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k 不能为负数: " + k);
        }
        List<SearchHit> sorted = descending();
        return sorted.subList(0, Math.min(k, sorted.size()));
    }
}
