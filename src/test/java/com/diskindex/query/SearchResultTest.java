package com.diskindex.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SearchResultTest {

    private static final SearchHit LOW = new SearchHit(2, "c", "default", -1.0);
    private static final SearchHit TIE_FIRST = new SearchHit(0, "a", "default", 0.5);
    private static final SearchHit TIE_SECOND = new SearchHit(1, "b", "default", 0.5);
    private static final SearchHit HIGH = new SearchHit(3, "d", "default", 2.0);

    @Test
    @DisplayName("降序视图最优在前，同分按DocID升序")
    void testDescending() {
        SearchResult result = new SearchResult("q", List.of(LOW, TIE_FIRST, TIE_SECOND, HIGH), 1, 0);
        assertEquals(List.of(HIGH, TIE_FIRST, TIE_SECOND, LOW), result.descending());
        assertEquals(List.of(LOW, TIE_FIRST, TIE_SECOND, HIGH), result.hits());
    }

    @Test
    @DisplayName("top(k)截取最优的k个命中")
    void testTop() {
        SearchResult result = new SearchResult("q", List.of(LOW, TIE_FIRST, HIGH), 1, 0);
        assertEquals(List.of(HIGH, TIE_FIRST), result.top(2));
        assertEquals(3, result.top(10).size());
        assertTrue(result.top(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> result.top(-1));
    }

    @Test
    void testEmpty() {
        SearchResult result = SearchResult.empty("nothing", 3);
        assertEquals(0, result.totalMatches());
        assertTrue(result.descending().isEmpty());
    }
}
