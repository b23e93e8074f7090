package com.diskindex.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TermIdMappingTest {

    @Test
    @DisplayName("首次出现的词项获得下一个稠密ID")
    void testGetOrAssign() {
        TermIdMapping mapping = TermIdMapping.create();
        assertEquals(0, mapping.getOrAssign("alpha"));
        assertEquals(1, mapping.getOrAssign("beta"));
        assertEquals(0, mapping.getOrAssign("alpha"));
        assertEquals("beta", mapping.term(1));
        assertEquals(List.of("alpha", "beta"), mapping.termsById());
        assertEquals(OptionalInt.empty(), mapping.lookup("gamma"));
        assertThrows(IndexOutOfBoundsException.class, () -> mapping.term(2));
    }

    @Test
    @DisplayName("只读映射不能分配新词项")
    void testReadOnly() {
        TermIdMapping mapping = TermIdMapping.readOnly(List.of("x", "y"));
        assertTrue(mapping.isReadOnly());
        assertEquals(1, mapping.getOrAssign("y"));
        assertThrows(IllegalStateException.class, () -> mapping.getOrAssign("z"));
        assertThrows(IllegalArgumentException.class, () -> TermIdMapping.readOnly(List.of("x", "x")));
    }

    @Test
    @DisplayName("并发分配得到全局唯一且稠密的ID")
    void testConcurrentAssignment() throws Exception {
        TermIdMapping mapping = TermIdMapping.create();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 8; worker++) {
                futures.add(executor.submit(() -> {
                    for (int index = 0; index < 1000; index++) {
                        mapping.getOrAssign("term" + index);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1000, mapping.size());
        Set<Integer> ids = new HashSet<>();
        for (int index = 0; index < 1000; index++) {
            ids.add(mapping.lookup("term" + index).getAsInt());
        }
        assertEquals(1000, ids.size());
        assertEquals(0, ids.stream().mapToInt(Integer::intValue).min().getAsInt());
        assertEquals(999, ids.stream().mapToInt(Integer::intValue).max().getAsInt());
    }
}
