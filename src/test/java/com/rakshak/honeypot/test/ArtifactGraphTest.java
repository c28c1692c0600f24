package com.rakshak.honeypot.test;

import com.rakshak.honeypot.model.ArtifactGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ArtifactGraphTest {

    @Test
    @DisplayName("累計出現次數並依次數排序")
    public void testCountsAndTopOrdering() {
        ArtifactGraph graph = new ArtifactGraph(100);
        graph.record("b@upi");
        graph.record("a@upi");
        graph.record("a@upi");
        graph.record("c@upi");

        Map<String, Long> top = graph.top(2);
        assertEquals(List.of("a@upi", "b@upi"), List.copyOf(top.keySet()), "次數相同時依字母排序");
        assertEquals(2L, top.get("a@upi"));
        assertEquals(0L, graph.count("missing@upi"));
    }

    @Test
    @DisplayName("達到容量時淘汰出現次數最少的項目")
    public void testEvictsLeastObservedAtCapacity() {
        ArtifactGraph graph = new ArtifactGraph(2);
        graph.record("a@upi");
        graph.record("a@upi");
        graph.record("b@upi");

        graph.record("c@upi");

        assertEquals(2, graph.size());
        assertEquals(2L, graph.count("a@upi"));
        assertEquals(0L, graph.count("b@upi"), "b 出現次數最少，應被淘汰");
        assertEquals(1L, graph.count("c@upi"));
    }

    @Test
    @DisplayName("已存在的項目不觸發淘汰")
    public void testExistingKeyDoesNotEvict() {
        ArtifactGraph graph = new ArtifactGraph(2);
        graph.record("a@upi");
        graph.record("b@upi");
        graph.record("b@upi");

        assertEquals(2, graph.size());
        assertEquals(1L, graph.count("a@upi"));
    }

    @Test
    @DisplayName("忽略空值")
    public void testIgnoresBlank() {
        ArtifactGraph graph = new ArtifactGraph(0);
        graph.record(null);
        graph.record("");

        assertEquals(0, graph.size());
        assertEquals(1, graph.getMaxEntries(), "容量至少為 1");
        assertTrue(graph.top(10).isEmpty());
    }

    @Test
    @DisplayName("達到容量時一次淘汰一批最少出現的項目")
    public void testEvictsBatchAtCapacity() {
        ArtifactGraph graph = new ArtifactGraph(20);
        graph.record("hot@upi");
        graph.record("hot@upi");
        for (int i = 0; i < 19; i++) {
            graph.record("k" + i + "@upi");
        }

        graph.record("new@upi");

        assertEquals(19, graph.size(), "20 筆時淘汰 2 筆，再加入 1 筆");
        assertEquals(2L, graph.count("hot@upi"));
        assertEquals(1L, graph.count("new@upi"));
        assertEquals(0L, graph.count("k0@upi"), "次數相同時依字母順序淘汰");
        assertEquals(0L, graph.count("k10@upi"));
        assertEquals(1L, graph.count("k1@upi"));
    }

    @Test
    @DisplayName("淘汰期間併發累加不遺失")
    public void testConcurrentIncrementsSurviveEviction() throws Exception {
        ArtifactGraph graph = new ArtifactGraph(50);
        for (int i = 0; i < 100; i++) {
            graph.record("hot@upi");
        }
        int threads = 8;
        int perThread = 2000;
        ExecutorService pool = Executors.newFixedThreadPool(threads * 2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        graph.record("hot@upi");
                    }
                    return null;
                }));
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        graph.record("t" + id + "-" + i + "@upi");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(100L + (long) threads * perThread, graph.count("hot@upi"));
    }
}
