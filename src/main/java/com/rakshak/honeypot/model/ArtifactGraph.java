package com.rakshak.honeypot.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 跨 Session 的付款帳號出現次數表
 * <p>
 * 計數以 `merge` 在 ConcurrentHashMap 的 per-key 鎖內累加，不使用全域鎖。
 * 容量有上限：新 key 進入且已達上限時，一次淘汰出現次數最少的一批（容量的 1/10），
 * 掃描成本由之後的多次新增分攤。淘汰只移除計數未被改變的項目，不會吃掉併發的累加；
 * 淘汰與新增之間不互斥，高併發下容量可能短暫超出少許。
 */
public class ArtifactGraph {

    private static final int EVICTION_BATCH_DIVISOR = 10;

    private final ConcurrentHashMap<String, Long> counters = new ConcurrentHashMap<>();
    private final ReentrantLock evictionLock = new ReentrantLock();
    private final int maxEntries;

    public ArtifactGraph(int maxEntries) {
        this.maxEntries = Math.max(1, maxEntries);
    }

    public void record(String artifact) {
        if (artifact == null || artifact.isEmpty()) {
            return;
        }
        if (!counters.containsKey(artifact) && counters.size() >= maxEntries) {
            evictLeastObserved();
        }
        counters.merge(artifact, 1L, Long::sum);
    }

    public long count(String artifact) {
        if (artifact == null) {
            return 0L;
        }
        return counters.getOrDefault(artifact, 0L);
    }

    public int size() {
        return counters.size();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    /**
     * 依出現次數遞減排序，取前 limit 筆
     */
    public Map<String, Long> top(int limit) {
        return counters.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(Math.max(0, limit))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (a, b) -> a, LinkedHashMap::new));
    }

    /**
     * 同一時間只有一個執行緒做淘汰掃描，其餘執行緒直接新增
     */
    private void evictLeastObserved() {
        if (!evictionLock.tryLock()) {
            return;
        }
        try {
            int overflow = counters.size() - maxEntries;
            if (overflow < 0) {
                return;
            }
            int batch = overflow + Math.max(1, maxEntries / EVICTION_BATCH_DIVISOR);
            counters.entrySet().stream()
                    .map(e -> Map.entry(e.getKey(), e.getValue()))
                    .sorted(Map.Entry.<String, Long>comparingByValue()
                            .thenComparing(Map.Entry.comparingByKey()))
                    .limit(batch)
                    .forEach(e -> counters.remove(e.getKey(), e.getValue()));
        } finally {
            evictionLock.unlock();
        }
    }
}
