package com.rakshak.honeypot.service.impl;

import com.rakshak.honeypot.service.AuditLogService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 稽核日誌服務實作 (Audit Log Service Implementation)
 * <p>
 * 功能：
 * 記憶體內的輕量稽核紀錄，保存後台設定變更與每次情資報告的送出結果（成功、失敗、被拒絕）。
 * <p>
 * 機制：
 * 1. 使用 `ConcurrentLinkedDeque` 儲存項目，確保 Thread-Safe。
 * 2. Rolling Buffer：數量超過 `maxEntries` 時自動移除最舊的項目。
 */
@Service
public class AuditLogServiceImpl implements AuditLogService {

    @Value("${audit.log.max:1000}")
    private int maxEntries = 1000;

    private final Deque<Entry> entries = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();

    @Override
    public void info(String action, String sessionId, String message, Map<String, Object> data) {
        append(new Entry(System.currentTimeMillis(), "INFO", action, sessionId, message, safeData(data)));
    }

    @Override
    public void warn(String action, String sessionId, String message, Map<String, Object> data) {
        append(new Entry(System.currentTimeMillis(), "WARN", action, sessionId, message, safeData(data)));
    }

    private void append(Entry entry) {
        entries.addLast(entry);
        // ConcurrentLinkedDeque.size() 為 O(n)，另以計數器追蹤
        int current = size.incrementAndGet();
        while (current > Math.max(1, maxEntries)) {
            if (entries.pollFirst() == null) {
                break;
            }
            current = size.decrementAndGet();
        }
    }

    /**
     * 查詢日誌 (Query Logs)
     * <p>
     * 篩選條件：
     * - sinceMs: 時間戳記是否在指定時間之後。
     * - actionContains: 動作名稱是否包含指定關鍵字 (不分大小寫)。
     * - level: 日誌等級 (INFO/WARN) 是否相符。
     * - sessionId: 只看特定對話。
     * 最後依 `limit` 截取最新的 N 筆。
     */
    @Override
    public List<Entry> query(Long sinceMs, Integer limit, String actionContains, String level, String sessionId) {
        long since = sinceMs != null ? sinceMs : 0L;
        int lim = limit != null ? Math.max(1, limit) : 200;

        String actionLike = actionContains != null ? actionContains.toLowerCase(Locale.ROOT) : null;
        String levelLike = level != null ? level.toUpperCase(Locale.ROOT) : null;

        List<Entry> out = new ArrayList<>();
        for (Entry e : entries) {
            if (e.timestampMs() < since) {
                continue;
            }
            if (actionLike != null
                    && (e.action() == null || !e.action().toLowerCase(Locale.ROOT).contains(actionLike))) {
                continue;
            }
            if (levelLike != null && !levelLike.equals(e.level())) {
                continue;
            }
            if (sessionId != null && !sessionId.equals(e.sessionId())) {
                continue;
            }
            out.add(e);
        }

        int from = Math.max(0, out.size() - lim);
        return new ArrayList<>(out.subList(from, out.size()));
    }

    @Override
    public Map<String, Long> countByAction() {
        Map<String, Long> counts = new TreeMap<>();
        for (Entry e : entries) {
            counts.merge(e.action() == null ? "" : e.action(), 1L, Long::sum);
        }
        return counts;
    }

    private static Map<String, Object> safeData(Map<String, Object> data) {
        return data == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(data));
    }
}
