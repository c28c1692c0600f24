package com.rakshak.honeypot.service;

import java.util.List;
import java.util.Map;

/**
 * 稽核日誌服務介面
 * 記錄設定變更與情資報告送出結果，供後台查詢
 */
public interface AuditLogService {
    record Entry(long timestampMs, String level, String action, String sessionId, String message,
            Map<String, Object> data) {
    }

    void info(String action, String sessionId, String message, Map<String, Object> data);

    void warn(String action, String sessionId, String message, Map<String, Object> data);

    List<Entry> query(Long sinceMs, Integer limit, String actionContains, String level, String sessionId);

    Map<String, Long> countByAction();
}
