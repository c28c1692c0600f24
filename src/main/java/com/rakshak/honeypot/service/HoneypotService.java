package com.rakshak.honeypot.service;

import com.rakshak.honeypot.model.AccumulatedIntelligence;
import com.rakshak.honeypot.model.EngagementMetrics;
import com.rakshak.honeypot.model.HoneypotRequest;

import java.util.List;
import java.util.Map;

/**
 * 蜜罐對話服務介面
 * 串接限流、Session、判定、情資抽取與報告升級
 */
public interface HoneypotService {

    /**
     * 用戶端是否超過限流上限（每次呼叫都會計入一次請求）
     *
     * @param clientId 用戶端識別
     * @return true 表示應拒絕
     */
    boolean isRateLimited(String clientId);

    /**
     * 處理一則訊息
     *
     * @param request  請求內容
     * @param clientId 用戶端識別（未提供 sessionId 時作為 Session ID）
     * @return 處理結果
     */
    HoneypotResult processMessage(HoneypotRequest request, String clientId);

    /**
     * 取得 Session 累積情資，Session 不存在時為 null
     */
    SessionView getSessionView(String sessionId);

    /**
     * 清除指定 Session
     */
    void clearSession(String sessionId);

    /**
     * 取得累計統計（total / scam / safe）
     */
    Map<String, Long> getStats();

    /**
     * 處理結果
     */
    record HoneypotResult(
            String sessionId,
            boolean scamDetected,
            double confidence,
            String reply,
            AccumulatedIntelligence extractedIntelligence,
            EngagementMetrics engagementMetrics) {
    }

    /**
     * Session 查詢結果
     */
    record SessionView(
            String sessionId,
            long createdAt,
            long lastActiveAt,
            int turnCount,
            List<String> history,
            boolean conversationFlagged,
            boolean escalationSent,
            AccumulatedIntelligence extractedIntelligence) {
    }
}
