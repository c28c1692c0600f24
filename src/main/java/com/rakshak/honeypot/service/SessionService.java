package com.rakshak.honeypot.service;

import com.rakshak.honeypot.model.ConversationSession;
import com.rakshak.honeypot.model.ExtractedEntities;

import java.util.Collection;
import java.util.Map;

/**
 * Session 服務介面
 * 負責對話 Session 的生命週期、用戶端限流與跨對話的付款帳號統計
 */
public interface SessionService {

    /**
     * 取得指定 Session（不建立、不更新活躍時間）
     *
     * @param sessionId Session ID
     * @return ConversationSession，不存在或已過期時為 null
     */
    ConversationSession getSession(String sessionId);

    /**
     * 取得或建立 Session
     * 已過期的 Session 會被全新的紀錄取代；仍有效時更新活躍時間
     *
     * @param sessionId Session ID
     * @return ConversationSession（保證不為 null）
     */
    ConversationSession getOrCreateSession(String sessionId);

    /**
     * 將訊息加入 Session 歷史
     */
    void appendMessage(String sessionId, String text);

    /**
     * 合併抽取結果與可疑關鍵字到 Session 累積情資，並累計付款帳號出現次數
     *
     * @return 有任何新成員加入時回傳 true
     */
    boolean mergeIntelligence(String sessionId, ExtractedEntities extracted, Collection<String> keywords);

    /**
     * 合併情資到呼叫端已持有的 Session，並累計付款帳號出現次數
     * 不經由 Session 表查找，可在 {@link ConversationSession#locked} 內呼叫
     *
     * @return 有任何新成員加入時回傳 true
     */
    boolean mergeIntelligence(ConversationSession session, ExtractedEntities extracted, Collection<String> keywords);

    /**
     * 標記 Session 已送出報告
     *
     * @return 只有實際將旗標由 false 轉為 true 的那次呼叫回傳 true
     */
    boolean markEscalated(String sessionId);

    /**
     * 對方是否疑似自動化程式（最近三則訊息字數相同）
     */
    boolean isLikelyAutomated(String sessionId);

    /**
     * 固定視窗限流
     *
     * @param clientId 用戶端識別（通常為網路位址）
     * @return true 表示超過上限，應拒絕此請求
     */
    boolean checkRateLimit(String clientId);

    /**
     * 清除指定 Session
     */
    void clearSession(String sessionId);

    /**
     * 清理所有過期的 Session 與限流桶
     */
    void cleanExpiredSessions();

    /**
     * 取得目前活躍的 Session 數量
     */
    int getActiveSessionCount();

    /**
     * 取得出現次數最多的付款帳號
     *
     * @param limit 筆數上限
     * @return 付款帳號 → 出現次數（遞減排序）
     */
    Map<String, Long> getTopArtifacts(int limit);
}
