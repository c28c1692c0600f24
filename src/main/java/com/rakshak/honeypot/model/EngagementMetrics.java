package com.rakshak.honeypot.model;

/**
 * 對話互動指標
 *
 * @param turnCount                  已交換訊息數
 * @param simulatedResponseDelayMs   模擬人類回覆延遲（毫秒）
 * @param likelyAutomatedCounterpart 對方疑似為自動化程式
 * @param conversationFlagged        對話曾被判定為詐騙（累積）
 * @param escalationSent             已送出情資報告
 */
public record EngagementMetrics(
        int turnCount,
        long simulatedResponseDelayMs,
        boolean likelyAutomatedCounterpart,
        boolean conversationFlagged,
        boolean escalationSent) {
}
