package com.rakshak.honeypot.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;
import java.util.Objects;

/**
 * 蜜罐訊息請求
 *
 * @param sessionId           對話 ID（可選，未提供時以用戶端位址代替）
 * @param message             本輪訊息
 * @param conversationHistory 先前各輪訊息（可選，僅在新對話時用來補齊歷史）
 */
public record HoneypotRequest(
        @JsonAlias({"conversation_id", "conversationId", "session_id"}) String sessionId,
        String message,
        @JsonAlias("conversation_history") List<String> conversationHistory) {

    public HoneypotRequest {
        conversationHistory = conversationHistory == null
                ? List.of()
                : conversationHistory.stream().filter(Objects::nonNull).toList();
    }
}
