package com.rakshak.honeypot.model;

/**
 * 外送至情資收集端的詐騙確認報告
 */
public record EscalationReport(
        String sessionId,
        boolean scamDetected,
        int totalMessagesExchanged,
        AccumulatedIntelligence extractedIntelligence,
        String agentNotes) {
}
