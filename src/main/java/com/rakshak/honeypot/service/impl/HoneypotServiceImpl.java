package com.rakshak.honeypot.service.impl;

import com.rakshak.honeypot.model.ConversationSession;
import com.rakshak.honeypot.model.DetectionResult;
import com.rakshak.honeypot.model.EngagementMetrics;
import com.rakshak.honeypot.model.ExtractedEntities;
import com.rakshak.honeypot.model.HoneypotRequest;
import com.rakshak.honeypot.service.EscalationService;
import com.rakshak.honeypot.service.HoneypotService;
import com.rakshak.honeypot.service.ScamClassifierService;
import com.rakshak.honeypot.service.SessionService;
import com.rakshak.honeypot.util.EntityExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 蜜罐對話服務實作 (Honeypot Service Implementation)
 * <p>
 * 功能：
 * 作為整個系統的協調者，處理每一則進來的對話訊息。
 * <p>
 * 核心流程：
 * 1. 決定 Session ID（請求未提供時使用用戶端識別）。
 * 2. 在 Session lock 內完成一整輪：補齊歷史、加入訊息、判定、抽取情資、合併、檢查是否送出報告。
 * 3. 依判定結果挑選回覆：詐騙時回覆誘導對方透露更多資訊的句子，否則回覆中性確認。
 * 4. 回傳本輪判定、累積情資與互動指標。
 */
@Service
public class HoneypotServiceImpl implements HoneypotService {

    private static final Logger logger = LoggerFactory.getLogger(HoneypotServiceImpl.class);

    static final List<String> PROBING_REPLIES = List.of(
            "Oh no, what should I do? Can you explain the process again?",
            "I am a bit confused. Which account details do you need exactly?",
            "Okay, but where should I send it? Please share the full details.",
            "Is there any other way to verify? My app is not opening.",
            "Which bank are you calling from? Can you share your employee ID?",
            "I tried but it failed. Can you send the link or UPI ID once more?");

    static final String NEUTRAL_REPLY = "Okay, noted. Thanks for the message.";

    static final long MIN_SIMULATED_DELAY_MS = 800L;
    static final long MAX_SIMULATED_DELAY_MS = 2500L;

    @Autowired
    private SessionService sessionService;

    @Autowired
    private ScamClassifierService scamClassifierService;

    @Autowired
    private EscalationService escalationService;

    private final AtomicLong totalCount = new AtomicLong();
    private final AtomicLong scamCount = new AtomicLong();
    private final AtomicLong safeCount = new AtomicLong();

    @Override
    public boolean isRateLimited(String clientId) {
        return sessionService.checkRateLimit(clientId);
    }

    /**
     * 處理訊息 (Process Message)
     * <p>
     * 同一 Session 的一整輪處理都在 {@link ConversationSession#locked} 中執行，
     * 同一對話的併發請求不會交錯造成重複計算或重複送出報告；不同對話互不影響。
     *
     * @param request  請求
     * @param clientId 用戶端識別
     * @return 處理結果
     */
    @Override
    public HoneypotResult processMessage(HoneypotRequest request, String clientId) {
        final long t0 = System.nanoTime();
        String sid = resolveSessionId(request.sessionId(), clientId);
        String message = request.message() == null ? "" : request.message();

        cleanExpiredSessions();
        ConversationSession session = sessionService.getOrCreateSession(sid);

        HoneypotResult result = session.locked(() -> {
            StringBuilder scanText = new StringBuilder();
            if (session.getMessageCount() == 0 && !request.conversationHistory().isEmpty()) {
                for (String prior : request.conversationHistory()) {
                    session.appendMessage(prior);
                    scanText.append(prior).append('\n');
                }
                logger.debug("Session {} 以請求歷史補齊 {} 則訊息", sid, request.conversationHistory().size());
            }
            session.appendMessage(message);
            scanText.append(message);

            DetectionResult detection = scamClassifierService.classify(message);

            ExtractedEntities extracted = EntityExtractor.extract(scanText.toString());
            List<String> keywords = scamClassifierService.findSuspiciousKeywords(scanText.toString());
            sessionService.mergeIntelligence(session, extracted, keywords);

            if (detection.scamDetected()) {
                session.markScamConfirmed();
            }
            boolean escalatedNow = escalationService.escalateIfEligible(session, detection);
            if (escalatedNow) {
                logger.info("Session {} 已確認為詐騙並觸發情資報告", sid);
            }

            EngagementMetrics metrics = new EngagementMetrics(
                    session.getMessageCount(),
                    simulatedDelayMs(),
                    session.isLikelyAutomated(),
                    session.isScamConfirmed(),
                    session.isEscalationSent());

            return new HoneypotResult(
                    sid,
                    detection.scamDetected(),
                    detection.confidence(),
                    chooseReply(detection.scamDetected()),
                    session.snapshotIntelligence(),
                    metrics);
        });

        totalCount.incrementAndGet();
        if (result.scamDetected()) {
            scamCount.incrementAndGet();
        } else {
            safeCount.incrementAndGet();
        }

        long totalMs = (System.nanoTime() - t0) / 1_000_000;
        logger.info("PERF(honeypot) sid={} scam={} confidence={} turns={} totalMs={}",
                sid, result.scamDetected(), String.format("%.2f", result.confidence()),
                result.engagementMetrics().turnCount(), totalMs);
        return result;
    }

    @Override
    public SessionView getSessionView(String sessionId) {
        ConversationSession session = sessionService.getSession(sessionId);
        if (session == null) {
            return null;
        }
        return new SessionView(
                session.getSessionId(),
                session.getCreatedAt(),
                session.getLastActiveAt(),
                session.getMessageCount(),
                session.getHistory(),
                session.isScamConfirmed(),
                session.isEscalationSent(),
                session.snapshotIntelligence());
    }

    @Override
    public void clearSession(String sessionId) {
        sessionService.clearSession(sessionId);
    }

    @Override
    public Map<String, Long> getStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("total", totalCount.get());
        stats.put("scam", scamCount.get());
        stats.put("safe", safeCount.get());
        return stats;
    }

    // ========== 私有輔助方法 ==========

    private void cleanExpiredSessions() {
        sessionService.cleanExpiredSessions();
    }

    private static String resolveSessionId(String sessionId, String clientId) {
        if (sessionId != null && !sessionId.isBlank()) {
            return sessionId.trim();
        }
        return clientId == null || clientId.isBlank() ? "anonymous" : clientId;
    }

    private static String chooseReply(boolean scam) {
        if (!scam) {
            return NEUTRAL_REPLY;
        }
        return PROBING_REPLIES.get(ThreadLocalRandom.current().nextInt(PROBING_REPLIES.size()));
    }

    private static long simulatedDelayMs() {
        return ThreadLocalRandom.current().nextLong(MIN_SIMULATED_DELAY_MS, MAX_SIMULATED_DELAY_MS + 1);
    }
}
