package com.rakshak.honeypot.service.impl;

import com.rakshak.honeypot.model.AccumulatedIntelligence;
import com.rakshak.honeypot.model.ConversationSession;
import com.rakshak.honeypot.model.DetectionResult;
import com.rakshak.honeypot.model.EscalationReport;
import com.rakshak.honeypot.service.AuditLogService;
import com.rakshak.honeypot.service.EscalationService;
import com.rakshak.honeypot.service.ReportSender;
import com.rakshak.honeypot.service.RuntimeConfigService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 情資報告升級服務實作 (Escalation Service Implementation)
 * <p>
 * 功能：
 * 對話被確認為詐騙且達到最少輪數時，組出報告並交由背景執行緒送往外部收集端。
 * <p>
 * 機制：
 * 1. 在傳入的 Session 物件上呼叫 {@link ConversationSession#markEscalated()} 取得唯一送出權，
 *    旗標與報告內容來自同一個物件，同一對話只會成功一次。
 * 2. 報告在有界的 ThreadPool 中送出，不阻塞訊息判定流程。
 * 3. 送出失敗（逾時、無法連線、非 2xx、佇列已滿）只記錄日誌，不重試、不還原旗標。
 */
@Service
public class EscalationServiceImpl implements EscalationService {

    private static final Logger logger = LoggerFactory.getLogger(EscalationServiceImpl.class);

    @Autowired
    private ReportSender reportSender;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Autowired
    private AuditLogService auditLogService;

    private final ThreadPoolExecutor executor = new ThreadPoolExecutor(
            2,
            4,
            60L,
            TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(100),
            new ThreadPoolExecutor.AbortPolicy());

    @PreDestroy
    public void shutdownExecutor() {
        executor.shutdown();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean escalateIfEligible(ConversationSession session, DetectionResult detection) {
        if (session == null || detection == null || !detection.scamDetected()) {
            return false;
        }
        int totalMessages = session.getMessageCount();
        if (totalMessages < runtimeConfigService.getEscalationMinTurns()) {
            return false;
        }
        if (!session.markEscalated()) {
            return false;
        }

        EscalationReport report = buildReport(session.getSessionId(), totalMessages,
                session.snapshotIntelligence(), detection);
        dispatch(report);
        return true;
    }

    /**
     * 背景送出 (Dispatch)
     * <p>
     * 佇列已滿時直接放棄此報告：旗標已設定，不會再有第二次機會。
     */
    private void dispatch(EscalationReport report) {
        try {
            executor.execute(() -> deliver(report));
            logger.info("情資報告已排入送出佇列: sessionId={}, messages={}",
                    report.sessionId(), report.totalMessagesExchanged());
        } catch (RejectedExecutionException e) {
            logger.warn("情資報告被拒絕（執行緒池已滿），放棄送出: sessionId={}", report.sessionId());
            auditLogService.warn("escalation.rejected", report.sessionId(), "Dispatch queue full", Map.of());
        }
    }

    private void deliver(EscalationReport report) {
        boolean delivered;
        try {
            delivered = reportSender.send(report);
        } catch (RuntimeException e) {
            logger.warn("情資報告送出時發生錯誤: sessionId={}, error={}", report.sessionId(), e.getMessage());
            delivered = false;
        }
        Map<String, Object> data = Map.of(
                "totalMessagesExchanged", report.totalMessagesExchanged(),
                "artifacts", report.extractedIntelligence().artifactCount());
        if (delivered) {
            auditLogService.info("escalation.delivered", report.sessionId(), "Report delivered", data);
        } else {
            auditLogService.warn("escalation.failed", report.sessionId(), "Report delivery failed", data);
        }
    }

    /**
     * 組合報告 (Build Report)
     * <p>
     * agentNotes 簡述判定依據：做出判定的規則、命中的關鍵字與各類情資數量。
     */
    @Override
    public EscalationReport buildReport(String sessionId, int totalMessages, AccumulatedIntelligence intelligence,
            DetectionResult detection) {
        AccumulatedIntelligence snapshot = intelligence == null ? AccumulatedIntelligence.empty() : intelligence;

        List<String> notes = new ArrayList<>();
        notes.add(String.format("Scam confirmed after %d messages (decided by %s, confidence %.2f)",
                totalMessages,
                detection == null ? "unknown" : detection.decidedBy(),
                detection == null ? 0.0 : detection.confidence()));
        if (!snapshot.suspiciousKeywords().isEmpty()) {
            notes.add("keywords: " + String.join(", ", snapshot.suspiciousKeywords()));
        }
        notes.add(String.format("payment ids: %d, bank accounts: %d, links: %d, phone numbers: %d",
                snapshot.upiIds().size(), snapshot.bankAccounts().size(),
                snapshot.phishingLinks().size(), snapshot.phoneNumbers().size()));

        return new EscalationReport(sessionId, true, totalMessages, snapshot, String.join("; ", notes));
    }
}
