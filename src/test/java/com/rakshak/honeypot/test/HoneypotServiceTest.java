package com.rakshak.honeypot.test;

import com.rakshak.honeypot.model.HoneypotRequest;
import com.rakshak.honeypot.repository.impl.ClasspathScamCorpusRepository;
import com.rakshak.honeypot.service.HoneypotService;
import com.rakshak.honeypot.service.HoneypotService.HoneypotResult;
import com.rakshak.honeypot.service.ReportSender;
import com.rakshak.honeypot.service.impl.AuditLogServiceImpl;
import com.rakshak.honeypot.service.impl.EscalationServiceImpl;
import com.rakshak.honeypot.service.impl.HoneypotServiceImpl;
import com.rakshak.honeypot.service.impl.RuntimeConfigServiceImpl;
import com.rakshak.honeypot.service.impl.ScamClassifierServiceImpl;
import com.rakshak.honeypot.service.impl.SessionServiceImpl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 蜜罐對話流程測試
 * 使用 resources 中的語料，不啟用機率估計器
 */
public class HoneypotServiceTest {

    private ReportSender sender;
    private SessionServiceImpl sessionService;
    private EscalationServiceImpl escalationService;
    private HoneypotServiceImpl honeypotService;

    @BeforeEach
    public void setUp() {
        ClasspathScamCorpusRepository corpus = new ClasspathScamCorpusRepository();
        ReflectionTestUtils.setField(corpus, "templatesFile", "scam_sentences.txt");
        ReflectionTestUtils.setField(corpus, "keywordsFile", "scam_keywords.txt");
        ReflectionTestUtils.setField(corpus, "safeSamplesFile", "safe_samples.txt");
        corpus.init();

        RuntimeConfigServiceImpl config = new RuntimeConfigServiceImpl();
        ScamClassifierServiceImpl classifier = TestFixtures.classifier(corpus, config, null);
        sessionService = TestFixtures.sessionService(MutableClock.startingAt(0L), config);

        sender = mock(ReportSender.class);
        when(sender.send(any())).thenReturn(true);
        escalationService = TestFixtures.escalationService(sender, config, new AuditLogServiceImpl());

        honeypotService = new HoneypotServiceImpl();
        ReflectionTestUtils.setField(honeypotService, "sessionService", sessionService);
        ReflectionTestUtils.setField(honeypotService, "scamClassifierService", classifier);
        ReflectionTestUtils.setField(honeypotService, "escalationService", escalationService);
    }

    @AfterEach
    public void tearDown() {
        escalationService.shutdownExecutor();
    }

    private HoneypotResult send(String sessionId, String message) {
        return honeypotService.processMessage(new HoneypotRequest(sessionId, message, null), "127.0.0.1");
    }

    @Test
    @DisplayName("三輪對話：寒暄、釣魚連結、付款帳號，第三輪送出一次報告")
    public void testThreeTurnScenario() {
        HoneypotResult t1 = send("s1", "hello");
        assertFalse(t1.scamDetected(), "寒暄應為安全");
        assertTrue(t1.confidence() <= 0.10);
        assertEquals(1, t1.engagementMetrics().turnCount());

        HoneypotResult t2 = send("s1", "your account is blocked, verify at http://bad.link");
        assertTrue(t2.scamDetected(), "第二輪應判定為詐騙");
        assertTrue(t2.confidence() >= 0.7, "信心值應 ≥ 0.7，實際: " + t2.confidence());
        assertTrue(t2.extractedIntelligence().phishingLinks().contains("http://bad.link"));
        assertFalse(t2.engagementMetrics().escalationSent(), "兩輪尚未達到報告門檻");

        HoneypotResult t3 = send("s1", "send money to scammer@upi");
        assertTrue(t3.scamDetected());
        assertTrue(t3.extractedIntelligence().phishingLinks().contains("http://bad.link"), "先前情資應保留");
        assertTrue(t3.extractedIntelligence().upiIds().contains("scammer@upi"));
        assertTrue(t3.engagementMetrics().escalationSent());
        assertTrue(t3.engagementMetrics().conversationFlagged());
        assertEquals(3, t3.engagementMetrics().turnCount());

        verify(sender, timeout(2000)).send(argThat(r -> r.sessionId().equals("s1")
                && r.totalMessagesExchanged() == 3
                && r.extractedIntelligence().upiIds().contains("scammer@upi")));

        send("s1", "pay now to scammer@upi");
        verify(sender, after(300).times(1)).send(any());
    }

    @Test
    @DisplayName("回覆依判定結果選擇")
    public void testReplySelection() {
        HoneypotResult safe = send("s2", "see you tomorrow");
        HoneypotResult scam = send("s3", "share your otp to unblock the card");

        assertEquals("Okay, noted. Thanks for the message.", safe.reply());
        assertNotEquals(safe.reply(), scam.reply());
        assertFalse(scam.reply().isBlank());
    }

    @Test
    @DisplayName("模擬延遲落在固定區間")
    public void testSimulatedDelayRange() {
        for (int i = 0; i < 20; i++) {
            long delay = send("s4", "hi").engagementMetrics().simulatedResponseDelayMs();
            assertTrue(delay >= 800 && delay <= 2500, "延遲超出範圍: " + delay);
        }
    }

    @Test
    @DisplayName("未提供 Session ID 時使用用戶端識別")
    public void testClientIdFallback() {
        HoneypotResult r = honeypotService.processMessage(new HoneypotRequest(null, "hi", null), "10.1.2.3");

        assertEquals("10.1.2.3", r.sessionId());
        HoneypotService.SessionView view = honeypotService.getSessionView("10.1.2.3");
        assertNotNull(view);
        assertEquals(List.of("hi"), view.history());
    }

    @Test
    @DisplayName("新對話以請求歷史補齊，並從歷史中抽取情資")
    public void testHistorySeedsNewSession() {
        HoneypotRequest request = new HoneypotRequest("s5", "did you do it?",
                List.of("hello sir", "transfer to refund@okaxis for your refund"));

        HoneypotResult r = honeypotService.processMessage(request, "127.0.0.1");

        assertEquals(3, r.engagementMetrics().turnCount());
        assertTrue(r.extractedIntelligence().upiIds().contains("refund@okaxis"));

        HoneypotResult next = honeypotService.processMessage(request, "127.0.0.1");
        assertEquals(4, next.engagementMetrics().turnCount(), "既有對話不再重複補齊歷史");
    }

    @Test
    @DisplayName("統計計數")
    public void testStats() {
        send("s6", "hello");
        send("s6", "send money to scammer@upi");

        Map<String, Long> stats = honeypotService.getStats();
        assertEquals(2L, stats.get("total"));
        assertEquals(1L, stats.get("scam"));
        assertEquals(1L, stats.get("safe"));
    }

    @Test
    @DisplayName("清除 Session 後查無資料")
    public void testClearSession() {
        send("s7", "hello");
        honeypotService.clearSession("s7");

        assertNull(honeypotService.getSessionView("s7"));
    }

    @Test
    @DisplayName("同一對話併發處理：不死結、輪數不遺漏、情資不重複、只送出一次報告")
    public void testConcurrentTurnsOnSameSession() throws Exception {
        int threads = 8;
        int turnsPerThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads + 1);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < turnsPerThread; i++) {
                        send("same", "send money to scammer@upi now " + i);
                    }
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < turnsPerThread; i++) {
                    send("other", "hello");
                }
                return null;
            }));

            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        HoneypotService.SessionView view = honeypotService.getSessionView("same");
        assertEquals(threads * turnsPerThread, view.turnCount(), "每一輪都應寫入歷史");
        assertEquals(List.of("scammer@upi"), view.extractedIntelligence().upiIds(), "情資以集合累積，不重複");
        assertEquals(threads * turnsPerThread, sessionService.getTopArtifacts(1).get("scammer@upi").longValue(),
                "每輪只累計一次付款帳號");
        assertTrue(view.escalationSent());
        assertEquals(turnsPerThread, honeypotService.getSessionView("other").turnCount());

        verify(sender, timeout(2000)).send(argThat(r -> r.sessionId().equals("same")));
        verify(sender, after(300).times(1)).send(any());
    }
}
