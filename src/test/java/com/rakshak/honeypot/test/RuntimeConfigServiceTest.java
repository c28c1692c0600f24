package com.rakshak.honeypot.test;

import com.rakshak.honeypot.service.impl.RuntimeConfigServiceImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RuntimeConfigServiceTest {

    @Test
    @DisplayName("未覆蓋時使用預設值")
    public void testDefaults() {
        RuntimeConfigServiceImpl config = new RuntimeConfigServiceImpl();

        assertEquals(7, config.getScoreThreshold());
        assertEquals(10, config.getScoreDenominator());
        assertEquals(0.65, config.getEstimatorCutover(), 1e-9);
        assertEquals(6, config.getEstimatorWeight());
        assertEquals(3, config.getMinWords());
        assertEquals(200, config.getCorpusScanLimit());
        assertEquals(3, config.getEscalationMinTurns());
        assertEquals(5000, config.getEscalationTimeoutMs());
        assertEquals(30, config.getRateLimitMaxRequests());
        assertEquals(60, config.getRateLimitWindowSeconds());
    }

    @Test
    @DisplayName("null 參數不覆蓋原值")
    public void testPartialUpdate() {
        RuntimeConfigServiceImpl config = new RuntimeConfigServiceImpl();
        config.updateDetection(9, null, null, null, null, null);
        config.updateEscalation(5, null, null);
        config.updateRateLimit(null, 10);

        assertEquals(9, config.getScoreThreshold());
        assertEquals(10, config.getScoreDenominator());
        assertEquals(5, config.getEscalationMinTurns());
        assertEquals(30, config.getRateLimitMaxRequests());
        assertEquals(10, config.getRateLimitWindowSeconds());
    }

    @Test
    @DisplayName("分母至少為 1")
    public void testDenominatorFloor() {
        RuntimeConfigServiceImpl config = new RuntimeConfigServiceImpl();
        config.updateDetection(null, 0, null, null, null, null);

        assertEquals(1, config.getScoreDenominator());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("快照包含三類設定")
    public void testSnapshot() {
        RuntimeConfigServiceImpl config = new RuntimeConfigServiceImpl();
        config.updateEscalation(null, "http://collector/api", null);

        Map<String, Object> snapshot = config.snapshot();
        Map<String, Object> escalation = (Map<String, Object>) snapshot.get("escalation");

        assertTrue(snapshot.containsKey("detection"));
        assertTrue(snapshot.containsKey("rateLimit"));
        assertEquals("http://collector/api", escalation.get("callbackUrl"));
    }
}
