package com.rakshak.honeypot.test;

import com.rakshak.honeypot.service.AuditLogService;
import com.rakshak.honeypot.service.impl.AuditLogServiceImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AuditLogServiceTest {

    @Test
    @DisplayName("超過上限時丟棄最舊的紀錄")
    public void testRollingWindow() {
        AuditLogServiceImpl log = new AuditLogServiceImpl();
        ReflectionTestUtils.setField(log, "maxEntries", 3);

        for (int i = 0; i < 5; i++) {
            log.info("escalation.delivered", "s" + i, "Report delivered", Map.of());
        }

        List<AuditLogService.Entry> all = log.query(null, null, null, null, null);
        assertEquals(3, all.size());
        assertEquals("s2", all.get(0).sessionId());
        assertEquals("s4", all.get(2).sessionId());
    }

    @Test
    @DisplayName("依動作、等級與 Session 篩選")
    public void testQueryFilters() {
        AuditLogServiceImpl log = new AuditLogServiceImpl();
        log.info("escalation.delivered", "s1", "ok", Map.of());
        log.warn("escalation.failed", "s2", "failed", Map.of("status", 500));
        log.info("config.update", null, "updated", null);

        assertEquals(2, log.query(null, null, "ESCALATION", null, null).size());
        assertEquals(1, log.query(null, null, null, "warn", null).size());
        assertEquals("escalation.failed", log.query(null, null, null, null, "s2").get(0).action());
        assertEquals(1, log.query(null, 1, null, null, null).size());
        assertEquals(Map.of("config.update", 1L, "escalation.delivered", 1L, "escalation.failed", 1L),
                log.countByAction());
    }

    @Test
    @DisplayName("附加資料允許 null 值且不受外部修改影響")
    public void testDataIsCopied() {
        AuditLogServiceImpl log = new AuditLogServiceImpl();
        Map<String, Object> data = new HashMap<>();
        data.put("reason", null);
        log.warn("escalation.rejected", "s1", "queue full", data);
        data.put("late", 1);

        Map<String, Object> stored = log.query(null, null, null, null, "s1").get(0).data();
        assertFalse(stored.containsKey("late"));
        assertThrows(UnsupportedOperationException.class, () -> stored.put("x", 1));
    }
}
