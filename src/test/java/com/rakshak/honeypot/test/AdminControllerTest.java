package com.rakshak.honeypot.test;

import com.rakshak.honeypot.adminapi.controller.AdminController;
import com.rakshak.honeypot.service.AuditLogService;
import com.rakshak.honeypot.service.RuntimeConfigService;
import com.rakshak.honeypot.service.SessionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminController.class)
@TestPropertySource(properties = {"honeypot.api-key=test-key", "admin.api-key=admin-key"})
public class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RuntimeConfigService runtimeConfigService;

    @MockBean
    private AuditLogService auditLogService;

    @MockBean
    private SessionService sessionService;

    @Test
    public void missingAdminKeyShouldReturn401() throws Exception {
        mockMvc.perform(get("/api/admin/config"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Unauthorized"));
    }

    @Test
    public void honeypotKeyIsNotAcceptedForAdmin() throws Exception {
        mockMvc.perform(get("/api/admin/config").header("x-api-key", "test-key"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    public void updateConfigShouldApplyOverrides() throws Exception {
        when(runtimeConfigService.snapshot()).thenReturn(Map.of("detection", Map.of("scoreThreshold", 8)));

        mockMvc.perform(put("/api/admin/config")
                        .header("X-Admin-Key", "admin-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"detection\":{\"scoreThreshold\":8,\"estimatorCutover\":\"0.7\"},"
                                + "\"rateLimit\":{\"maxRequests\":10}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.detection.scoreThreshold").value(8));

        verify(runtimeConfigService).updateDetection(eq(8), isNull(), eq(0.7), isNull(), isNull(), isNull());
        verify(runtimeConfigService).updateRateLimit(eq(10), isNull());
        verify(runtimeConfigService, never()).updateEscalation(any(), any(), any());
        verify(auditLogService).info(eq("config.update"), isNull(), anyString(), anyMap());
    }

    @Test
    public void logsShouldPassFilters() throws Exception {
        when(auditLogService.query(null, 10, "escalation", null, "s1")).thenReturn(List.of(
                new AuditLogService.Entry(1L, "WARN", "escalation.failed", "s1", "Report delivery failed", Map.of())));

        mockMvc.perform(get("/api/admin/logs")
                        .header("X-Admin-Key", "admin-key")
                        .param("limit", "10")
                        .param("actionContains", "escalation")
                        .param("sessionId", "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.data[0].action").value("escalation.failed"));
    }

    @Test
    public void artifactsShouldReturnTopPaymentIdentifiers() throws Exception {
        Map<String, Long> top = new LinkedHashMap<>();
        top.put("mule@okaxis", 7L);
        top.put("scammer@upi", 3L);
        when(sessionService.getTopArtifacts(5)).thenReturn(top);

        mockMvc.perform(get("/api/admin/artifacts").header("X-Admin-Key", "admin-key").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.data['mule@okaxis']").value(7));
    }
}
