package com.rakshak.honeypot.adminapi.controller;

import com.rakshak.honeypot.service.AuditLogService;
import com.rakshak.honeypot.service.RuntimeConfigService;
import com.rakshak.honeypot.service.SessionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@CrossOrigin(origins = "*")
public class AdminController {

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Autowired
    private AuditLogService auditLogService;

    @Autowired
    private SessionService sessionService;

    @GetMapping("/config")
    public Map<String, Object> getConfig() {
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", runtimeConfigService.snapshot());
        return out;
    }

    @PutMapping("/config")
    @SuppressWarnings("unchecked")
    public Map<String, Object> updateConfig(@RequestBody Map<String, Object> body) {
        Map<String, Object> detection = body.get("detection") instanceof Map ? (Map<String, Object>) body.get("detection") : null;
        Map<String, Object> escalation = body.get("escalation") instanceof Map ? (Map<String, Object>) body.get("escalation") : null;
        Map<String, Object> rateLimit = body.get("rateLimit") instanceof Map ? (Map<String, Object>) body.get("rateLimit") : null;

        if (detection != null) {
            runtimeConfigService.updateDetection(
                    asInt(detection.get("scoreThreshold")),
                    asInt(detection.get("scoreDenominator")),
                    asDouble(detection.get("estimatorCutover")),
                    asInt(detection.get("estimatorWeight")),
                    asInt(detection.get("minWords")),
                    asInt(detection.get("corpusScanLimit")));
        }

        if (escalation != null) {
            runtimeConfigService.updateEscalation(
                    asInt(escalation.get("minTurns")),
                    asString(escalation.get("callbackUrl")),
                    asInt(escalation.get("timeoutMs")));
        }

        if (rateLimit != null) {
            runtimeConfigService.updateRateLimit(
                    asInt(rateLimit.get("maxRequests")),
                    asInt(rateLimit.get("windowSeconds")));
        }

        auditLogService.info("config.update", null, "Runtime config updated", Map.of());

        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", runtimeConfigService.snapshot());
        return out;
    }

    @GetMapping("/logs")
    public Map<String, Object> queryLogs(
            @RequestParam(required = false) Long sinceMs,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String actionContains,
            @RequestParam(required = false) String level,
            @RequestParam(required = false) String sessionId) {

        List<AuditLogService.Entry> entries = auditLogService.query(sinceMs, limit, actionContains, level, sessionId);
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", entries);
        out.put("count", entries.size());
        out.put("byAction", auditLogService.countByAction());
        return out;
    }

    @GetMapping("/artifacts")
    public Map<String, Object> topArtifacts(@RequestParam(required = false, defaultValue = "20") int limit) {
        Map<String, Long> top = sessionService.getTopArtifacts(limit);
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", top);
        out.put("count", top.size());
        return out;
    }

    private static Integer asInt(Object o) {
        if (o == null) {
            return null;
        }
        if (o instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(o).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double asDouble(Object o) {
        if (o == null) {
            return null;
        }
        if (o instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(o).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String asString(Object o) {
        return o == null ? null : String.valueOf(o);
    }
}
