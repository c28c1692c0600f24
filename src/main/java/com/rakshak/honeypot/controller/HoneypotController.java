package com.rakshak.honeypot.controller;

import com.rakshak.honeypot.model.HoneypotRequest;
import com.rakshak.honeypot.service.HoneypotService;
import com.rakshak.honeypot.service.ScamClassifierService;
import com.rakshak.honeypot.service.SessionService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 蜜罐控制器
 * 提供對話訊息判定與 Session 查詢的 REST API 端點
 *
 * 注意：業務邏輯在 HoneypotService
 */
@RestController
@RequestMapping("/api/honeypot")
@CrossOrigin(origins = "*")
public class HoneypotController {

    private static final Logger logger = LoggerFactory.getLogger(HoneypotController.class);

    @Autowired
    private HoneypotService honeypotService;

    @Autowired
    private SessionService sessionService;

    @Autowired
    private ScamClassifierService scamClassifierService;

    /**
     * 處理一則對話訊息
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> handleMessage(
            @RequestBody HoneypotRequest request,
            HttpServletRequest httpRequest) {

        if (request == null || request.message() == null) {
            Map<String, Object> error = new HashMap<>();
            error.put("success", false);
            error.put("message", "message is required");
            return ResponseEntity.badRequest().body(error);
        }

        String clientId = resolveClientId(httpRequest);
        if (honeypotService.isRateLimited(clientId)) {
            logger.warn("用戶端 {} 超過請求上限", clientId);
            Map<String, Object> error = new HashMap<>();
            error.put("success", false);
            error.put("message", "Too many requests");
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(error);
        }

        logger.info("收到訊息: sessionId={}, client={}, length={}",
                request.sessionId(), clientId, request.message().length());

        HoneypotService.HoneypotResult result = honeypotService.processMessage(request, clientId);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("sessionId", result.sessionId());
        response.put("scamDetected", result.scamDetected());
        response.put("confidence", result.confidence());
        response.put("reply", result.reply());
        response.put("extractedIntelligence", result.extractedIntelligence());
        response.put("engagementMetrics", result.engagementMetrics());
        return ResponseEntity.ok(response);
    }

    /**
     * 查詢 Session 累積情資
     */
    @GetMapping("/session/{sessionId}")
    public ResponseEntity<Map<String, Object>> getSession(@PathVariable String sessionId) {
        HoneypotService.SessionView view = honeypotService.getSessionView(sessionId);
        Map<String, Object> response = new HashMap<>();
        if (view == null) {
            response.put("success", false);
            response.put("message", "Session not found");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
        response.put("success", true);
        response.put("data", view);
        return ResponseEntity.ok(response);
    }

    /**
     * 清除 Session
     */
    @DeleteMapping("/session/{sessionId}")
    public Map<String, Object> clearSession(@PathVariable String sessionId) {
        logger.info("清除 Session 請求: {}", sessionId);
        honeypotService.clearSession(sessionId);
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Session cleared");
        return response;
    }

    /**
     * 取得系統狀態
     */
    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("stats", honeypotService.getStats());
        status.put("activeSessions", sessionService.getActiveSessionCount());
        status.put("keywordCount", scamClassifierService.getKeywordCount());
        status.put("templateCount", scamClassifierService.getTemplateCount());
        status.put("estimatorAvailable", scamClassifierService.isEstimatorAvailable());
        status.put("rules", scamClassifierService.ruleNames());
        return status;
    }

    /**
     * 用戶端識別一律取自連線位址，不直接信任請求標頭
     * 部署在反向代理後方時，以 server.forward-headers-strategy 讓容器改寫 remoteAddr
     */
    private static String resolveClientId(HttpServletRequest request) {
        return request.getRemoteAddr();
    }
}
