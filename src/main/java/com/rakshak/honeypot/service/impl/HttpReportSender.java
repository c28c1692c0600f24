package com.rakshak.honeypot.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rakshak.honeypot.model.EscalationReport;
import com.rakshak.honeypot.service.ReportSender;
import com.rakshak.honeypot.service.RuntimeConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;

/**
 * HTTP 情資報告外送實作
 * <p>
 * 功能：
 * 將報告序列化為 JSON 並以 POST 送往設定的收集端網址。
 * <p>
 * 流程：
 * 1. 從 {@link RuntimeConfigService} 取得網址與逾時設定（連線與讀取共用）。
 * 2. 以 Jackson 序列化報告並寫入請求本文。
 * 3. 讀取回應碼：2xx 視為成功；其餘狀況記錄警告並回傳 false。任何例外都不向上拋出。
 */
@Service
public class HttpReportSender implements ReportSender {

    private static final Logger logger = LoggerFactory.getLogger(HttpReportSender.class);

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public boolean send(EscalationReport report) {
        String url = runtimeConfigService.getEscalationCallbackUrl();
        if (url == null || url.isBlank()) {
            logger.warn("未設定情資收集端網址，略過報告: sessionId={}", report.sessionId());
            return false;
        }

        HttpURLConnection conn = null;
        try {
            int timeout = Math.max(1, runtimeConfigService.getEscalationTimeoutMs());
            conn = (HttpURLConnection) URI.create(url).toURL().openConnection();
            conn.setConnectTimeout(timeout);
            conn.setReadTimeout(timeout);
            conn.setRequestMethod("POST");
            conn.setDoOutput(true);
            conn.setRequestProperty("Content-Type", "application/json");

            try (OutputStream os = conn.getOutputStream()) {
                os.write(objectMapper.writeValueAsBytes(report));
            }

            int status = conn.getResponseCode();
            drain(conn, status);
            if (status >= 200 && status < 300) {
                logger.info("情資報告已送出: sessionId={}, status={}", report.sessionId(), status);
                return true;
            }
            logger.warn("情資收集端回應非 2xx: sessionId={}, status={}", report.sessionId(), status);
            return false;
        } catch (Exception e) {
            logger.warn("情資報告送出失敗: sessionId={}, error={}: {}", report.sessionId(),
                    e.getClass().getSimpleName(), e.getMessage());
            return false;
        } finally {
            if (conn != null) {
                conn.disconnect();
            }
        }
    }

    private static void drain(HttpURLConnection conn, int status) {
        try (InputStream is = status >= 400 ? conn.getErrorStream() : conn.getInputStream()) {
            if (is != null) {
                is.readAllBytes();
            }
        } catch (Exception e) {
            logger.debug("讀取收集端回應本文失敗: {}", e.getMessage());
        }
    }
}
