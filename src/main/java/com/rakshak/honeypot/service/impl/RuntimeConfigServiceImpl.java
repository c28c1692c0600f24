package com.rakshak.honeypot.service.impl;

import com.rakshak.honeypot.service.RuntimeConfigService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 執行時配置服務實作 (Runtime Configuration Service Implementation)
 * <p>
 * 功能：
 * 允許在不重啟伺服器的情況下，動態調整判定門檻、報告升級條件與限流參數。
 * <p>
 * 機制：
 * 1. 使用 `AtomicReference` 儲存可變的覆蓋值 (Override)。
 * 2. 讀取時，優先回傳 Override 值，若無則回傳 `application.properties` 中的預設值。
 */
@Service
public class RuntimeConfigServiceImpl implements RuntimeConfigService {

    @Value("${detection.score-threshold:7}")
    private int scoreThresholdDefault = 7;

    @Value("${detection.score-denominator:10}")
    private int scoreDenominatorDefault = 10;

    @Value("${detection.estimator-cutover:0.65}")
    private double estimatorCutoverDefault = 0.65;

    @Value("${detection.estimator-weight:6}")
    private int estimatorWeightDefault = 6;

    @Value("${detection.min-words:3}")
    private int minWordsDefault = 3;

    @Value("${detection.corpus-scan-limit:200}")
    private int corpusScanLimitDefault = 200;

    @Value("${escalation.min-turns:3}")
    private int escalationMinTurnsDefault = 3;

    @Value("${escalation.callback-url:http://localhost:8081/api/scam-reports}")
    private String escalationCallbackUrlDefault = "http://localhost:8081/api/scam-reports";

    @Value("${escalation.timeout-ms:5000}")
    private int escalationTimeoutMsDefault = 5000;

    @Value("${ratelimit.max-requests:30}")
    private int rateLimitMaxRequestsDefault = 30;

    @Value("${ratelimit.window-seconds:60}")
    private int rateLimitWindowSecondsDefault = 60;

    private final AtomicReference<Integer> scoreThresholdOverride = new AtomicReference<>();
    private final AtomicReference<Integer> scoreDenominatorOverride = new AtomicReference<>();
    private final AtomicReference<Double> estimatorCutoverOverride = new AtomicReference<>();
    private final AtomicReference<Integer> estimatorWeightOverride = new AtomicReference<>();
    private final AtomicReference<Integer> minWordsOverride = new AtomicReference<>();
    private final AtomicReference<Integer> corpusScanLimitOverride = new AtomicReference<>();

    private final AtomicReference<Integer> escalationMinTurnsOverride = new AtomicReference<>();
    private final AtomicReference<String> escalationCallbackUrlOverride = new AtomicReference<>();
    private final AtomicReference<Integer> escalationTimeoutMsOverride = new AtomicReference<>();

    private final AtomicReference<Integer> rateLimitMaxRequestsOverride = new AtomicReference<>();
    private final AtomicReference<Integer> rateLimitWindowSecondsOverride = new AtomicReference<>();

    @Override
    public int getScoreThreshold() {
        Integer v = scoreThresholdOverride.get();
        return v != null ? v : scoreThresholdDefault;
    }

    @Override
    public int getScoreDenominator() {
        Integer v = scoreDenominatorOverride.get();
        return Math.max(1, v != null ? v : scoreDenominatorDefault);
    }

    @Override
    public double getEstimatorCutover() {
        Double v = estimatorCutoverOverride.get();
        return v != null ? v : estimatorCutoverDefault;
    }

    @Override
    public int getEstimatorWeight() {
        Integer v = estimatorWeightOverride.get();
        return v != null ? v : estimatorWeightDefault;
    }

    @Override
    public int getMinWords() {
        Integer v = minWordsOverride.get();
        return v != null ? v : minWordsDefault;
    }

    @Override
    public int getCorpusScanLimit() {
        Integer v = corpusScanLimitOverride.get();
        return v != null ? v : corpusScanLimitDefault;
    }

    @Override
    public int getEscalationMinTurns() {
        Integer v = escalationMinTurnsOverride.get();
        return v != null ? v : escalationMinTurnsDefault;
    }

    @Override
    public String getEscalationCallbackUrl() {
        String v = escalationCallbackUrlOverride.get();
        return v != null ? v : escalationCallbackUrlDefault;
    }

    @Override
    public int getEscalationTimeoutMs() {
        Integer v = escalationTimeoutMsOverride.get();
        return v != null ? v : escalationTimeoutMsDefault;
    }

    @Override
    public int getRateLimitMaxRequests() {
        Integer v = rateLimitMaxRequestsOverride.get();
        return v != null ? v : rateLimitMaxRequestsDefault;
    }

    @Override
    public int getRateLimitWindowSeconds() {
        Integer v = rateLimitWindowSecondsOverride.get();
        return v != null ? v : rateLimitWindowSecondsDefault;
    }

    /**
     * 更新判定配置 (Update Detection Configuration)
     * <p>
     * 參數說明：
     * - scoreThreshold: 加權分數達到此值即判定為詐騙。
     * - scoreDenominator: 將分數正規化為信心值的分母。
     * - estimatorCutover: 外部機率超過此值即直接判定為詐騙。
     * - estimatorWeight: 外部機率折算為整數分數時的倍數。
     * - minWords: 短訊息略過門檻（字數）。
     * - corpusScanLimit: 句型比對時掃描的句型數量上限。
     */
    @Override
    public void updateDetection(Integer scoreThreshold, Integer scoreDenominator, Double estimatorCutover,
            Integer estimatorWeight, Integer minWords, Integer corpusScanLimit) {
        if (scoreThreshold != null) {
            scoreThresholdOverride.set(scoreThreshold);
        }
        if (scoreDenominator != null) {
            scoreDenominatorOverride.set(scoreDenominator);
        }
        if (estimatorCutover != null) {
            estimatorCutoverOverride.set(estimatorCutover);
        }
        if (estimatorWeight != null) {
            estimatorWeightOverride.set(estimatorWeight);
        }
        if (minWords != null) {
            minWordsOverride.set(minWords);
        }
        if (corpusScanLimit != null) {
            corpusScanLimitOverride.set(corpusScanLimit);
        }
    }

    @Override
    public void updateEscalation(Integer minTurns, String callbackUrl, Integer timeoutMs) {
        if (minTurns != null) {
            escalationMinTurnsOverride.set(minTurns);
        }
        if (callbackUrl != null) {
            escalationCallbackUrlOverride.set(callbackUrl);
        }
        if (timeoutMs != null) {
            escalationTimeoutMsOverride.set(timeoutMs);
        }
    }

    @Override
    public void updateRateLimit(Integer maxRequests, Integer windowSeconds) {
        if (maxRequests != null) {
            rateLimitMaxRequestsOverride.set(maxRequests);
        }
        if (windowSeconds != null) {
            rateLimitWindowSecondsOverride.set(windowSeconds);
        }
    }

    /**
     * 取得設定快照 (Get Configuration Snapshot)
     * <p>
     * 匯總當前生效的設定值（包含預設值與覆蓋值），用於後台顯示。
     *
     * @return Map 包含 detection、escalation 與 rateLimit 三大類的當前設定。
     */
    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> out = new HashMap<>();
        Map<String, Object> detection = new HashMap<>();
        detection.put("scoreThreshold", getScoreThreshold());
        detection.put("scoreDenominator", getScoreDenominator());
        detection.put("estimatorCutover", getEstimatorCutover());
        detection.put("estimatorWeight", getEstimatorWeight());
        detection.put("minWords", getMinWords());
        detection.put("corpusScanLimit", getCorpusScanLimit());
        out.put("detection", detection);

        Map<String, Object> escalation = new HashMap<>();
        escalation.put("minTurns", getEscalationMinTurns());
        escalation.put("callbackUrl", getEscalationCallbackUrl());
        escalation.put("timeoutMs", getEscalationTimeoutMs());
        out.put("escalation", escalation);

        Map<String, Object> rateLimit = new HashMap<>();
        rateLimit.put("maxRequests", getRateLimitMaxRequests());
        rateLimit.put("windowSeconds", getRateLimitWindowSeconds());
        out.put("rateLimit", rateLimit);

        return out;
    }
}
