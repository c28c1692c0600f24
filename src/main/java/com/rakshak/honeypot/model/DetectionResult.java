package com.rakshak.honeypot.model;

import java.util.List;

/**
 * 詐騙判定結果
 *
 * @param scamDetected         是否判定為詐騙
 * @param confidence           信心分數，介於 0 與 1 之間
 * @param score                加權分數（終止規則直接判定時為 0）
 * @param decidedBy            做出判定的規則名稱，或 {@code weighted-score}
 * @param firedRules           有貢獻分數的規則名稱
 * @param estimatorProbability 外部機率估計值，未提供時為 null
 */
public record DetectionResult(
        boolean scamDetected,
        double confidence,
        int score,
        String decidedBy,
        List<String> firedRules,
        Double estimatorProbability) {

    public static final String WEIGHTED_SCORE = "weighted-score";

    public DetectionResult {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        firedRules = firedRules == null ? List.of() : List.copyOf(firedRules);
    }
}
