package com.rakshak.honeypot.service;

import java.util.Map;

public interface RuntimeConfigService {
    int getScoreThreshold();

    int getScoreDenominator();

    double getEstimatorCutover();

    int getEstimatorWeight();

    int getMinWords();

    int getCorpusScanLimit();

    int getEscalationMinTurns();

    String getEscalationCallbackUrl();

    int getEscalationTimeoutMs();

    int getRateLimitMaxRequests();

    int getRateLimitWindowSeconds();

    void updateDetection(Integer scoreThreshold, Integer scoreDenominator, Double estimatorCutover,
            Integer estimatorWeight, Integer minWords, Integer corpusScanLimit);

    void updateEscalation(Integer minTurns, String callbackUrl, Integer timeoutMs);

    void updateRateLimit(Integer maxRequests, Integer windowSeconds);

    Map<String, Object> snapshot();
}
