package com.rakshak.honeypot.service;

import com.rakshak.honeypot.model.DetectionResult;

import java.util.List;

/**
 * 詐騙判定服務介面
 * 依固定順序的規則表判斷單則訊息是否為詐騙
 */
public interface ScamClassifierService {

    /**
     * 判定訊息（若有註冊機率估計器則自動取用）
     *
     * @param text 訊息文字，可為 null 或空字串
     * @return 判定結果，信心值保證介於 0 與 1 之間
     */
    DetectionResult classify(String text);

    /**
     * 判定訊息，並使用呼叫端提供的外部機率
     *
     * @param text                訊息文字
     * @param externalProbability 外部詐騙機率；null 表示沒有，不參與混合
     * @return 判定結果
     */
    DetectionResult classify(String text, Double externalProbability);

    /**
     * 找出訊息中出現的可疑關鍵字片語
     */
    List<String> findSuspiciousKeywords(String text);

    /**
     * 依評估順序列出所有規則名稱
     */
    List<String> ruleNames();

    int getKeywordCount();

    int getTemplateCount();

    boolean isEstimatorAvailable();
}
