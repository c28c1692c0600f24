package com.rakshak.honeypot.service;

/**
 * 外部詐騙機率估計器
 * <p>
 * 黑盒元件：輸入訊息，輸出 0~1 的詐騙機率。判定服務在此元件不存在或不可用時仍須正常運作。
 */
public interface ProbabilityEstimator {

    /**
     * 估計詐騙機率
     *
     * @param text 訊息文字
     * @return 0~1 之間的機率
     */
    double estimate(String text);

    /**
     * 檢查估計器是否已就緒
     */
    boolean isAvailable();
}
