package com.rakshak.honeypot.repository;

import java.util.List;

/**
 * 靜態語料來源
 * 啟動時載入一次，之後唯讀
 */
public interface ScamCorpusRepository {

    /**
     * 已知詐騙句型（小寫）
     */
    List<String> templates();

    /**
     * 基礎詐騙關鍵字（小寫，未展開）
     */
    List<String> baseKeywords();

    /**
     * 一般對話樣本（小寫）
     */
    List<String> safeSamples();
}
