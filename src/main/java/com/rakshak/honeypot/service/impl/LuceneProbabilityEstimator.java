package com.rakshak.honeypot.service.impl;

import com.rakshak.honeypot.repository.ScamCorpusRepository;
import com.rakshak.honeypot.service.ProbabilityEstimator;
import com.rakshak.honeypot.util.LuceneScamIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;

/**
 * Lucene 相似度機率估計器 (Lucene Similarity Estimator)
 * <p>
 * 功能：
 * 以已知詐騙句型與一般對話樣本建立記憶體索引，對新訊息取回最相近的前 K 筆文件，
 * 以詐騙文件所佔的 BM25 分數比例作為詐騙機率。
 * <p>
 * 流程：
 * 1. 啟動時由 {@link ScamCorpusRepository} 取得兩類語料並建立索引。
 * 2. 任一語料為空時估計器視為不可用（回傳 0，且 isAvailable() 為 false）。
 * 3. 查詢失敗一律回傳 0，不向上拋出。
 */
@Service
@ConditionalOnProperty(name = "estimator.enabled", havingValue = "true", matchIfMissing = true)
public class LuceneProbabilityEstimator implements ProbabilityEstimator {

    private static final Logger logger = LoggerFactory.getLogger(LuceneProbabilityEstimator.class);

    @Autowired
    private ScamCorpusRepository corpusRepository;

    @Value("${estimator.top-k:10}")
    private int topK = 10;

    private volatile LuceneScamIndex index;

    @PostConstruct
    public void init() {
        if (corpusRepository.templates().isEmpty() || corpusRepository.safeSamples().isEmpty()) {
            logger.warn("語料不足，機率估計器停用 (templates={}, safeSamples={})",
                    corpusRepository.templates().size(), corpusRepository.safeSamples().size());
            this.index = null;
            return;
        }
        try {
            LuceneScamIndex newIndex = new LuceneScamIndex();
            newIndex.build(corpusRepository.templates(), corpusRepository.safeSamples());
            this.index = newIndex;
            logger.info("機率估計器初始化完成，索引文件數: {}", newIndex.getDocCount());
        } catch (Exception e) {
            logger.error("建立機率估計索引失敗: {}", e.getMessage());
            this.index = null;
        }
    }

    @Override
    public double estimate(String text) {
        LuceneScamIndex current = index;
        if (current == null) {
            return 0.0;
        }
        LuceneScamIndex.Estimate estimate = current.estimate(text, topK);
        double p = estimate.probability();
        if (logger.isDebugEnabled()) {
            logger.debug("機率估計 hits={} scamScore={} safeScore={} p={}",
                    estimate.hits(), estimate.scamScore(), estimate.safeScore(), String.format("%.3f", p));
        }
        return Math.max(0.0, Math.min(1.0, p));
    }

    @Override
    public boolean isAvailable() {
        return index != null;
    }
}
