package com.rakshak.honeypot.repository.impl;

import com.rakshak.honeypot.repository.ScamCorpusRepository;
import com.rakshak.honeypot.util.CorpusLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import jakarta.annotation.PostConstruct;
import java.util.List;

/**
 * Classpath 語料來源
 * <p>
 * 從 resources 讀取詐騙句型、基礎關鍵字與一般對話樣本。任何檔案缺少時都不會中斷啟動：
 * 句型與樣本退化為空列表，關鍵字退化為內建清單。
 */
@Repository
public class ClasspathScamCorpusRepository implements ScamCorpusRepository {

    private static final Logger logger = LoggerFactory.getLogger(ClasspathScamCorpusRepository.class);

    static final List<String> BUILT_IN_KEYWORDS = List.of(
            "otp", "send money", "upi", "verify", "account blocked", "bank alert",
            "click here", "urgent", "refund", "kyc", "aadhaar", "pan",
            "debit card", "credit card", "cvv", "loan approved", "processing fee",
            "telegram job", "whatsapp job", "legal notice", "customs", "parcel seized");

    @Value("${corpus.templates-file:scam_sentences.txt}")
    private String templatesFile;

    @Value("${corpus.keywords-file:scam_keywords.txt}")
    private String keywordsFile;

    @Value("${corpus.safe-samples-file:safe_samples.txt}")
    private String safeSamplesFile;

    private volatile List<String> templates = List.of();
    private volatile List<String> baseKeywords = BUILT_IN_KEYWORDS;
    private volatile List<String> safeSamples = List.of();

    @PostConstruct
    public void init() {
        List<String> loadedTemplates = CorpusLoader.loadLines(templatesFile);
        List<String> loadedKeywords = CorpusLoader.loadLines(keywordsFile);
        List<String> loadedSafe = CorpusLoader.loadLines(safeSamplesFile);

        if (loadedKeywords.isEmpty()) {
            logger.warn("關鍵字語料為空，改用內建清單 ({} 筆)", BUILT_IN_KEYWORDS.size());
            loadedKeywords = BUILT_IN_KEYWORDS;
        }
        if (loadedTemplates.isEmpty()) {
            logger.warn("詐騙句型語料為空，句型比對規則將不會加分");
        }

        this.templates = List.copyOf(loadedTemplates);
        this.baseKeywords = List.copyOf(loadedKeywords);
        this.safeSamples = List.copyOf(loadedSafe);

        logger.info("Scam corpus initialized: templates={}, keywords={}, safeSamples={}",
                templates.size(), baseKeywords.size(), safeSamples.size());
    }

    @Override
    public List<String> templates() {
        return templates;
    }

    @Override
    public List<String> baseKeywords() {
        return baseKeywords;
    }

    @Override
    public List<String> safeSamples() {
        return safeSamples;
    }
}
