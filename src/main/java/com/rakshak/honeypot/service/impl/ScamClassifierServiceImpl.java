package com.rakshak.honeypot.service.impl;

import com.rakshak.honeypot.model.DetectionResult;
import com.rakshak.honeypot.repository.ScamCorpusRepository;
import com.rakshak.honeypot.service.ProbabilityEstimator;
import com.rakshak.honeypot.service.RuntimeConfigService;
import com.rakshak.honeypot.service.ScamClassifierService;
import com.rakshak.honeypot.service.rule.DetectionRule;
import com.rakshak.honeypot.service.rule.GreetingBypassRule;
import com.rakshak.honeypot.service.rule.KeywordScoreRule;
import com.rakshak.honeypot.service.rule.LinkScoreRule;
import com.rakshak.honeypot.service.rule.MessageContext;
import com.rakshak.honeypot.service.rule.PatternTriggerRule;
import com.rakshak.honeypot.service.rule.RuleOutcome;
import com.rakshak.honeypot.service.rule.ShortMessageBypassRule;
import com.rakshak.honeypot.service.rule.TemplateCorpusRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;

/**
 * 詐騙判定服務實作 (Scam Classifier Service Implementation)
 * <p>
 * 功能：
 * 以「硬性觸發優先、加權計分其次」的規則表判斷訊息是否為詐騙，可選擇性混合外部機率估計。
 * <p>
 * 規則順序：
 * 1. 寒暄白名單、短訊息略過 → 直接判定安全。
 * 2. UPI 付款帳號、OTP、「send + money/amount」→ 直接判定詐騙，不再計分。
 * 3. 關鍵字、已知句型、連結 → 累加分數。
 * 4. 若有外部機率：折算整數分數加入總分，並與正規化分數取平均作為信心值。
 * 5. 總分達門檻，或外部機率超過切換值 → 詐騙。
 */
@Service
public class ScamClassifierServiceImpl implements ScamClassifierService {

    private static final Logger logger = LoggerFactory.getLogger(ScamClassifierServiceImpl.class);

    static final int KEYWORD_WEIGHT = 1;
    static final int TEMPLATE_BONUS = 5;
    static final int LINK_ACTION_BONUS = 6;
    static final int LINK_BARE_BONUS = 4;

    @Autowired
    private ScamCorpusRepository corpusRepository;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Autowired(required = false)
    private ProbabilityEstimator probabilityEstimator;

    private volatile List<DetectionRule> rules = List.of();
    private volatile KeywordScoreRule keywordRule;
    private volatile TemplateCorpusRule templateRule;

    @PostConstruct
    public void init() {
        KeywordScoreRule newKeywordRule = new KeywordScoreRule(corpusRepository.baseKeywords(), KEYWORD_WEIGHT);
        TemplateCorpusRule newTemplateRule = new TemplateCorpusRule(
                corpusRepository.templates(), runtimeConfigService::getCorpusScanLimit, TEMPLATE_BONUS);

        List<DetectionRule> table = new ArrayList<>();
        table.add(new GreetingBypassRule(GreetingBypassRule.DEFAULT_GREETINGS));
        table.add(new ShortMessageBypassRule(runtimeConfigService::getMinWords,
                ShortMessageBypassRule.DEFAULT_TRIGGER_WORDS));
        table.add(PatternTriggerRule.paymentIdentifier());
        table.add(PatternTriggerRule.otp());
        table.add(PatternTriggerRule.sendMoney());
        table.add(newKeywordRule);
        table.add(newTemplateRule);
        table.add(new LinkScoreRule(LinkScoreRule.DEFAULT_ACTION_WORDS, LINK_ACTION_BONUS, LINK_BARE_BONUS));

        this.keywordRule = newKeywordRule;
        this.templateRule = newTemplateRule;
        this.rules = List.copyOf(table);

        logger.info("判定規則表初始化完成: rules={}, keywordPhrases={}, templates={}, estimator={}",
                ruleNames(), newKeywordRule.phraseCount(), newTemplateRule.templateCount(),
                isEstimatorAvailable());
    }

    @Override
    public DetectionResult classify(String text) {
        MessageContext context = MessageContext.of(text);
        RuleOutcomeTrace trace = evaluateRules(context);
        if (trace.terminal() != null) {
            return trace.terminal();
        }
        return decide(trace, estimate(context.raw()));
    }

    @Override
    public DetectionResult classify(String text, Double externalProbability) {
        MessageContext context = MessageContext.of(text);
        RuleOutcomeTrace trace = evaluateRules(context);
        if (trace.terminal() != null) {
            return trace.terminal();
        }
        Double p = externalProbability == null ? null : clamp(externalProbability);
        return decide(trace, p);
    }

    /**
     * 依序評估規則 (Evaluate Rules)
     * <p>
     * 遇到第一個終止判定即停止；否則收集所有計分規則的分數與名稱。
     */
    private RuleOutcomeTrace evaluateRules(MessageContext context) {
        int score = 0;
        List<String> fired = new ArrayList<>();
        for (DetectionRule rule : rules) {
            RuleOutcome outcome;
            try {
                outcome = rule.evaluate(context);
            } catch (RuntimeException e) {
                logger.warn("規則 {} 評估失敗，略過: {}", rule.name(), e.getMessage());
                continue;
            }
            if (outcome.isTerminal()) {
                logger.debug("規則 {} 直接判定 scam={} confidence={}", rule.name(), outcome.scam(),
                        outcome.confidence());
                DetectionResult result = new DetectionResult(
                        outcome.scam(), outcome.confidence(), 0, rule.name(), List.of(rule.name()), null);
                return new RuleOutcomeTrace(result, 0, List.of());
            }
            if (outcome.points() > 0) {
                score += outcome.points();
                fired.add(rule.name());
            }
        }
        return new RuleOutcomeTrace(null, score, fired);
    }

    /**
     * 門檻判定 (Threshold Decision)
     * <p>
     * 1. 有外部機率時，折算 (int)(p * weight) 分加入總分。
     * 2. 正規化分數 = min(score / denominator, 1)。
     * 3. 信心值 = 有外部機率時取兩者平均，否則為正規化分數。
     * 4. score ≥ threshold 或 p > cutover 即為詐騙。
     */
    private DetectionResult decide(RuleOutcomeTrace trace, Double p) {
        int score = trace.score();
        if (p != null) {
            score += (int) (p * runtimeConfigService.getEstimatorWeight());
        }

        double normalized = Math.min((double) score / runtimeConfigService.getScoreDenominator(), 1.0);
        double confidence = p == null ? normalized : (normalized + p) / 2.0;

        boolean scam = score >= runtimeConfigService.getScoreThreshold()
                || (p != null && p > runtimeConfigService.getEstimatorCutover());

        logger.debug("加權判定 score={} p={} scam={} fired={}", score, p, scam, trace.fired());
        return new DetectionResult(scam, clamp(confidence), score, DetectionResult.WEIGHTED_SCORE,
                trace.fired(), p);
    }

    private Double estimate(String text) {
        ProbabilityEstimator estimator = probabilityEstimator;
        if (estimator == null || !estimator.isAvailable()) {
            return null;
        }
        try {
            return clamp(estimator.estimate(text));
        } catch (RuntimeException e) {
            logger.warn("外部機率估計失敗，改用純規則判定: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public List<String> findSuspiciousKeywords(String text) {
        KeywordScoreRule rule = keywordRule;
        if (rule == null) {
            return List.of();
        }
        return rule.matches(MessageContext.of(text));
    }

    @Override
    public List<String> ruleNames() {
        return rules.stream().map(DetectionRule::name).toList();
    }

    @Override
    public int getKeywordCount() {
        KeywordScoreRule rule = keywordRule;
        return rule == null ? 0 : rule.phraseCount();
    }

    @Override
    public int getTemplateCount() {
        TemplateCorpusRule rule = templateRule;
        return rule == null ? 0 : rule.templateCount();
    }

    @Override
    public boolean isEstimatorAvailable() {
        ProbabilityEstimator estimator = probabilityEstimator;
        return estimator != null && estimator.isAvailable();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private record RuleOutcomeTrace(DetectionResult terminal, int score, List<String> fired) {
    }
}
