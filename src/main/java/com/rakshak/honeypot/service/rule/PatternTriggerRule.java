package com.rakshak.honeypot.service.rule;

import com.rakshak.honeypot.util.EntityExtractor;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 硬性觸發規則：所有 pattern 同時出現時直接判定為詐騙，不再進入加權計分
 */
public class PatternTriggerRule implements DetectionRule {

    private final String name;
    private final double confidence;
    private final List<Pattern> required;

    public PatternTriggerRule(String name, double confidence, Pattern... required) {
        this.name = name;
        this.confidence = confidence;
        this.required = List.of(required);
    }

    public static PatternTriggerRule paymentIdentifier() {
        return new PatternTriggerRule("payment-identifier-trigger", 0.95, EntityExtractor.UPI_PATTERN);
    }

    public static PatternTriggerRule otp() {
        return new PatternTriggerRule("otp-trigger", 0.92, Pattern.compile("\\botp\\b"));
    }

    public static PatternTriggerRule sendMoney() {
        return new PatternTriggerRule("send-money-trigger", 0.90,
                Pattern.compile("\\bsend\\b"), Pattern.compile("\\b(money|amount)\\b"));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RuleOutcome evaluate(MessageContext context) {
        for (Pattern p : required) {
            if (!p.matcher(context.lower()).find()) {
                return RuleOutcome.pass();
            }
        }
        return RuleOutcome.verdict(true, confidence);
    }
}
