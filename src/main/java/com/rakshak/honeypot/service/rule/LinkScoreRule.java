package com.rakshak.honeypot.service.rule;

import com.rakshak.honeypot.util.EntityExtractor;

import java.util.Arrays;
import java.util.Set;

/**
 * 連結計分：含網址即加分，同時出現驗證/操作字眼時加更多
 */
public class LinkScoreRule implements DetectionRule {

    public static final String NAME = "link-score";

    public static final Set<String> DEFAULT_ACTION_WORDS = Set.of(
            "verify", "click", "update", "login", "confirm", "kyc", "claim", "pay");

    private final Set<String> actionWords;
    private final int actionBonus;
    private final int bareBonus;

    public LinkScoreRule(Set<String> actionWords, int actionBonus, int bareBonus) {
        this.actionWords = Set.copyOf(actionWords);
        this.actionBonus = actionBonus;
        this.bareBonus = bareBonus;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RuleOutcome evaluate(MessageContext context) {
        if (!EntityExtractor.hasUrl(context.lower())) {
            return RuleOutcome.pass();
        }
        boolean hasAction = Arrays.stream(context.plain().split(" ")).anyMatch(actionWords::contains);
        return RuleOutcome.score(hasAction ? actionBonus : bareBonus);
    }
}
