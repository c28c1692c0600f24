package com.rakshak.honeypot.service.rule;

import com.rakshak.honeypot.util.EntityExtractor;

import java.util.Arrays;
import java.util.Set;
import java.util.function.IntSupplier;

/**
 * 短訊息略過：字數不超過門檻、且不含任何金融觸發字或結構化情資時，判定為安全
 */
public class ShortMessageBypassRule implements DetectionRule {

    public static final String NAME = "short-message-bypass";

    static final double CONFIDENCE = 0.10;

    public static final Set<String> DEFAULT_TRIGGER_WORDS = Set.of(
            "otp", "upi", "bank", "account", "money", "pay", "payment", "send", "transfer",
            "card", "kyc", "verify", "link", "cvv", "pin", "loan", "refund", "prize", "lottery",
            "blocked", "urgent", "fee", "click");

    private final IntSupplier minWords;
    private final Set<String> triggerWords;

    public ShortMessageBypassRule(IntSupplier minWords, Set<String> triggerWords) {
        this.minWords = minWords;
        this.triggerWords = Set.copyOf(triggerWords);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RuleOutcome evaluate(MessageContext context) {
        if (context.wordCount() > minWords.getAsInt()) {
            return RuleOutcome.pass();
        }
        if (EntityExtractor.hasAnyArtifact(context.lower())) {
            return RuleOutcome.pass();
        }
        boolean hasTrigger = Arrays.stream(context.plain().split(" ")).anyMatch(triggerWords::contains);
        return hasTrigger ? RuleOutcome.pass() : RuleOutcome.verdict(false, CONFIDENCE);
    }
}
