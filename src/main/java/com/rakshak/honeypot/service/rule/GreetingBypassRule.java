package com.rakshak.honeypot.service.rule;

import java.util.List;

/**
 * 寒暄白名單：完全相同或整句包含在某個白名單項目中，直接判定為安全
 */
public class GreetingBypassRule implements DetectionRule {

    public static final String NAME = "greeting-bypass";

    static final double CONFIDENCE = 0.05;

    public static final List<String> DEFAULT_GREETINGS = List.of(
            "hi", "hii", "hello", "hey", "ok", "okay", "thanks", "thank you", "thanku",
            "good morning", "good afternoon", "good evening", "good night",
            "bye", "yes", "no", "sure", "fine", "hmm", "cool", "great", "nice", "welcome");

    private final List<String> greetings;

    public GreetingBypassRule(List<String> greetings) {
        this.greetings = greetings.stream().map(MessageContext::plain).filter(s -> !s.isEmpty()).toList();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RuleOutcome evaluate(MessageContext context) {
        if (context.isEmpty()) {
            return RuleOutcome.verdict(false, CONFIDENCE);
        }
        String text = context.plain();
        for (String greeting : greetings) {
            if (greeting.equals(text) || greeting.contains(text)) {
                return RuleOutcome.verdict(false, CONFIDENCE);
            }
        }
        return RuleOutcome.pass();
    }
}
