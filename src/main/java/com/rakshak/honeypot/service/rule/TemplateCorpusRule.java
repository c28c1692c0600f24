package com.rakshak.honeypot.service.rule;

import java.util.List;
import java.util.function.IntSupplier;

/**
 * 已知詐騙句型比對：訊息與前 N 筆句型互相包含時加一次固定分數，第一筆命中即停止
 */
public class TemplateCorpusRule implements DetectionRule {

    public static final String NAME = "template-corpus";

    private final List<String> templates;
    private final IntSupplier scanLimit;
    private final int bonus;

    public TemplateCorpusRule(List<String> templates, IntSupplier scanLimit, int bonus) {
        this.templates = templates.stream().map(MessageContext::plain).filter(s -> !s.isEmpty()).toList();
        this.scanLimit = scanLimit;
        this.bonus = bonus;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RuleOutcome evaluate(MessageContext context) {
        if (context.isEmpty()) {
            return RuleOutcome.pass();
        }
        String text = context.plain();
        int limit = Math.min(templates.size(), Math.max(0, scanLimit.getAsInt()));
        for (int i = 0; i < limit; i++) {
            String template = templates.get(i);
            if (template.contains(text) || text.contains(template)) {
                return RuleOutcome.score(bonus);
            }
        }
        return RuleOutcome.pass();
    }

    public int templateCount() {
        return templates.size();
    }
}
