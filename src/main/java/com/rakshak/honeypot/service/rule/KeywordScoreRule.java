package com.rakshak.honeypot.service.rule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 關鍵字計分：每個命中的關鍵字片語（含語氣後綴展開）各加固定分數
 */
public class KeywordScoreRule implements DetectionRule {

    public static final String NAME = "keyword-score";

    public static final List<String> SUFFIXES = List.of("", " please", " immediately", " now", " urgently");

    private final Map<String, Pattern> phrases = new LinkedHashMap<>();
    private final int weight;

    public KeywordScoreRule(List<String> baseKeywords, int weight) {
        this.weight = weight;
        for (String base : baseKeywords) {
            String keyword = MessageContext.plain(base);
            if (keyword.isEmpty()) {
                continue;
            }
            for (String suffix : SUFFIXES) {
                String phrase = keyword + suffix;
                phrases.computeIfAbsent(phrase, p -> Pattern.compile(
                        "(?<![\\p{L}\\p{N}])" + Pattern.quote(p) + "(?![\\p{L}\\p{N}])"));
            }
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RuleOutcome evaluate(MessageContext context) {
        return RuleOutcome.score(matches(context).size() * weight);
    }

    /**
     * 回傳訊息中出現的所有不重複關鍵字片語
     */
    public List<String> matches(MessageContext context) {
        if (context.isEmpty()) {
            return List.of();
        }
        List<String> hits = new ArrayList<>();
        for (Map.Entry<String, Pattern> e : phrases.entrySet()) {
            if (e.getValue().matcher(context.plain()).find()) {
                hits.add(e.getKey());
            }
        }
        return hits;
    }

    public int phraseCount() {
        return phrases.size();
    }
}
