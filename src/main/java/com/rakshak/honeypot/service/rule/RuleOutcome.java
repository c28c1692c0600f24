package com.rakshak.honeypot.service.rule;

/**
 * 單一規則的評估結果：略過、加分，或直接做出最終判定
 */
public record RuleOutcome(Kind kind, boolean scam, double confidence, int points) {

    public enum Kind {
        PASS,
        SCORE,
        VERDICT
    }

    private static final RuleOutcome PASS = new RuleOutcome(Kind.PASS, false, 0.0, 0);

    public static RuleOutcome pass() {
        return PASS;
    }

    public static RuleOutcome score(int points) {
        return points <= 0 ? PASS : new RuleOutcome(Kind.SCORE, false, 0.0, points);
    }

    public static RuleOutcome verdict(boolean scam, double confidence) {
        return new RuleOutcome(Kind.VERDICT, scam, confidence, 0);
    }

    public boolean isTerminal() {
        return kind == Kind.VERDICT;
    }
}
