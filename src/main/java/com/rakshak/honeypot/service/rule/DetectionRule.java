package com.rakshak.honeypot.service.rule;

/**
 * 判定規則
 * <p>
 * 規則依固定順序評估；第一個回傳 {@link RuleOutcome.Kind#VERDICT} 的規則決定結果，
 * 其後的規則全部略過。其餘規則只能累加分數。
 */
public interface DetectionRule {

    String name();

    RuleOutcome evaluate(MessageContext context);
}
