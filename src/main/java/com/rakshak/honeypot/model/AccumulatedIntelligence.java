package com.rakshak.honeypot.model;

import java.util.List;

/**
 * 對話累積情資快照
 * <p>
 * 由 {@link ConversationSession} 產生的唯讀副本，可安全地序列化為 JSON 或放入外送報告。
 */
public record AccumulatedIntelligence(
        List<String> bankAccounts,
        List<String> upiIds,
        List<String> phishingLinks,
        List<String> phoneNumbers,
        List<String> suspiciousKeywords) {

    public AccumulatedIntelligence {
        bankAccounts = bankAccounts == null ? List.of() : List.copyOf(bankAccounts);
        upiIds = upiIds == null ? List.of() : List.copyOf(upiIds);
        phishingLinks = phishingLinks == null ? List.of() : List.copyOf(phishingLinks);
        phoneNumbers = phoneNumbers == null ? List.of() : List.copyOf(phoneNumbers);
        suspiciousKeywords = suspiciousKeywords == null ? List.of() : List.copyOf(suspiciousKeywords);
    }

    public static AccumulatedIntelligence empty() {
        return new AccumulatedIntelligence(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public int artifactCount() {
        return bankAccounts.size() + upiIds.size() + phishingLinks.size() + phoneNumbers.size();
    }
}
