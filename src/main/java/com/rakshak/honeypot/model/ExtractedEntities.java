package com.rakshak.honeypot.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 單次文字抽取結果
 * 每個欄位皆為去重後的集合
 */
public record ExtractedEntities(
        Set<String> upiIds,
        Set<String> bankAccounts,
        Set<String> urls,
        Set<String> phoneNumbers) {

    public ExtractedEntities {
        upiIds = ordered(upiIds);
        bankAccounts = ordered(bankAccounts);
        urls = ordered(urls);
        phoneNumbers = ordered(phoneNumbers);
    }

    private static Set<String> ordered(Set<String> values) {
        return values == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    public static ExtractedEntities empty() {
        return new ExtractedEntities(Set.of(), Set.of(), Set.of(), Set.of());
    }

    public boolean isEmpty() {
        return upiIds.isEmpty() && bankAccounts.isEmpty() && urls.isEmpty() && phoneNumbers.isEmpty();
    }
}
