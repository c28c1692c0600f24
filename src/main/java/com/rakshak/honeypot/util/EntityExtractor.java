package com.rakshak.honeypot.util;

import com.rakshak.honeypot.model.ExtractedEntities;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 情資抽取工具
 * 從文字中找出 UPI 付款帳號、銀行帳號、網址與電話號碼
 * <p>
 * 純函式、無狀態；找不到任何項目時回傳空集合，不會拋出例外。
 */
public final class EntityExtractor {

    /** local-part@domain-part 形式的付款帳號 */
    public static final Pattern UPI_PATTERN = Pattern.compile("[\\w.-]+@[\\w.-]+");

    public static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);

    /** 9~18 位數字，前後不可再接數字 */
    public static final Pattern BANK_ACCOUNT_PATTERN = Pattern.compile("(?<![\\d+])\\d{9,18}(?!\\d)");

    /** 10~13 位數字，可帶 + 號 */
    public static final Pattern PHONE_PATTERN = Pattern.compile("(?<![\\d+])\\+?\\d{10,13}(?!\\d)");

    private static final String URL_TRAILING_PUNCTUATION = ".,;:!?)'\"";

    private EntityExtractor() {
    }

    public static ExtractedEntities extract(String text) {
        if (text == null || text.isEmpty()) {
            return ExtractedEntities.empty();
        }

        Set<String> urls = new LinkedHashSet<>();
        Matcher urlMatcher = URL_PATTERN.matcher(text);
        while (urlMatcher.find()) {
            String url = trimTrailingPunctuation(urlMatcher.group());
            if (!url.isEmpty()) {
                urls.add(url);
            }
        }

        Set<String> upiIds = new LinkedHashSet<>();
        Matcher upiMatcher = UPI_PATTERN.matcher(text);
        while (upiMatcher.find()) {
            String id = trimTrailingPunctuation(upiMatcher.group()).toLowerCase(Locale.ROOT);
            if (id.indexOf('@') > 0 && !id.endsWith("@")) {
                upiIds.add(id);
            }
        }

        return new ExtractedEntities(
                upiIds,
                findAll(BANK_ACCOUNT_PATTERN, text),
                urls,
                findAll(PHONE_PATTERN, text));
    }

    public static boolean hasPaymentIdentifier(String text) {
        return text != null && UPI_PATTERN.matcher(text).find();
    }

    public static boolean hasUrl(String text) {
        return text != null && URL_PATTERN.matcher(text).find();
    }

    /**
     * 是否含任何可抽取的結構化情資（付款帳號、網址、帳號或電話）
     */
    public static boolean hasAnyArtifact(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return hasPaymentIdentifier(text)
                || hasUrl(text)
                || BANK_ACCOUNT_PATTERN.matcher(text).find()
                || PHONE_PATTERN.matcher(text).find();
    }

    private static Set<String> findAll(Pattern pattern, String text) {
        Set<String> out = new LinkedHashSet<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            out.add(m.group());
        }
        return out;
    }

    private static String trimTrailingPunctuation(String token) {
        int end = token.length();
        while (end > 0 && URL_TRAILING_PUNCTUATION.indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(0, end);
    }
}
