package com.rakshak.honeypot.service.rule;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 規則評估時共用的訊息視圖
 *
 * @param raw       原始文字（null 轉為空字串）
 * @param lower     小寫、合併空白後的文字，供 pattern 比對
 * @param plain     再去除標點後的文字，供關鍵字與句型比對
 * @param wordCount 以空白切分的字數
 */
public record MessageContext(String raw, String lower, String plain, int wordCount) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");

    public static MessageContext of(String text) {
        String raw = text == null ? "" : text;
        String lower = normalize(raw);
        String plain = plain(lower);
        int words = lower.isEmpty() ? 0 : lower.split(" ").length;
        return new MessageContext(raw, lower, plain, words);
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
    }

    public static String plain(String text) {
        if (text == null) {
            return "";
        }
        String stripped = NON_WORD.matcher(normalize(text)).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").strip();
    }

    public boolean isEmpty() {
        return plain.isEmpty();
    }
}
