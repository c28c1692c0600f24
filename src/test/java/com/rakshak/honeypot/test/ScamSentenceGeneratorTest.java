package com.rakshak.honeypot.test;

import com.rakshak.honeypot.tool.ScamSentenceGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class ScamSentenceGeneratorTest {

    private static final Pattern AMOUNT = Pattern.compile("₹(\\d+)");

    @Test
    @DisplayName("產生指定數量且所有欄位都已填入")
    public void testGenerateFillsAllSlots() {
        List<String> sentences = ScamSentenceGenerator.generate(200, new Random(7));

        assertEquals(200, sentences.size());
        for (String s : sentences) {
            assertFalse(s.contains("{") || s.contains("}"), "尚有未填入的欄位: " + s);
            Matcher m = AMOUNT.matcher(s);
            if (m.find()) {
                int amount = Integer.parseInt(m.group(1));
                assertTrue(amount >= 500 && amount <= 50000, "金額超出範圍: " + amount);
            }
        }
    }

    @Test
    @DisplayName("相同種子產生相同結果")
    public void testDeterministicWithSeed() {
        assertEquals(ScamSentenceGenerator.generate(20, new Random(42)),
                ScamSentenceGenerator.generate(20, new Random(42)));
    }

    @Test
    @DisplayName("句首動作詞首字大寫")
    public void testLeadingActionCapitalized() {
        List<String> sentences = ScamSentenceGenerator.generate(300, new Random(1));

        assertTrue(sentences.stream()
                .filter(s -> s.startsWith("We noticed suspicious activity"))
                .allMatch(s -> Character.isUpperCase(s.charAt(s.indexOf(". ") + 2))));
        assertTrue(sentences.stream()
                .filter(s -> s.contains(". Please "))
                .allMatch(s -> Character.isLowerCase(s.charAt(s.indexOf(". Please ") + 9))));
    }

    @Test
    @DisplayName("輸出為編號格式")
    public void testWriteNumberedLines(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("scam_sentences.txt");
        ScamSentenceGenerator.write(List.of("first one.", "second one."), out);

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(List.of("1. first one.", "2. second one."), lines);
    }

    @Test
    @DisplayName("負數數量拋出例外")
    public void testNegativeCount() {
        assertThrows(IllegalArgumentException.class, () -> ScamSentenceGenerator.generate(-1, new Random()));
        assertTrue(ScamSentenceGenerator.generate(0, new Random()).isEmpty());
    }
}
