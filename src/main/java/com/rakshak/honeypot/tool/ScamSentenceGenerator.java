package com.rakshak.honeypot.tool;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 產生合成詐騙句子語料，輸出為 "序號. 句子" 格式，供 scam_sentences.txt 使用
 * <p>
 * 用法：ScamSentenceGenerator [count] [outputPath] [seed]
 */
public class ScamSentenceGenerator {

    static final List<String> TEMPLATES = List.of(
            "Your {entity} is {status}. Please {action}.",
            "Dear customer, your {entity} has been {status}. {action} immediately.",
            "We noticed suspicious activity in your {entity}. {action}.",
            "Congratulations! You have won a {reward}. {action}.",
            "Your {entity} will be blocked today. {action}.",
            "Police case registered regarding your {entity}. {action}.",
            "Your refund of ₹{amount} is pending. {action}.",
            "Work from home job available. Earn ₹{amount} daily. {action}.");

    static final List<String> ENTITIES = List.of(
            "bank account", "UPI account", "credit card", "debit card",
            "mobile number", "PAN card", "Aadhaar", "loan account");

    static final List<String> STATUSES = List.of(
            "blocked", "suspended", "on hold", "under verification", "flagged", "disabled");

    static final List<String> ACTIONS = List.of(
            "click the link", "verify now", "share OTP",
            "send money", "update KYC", "confirm details",
            "call this number", "reply immediately");

    static final List<String> REWARDS = List.of(
            "lottery prize", "cash reward", "bonus amount", "lucky draw prize");

    static final int MIN_AMOUNT = 500;
    static final int MAX_AMOUNT = 50000;

    public static void main(String[] args) throws IOException {
        int count = args.length >= 1 ? Integer.parseInt(args[0]) : 1000;
        String outputPath = args.length >= 2 ? args[1] : "src/main/resources/scam_sentences.txt";
        Random random = args.length >= 3 ? new Random(Long.parseLong(args[2])) : new Random();

        List<String> sentences = generate(count, random);

        Path outPath = Paths.get(outputPath);
        Path parent = outPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        write(sentences, outPath);

        System.out.println("Generated scam sentences: " + sentences.size() + " -> " + outPath.toAbsolutePath());
    }

    public static List<String> generate(int count, Random random) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String template = pick(TEMPLATES, random);
            out.add(template
                    .replace("{entity}", pick(ENTITIES, random))
                    .replace("{status}", pick(STATUSES, random))
                    .replace("{action}", capitalizeIfLeading(template, pick(ACTIONS, random)))
                    .replace("{reward}", pick(REWARDS, random))
                    .replace("{amount}", String.valueOf(MIN_AMOUNT + random.nextInt(MAX_AMOUNT - MIN_AMOUNT + 1))));
        }
        return out;
    }

    public static void write(List<String> sentences, Path outPath) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(outPath, StandardCharsets.UTF_8)) {
            int i = 1;
            for (String s : sentences) {
                writer.write(i++ + ". " + s);
                writer.newLine();
            }
        }
    }

    private static String pick(List<String> values, Random random) {
        return values.get(random.nextInt(values.size()));
    }

    // 放在句首的動作詞首字大寫，如 "Verify now immediately."
    private static String capitalizeIfLeading(String template, String action) {
        int idx = template.indexOf("{action}");
        if (idx < 2 || action.isEmpty()) {
            return action;
        }
        char before = template.charAt(idx - 2);
        if (before != '.' && before != '!') {
            return action;
        }
        return Character.toUpperCase(action.charAt(0)) + action.substring(1);
    }
}
