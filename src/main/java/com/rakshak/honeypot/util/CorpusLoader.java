package com.rakshak.honeypot.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 文字語料載入工具
 * 從 resources 目錄讀取純文字檔，每行一筆
 */
public class CorpusLoader {

    private static final Logger logger = LoggerFactory.getLogger(CorpusLoader.class);

    /** 產生器輸出的行首編號，例如 "12. " */
    private static final Pattern LINE_NUMBER_PREFIX = Pattern.compile("^\\d+\\.\\s*");

    /**
     * 載入指定的語料檔
     * <p>
     * 去除行首編號、空白行與 # 開頭的註解行，轉為小寫並去重（保留原始順序）。
     *
     * @param resource 檔案名稱（位於 resources 目錄下）
     * @return 語料列表，若檔案不存在或讀取失敗則回傳空列表
     */
    public static List<String> loadLines(String resource) {
        if (resource == null || resource.isBlank()) {
            return Collections.emptyList();
        }
        String path = resource.startsWith("/") ? resource : "/" + resource;
        try (InputStream is = CorpusLoader.class.getResourceAsStream(path)) {
            if (is == null) {
                logger.warn("找不到語料檔: {}", resource);
                return Collections.emptyList();
            }
            Set<String> lines = new LinkedHashSet<>();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String cleaned = LINE_NUMBER_PREFIX.matcher(line.strip()).replaceFirst("");
                    if (cleaned.isEmpty() || cleaned.startsWith("#")) {
                        continue;
                    }
                    lines.add(cleaned.toLowerCase(Locale.ROOT));
                }
            }
            logger.info("成功載入語料 {}，共 {} 筆", resource, lines.size());
            return new ArrayList<>(lines);
        } catch (Exception e) {
            logger.error("載入語料檔 {} 時發生錯誤: {}", resource, e.getMessage());
            return Collections.emptyList();
        }
    }
}
