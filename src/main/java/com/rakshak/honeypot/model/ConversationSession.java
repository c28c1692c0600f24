package com.rakshak.honeypot.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 對話 Session 模型
 * 記錄多輪對話歷史與累積情資
 * <p>
 * 歷史、情資與旗標皆以 Session 自身的 lock 保護，不同 Session 之間互不阻塞。
 * lastActiveAt 為 volatile，Session 表的 `compute` 與過期清理讀寫它時不取得 Session lock。
 * 情資集合只增不減；escalationSent 只會由 false 轉為 true 一次。
 */
public class ConversationSession {

    private static final int BOT_PATTERN_WINDOW = 3;

    private final String sessionId;
    private final long createdAt;
    private volatile long lastActiveAt;
    private final List<String> history = new ArrayList<>();

    private final Set<String> upiIds = new LinkedHashSet<>();
    private final Set<String> bankAccounts = new LinkedHashSet<>();
    private final Set<String> phishingLinks = new LinkedHashSet<>();
    private final Set<String> phoneNumbers = new LinkedHashSet<>();
    private final Set<String> suspiciousKeywords = new LinkedHashSet<>();

    private boolean escalationSent;
    private boolean scamConfirmed;
    private final Object lock = new Object();

    public ConversationSession(String sessionId, long now) {
        this.sessionId = sessionId;
        this.createdAt = now;
        this.lastActiveAt = now;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastActiveAt() {
        return lastActiveAt;
    }

    /**
     * 只由 Session 表的 `compute` 呼叫，同一 key 的寫入已被序列化
     */
    public void touch(long now) {
        if (now > lastActiveAt) {
            lastActiveAt = now;
        }
    }

    public boolean isExpired(long now, long ttlMs) {
        return now - lastActiveAt > ttlMs;
    }

    /**
     * 在 Session lock 內執行整段操作，讓同一對話的一輪處理不會與其他請求交錯
     * <p>
     * action 內不可再經由 Session 表取得 Session（例如 getOrCreateSession），
     * 否則會與 `compute` 形成反向鎖序。
     */
    public <T> T locked(Supplier<T> action) {
        synchronized (lock) {
            return action.get();
        }
    }

    public void appendMessage(String text) {
        synchronized (lock) {
            history.add(text == null ? "" : text);
        }
    }

    public List<String> getHistory() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    public int getMessageCount() {
        synchronized (lock) {
            return history.size();
        }
    }

    /**
     * 合併情資 (Merge Intelligence)
     * <p>
     * 以集合聯集方式併入本輪抽取結果與可疑關鍵字，重複套用不會改變內容。
     *
     * @return 有任何新成員加入時回傳 true
     */
    public boolean mergeIntelligence(ExtractedEntities extracted, Collection<String> keywords) {
        synchronized (lock) {
            boolean changed = false;
            if (extracted != null) {
                changed |= upiIds.addAll(extracted.upiIds());
                changed |= bankAccounts.addAll(extracted.bankAccounts());
                changed |= phishingLinks.addAll(extracted.urls());
                changed |= phoneNumbers.addAll(extracted.phoneNumbers());
            }
            if (keywords != null) {
                changed |= suspiciousKeywords.addAll(keywords);
            }
            return changed;
        }
    }

    public AccumulatedIntelligence snapshotIntelligence() {
        synchronized (lock) {
            return new AccumulatedIntelligence(
                    new ArrayList<>(bankAccounts),
                    new ArrayList<>(upiIds),
                    new ArrayList<>(phishingLinks),
                    new ArrayList<>(phoneNumbers),
                    new ArrayList<>(suspiciousKeywords));
        }
    }

    /**
     * 標記已送出報告
     *
     * @return 只有第一次呼叫（實際將旗標由 false 轉 true）時回傳 true
     */
    public boolean markEscalated() {
        synchronized (lock) {
            if (escalationSent) {
                return false;
            }
            escalationSent = true;
            return true;
        }
    }

    public boolean isEscalationSent() {
        synchronized (lock) {
            return escalationSent;
        }
    }

    public void markScamConfirmed() {
        synchronized (lock) {
            scamConfirmed = true;
        }
    }

    public boolean isScamConfirmed() {
        synchronized (lock) {
            return scamConfirmed;
        }
    }

    /**
     * 最近三則訊息字數完全相同時，視為對方可能是自動化程式（弱訊號，不影響詐騙判定）
     */
    public boolean isLikelyAutomated() {
        synchronized (lock) {
            if (history.size() < BOT_PATTERN_WINDOW) {
                return false;
            }
            List<String> recent = history.subList(history.size() - BOT_PATTERN_WINDOW, history.size());
            int first = wordCount(recent.get(0));
            for (String message : recent) {
                if (wordCount(message) != first) {
                    return false;
                }
            }
            return true;
        }
    }

    static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
