package com.rakshak.honeypot.service.impl;

import com.rakshak.honeypot.model.ArtifactGraph;
import com.rakshak.honeypot.model.ConversationSession;
import com.rakshak.honeypot.model.ExtractedEntities;
import com.rakshak.honeypot.model.RateLimitBucket;
import com.rakshak.honeypot.service.RuntimeConfigService;
import com.rakshak.honeypot.service.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session 服務實作 (Session Service Implementation)
 * <p>
 * 功能：
 * 管理對話 Session 的建立、過期與情資累積，並提供用戶端固定視窗限流與跨對話付款帳號統計。
 * <p>
 * 同步策略：
 * 1. Session 表、限流表皆為 ConcurrentHashMap，以 `compute` 做 per-key 原子更新，不同 key 互不阻塞。
 * 2. 單一 Session 內的可變狀態由 {@link ConversationSession} 自己的 lock 保護；
 *    `compute` 與過期清理只讀寫 volatile 的 lastActiveAt，持有 map 鎖時不會再等 Session lock。
 * 3. 付款帳號統計由 {@link ArtifactGraph} 以 per-key 計數器累加。
 * 不使用任何跨 Session 的全域鎖。
 */
@Service
public class SessionServiceImpl implements SessionService {

    private static final Logger logger = LoggerFactory.getLogger(SessionServiceImpl.class);

    static final String ANONYMOUS_SESSION = "anonymous";

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, RateLimitBucket> buckets = new ConcurrentHashMap<>();

    @Autowired
    private Clock clock;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    // Session 超時時間（分鐘），預設 30 分鐘
    @Value("${session.timeout-minutes:30}")
    private int sessionTimeoutMinutes = 30;

    @Value("${artifact-graph.max-entries:10000}")
    private int artifactGraphMaxEntries = 10000;

    private volatile ArtifactGraph artifactGraph = new ArtifactGraph(10000);

    @PostConstruct
    public void init() {
        this.artifactGraph = new ArtifactGraph(artifactGraphMaxEntries);
        logger.info("Session store initialized: timeoutMinutes={}, artifactGraphMaxEntries={}",
                sessionTimeoutMinutes, artifactGraphMaxEntries);
    }

    @Override
    public ConversationSession getSession(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        ConversationSession session = sessions.get(sessionId);
        if (session == null || session.isExpired(now(), sessionTimeoutMs())) {
            return null;
        }
        return session;
    }

    /**
     * 取得或建立 Session
     * <p>
     * 流程：
     * 1. 以 `compute` 鎖定該 sessionId 的 bucket。
     * 2. 不存在，或距離 lastActiveAt 已超過 TTL → 建立全新 Session（歷史與情資皆為空）。
     * 3. 否則更新 lastActiveAt 並回傳原 Session。
     */
    @Override
    public ConversationSession getOrCreateSession(String sessionId) {
        String key = sessionId == null ? ANONYMOUS_SESSION : sessionId;
        long now = now();
        long ttl = sessionTimeoutMs();
        return sessions.compute(key, (id, existing) -> {
            if (existing == null) {
                logger.debug("建立新 Session: {}", id);
                return new ConversationSession(id, now);
            }
            if (existing.isExpired(now, ttl)) {
                logger.info("Session 已過期，重新建立: {}", id);
                return new ConversationSession(id, now);
            }
            existing.touch(now);
            return existing;
        });
    }

    @Override
    public void appendMessage(String sessionId, String text) {
        getOrCreateSession(sessionId).appendMessage(text);
    }

    /**
     * 合併情資 (Merge Intelligence)
     * <p>
     * 1. 以集合聯集併入 Session（重複套用不改變內容）。
     * 2. 每個本次觀察到的付款帳號，不論是否已存在於 Session，都在 ArtifactGraph 中 +1。
     */
    @Override
    public boolean mergeIntelligence(String sessionId, ExtractedEntities extracted, Collection<String> keywords) {
        return mergeIntelligence(getOrCreateSession(sessionId), extracted, keywords);
    }

    @Override
    public boolean mergeIntelligence(ConversationSession session, ExtractedEntities extracted,
            Collection<String> keywords) {
        boolean changed = session.mergeIntelligence(extracted, keywords);
        if (extracted != null) {
            ArtifactGraph graph = artifactGraph;
            extracted.upiIds().forEach(graph::record);
        }
        return changed;
    }

    @Override
    public boolean markEscalated(String sessionId) {
        ConversationSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        return session.markEscalated();
    }

    @Override
    public boolean isLikelyAutomated(String sessionId) {
        ConversationSession session = getSession(sessionId);
        return session != null && session.isLikelyAutomated();
    }

    /**
     * 固定視窗限流 (Fixed Window Rate Limit)
     * <p>
     * 流程：
     * 1. 以 `compute` 原子更新該用戶端的計數桶。
     * 2. 尚無計數桶，或 now - windowStart 超過視窗長度 → 重設為 count=1，允許。
     * 3. 否則 count+1；count 嚴格大於上限時回傳 true（拒絕）。
     */
    @Override
    public boolean checkRateLimit(String clientId) {
        String key = clientId == null ? "" : clientId;
        long now = now();
        long windowMs = runtimeConfigService.getRateLimitWindowSeconds() * 1000L;
        int max = runtimeConfigService.getRateLimitMaxRequests();

        RateLimitBucket bucket = buckets.compute(key, (k, existing) ->
                existing == null || existing.isWindowElapsed(now, windowMs)
                        ? RateLimitBucket.open(now)
                        : existing.increment());

        boolean limited = bucket.count() > max;
        if (limited) {
            logger.warn("用戶端 {} 超過限流上限 ({} 次 / {} 秒)", key, max,
                    runtimeConfigService.getRateLimitWindowSeconds());
        }
        return limited;
    }

    @Override
    public void clearSession(String sessionId) {
        if (sessionId == null) {
            return;
        }
        sessions.remove(sessionId);
        logger.info("已清除 Session: {}", sessionId);
    }

    /**
     * 清理過期 Session 與限流桶
     * <p>
     * Session 以 TTL 判斷；限流桶只要視窗已結束即可移除，下次請求會重新建立。
     */
    @Override
    public void cleanExpiredSessions() {
        long now = now();
        long ttl = sessionTimeoutMs();
        int before = sessions.size();
        sessions.entrySet().removeIf(entry -> entry.getValue().isExpired(now, ttl));
        int removed = before - sessions.size();

        long windowMs = runtimeConfigService.getRateLimitWindowSeconds() * 1000L;
        buckets.entrySet().removeIf(entry -> entry.getValue().isWindowElapsed(now, windowMs));

        if (removed > 0) {
            logger.info("已清理 {} 個過期 Session", removed);
        }
    }

    @Override
    public int getActiveSessionCount() {
        cleanExpiredSessions();
        return sessions.size();
    }

    @Override
    public Map<String, Long> getTopArtifacts(int limit) {
        return artifactGraph.top(limit);
    }

    private long now() {
        return clock.millis();
    }

    private long sessionTimeoutMs() {
        return sessionTimeoutMinutes * 60L * 1000L;
    }
}
