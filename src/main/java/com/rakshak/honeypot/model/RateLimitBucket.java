package com.rakshak.honeypot.model;

/**
 * 固定視窗限流計數桶
 * 不可變物件，由 Session Store 以 per-key 原子操作整個替換
 *
 * @param windowStart 目前視窗起點（epoch ms）
 * @param count       自 windowStart 起觀察到的請求數
 */
public record RateLimitBucket(long windowStart, int count) {

    public static RateLimitBucket open(long now) {
        return new RateLimitBucket(now, 1);
    }

    public RateLimitBucket increment() {
        return new RateLimitBucket(windowStart, count + 1);
    }

    public boolean isWindowElapsed(long now, long windowMs) {
        return now - windowStart > windowMs;
    }
}
