package com.example.tieredcache.cache;

import lombok.Getter;

import java.time.Duration;

/**
 * 로컬 티어에 저장되는 항목
 * expireAtMs가 0이면 만료 없음, 그 외에는 now > expireAtMs 인 순간부터 논리적으로 없는 값
 */
@Getter
public class CacheEntry {

    private static final long NO_EXPIRY = 0L;

    private final String key;
    private final byte[] value;
    private final long expireAtMs;
    private final long createdAtMs;

    private CacheEntry(String key, byte[] value, long expireAtMs, long createdAtMs) {
        this.key = key;
        this.value = value;
        this.expireAtMs = expireAtMs;
        this.createdAtMs = createdAtMs;
    }

    public static CacheEntry of(String key, byte[] value, Duration ttl, long nowMs) {
        return new CacheEntry(key, value, expireAt(ttl, nowMs), nowMs);
    }

    public boolean hasExpiry() {
        return expireAtMs != NO_EXPIRY;
    }

    public boolean isExpired(long nowMs) {
        return hasExpiry() && nowMs > expireAtMs;
    }

    /**
     * 남은 TTL (초, 올림). 만료 없음이면 -1
     */
    public long remainingSeconds(long nowMs) {
        if (!hasExpiry()) {
            return -1L;
        }
        long remainingMs = expireAtMs - nowMs;
        if (remainingMs <= 0) {
            return 0L;
        }
        return (remainingMs + 999) / 1000;
    }

    /**
     * 남은 TTL을 그대로 유지한 채 값만 바꾼 항목 (카운터 증가용)
     */
    public CacheEntry withValue(byte[] newValue) {
        return new CacheEntry(key, newValue, expireAtMs, createdAtMs);
    }

    public CacheEntry withTtl(Duration ttl, long nowMs) {
        return new CacheEntry(key, value, expireAt(ttl, nowMs), createdAtMs);
    }

    private static long expireAt(Duration ttl, long nowMs) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return NO_EXPIRY;
        }
        return nowMs + ttl.toMillis();
    }
}
