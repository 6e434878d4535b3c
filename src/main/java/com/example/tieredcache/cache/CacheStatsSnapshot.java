package com.example.tieredcache.cache;

import lombok.Builder;
import lombok.Getter;

import java.util.Locale;
import java.util.Map;

/**
 * getStats() 응답
 */
@Getter
@Builder
public class CacheStatsSnapshot {

    private final CacheStrategy strategy;
    private final long hits;
    private final long misses;
    private final long evictions;
    private final double hitRate;       // %
    private final long localHits;
    private final long distributedHits;
    private final int localItems;
    private final Map<String, Long> prefixCounts;
    private final boolean distributedAvailable;

    public String hitRateText() {
        return String.format(Locale.ROOT, "%.2f%%", hitRate);
    }

    public long prefixCount(CachePrefix prefix) {
        return prefixCounts.getOrDefault(prefix.value(), 0L);
    }

    public static CacheStatsSnapshot empty(CacheStrategy strategy) {
        return CacheStatsSnapshot.builder()
                .strategy(strategy)
                .prefixCounts(Map.of())
                .build();
    }
}
