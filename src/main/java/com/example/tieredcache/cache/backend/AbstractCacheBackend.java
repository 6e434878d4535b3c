package com.example.tieredcache.cache.backend;

import com.example.tieredcache.cache.CachePrefix;
import com.example.tieredcache.cache.CacheStats;
import com.example.tieredcache.cache.CacheStatsSnapshot;
import com.example.tieredcache.cache.CacheStrategy;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

abstract class AbstractCacheBackend implements CacheBackend {

    protected final CacheStrategy strategy;
    protected final CacheStats stats;

    protected AbstractCacheBackend(CacheStrategy strategy, CacheStats stats) {
        this.strategy = strategy;
        this.stats = stats;
    }

    @Override
    public CacheStrategy strategy() {
        return strategy;
    }

    protected CacheStatsSnapshot.CacheStatsSnapshotBuilder snapshotBuilder() {
        return CacheStatsSnapshot.builder()
                .strategy(strategy)
                .hits(stats.hits())
                .misses(stats.misses())
                .evictions(stats.evictions())
                .hitRate(stats.hitRate())
                .localHits(stats.localHits())
                .distributedHits(stats.distributedHits());
    }

    protected static Map<String, Long> countByPrefix(Collection<String> keys) {
        Map<String, Long> counts = new TreeMap<>();
        for (String key : keys) {
            counts.merge(CachePrefix.prefixOf(key), 1L, Long::sum);
        }
        return counts;
    }

    /**
     * 분산 티어가 돌려준 남은 TTL(초)을 로컬 티어에 다시 쓸 Duration으로 변환
     * 만료 없음(-1)이면 null
     */
    protected static Duration remainingTtl(long ttlSeconds) {
        return ttlSeconds > 0 ? Duration.ofSeconds(ttlSeconds) : null;
    }
}
