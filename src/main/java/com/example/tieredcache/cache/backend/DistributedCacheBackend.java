package com.example.tieredcache.cache.backend;

import com.example.tieredcache.cache.CachePrefix;
import com.example.tieredcache.cache.CacheStats;
import com.example.tieredcache.cache.CacheStatsSnapshot;
import com.example.tieredcache.cache.CacheStrategy;
import com.example.tieredcache.cache.CacheWriteResult;
import com.example.tieredcache.cache.LocalStore;
import com.example.tieredcache.cache.distributed.DistributedTier;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Redis 단독 백엔드
 * 분산 티어가 내려가면 fallback 로컬 저장소로 계속 동작한다 (로컬 전용 모드)
 */
public class DistributedCacheBackend extends AbstractCacheBackend {

    private final DistributedTier tier;
    private final LocalStore fallback;

    public DistributedCacheBackend(DistributedTier tier, LocalStore fallback, CacheStats stats) {
        super(CacheStrategy.DISTRIBUTED, stats);
        this.tier = tier;
        this.fallback = fallback;
    }

    @Override
    public Optional<byte[]> get(String key) {
        // 바깥 Optional: 호출 성공 여부, 안쪽 Optional: 값 존재 여부
        Optional<Optional<byte[]>> remote = tier.call("get", key, store -> store.get(key));
        Optional<byte[]> value = remote.orElseGet(() -> fallback.get(key));
        if (value.isEmpty()) {
            stats.recordMiss();
        } else if (remote.isPresent()) {
            stats.recordDistributedHit();
        } else {
            stats.recordLocalHit();
        }
        return value;
    }

    @Override
    public CacheWriteResult set(String key, byte[] value, Duration ttl) {
        if (tier.run("set", key, store -> store.set(key, value, ttl))) {
            return CacheWriteResult.STORED;
        }
        fallback.put(key, value, ttl);
        return CacheWriteResult.STORED_LOCAL_ONLY;
    }

    @Override
    public CacheWriteResult setMany(Map<String, byte[]> entries, Duration ttl) {
        if (tier.run("pipelineSet", entries.size() + " keys", store -> store.pipelineSet(entries, ttl))) {
            return CacheWriteResult.STORED;
        }
        entries.forEach((key, value) -> fallback.put(key, value, ttl));
        return CacheWriteResult.STORED_LOCAL_ONLY;
    }

    @Override
    public boolean delete(String key) {
        boolean remote = tier.call("delete", key, store -> store.delete(key)).orElse(false);
        return fallback.delete(key) || remote;
    }

    @Override
    public boolean exists(String key) {
        return tier.call("exists", key, store -> store.exists(key))
                .orElseGet(() -> fallback.exists(key));
    }

    @Override
    public long clearPrefix(String keyPattern) {
        long remote = tier.call("clearPrefix", keyPattern,
                store -> store.deleteAll(store.scanByPrefix(keyPattern))).orElse(0L);
        return remote + fallback.removeIf(key -> key.startsWith(keyPattern));
    }

    @Override
    public void clear() {
        for (CachePrefix prefix : CachePrefix.values()) {
            clearPrefix(prefix.keyPattern());
        }
        fallback.clear();
        stats.reset();
    }

    @Override
    public long increment(String key, long amount) {
        return tier.call("incrBy", key, store -> store.incrBy(key, amount))
                .orElseGet(() -> fallback.increment(key, amount));
    }

    /**
     * 조회 통계(hit/miss)에 넣지 않는다
     */
    @Override
    public Optional<byte[]> readCounter(String key) {
        Optional<Optional<byte[]>> remote = tier.call("get", key, store -> store.get(key));
        return remote.orElseGet(() -> fallback.get(key));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return tier.call("expire", key, store -> store.expire(key, ttl))
                .orElseGet(() -> fallback.expire(key, ttl));
    }

    @Override
    public long ttl(String key) {
        return tier.call("ttl", key, store -> store.ttl(key))
                .orElseGet(() -> fallback.ttl(key));
    }

    @Override
    public CacheStatsSnapshot stats() {
        Set<String> localKeys = fallback.keys();
        Map<String, Long> prefixCounts = tier.isAvailable() ? remotePrefixCounts() : countByPrefix(localKeys);
        return snapshotBuilder()
                .localItems(localKeys.size())
                .prefixCounts(prefixCounts)
                .distributedAvailable(tier.isAvailable())
                .build();
    }

    @Override
    public void close() {
        tier.close();
    }

    private Map<String, Long> remotePrefixCounts() {
        Map<String, Long> counts = new TreeMap<>();
        for (CachePrefix prefix : CachePrefix.values()) {
            tier.call("scan", prefix.keyPattern(), store -> store.scanByPrefix(prefix.keyPattern()))
                    .filter(keys -> !keys.isEmpty())
                    .ifPresent(keys -> counts.put(prefix.value(), (long) keys.size()));
        }
        return counts;
    }
}
