package com.example.tieredcache.cache.backend;

import com.example.tieredcache.cache.CachePrefix;
import com.example.tieredcache.cache.CacheStats;
import com.example.tieredcache.cache.CacheStatsSnapshot;
import com.example.tieredcache.cache.CacheWriteResult;
import com.example.tieredcache.cache.CacheStrategy;
import com.example.tieredcache.cache.LocalStore;
import com.example.tieredcache.cache.distributed.DistributedStore;
import com.example.tieredcache.cache.distributed.DistributedTier;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 2단 캐시 (L1: 로컬 저장소, L2: Redis)
 *
 * <ul>
 *   <li>조회: L1 → L2, L2 히트 시 남은 TTL 그대로 L1 백필</li>
 *   <li>저장: L1은 항상, L2는 best-effort (실패해도 저장 성공으로 보고 L1을 기준으로 삼는다)</li>
 *   <li>삭제/prefix 삭제: 양쪽 모두 (L2는 SCAN 후 일괄 삭제)</li>
 *   <li>카운터(increment/ttl/expire): 계층화하지 않는다. L2가 살아 있으면 L2가 유일한 기준이고,
 *       로컬 전용 모드로 내려간 뒤에는 로컬 카운터 저장소가 기준이다. 전환 직전 L2에 있던 카운트는 옮겨지지 않는다.</li>
 * </ul>
 *
 * L1이 LRU면 카운터 저장소는 용량 제한 없는 별도 저장소라서, 캐시 트래픽이 잠금 기록을 밀어내지 못한다.
 */
@Slf4j
public class TieredCacheBackend extends AbstractCacheBackend {

    private final LocalStore local;
    private final LocalStore counters;
    private final DistributedTier tier;

    public TieredCacheBackend(LocalStore local, DistributedTier tier, CacheStats stats) {
        this(local, local, tier, stats);
    }

    public TieredCacheBackend(LocalStore local, LocalStore counters, DistributedTier tier, CacheStats stats) {
        super(CacheStrategy.MULTI, stats);
        this.local = local;
        this.counters = counters;
        this.tier = tier;
    }

    @Override
    public Optional<byte[]> get(String key) {
        Optional<byte[]> cached = local.get(key);
        if (cached.isPresent()) {
            stats.recordLocalHit();
            return cached;
        }

        Optional<byte[]> remote = tier.call("get", key, store -> store.get(key)).flatMap(value -> value);
        if (remote.isEmpty()) {
            Optional<byte[]> counter = counters == local ? Optional.empty() : counters.get(key);
            if (counter.isPresent()) {
                stats.recordLocalHit();
            } else {
                stats.recordMiss();
            }
            return counter;
        }

        backfill(key, remote.get());
        stats.recordDistributedHit();
        return remote;
    }

    @Override
    public CacheWriteResult set(String key, byte[] value, Duration ttl) {
        local.put(key, value, ttl);
        if (tier.run("set", key, store -> store.set(key, value, ttl))) {
            return CacheWriteResult.STORED;
        }
        return CacheWriteResult.STORED_LOCAL_ONLY;
    }

    @Override
    public CacheWriteResult setMany(Map<String, byte[]> entries, Duration ttl) {
        entries.forEach((key, value) -> local.put(key, value, ttl));
        if (tier.run("pipelineSet", entries.size() + " keys", store -> store.pipelineSet(entries, ttl))) {
            return CacheWriteResult.STORED;
        }
        return CacheWriteResult.STORED_LOCAL_ONLY;
    }

    @Override
    public boolean delete(String key) {
        boolean remote = tier.call("delete", key, store -> store.delete(key)).orElse(false);
        boolean removedCounter = counters != local && counters.delete(key);
        return local.delete(key) || removedCounter || remote;
    }

    @Override
    public boolean exists(String key) {
        return local.exists(key)
                || tier.call("exists", key, store -> store.exists(key)).orElseGet(() -> counters.exists(key));
    }

    @Override
    public long clearPrefix(String keyPattern) {
        long removedLocal = local.removeIf(key -> key.startsWith(keyPattern));
        if (counters != local) {
            removedLocal += counters.removeIf(key -> key.startsWith(keyPattern));
        }
        long removedRemote = tier.call("clearPrefix", keyPattern,
                store -> store.deleteAll(store.scanByPrefix(keyPattern))).orElse(0L);
        log.debug("[prefix 삭제] pattern={}, local={}, remote={}", keyPattern, removedLocal, removedRemote);
        return removedLocal + removedRemote;
    }

    @Override
    public void clear() {
        local.clear();
        counters.clear();
        for (CachePrefix prefix : CachePrefix.values()) {
            tier.call("clearPrefix", prefix.keyPattern(),
                    store -> store.deleteAll(store.scanByPrefix(prefix.keyPattern())));
        }
        stats.reset();
    }

    @Override
    public long increment(String key, long amount) {
        Optional<Long> remote = tier.call("incrBy", key, store -> store.incrBy(key, amount));
        if (remote.isPresent()) {
            // L1에 남은 사본이 카운터를 가리지 않도록 제거
            local.delete(key);
            return remote.get();
        }
        return counters.increment(key, amount);
    }

    /**
     * L1 백필 없이 기준 티어에서만 읽는다
     */
    @Override
    public Optional<byte[]> readCounter(String key) {
        Optional<Optional<byte[]>> remote = tier.call("get", key, store -> store.get(key));
        return remote.orElseGet(() -> counters.get(key));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        Optional<Boolean> remote = tier.call("expire", key, store -> store.expire(key, ttl));
        boolean applied = local.expire(key, ttl);
        if (counters != local) {
            applied = counters.expire(key, ttl) || applied;
        }
        return remote.orElse(applied);
    }

    @Override
    public long ttl(String key) {
        return tier.call("ttl", key, store -> store.ttl(key))
                .orElseGet(() -> {
                    long ttl = counters.ttl(key);
                    return ttl == LocalStore.TTL_MISSING ? local.ttl(key) : ttl;
                });
    }

    @Override
    public CacheStatsSnapshot stats() {
        Set<String> localKeys = new HashSet<>(local.keys());
        localKeys.addAll(counters.keys());
        Map<String, Long> prefixCounts = new TreeMap<>(countByPrefix(localKeys));
        if (tier.isAvailable()) {
            for (CachePrefix prefix : CachePrefix.values()) {
                tier.call("scan", prefix.keyPattern(), store -> store.scanByPrefix(prefix.keyPattern()))
                        .filter(keys -> !keys.isEmpty())
                        .ifPresent(keys -> prefixCounts.merge(prefix.value(), (long) keys.size(), Math::max));
            }
        }
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

    /**
     * L2 값의 남은 TTL을 유지한 채 L1에 채운다
     * TTL 조회 시점에 이미 만료됐으면(-2) 채우지 않는다
     */
    private void backfill(String key, byte[] value) {
        long ttlSeconds = tier.call("ttl", key, store -> store.ttl(key)).orElse(DistributedStore.TTL_MISSING);
        if (ttlSeconds == DistributedStore.TTL_MISSING || ttlSeconds == 0) {
            return;
        }
        local.put(key, value, remainingTtl(ttlSeconds));
        log.debug("[L1 백필] key={}, ttl={}s", key, ttlSeconds);
    }
}
