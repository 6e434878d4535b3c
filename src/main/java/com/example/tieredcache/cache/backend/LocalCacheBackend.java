package com.example.tieredcache.cache.backend;

import com.example.tieredcache.cache.CacheStats;
import com.example.tieredcache.cache.CacheStatsSnapshot;
import com.example.tieredcache.cache.CacheStrategy;
import com.example.tieredcache.cache.CacheWriteResult;
import com.example.tieredcache.cache.LocalStore;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 로컬 저장소 하나로 동작하는 백엔드 (MEMORY: LocalMemoryStore, LRU: LruStore)
 *
 * 카운터(increment/readCounter)는 counters 저장소에 둔다. LRU는 일반 캐시 트래픽으로 항목이 밀려나므로
 * 로그인 잠금 같은 카운터는 용량 제한이 없는 저장소에 따로 보관한다. MEMORY는 두 저장소가 같은 인스턴스다.
 */
public class LocalCacheBackend extends AbstractCacheBackend {

    private final LocalStore store;
    private final LocalStore counters;

    public LocalCacheBackend(CacheStrategy strategy, LocalStore store, CacheStats stats) {
        this(strategy, store, store, stats);
    }

    public LocalCacheBackend(CacheStrategy strategy, LocalStore store, LocalStore counters, CacheStats stats) {
        super(strategy, stats);
        this.store = store;
        this.counters = counters;
    }

    @Override
    public Optional<byte[]> get(String key) {
        Optional<byte[]> value = store.get(key);
        if (value.isEmpty() && counters != store) {
            value = counters.get(key);
        }
        if (value.isPresent()) {
            stats.recordLocalHit();
        } else {
            stats.recordMiss();
        }
        return value;
    }

    @Override
    public CacheWriteResult set(String key, byte[] value, Duration ttl) {
        store.put(key, value, ttl);
        return CacheWriteResult.STORED;
    }

    @Override
    public boolean delete(String key) {
        boolean removed = store.delete(key);
        return counters.delete(key) || removed;
    }

    @Override
    public boolean exists(String key) {
        return store.exists(key) || counters.exists(key);
    }

    @Override
    public long clearPrefix(String keyPattern) {
        long removed = store.removeIf(key -> key.startsWith(keyPattern));
        if (counters != store) {
            removed += counters.removeIf(key -> key.startsWith(keyPattern));
        }
        return removed;
    }

    @Override
    public void clear() {
        store.clear();
        counters.clear();
        stats.reset();
    }

    @Override
    public long increment(String key, long amount) {
        return counters.increment(key, amount);
    }

    /**
     * 조회 통계(hit/miss)에 넣지 않는다
     */
    @Override
    public Optional<byte[]> readCounter(String key) {
        return counters.get(key);
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        if (counters.exists(key)) {
            return counters.expire(key, ttl);
        }
        return store.expire(key, ttl);
    }

    @Override
    public long ttl(String key) {
        long ttl = counters.ttl(key);
        return ttl == LocalStore.TTL_MISSING ? store.ttl(key) : ttl;
    }

    @Override
    public CacheStatsSnapshot stats() {
        Set<String> keys = new HashSet<>(store.keys());
        keys.addAll(counters.keys());
        return snapshotBuilder()
                .localItems(keys.size())
                .prefixCounts(countByPrefix(keys))
                .distributedAvailable(false)
                .build();
    }
}
