package com.example.tieredcache.cache.backend;

import com.example.tieredcache.cache.CacheStats;
import com.example.tieredcache.cache.CacheStrategy;
import com.example.tieredcache.cache.LocalMemoryStore;
import com.example.tieredcache.cache.LocalStore;
import com.example.tieredcache.cache.LruStore;
import com.example.tieredcache.cache.distributed.DistributedStore;
import com.example.tieredcache.cache.distributed.DistributedTier;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * 전략에 맞는 CacheBackend 하나를 만든다
 * 분산 저장소는 DISTRIBUTED / MULTI 일 때만 만들어지고, 헬스체크는 DistributedTier 생성 시 한 번 수행된다
 * 로컬 티어가 LRU면 카운터용으로 용량 제한 없는 LocalMemoryStore를 따로 붙인다
 */
@Slf4j
public class CacheBackendFactory {

    private final Supplier<DistributedStore> distributedStoreSupplier;
    private final Duration probeTimeout;
    private final int lruCapacity;
    private final CacheStrategy tieredLocalStrategy;
    private final Clock clock;

    public CacheBackendFactory(Supplier<DistributedStore> distributedStoreSupplier,
                               Duration probeTimeout,
                               int lruCapacity,
                               CacheStrategy tieredLocalStrategy,
                               Clock clock) {
        if (tieredLocalStrategy != CacheStrategy.MEMORY && tieredLocalStrategy != CacheStrategy.LRU) {
            throw new IllegalArgumentException("Tiered local tier must be MEMORY or LRU: " + tieredLocalStrategy);
        }
        this.distributedStoreSupplier = distributedStoreSupplier;
        this.probeTimeout = probeTimeout;
        this.lruCapacity = lruCapacity;
        this.tieredLocalStrategy = tieredLocalStrategy;
        this.clock = clock;
    }

    public CacheBackend create(CacheStrategy strategy) {
        CacheStats stats = new CacheStats();
        log.info("[캐시 백엔드 생성] strategy={}, lruCapacity={}", strategy, lruCapacity);
        switch (strategy) {
            case MEMORY:
                return new LocalCacheBackend(CacheStrategy.MEMORY, localStore(CacheStrategy.MEMORY, stats), stats);
            case LRU:
                return new LocalCacheBackend(CacheStrategy.LRU,
                        localStore(CacheStrategy.LRU, stats), localStore(CacheStrategy.MEMORY, stats), stats);
            case DISTRIBUTED:
                return new DistributedCacheBackend(
                        distributedTier(), localStore(CacheStrategy.MEMORY, stats), stats);
            case MULTI:
                LocalStore l1 = localStore(tieredLocalStrategy, stats);
                LocalStore counters = tieredLocalStrategy == CacheStrategy.LRU ? localStore(CacheStrategy.MEMORY, stats) : l1;
                return new TieredCacheBackend(l1, counters, distributedTier(), stats);
            default:
                throw new IllegalArgumentException("Unknown cache strategy: " + strategy);
        }
    }

    private LocalStore localStore(CacheStrategy kind, CacheStats stats) {
        if (kind == CacheStrategy.LRU) {
            return new LruStore(lruCapacity, clock, stats::recordEviction);
        }
        return new LocalMemoryStore(clock, stats::recordEviction);
    }

    private DistributedTier distributedTier() {
        return new DistributedTier(distributedStoreSupplier.get(), probeTimeout);
    }
}
