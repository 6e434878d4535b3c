package com.example.tieredcache.cache;

import java.util.concurrent.atomic.LongAdder;

/**
 * 프로세스 단위 캐시 카운터
 * 전체 clear() 또는 재시작 시에만 0으로 돌아가고, 그 외에는 계속 누적된다
 */
public class CacheStats {

    private final LongAdder localHits = new LongAdder();
    private final LongAdder distributedHits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    public void recordLocalHit() {
        localHits.increment();
    }

    public void recordDistributedHit() {
        distributedHits.increment();
    }

    public void recordMiss() {
        misses.increment();
    }

    public void recordEviction() {
        evictions.increment();
    }

    /**
     * LocalStore 제거 콜백용 (Consumer&lt;String&gt;)
     */
    public void recordEviction(String key) {
        recordEviction();
    }

    public long hits() {
        return localHits.sum() + distributedHits.sum();
    }

    public long localHits() {
        return localHits.sum();
    }

    public long distributedHits() {
        return distributedHits.sum();
    }

    public long misses() {
        return misses.sum();
    }

    public long evictions() {
        return evictions.sum();
    }

    /**
     * 히트율 (%)
     */
    public double hitRate() {
        long hits = hits();
        long total = hits + misses();
        return total > 0 ? (double) hits / total * 100 : 0.0;
    }

    public void reset() {
        localHits.reset();
        distributedHits.reset();
        misses.reset();
        evictions.reset();
    }
}
