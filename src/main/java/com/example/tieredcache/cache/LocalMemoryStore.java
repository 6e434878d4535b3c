package com.example.tieredcache.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 단순 인메모리 저장소 (key → 값, 만료 시각)
 *
 * 동시성: ConcurrentHashMap 기반. 단일 키 연산은 compute/조건부 remove로 원자적이고,
 * 여러 키에 걸친 연산(removeIf, keys)은 약한 일관성 스냅샷이다.
 * 만료: 읽는 시점에 만료를 확인하고 그 자리에서 지운다 (lazy expiration).
 */
public class LocalMemoryStore implements LocalStore {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Consumer<String> evictionListener;

    public LocalMemoryStore() {
        this(Clock.systemUTC(), key -> { });
    }

    public LocalMemoryStore(Clock clock, Consumer<String> evictionListener) {
        this.clock = clock;
        this.evictionListener = evictionListener;
    }

    @Override
    public Optional<byte[]> get(String key) {
        return liveEntry(key).map(CacheEntry::getValue);
    }

    @Override
    public void put(String key, byte[] value, Duration ttl) {
        entries.put(key, CacheEntry.of(key, value, ttl, now()));
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return liveEntry(key).isPresent();
    }

    @Override
    public long ttl(String key) {
        return liveEntry(key)
                .map(entry -> entry.remainingSeconds(now()))
                .orElse(TTL_MISSING);
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        long nowMs = now();
        CacheEntry updated = entries.computeIfPresent(key, (k, entry) ->
                entry.isExpired(nowMs) ? null : entry.withTtl(ttl, nowMs));
        return updated != null;
    }

    /**
     * 읽기-수정-쓰기 증가. compute 안에서 실행되므로 같은 저장소 인스턴스 안에서는 원자적이다.
     * 다른 프로세스의 로컬 티어와는 공유되지 않으므로 여러 인스턴스 사이의 정확한 카운트는 보장하지 않는다.
     */
    @Override
    public long increment(String key, long amount) {
        long nowMs = now();
        CacheEntry updated = entries.compute(key, (k, entry) -> {
            if (entry == null || entry.isExpired(nowMs)) {
                return CacheEntry.of(k, CounterCodec.encode(amount), null, nowMs);
            }
            long next = CounterCodec.decode(entry.getValue()) + amount;
            return entry.withValue(CounterCodec.encode(next));
        });
        return CounterCodec.decode(updated.getValue());
    }

    @Override
    public int removeIf(Predicate<String> keyFilter) {
        int removed = 0;
        Iterator<String> iterator = entries.keySet().iterator();
        while (iterator.hasNext()) {
            if (keyFilter.test(iterator.next())) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public Set<String> keys() {
        long nowMs = now();
        Set<String> live = new HashSet<>();
        entries.forEach((key, entry) -> {
            if (!entry.isExpired(nowMs)) {
                live.add(key);
            }
        });
        return live;
    }

    @Override
    public int size() {
        return keys().size();
    }

    @Override
    public void clear() {
        entries.clear();
    }

    private Optional<CacheEntry> liveEntry(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(now())) {
            // 같은 항목일 때만 지워야 동시에 새로 쓴 값을 날리지 않는다
            if (entries.remove(key, entry)) {
                evictionListener.accept(key);
            }
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private long now() {
        return clock.millis();
    }
}
