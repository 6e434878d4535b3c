package com.example.tieredcache.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 용량 제한 LRU 저장소
 *
 * 삽입 순서 LinkedHashMap을 사용하고, 히트 시 remove + put으로 맨 뒤(MRU)로 옮긴다.
 * 맨 앞이 항상 LRU 항목이므로 용량 초과 시 그 하나만 제거한다.
 *
 * 동시성: 순서 갱신과 제거가 한 덩어리로 일어나야 하므로 저장소 전체를 ReentrantLock 하나로 보호한다.
 * exists/ttl은 순서를 바꾸지 않는 조회다.
 */
public class LruStore implements LocalStore {

    private final int capacity;
    private final LinkedHashMap<String, CacheEntry> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final Consumer<String> evictionListener;

    public LruStore(int capacity) {
        this(capacity, Clock.systemUTC(), key -> { });
    }

    public LruStore(int capacity, Clock clock, Consumer<String> evictionListener) {
        if (capacity < 1) {
            throw new IllegalArgumentException("LRU capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(Math.min(capacity, 1 << 16));
        this.clock = clock;
        this.evictionListener = evictionListener;
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public Optional<byte[]> get(String key) {
        lock.lock();
        try {
            CacheEntry entry = liveEntry(key);
            if (entry == null) {
                return Optional.empty();
            }
            promote(key, entry);
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String key, byte[] value, Duration ttl) {
        lock.lock();
        try {
            store(CacheEntry.of(key, value, ttl, now()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(String key) {
        lock.lock();
        try {
            return liveEntry(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long ttl(String key) {
        lock.lock();
        try {
            CacheEntry entry = liveEntry(key);
            return entry == null ? TTL_MISSING : entry.remainingSeconds(now());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        lock.lock();
        try {
            CacheEntry entry = liveEntry(key);
            if (entry == null) {
                return false;
            }
            entries.put(key, entry.withTtl(ttl, now()));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long increment(String key, long amount) {
        lock.lock();
        try {
            CacheEntry entry = liveEntry(key);
            long next = entry == null ? amount : CounterCodec.decode(entry.getValue()) + amount;
            CacheEntry updated = entry == null
                    ? CacheEntry.of(key, CounterCodec.encode(next), null, now())
                    : entry.withValue(CounterCodec.encode(next));
            store(updated);
            return next;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int removeIf(Predicate<String> keyFilter) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<String> iterator = entries.keySet().iterator();
            while (iterator.hasNext()) {
                if (keyFilter.test(iterator.next())) {
                    iterator.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> keys() {
        lock.lock();
        try {
            long nowMs = now();
            Set<String> live = new HashSet<>();
            for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
                if (!e.getValue().isExpired(nowMs)) {
                    live.add(e.getKey());
                }
            }
            return live;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        return keys().size();
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 기존 키면 교체 후 MRU로, 새 키면 용량 확인 후 LRU 하나를 내보내고 삽입
     * 호출자가 lock을 잡고 있어야 한다
     */
    private void store(CacheEntry entry) {
        String key = entry.getKey();
        if (entries.remove(key) == null && entries.size() >= capacity) {
            evictEldest();
        }
        entries.put(key, entry);
    }

    private void evictEldest() {
        Iterator<String> iterator = entries.keySet().iterator();
        if (iterator.hasNext()) {
            String eldest = iterator.next();
            iterator.remove();
            evictionListener.accept(eldest);
        }
    }

    private void promote(String key, CacheEntry entry) {
        entries.remove(key);
        entries.put(key, entry);
    }

    private CacheEntry liveEntry(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(now())) {
            entries.remove(key);
            evictionListener.accept(key);
            return null;
        }
        return entry;
    }

    private long now() {
        return clock.millis();
    }
}
