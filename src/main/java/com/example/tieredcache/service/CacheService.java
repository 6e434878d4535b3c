package com.example.tieredcache.service;

import com.example.tieredcache.cache.CachePrefix;
import com.example.tieredcache.cache.CacheStatsSnapshot;
import com.example.tieredcache.cache.CacheValueCodec;
import com.example.tieredcache.cache.CacheWriteResult;
import com.example.tieredcache.cache.CounterCodec;
import com.example.tieredcache.cache.backend.CacheBackend;
import com.example.tieredcache.config.CacheProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 캐시 파사드
 *
 * 전략(MEMORY / LRU / DISTRIBUTED / MULTI)은 생성 시점에 정해진 CacheBackend 하나로 고정된다.
 * 키는 항상 "{prefix}:{id}" 규칙으로 만든다.
 *
 * 실패 정책: 캐시는 최적화일 뿐이므로 일반 연산의 실패는 로그만 남기고 삼킨다
 * (get은 empty, set은 false). 예외는 카운터 연산(increment/getCounter)뿐이다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheService {

    private final CacheBackend backend;
    private final CacheValueCodec codec;
    private final CacheProperties cacheProperties;

    public Optional<Object> get(CachePrefix prefix, String id) {
        String key = prefix.key(id);
        return guard("get", key, () -> backend.get(key).flatMap(bytes -> codec.decode(key, bytes)), Optional.empty());
    }

    public <T> Optional<T> get(CachePrefix prefix, String id, Class<T> type) {
        return get(prefix, id).flatMap(value -> {
            if (type.isInstance(value)) {
                return Optional.of(type.cast(value));
            }
            log.warn("[캐시 타입 불일치] key={}, expected={}, actual={}",
                    prefix.key(id), type.getSimpleName(), value.getClass().getSimpleName());
            return Optional.empty();
        });
    }

    /**
     * prefix 기본 TTL로 저장
     */
    public boolean set(CachePrefix prefix, String id, Object value) {
        return write(prefix, id, value, cacheProperties.defaultTtl(prefix)).isStored();
    }

    public boolean set(CachePrefix prefix, String id, Object value, Duration ttl) {
        return write(prefix, id, value, ttl).isStored();
    }

    /**
     * 결과를 구분해서 돌려주는 저장. 토큰처럼 유실 여부가 중요한 경로에서 사용
     */
    public CacheWriteResult write(CachePrefix prefix, String id, Object value, Duration ttl) {
        String key = prefix.key(id);
        Optional<byte[]> encoded = codec.encode(key, value);
        if (encoded.isEmpty()) {
            return CacheWriteResult.SERIALIZATION_FAILED;
        }
        CacheWriteResult result = guard("set", key,
                () -> backend.set(key, encoded.get(), ttl), CacheWriteResult.NOT_STORED);
        log.debug("[캐시 저장] key={}, ttl={}, result={}", key, ttl, result);
        return result;
    }

    public boolean delete(CachePrefix prefix, String id) {
        String key = prefix.key(id);
        return guard("delete", key, () -> backend.delete(key), false);
    }

    public boolean exists(CachePrefix prefix, String id) {
        String key = prefix.key(id);
        return guard("exists", key, () -> backend.exists(key), false);
    }

    /**
     * 전체 삭제 + 통계 초기화
     */
    public boolean clear() {
        return guard("clear", "*", () -> {
            backend.clear();
            log.info("[캐시 전체 삭제] strategy={}", backend.strategy());
            return true;
        }, false);
    }

    /**
     * prefix 단위 삭제. 비어 있는 prefix를 다시 지워도 0을 돌려줄 뿐 오류가 아니다
     */
    public long clearPrefix(CachePrefix prefix) {
        long removed = guard("clearPrefix", prefix.keyPattern(), () -> backend.clearPrefix(prefix.keyPattern()), 0L);
        log.info("[캐시 prefix 삭제] prefix={}, removed={}", prefix.value(), removed);
        return removed;
    }

    /**
     * @return id → 값 (없는 id는 결과에서 빠진다)
     */
    public <T> Map<String, T> getMany(CachePrefix prefix, Collection<String> ids, Class<T> type) {
        List<String> keys = ids.stream().map(prefix::key).toList();
        Map<String, byte[]> found = guard("getMany", keys.size() + " keys", () -> backend.getMany(keys), Map.of());

        Map<String, T> result = new LinkedHashMap<>();
        for (String id : ids) {
            String key = prefix.key(id);
            byte[] bytes = found.get(key);
            if (bytes == null) {
                continue;
            }
            codec.decode(key, bytes)
                    .filter(type::isInstance)
                    .map(type::cast)
                    .ifPresent(value -> result.put(id, value));
        }
        return result;
    }

    /**
     * 하나라도 직렬화에 실패하면 아무것도 저장하지 않고 false
     */
    public boolean setMany(CachePrefix prefix, Map<String, ?> values, Duration ttl) {
        Map<String, byte[]> encoded = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String key = prefix.key(entry.getKey());
            Optional<byte[]> bytes = codec.encode(key, entry.getValue());
            if (bytes.isEmpty()) {
                return false;
            }
            encoded.put(key, bytes.get());
        }
        if (encoded.isEmpty()) {
            return true;
        }
        return guard("setMany", encoded.size() + " keys",
                () -> backend.setMany(encoded, ttl).isStored(), false);
    }

    /**
     * 카운터 증가 (키가 없으면 0부터). 기존 TTL은 유지된다
     *
     * @throws CacheUnavailableException 저장소가 증가를 처리하지 못한 경우
     */
    public long increment(CachePrefix prefix, String id, long amount) {
        String key = prefix.key(id);
        try {
            return backend.increment(key, amount);
        } catch (RuntimeException e) {
            log.error("[카운터 증가 실패] key={}, cause={}", key, e.getMessage());
            throw new CacheUnavailableException("Counter increment failed for key=" + key, e);
        }
    }

    /**
     * 카운터 조회. 없거나 카운터 형식이 아니면 0
     *
     * @throws CacheUnavailableException 저장소 조회 자체가 실패한 경우
     */
    public long getCounter(CachePrefix prefix, String id) {
        String key = prefix.key(id);
        Optional<byte[]> bytes;
        try {
            bytes = backend.readCounter(key);
        } catch (RuntimeException e) {
            log.error("[카운터 조회 실패] key={}, cause={}", key, e.getMessage());
            throw new CacheUnavailableException("Counter read failed for key=" + key, e);
        }
        if (bytes.isEmpty()) {
            return 0L;
        }
        try {
            return CounterCodec.decode(bytes.get());
        } catch (NumberFormatException e) {
            log.warn("[카운터 형식 아님] key={}", key);
            return 0L;
        }
    }

    /**
     * 남은 TTL (초). 키가 없거나 만료가 없으면 -1
     */
    public long ttl(CachePrefix prefix, String id) {
        String key = prefix.key(id);
        long ttl = guard("ttl", key, () -> backend.ttl(key), -1L);
        return ttl < 0 ? -1L : ttl;
    }

    public boolean expire(CachePrefix prefix, String id, Duration ttl) {
        String key = prefix.key(id);
        return guard("expire", key, () -> backend.expire(key, ttl), false);
    }

    public CacheStatsSnapshot getStats() {
        return guard("stats", "*", backend::stats, CacheStatsSnapshot.empty(backend.strategy()));
    }

    // 인증 계층용 토큰 캐시

    public CacheWriteResult cacheToken(String userId, String token, Duration ttl) {
        return write(CachePrefix.TOKEN, userId, token, ttl);
    }

    public Optional<String> getToken(String userId) {
        return get(CachePrefix.TOKEN, userId, String.class);
    }

    public boolean invalidateToken(String userId) {
        return delete(CachePrefix.TOKEN, userId);
    }

    // 레시피 조회수

    public long incrementRecipeViews(String recipeId) {
        try {
            return increment(CachePrefix.STATS, recipeViewsId(recipeId), 1L);
        } catch (CacheUnavailableException e) {
            return 0L;
        }
    }

    public long getRecipeViews(String recipeId) {
        try {
            return getCounter(CachePrefix.STATS, recipeViewsId(recipeId));
        } catch (CacheUnavailableException e) {
            return 0L;
        }
    }

    @PreDestroy
    public void close() {
        try {
            backend.close();
            log.info("[캐시 종료] strategy={}", backend.strategy());
        } catch (RuntimeException e) {
            log.warn("[캐시 종료 실패] cause={}", e.getMessage());
        }
    }

    private static String recipeViewsId(String recipeId) {
        return "recipe_views:" + recipeId;
    }

    private <T> T guard(String operation, String key, Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.error("[캐시 {} 실패] key={}, cause={}", operation, key, e.getMessage());
            return fallback;
        }
    }
}
