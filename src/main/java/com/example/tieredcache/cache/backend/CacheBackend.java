package com.example.tieredcache.cache.backend;

import com.example.tieredcache.cache.CacheStatsSnapshot;
import com.example.tieredcache.cache.CacheStrategy;
import com.example.tieredcache.cache.CacheWriteResult;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 캐시 전략별 저장소 구현
 * CacheService는 이 중 정확히 하나만 들고 있고, 구체 타입으로 분기하지 않는다.
 * 키는 이미 "{prefix}:{id}"로 만들어진 전체 키, 값은 직렬화된 바이트다.
 */
public interface CacheBackend extends AutoCloseable {

    CacheStrategy strategy();

    Optional<byte[]> get(String key);

    CacheWriteResult set(String key, byte[] value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    /**
     * "recipe:" 같은 패턴으로 시작하는 키를 모두 삭제
     * @return 삭제된 키 수 (티어별 합계)
     */
    long clearPrefix(String keyPattern);

    /**
     * 이 캐시가 관리하는 키 전체 삭제 + 통계 초기화
     */
    void clear();

    long increment(String key, long amount);

    /**
     * 카운터 값 조회. 카운터를 계층화하는 백엔드는 기준 티어에서만 읽는다
     */
    default Optional<byte[]> readCounter(String key) {
        return get(key);
    }

    boolean expire(String key, Duration ttl);

    /**
     * 남은 TTL (초). 만료 없음 -1, 키 없음 -2
     */
    long ttl(String key);

    CacheStatsSnapshot stats();

    default Map<String, byte[]> getMany(Collection<String> keys) {
        Map<String, byte[]> result = new LinkedHashMap<>();
        for (String key : keys) {
            get(key).ifPresent(value -> result.put(key, value));
        }
        return result;
    }

    default CacheWriteResult setMany(Map<String, byte[]> entries, Duration ttl) {
        CacheWriteResult result = CacheWriteResult.STORED;
        for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
            if (set(entry.getKey(), entry.getValue(), ttl) == CacheWriteResult.STORED_LOCAL_ONLY) {
                result = CacheWriteResult.STORED_LOCAL_ONLY;
            }
        }
        return result;
    }

    @Override
    default void close() {
    }
}
