package com.example.tieredcache.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 프로세스 내부 캐시 티어 (LocalMemoryStore, LruStore)
 * 값은 직렬화된 바이트, 카운터는 ASCII 10진수 문자열로 저장한다 (Redis INCRBY와 동일한 표현)
 */
public interface LocalStore {

    long TTL_NO_EXPIRY = -1L;
    long TTL_MISSING = -2L;

    Optional<byte[]> get(String key);

    void put(String key, byte[] value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    /**
     * 남은 TTL (초). 만료 없음 -1, 키 없음 -2
     */
    long ttl(String key);

    boolean expire(String key, Duration ttl);

    /**
     * 카운터 증가. 키가 없으면 0에서 시작하고, 기존 항목의 남은 TTL은 유지한다
     *
     * @throws NumberFormatException 기존 값이 카운터 표현이 아닐 때
     */
    long increment(String key, long amount);

    /**
     * 조건에 맞는 키를 모두 삭제
     * @return 삭제된 키 수
     */
    int removeIf(Predicate<String> keyFilter);

    /**
     * 만료되지 않은 키 스냅샷
     */
    Set<String> keys();

    int size();

    void clear();
}
