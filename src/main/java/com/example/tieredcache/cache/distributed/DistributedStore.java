package com.example.tieredcache.cache.distributed;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 네트워크 키-값 저장소 클라이언트 (운영은 Redis)
 * 구현체는 여러 스레드에서 동시에 써도 안전해야 한다.
 * 연결 실패/타임아웃은 DistributedStoreException, 서버가 거부한 명령은 DistributedCommandException으로 던진다
 */
public interface DistributedStore extends AutoCloseable {

    long TTL_NO_EXPIRY = -1L;
    long TTL_MISSING = -2L;

    Optional<byte[]> get(String key);

    /**
     * @param ttl null 이거나 0 이하면 만료 없음
     */
    void set(String key, byte[] value, Duration ttl);

    boolean delete(String key);

    long deleteAll(Collection<String> keys);

    boolean exists(String key);

    /**
     * prefix로 시작하는 키 조회 (SCAN 기반, 블로킹 KEYS 사용 안 함)
     */
    Set<String> scanByPrefix(String prefix);

    /**
     * 여러 키를 한 번의 왕복으로 저장
     */
    void pipelineSet(Map<String, byte[]> entries, Duration ttl);

    /**
     * 원자적 증가. 키가 없으면 0에서 시작하고 기존 TTL은 유지된다
     */
    long incrBy(String key, long amount);

    boolean expire(String key, Duration ttl);

    /**
     * 남은 TTL (초). 만료 없음 -1, 키 없음 -2
     */
    long ttl(String key);

    /**
     * 제한 시간 안에 응답하는지 확인 (예외를 던지지 않음)
     */
    boolean ping(Duration timeout);

    @Override
    void close();
}
