package com.example.tieredcache.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.util.Optional;

/**
 * 캐시 값 직렬화 (JDK 직렬화, Spring Data Redis 직렬화기 사용)
 * 실패는 예외 대신 empty로 돌려주고, 쓰기 실패 여부는 호출자가 결정한다
 */
@Slf4j
public class CacheValueCodec {

    private final RedisSerializer<Object> serializer;

    public CacheValueCodec() {
        this(RedisSerializer.java());
    }

    public CacheValueCodec(RedisSerializer<Object> serializer) {
        this.serializer = serializer;
    }

    public Optional<byte[]> encode(String key, Object value) {
        if (value == null) {
            log.warn("[직렬화 실패] null 값은 캐시하지 않음 - key={}", key);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(serializer.serialize(value));
        } catch (SerializationException e) {
            log.error("[직렬화 실패] key={}, type={}, cause={}",
                    key, value.getClass().getName(), e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<Object> decode(String key, byte[] bytes) {
        try {
            return Optional.ofNullable(serializer.deserialize(bytes));
        } catch (SerializationException e) {
            log.warn("[역직렬화 실패] 캐시 미스로 처리 - key={}, cause={}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
