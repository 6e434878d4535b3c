package com.example.tieredcache.config;

import com.example.tieredcache.cache.CacheValueCodec;
import com.example.tieredcache.cache.backend.CacheBackend;
import com.example.tieredcache.cache.backend.CacheBackendFactory;
import com.example.tieredcache.cache.distributed.RedisDistributedStore;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;

/**
 * 캐시 빈 구성
 *
 * Redis 연결 설정은 spring.data.redis.* 를 그대로 쓰고, 연결 팩토리의 수명은 스프링이 관리한다.
 * 분산 저장소는 DISTRIBUTED / MULTI 전략일 때만 만들어진다.
 */
@Configuration
@RequiredArgsConstructor
public class CacheConfig {

    private final CacheProperties cacheProperties;

    @Bean
    public RedisTemplate<String, byte[]> cacheRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(StringRedisSerializer.UTF_8);
        template.setValueSerializer(RedisSerializer.byteArray());
        template.setHashKeySerializer(StringRedisSerializer.UTF_8);
        template.setHashValueSerializer(RedisSerializer.byteArray());
        template.setEnableDefaultSerializer(false);
        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public CacheBackendFactory cacheBackendFactory(RedisTemplate<String, byte[]> cacheRedisTemplate) {
        return new CacheBackendFactory(
                () -> new RedisDistributedStore(cacheRedisTemplate, false),
                cacheProperties.healthProbeTimeout(),
                cacheProperties.getLruCapacity(),
                cacheProperties.tieredLocalStrategy(),
                Clock.systemUTC());
    }

    /**
     * 종료는 CacheService.close()가 맡는다
     */
    @Bean(destroyMethod = "")
    public CacheBackend cacheBackend(CacheBackendFactory cacheBackendFactory) {
        return cacheBackendFactory.create(cacheProperties.strategy());
    }

    @Bean
    public CacheValueCodec cacheValueCodec() {
        return new CacheValueCodec();
    }
}
