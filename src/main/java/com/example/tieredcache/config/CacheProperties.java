package com.example.tieredcache.config;

import com.example.tieredcache.cache.CachePrefix;
import com.example.tieredcache.cache.CacheStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

    /**
     * 캐시 백엔드 (memory | lru | distributed | multi)
     */
    private String backend = "multi";

    /**
     * multi 전략에서 L1으로 쓸 로컬 저장소 (memory | lru)
     */
    private String tieredLocal = "lru";

    /**
     * LRU 용량 (항목 수)
     */
    private int lruCapacity = 1000;

    /**
     * 기본 TTL (초), 0이면 만료 없음
     */
    private int defaultTtlSeconds = 3600;

    /**
     * prefix별 기본 TTL (초). 키는 CachePrefix 값 (recipe, token, ...)
     */
    private Map<String, Integer> prefixTtlSeconds = new HashMap<>();

    /**
     * 시작 시 분산 캐시 헬스체크 타임아웃 (밀리초)
     */
    private int healthProbeTimeoutMs = 1000;

    public CacheStrategy strategy() {
        return CacheStrategy.from(backend);
    }

    public CacheStrategy tieredLocalStrategy() {
        return CacheStrategy.from(tieredLocal);
    }

    public Duration healthProbeTimeout() {
        return Duration.ofMillis(healthProbeTimeoutMs);
    }

    /**
     * TTL 없이 set 했을 때 적용할 TTL (null이면 만료 없음)
     */
    public Duration defaultTtl(CachePrefix prefix) {
        int seconds = prefixTtlSeconds.getOrDefault(prefix.value(), defaultTtlSeconds);
        return seconds > 0 ? Duration.ofSeconds(seconds) : null;
    }
}
