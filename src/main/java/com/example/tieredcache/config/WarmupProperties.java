package com.example.tieredcache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "cache.warmup")
public class WarmupProperties {

    /**
     * 배치 크기 (배치끼리는 순차, 배치 안에서는 병렬)
     */
    private int batchSize = 100;

    /**
     * 배치 안 동시 쓰기 스레드 수 상한
     */
    private int maxConcurrency = 16;

    /**
     * 인기 레시피 웜업 개수
     */
    private int popularLimit = 500;

    /**
     * 인기 레시피 최대 데이터 나이 (일)
     */
    private int maxAgeDays = 30;

    /**
     * 인기 레시피 최저 평점
     */
    private double minRating = 4.0;

    /**
     * 활성 사용자 기준 기간 (일)
     */
    private int activeDays = 7;

    /**
     * 활성 사용자 웜업 개수
     */
    private int activeLimit = 500;

    /**
     * 시스템 설정 캐시 TTL (초)
     */
    private int systemConfigTtlSeconds = 3600;

    /**
     * 애플리케이션 시작 시 웜업 실행 여부
     */
    private boolean onStartup = false;
}
