package com.example.tieredcache.service;

import com.example.tieredcache.cache.CachePrefix;
import com.example.tieredcache.cache.CacheStatsSnapshot;
import com.example.tieredcache.config.WarmupProperties;
import com.example.tieredcache.domain.CacheableEntity;
import com.example.tieredcache.repository.WarmupSourceRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 캐시 웜업
 *
 * 원천 조회 → 고정 크기 배치로 분할 → 배치 안에서는 항목별 쓰기를 병렬로, 배치끼리는 순차로 실행.
 * 항목 하나의 실패(예외 또는 false)는 로그와 카운트만 남기고 나머지 항목과 다음 배치는 계속 진행한다.
 * 캐시 키는 엔티티 id로 정해지므로 다시 실행하면 같은 키를 덮어쓴다.
 */
@Slf4j
@Service
public class WarmupService {

    private final CacheService cacheService;
    private final WarmupSourceRepository repository;
    private final WarmupProperties properties;
    private final ExecutorService warmupExecutor;

    public WarmupService(CacheService cacheService,
                         WarmupSourceRepository repository,
                         WarmupProperties properties) {
        if (properties.getBatchSize() < 1 || properties.getMaxConcurrency() < 1) {
            throw new IllegalArgumentException("Warmup batch size and concurrency must be >= 1");
        }
        this.cacheService = cacheService;
        this.repository = repository;
        this.properties = properties;
        this.warmupExecutor = Executors.newFixedThreadPool(
                Math.min(properties.getMaxConcurrency(), properties.getBatchSize()));
    }

    @PreDestroy
    public void close() {
        warmupExecutor.shutdown();
        try {
            if (!warmupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                warmupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            warmupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 인기 레시피 + 활성 사용자 + 시스템 설정. 어느 한 단계가 실패해도 다음 단계는 실행한다
     */
    public WarmupReport warmupAll() {
        long startedAt = System.currentTimeMillis();
        WarmupReport report = warmupPopularRecipes()
                .plus(warmupActiveUsers())
                .plus(warmupSystemConfig());
        log.info("[웜업 완료] attempted={}, cached={}, failed={}, elapsed={}ms",
                report.getAttempted(), report.getCached(), report.getFailed(),
                System.currentTimeMillis() - startedAt);
        return report;
    }

    public WarmupReport warmupPopularRecipes() {
        return warmup("popularRecipes", CachePrefix.RECIPE, null,
                () -> repository.findPopularRecipes(
                        properties.getMaxAgeDays(), properties.getMinRating(), properties.getPopularLimit()));
    }

    public WarmupReport warmupActiveUsers() {
        return warmup("activeUsers", CachePrefix.USER_PROFILE, null,
                () -> repository.findActiveUsers(properties.getActiveDays(), properties.getActiveLimit()));
    }

    public WarmupReport warmupSystemConfig() {
        return warmup("systemConfig", CachePrefix.SYSTEM_CONFIG,
                Duration.ofSeconds(properties.getSystemConfigTtlSeconds()),
                repository::findSystemConfigs);
    }

    /**
     * 단일 엔티티 웜업 (RECIPE / USER_PROFILE / SYSTEM_CONFIG)
     *
     * @return 원천에 있고 캐시에 저장됐으면 true. 그 밖의 모든 경우(미지원 prefix 포함) false
     */
    public boolean warmupEntity(CachePrefix prefix, String id) {
        try {
            Optional<? extends CacheableEntity> entity = findEntity(prefix, id);
            if (entity.isEmpty()) {
                log.debug("[웜업 대상 없음] prefix={}, id={}", prefix.value(), id);
                return false;
            }
            return store(prefix, entity.get(), ttlFor(prefix));
        } catch (RuntimeException e) {
            log.warn("[웜업 실패] prefix={}, id={}, cause={}", prefix.value(), id, e.getMessage());
            return false;
        }
    }

    public WarmupStats getWarmupStats() {
        CacheStatsSnapshot cacheStats = cacheService.getStats();
        return WarmupStats.builder()
                .recipesTotal(repository.countRecipes())
                .recipesCached(cacheStats.prefixCount(CachePrefix.RECIPE))
                .usersTotal(repository.countUsers())
                .usersCached(cacheStats.prefixCount(CachePrefix.USER_PROFILE))
                .cacheStats(cacheStats)
                .timestamp(LocalDateTime.now())
                .build();
    }

    private WarmupReport warmup(String kind, CachePrefix prefix, Duration ttl,
                                Supplier<? extends List<? extends CacheableEntity>> source) {
        List<? extends CacheableEntity> candidates;
        try {
            candidates = source.get();
        } catch (RuntimeException e) {
            log.error("[웜업 원천 조회 실패] kind={}, cause={}", kind, e.getMessage());
            return WarmupReport.empty();
        }

        WarmupReport report = WarmupReport.empty();
        int batchSize = properties.getBatchSize();
        for (int from = 0; from < candidates.size(); from += batchSize) {
            List<? extends CacheableEntity> batch =
                    candidates.subList(from, Math.min(from + batchSize, candidates.size()));
            report = report.plus(runBatch(prefix, ttl, batch));
        }
        log.info("[웜업] kind={}, attempted={}, cached={}, failed={}",
                kind, report.getAttempted(), report.getCached(), report.getFailed());
        return report;
    }

    /**
     * 배치 안의 항목을 병렬로 저장하고 모두 끝날 때까지 기다린다
     */
    private WarmupReport runBatch(CachePrefix prefix, Duration ttl, List<? extends CacheableEntity> batch) {
        List<CompletableFuture<Boolean>> futures = new ArrayList<>(batch.size());
        for (CacheableEntity entity : batch) {
            futures.add(submit(prefix, ttl, entity));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        int cached = 0;
        for (CompletableFuture<Boolean> future : futures) {
            if (future.join()) {
                cached++;
            }
        }
        return WarmupReport.of(cached, batch.size() - cached);
    }

    private CompletableFuture<Boolean> submit(CachePrefix prefix, Duration ttl, CacheableEntity entity) {
        try {
            return CompletableFuture.supplyAsync(() -> storeSafely(prefix, entity, ttl), warmupExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("[웜업 실패] key={}, cause=executor rejected", prefix.key(entity.cacheId()));
            return CompletableFuture.completedFuture(false);
        }
    }

    private boolean storeSafely(CachePrefix prefix, CacheableEntity entity, Duration ttl) {
        try {
            boolean stored = store(prefix, entity, ttl);
            if (!stored) {
                log.warn("[웜업 실패] key={}, cause=not stored", prefix.key(entity.cacheId()));
            }
            return stored;
        } catch (RuntimeException e) {
            log.warn("[웜업 실패] key={}, cause={}", prefix.key(entity.cacheId()), e.getMessage());
            return false;
        }
    }

    private boolean store(CachePrefix prefix, CacheableEntity entity, Duration ttl) {
        if (ttl == null) {
            return cacheService.set(prefix, entity.cacheId(), entity);
        }
        return cacheService.set(prefix, entity.cacheId(), entity, ttl);
    }

    private Optional<? extends CacheableEntity> findEntity(CachePrefix prefix, String id) {
        switch (prefix) {
            case RECIPE:
                return repository.findRecipe(id);
            case USER_PROFILE:
                return repository.findUser(id);
            case SYSTEM_CONFIG:
                return repository.findSystemConfig(id);
            default:
                log.warn("[웜업 미지원 prefix] prefix={}", prefix.value());
                return Optional.empty();
        }
    }

    private Duration ttlFor(CachePrefix prefix) {
        return prefix == CachePrefix.SYSTEM_CONFIG ? Duration.ofSeconds(properties.getSystemConfigTtlSeconds()) : null;
    }
}
