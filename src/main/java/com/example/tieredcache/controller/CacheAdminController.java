package com.example.tieredcache.controller;

import com.example.tieredcache.cache.CachePrefix;
import com.example.tieredcache.cache.CacheStatsSnapshot;
import com.example.tieredcache.service.CacheService;
import com.example.tieredcache.service.LockStatus;
import com.example.tieredcache.service.LoginAttemptTracker;
import com.example.tieredcache.service.WarmupReport;
import com.example.tieredcache.service.WarmupService;
import com.example.tieredcache.service.WarmupStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 캐시 운영 API (통계, prefix 삭제, 웜업, 로그인 잠금 조회/해제)
 */
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final CacheService cacheService;
    private final WarmupService warmupService;
    private final LoginAttemptTracker loginAttemptTracker;

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        CacheStatsSnapshot stats = cacheService.getStats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("strategy", stats.getStrategy().name().toLowerCase());
        body.put("hits", stats.getHits());
        body.put("misses", stats.getMisses());
        body.put("evictions", stats.getEvictions());
        body.put("hitRate", stats.hitRateText());
        body.put("localHits", stats.getLocalHits());
        body.put("distributedHits", stats.getDistributedHits());
        body.put("localItems", stats.getLocalItems());
        body.put("prefixCounts", stats.getPrefixCounts());
        body.put("distributedAvailable", stats.isDistributedAvailable());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/prefixes/{prefix}")
    public ResponseEntity<Map<String, Object>> clearPrefix(@PathVariable String prefix) {
        return CachePrefix.fromValue(prefix)
                .map(cachePrefix -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("prefix", cachePrefix.value());
                    body.put("removed", cacheService.clearPrefix(cachePrefix));
                    return ResponseEntity.ok(body);
                })
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/warmup")
    public ResponseEntity<WarmupReport> warmup() {
        return ResponseEntity.ok(warmupService.warmupAll());
    }

    @GetMapping("/warmup/stats")
    public ResponseEntity<Map<String, Object>> warmupStats() {
        WarmupStats stats = warmupService.getWarmupStats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("recipes", Map.of(
                "total", stats.getRecipesTotal(),
                "cached", stats.getRecipesCached(),
                "warmupRate", stats.recipeWarmupRate()));
        body.put("users", Map.of(
                "total", stats.getUsersTotal(),
                "cached", stats.getUsersCached(),
                "warmupRate", stats.userWarmupRate()));
        body.put("timestamp", stats.getTimestamp().toString());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/lockouts/{username}")
    public ResponseEntity<LockStatus> lockStatus(@PathVariable String username) {
        return ResponseEntity.ok(loginAttemptTracker.isLocked(username));
    }

    @DeleteMapping("/lockouts/{username}")
    public ResponseEntity<Void> unlock(@PathVariable String username) {
        loginAttemptTracker.resetOnSuccess(username);
        return ResponseEntity.noContent().build();
    }
}
