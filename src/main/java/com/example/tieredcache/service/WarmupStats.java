package com.example.tieredcache.service;

import com.example.tieredcache.cache.CacheStatsSnapshot;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * 원천 대비 캐시에 올라와 있는 비율
 */
@Getter
@Builder
public class WarmupStats {

    private final long recipesTotal;
    private final long recipesCached;
    private final long usersTotal;
    private final long usersCached;
    private final CacheStatsSnapshot cacheStats;
    private final LocalDateTime timestamp;

    public String recipeWarmupRate() {
        return rate(recipesCached, recipesTotal);
    }

    public String userWarmupRate() {
        return rate(usersCached, usersTotal);
    }

    private static String rate(long cached, long total) {
        if (total <= 0) {
            return "0.00%";
        }
        return String.format(Locale.ROOT, "%.2f%%", cached * 100.0 / total);
    }
}
