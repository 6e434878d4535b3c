package com.example.tieredcache.repository;

import com.example.tieredcache.domain.Recipe;
import com.example.tieredcache.domain.SystemConfig;
import com.example.tieredcache.domain.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 인메모리 원천 저장소
 * 실제 환경에서는 DB 조회로 대체
 */
@Slf4j
@Repository
public class InMemoryWarmupSourceRepository implements WarmupSourceRepository {

    private final Map<String, Recipe> recipes = new ConcurrentHashMap<>();
    private final Map<String, UserProfile> users = new ConcurrentHashMap<>();
    private final Map<String, SystemConfig> configs = new ConcurrentHashMap<>();

    // 원천 조회 카운터 (테스트용)
    private final AtomicInteger queryCount = new AtomicInteger(0);

    @Value("${repository.latency-ms:0}")
    private int sourceLatencyMs;

    public InMemoryWarmupSourceRepository() {
        initializeData();
    }

    private void initializeData() {
        LocalDateTime now = LocalDateTime.now();
        addRecipe(createRecipe("r-kimchi-stew", "김치찌개", "u-alice", 4.8, 120, now.minusDays(3)));
        addRecipe(createRecipe("r-bibimbap", "비빔밥", "u-bob", 4.6, 85, now.minusDays(10)));
        addRecipe(createRecipe("r-tteokbokki", "떡볶이", "u-alice", 4.2, 40, now.minusDays(20)));
        addRecipe(createRecipe("r-japchae", "잡채", "u-carol", 3.5, 15, now.minusDays(5)));
        addRecipe(createRecipe("r-bulgogi", "불고기", "u-bob", 4.9, 200, now.minusDays(90)));

        addUser(createUser("u-alice", "alice", 2, 30, now.minusDays(1)));
        addUser(createUser("u-bob", "bob", 2, 12, now.minusDays(2)));
        addUser(createUser("u-carol", "carol", 1, 3, now.minusDays(30)));

        addConfig(SystemConfig.builder().key("feature.ai-chat").value("on").updatedAt(now).build());
        addConfig(SystemConfig.builder().key("upload.max-size-mb").value("10").updatedAt(now).build());
    }

    @Override
    public List<Recipe> findPopularRecipes(int maxAgeDays, double minRating, int limit) {
        recordQuery("popularRecipes");
        LocalDateTime since = LocalDateTime.now().minusDays(maxAgeDays);
        return recipes.values().stream()
                .filter(recipe -> !recipe.getCreatedAt().isBefore(since))
                .filter(recipe -> recipe.getAverageRating() >= minRating)
                .sorted(Comparator.comparingInt(Recipe::getRatingCount)
                        .thenComparingDouble(Recipe::getAverageRating)
                        .reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<UserProfile> findActiveUsers(int activeDays, int limit) {
        recordQuery("activeUsers");
        LocalDateTime since = LocalDateTime.now().minusDays(activeDays);
        return users.values().stream()
                .filter(user -> user.getLastLoginAt() != null && !user.getLastLoginAt().isBefore(since))
                .sorted(Comparator.comparingInt(UserProfile::getRecipeCount)
                        .thenComparingInt(UserProfile::getRatingCount)
                        .reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<SystemConfig> findSystemConfigs() {
        recordQuery("systemConfigs");
        return new ArrayList<>(configs.values());
    }

    @Override
    public Optional<Recipe> findRecipe(String id) {
        recordQuery("recipe:" + id);
        return Optional.ofNullable(recipes.get(id));
    }

    @Override
    public Optional<UserProfile> findUser(String id) {
        recordQuery("user:" + id);
        return Optional.ofNullable(users.get(id));
    }

    @Override
    public Optional<SystemConfig> findSystemConfig(String key) {
        recordQuery("systemConfig:" + key);
        return Optional.ofNullable(configs.get(key));
    }

    @Override
    public long countRecipes() {
        return recipes.size();
    }

    @Override
    public long countUsers() {
        return users.size();
    }

    private void recordQuery(String what) {
        int count = queryCount.incrementAndGet();
        log.debug("[원천 조회] {}, 총 조회 횟수={}", what, count);
        simulateLatency();
    }

    private void simulateLatency() {
        if (sourceLatencyMs <= 0) {
            return;
        }
        try {
            Thread.sleep(sourceLatencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Recipe createRecipe(String id, String title, String authorId,
                                double rating, int ratingCount, LocalDateTime createdAt) {
        return Recipe.builder()
                .id(id)
                .title(title)
                .authorId(authorId)
                .averageRating(rating)
                .ratingCount(ratingCount)
                .createdAt(createdAt)
                .build();
    }

    private UserProfile createUser(String id, String username, int recipeCount,
                                   int ratingCount, LocalDateTime lastLoginAt) {
        return UserProfile.builder()
                .id(id)
                .username(username)
                .recipeCount(recipeCount)
                .ratingCount(ratingCount)
                .lastLoginAt(lastLoginAt)
                .build();
    }

    // 테스트 헬퍼 메서드
    public int getQueryCount() {
        return queryCount.get();
    }

    public void resetQueryCount() {
        queryCount.set(0);
    }

    /**
     * 인기 레시피 조건을 만족하는 레시피 count개 추가 (평가 수 내림차순으로 id가 정렬되도록)
     */
    public List<String> seedRecipes(int count, String prefix) {
        List<String> ids = new ArrayList<>(count);
        LocalDateTime now = LocalDateTime.now();
        for (int i = 0; i < count; i++) {
            String id = String.format("%s%05d", prefix, i);
            addRecipe(createRecipe(id, "recipe " + i, "u-seed", 4.5, 10_000 - i, now));
            ids.add(id);
        }
        return ids;
    }

    public List<String> seedActiveUsers(int count, String prefix) {
        List<String> ids = new ArrayList<>(count);
        LocalDateTime now = LocalDateTime.now();
        for (int i = 0; i < count; i++) {
            String id = String.format("%s%05d", prefix, i);
            addUser(createUser(id, "user" + i, 10_000 - i, 0, now));
            ids.add(id);
        }
        return ids;
    }

    public void clearData() {
        recipes.clear();
        users.clear();
        configs.clear();
    }

    public void resetData() {
        clearData();
        initializeData();
    }

    public void addRecipe(Recipe recipe) {
        recipes.put(recipe.getId(), recipe);
    }

    public void addUser(UserProfile user) {
        users.put(user.getId(), user);
    }

    public void addConfig(SystemConfig config) {
        configs.put(config.getKey(), config);
    }
}
