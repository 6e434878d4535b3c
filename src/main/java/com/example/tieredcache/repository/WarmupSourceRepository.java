package com.example.tieredcache.repository;

import com.example.tieredcache.domain.Recipe;
import com.example.tieredcache.domain.SystemConfig;
import com.example.tieredcache.domain.UserProfile;

import java.util.List;
import java.util.Optional;

/**
 * 웜업이 읽는 원천 데이터 저장소 (읽기 전용)
 * 실제로는 DB 조회
 */
public interface WarmupSourceRepository {

    /**
     * 인기 레시피: 최근 maxAgeDays 안에 만들어졌고 평균 평점이 minRating 이상인 것을
     * 평가 수, 평균 평점 순으로 최대 limit 개
     */
    List<Recipe> findPopularRecipes(int maxAgeDays, double minRating, int limit);

    /**
     * 활성 사용자: 최근 activeDays 안에 로그인한 사용자를 작성 레시피 수, 평가 수 순으로 최대 limit 개
     */
    List<UserProfile> findActiveUsers(int activeDays, int limit);

    List<SystemConfig> findSystemConfigs();

    Optional<Recipe> findRecipe(String id);

    Optional<UserProfile> findUser(String id);

    Optional<SystemConfig> findSystemConfig(String key);

    long countRecipes();

    long countUsers();
}
