package com.example.tieredcache.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 사용자 프로필 (캐시 값)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile implements CacheableEntity {

    private String id;
    private String username;
    private int recipeCount;         // 작성한 레시피 수
    private int ratingCount;         // 남긴 평가 수
    private LocalDateTime lastLoginAt;

    @Override
    public String cacheId() {
        return id;
    }
}
