package com.example.tieredcache.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 레시피 요약 (캐시 값)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recipe implements CacheableEntity {

    private String id;
    private String title;
    private String authorId;
    private double averageRating;    // 평균 평점
    private int ratingCount;         // 평가 수
    private LocalDateTime createdAt;

    @Override
    public String cacheId() {
        return id;
    }
}
