package com.example.tieredcache.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemConfig implements CacheableEntity {

    private String key;
    private String value;
    private LocalDateTime updatedAt;

    @Override
    public String cacheId() {
        return key;
    }
}
