package com.example.tieredcache.cache;

import java.util.Locale;

public enum CacheStrategy {

    MEMORY,      // 단순 인메모리
    LRU,         // 용량 제한 LRU
    DISTRIBUTED, // Redis
    MULTI;       // 로컬 + Redis 다단계

    public static CacheStrategy from(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
