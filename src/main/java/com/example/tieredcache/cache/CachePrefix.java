package com.example.tieredcache.cache;

import java.util.Arrays;
import java.util.Optional;

/**
 * 캐시 키 네임스페이스
 * 모든 키는 "{prefix}:{id}" 형태로 만들어지며, prefix 단위 일괄 삭제의 기준이 된다
 */
public enum CachePrefix {

    USER("user"),
    USER_PROFILE("user_profile"),
    RECIPE("recipe"),
    PROFILE("profile"),
    TOKEN("token"),
    STATS("stats"),
    RATING("rating"),
    AI_RESPONSE("ai_response"),
    SYSTEM_CONFIG("system_config"),
    LOGIN_ATTEMPTS("login_attempts");

    public static final char SEPARATOR = ':';

    private final String value;

    CachePrefix(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public String key(String id) {
        return value + SEPARATOR + id;
    }

    /**
     * prefix 일괄 삭제/집계용 패턴 ("recipe:")
     * "recipe"가 "recipe_x"를 잡지 않도록 구분자까지 포함한다
     */
    public String keyPattern() {
        return value + SEPARATOR;
    }

    public boolean owns(String fullKey) {
        return fullKey.startsWith(keyPattern());
    }

    public static Optional<CachePrefix> fromValue(String value) {
        return Arrays.stream(values())
                .filter(prefix -> prefix.value.equalsIgnoreCase(value))
                .findFirst();
    }

    /**
     * 전체 키에서 prefix 부분만 추출 (구분자가 없으면 키 전체)
     */
    public static String prefixOf(String fullKey) {
        int index = fullKey.indexOf(SEPARATOR);
        return index < 0 ? fullKey : fullKey.substring(0, index);
    }
}
