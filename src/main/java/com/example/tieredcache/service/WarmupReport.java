package com.example.tieredcache.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 웜업 결과 요약
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WarmupReport {

    private final int attempted;
    private final int cached;
    private final int failed;

    public static WarmupReport empty() {
        return new WarmupReport(0, 0, 0);
    }

    public static WarmupReport of(int cached, int failed) {
        return new WarmupReport(cached + failed, cached, failed);
    }

    public WarmupReport plus(WarmupReport other) {
        return new WarmupReport(attempted + other.attempted, cached + other.cached, failed + other.failed);
    }
}
