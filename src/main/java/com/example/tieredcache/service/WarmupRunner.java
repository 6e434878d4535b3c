package com.example.tieredcache.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 기동 직후 웜업 (cache.warmup.on-startup=true 일 때만)
 * 웜업 실패는 기동을 막지 않는다
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "cache.warmup.on-startup", havingValue = "true")
public class WarmupRunner implements ApplicationRunner {

    private final WarmupService warmupService;

    @Override
    public void run(ApplicationArguments args) {
        log.info("[기동 웜업 시작]");
        WarmupReport report = warmupService.warmupAll();
        if (report.getFailed() > 0) {
            log.warn("[기동 웜업 일부 실패] failed={}/{}", report.getFailed(), report.getAttempted());
        }
    }
}
