package com.example.tieredcache.service;

import com.example.tieredcache.cache.CachePrefix;
import com.example.tieredcache.config.LoginSecurityProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * 로그인 실패 횟수 추적 + 계정 잠금
 *
 * 상태는 "login_attempts:{username}" 카운터 하나로 표현한다.
 * <ul>
 *   <li>OK: 실패 횟수 &lt; maxAttempts. 기록은 soft window TTL 동안만 유지된다</li>
 *   <li>LOCKED: 실패 횟수 &gt;= maxAttempts 이고 잠금 TTL이 남아 있음</li>
 * </ul>
 *
 * 카운터는 원자적 증가 후 TTL을 다시 거는 방식이라 증가 자체는 유실되지 않지만,
 * 여러 프로세스가 각자 로컬 티어만 쓰는 경우에는 프로세스마다 따로 센다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginAttemptTracker {

    private final CacheService cacheService;
    private final LoginSecurityProperties properties;

    /**
     * 실패 1회 기록
     *
     * @return 기록 후 실패 횟수. 카운터 저장소 장애로 세지 못하면 0
     */
    public int incrementFailedAttempt(String username) {
        long attempts;
        try {
            attempts = cacheService.increment(CachePrefix.LOGIN_ATTEMPTS, username, 1L);
        } catch (CacheUnavailableException e) {
            log.error("[로그인 실패 기록 불가] username={}, cause={}", username, e.getMessage());
            return 0;
        }

        boolean lockedNow = attempts >= properties.getMaxAttempts();
        Duration ttl = lockedNow ? properties.lockoutDuration() : properties.softWindow();
        if (!cacheService.expire(CachePrefix.LOGIN_ATTEMPTS, username, ttl)) {
            log.warn("[로그인 실패 TTL 설정 실패] username={}, attempts={}", username, attempts);
        }

        if (lockedNow) {
            log.warn("[계정 잠금] username={}, attempts={}, lockout={}m",
                    username, attempts, ttl.toMinutes());
        } else {
            log.debug("[로그인 실패] username={}, attempts={}/{}", username, attempts, properties.getMaxAttempts());
        }
        return (int) attempts;
    }

    /**
     * 잠금 여부는 남은 TTL로만 판단한다.
     * 임계치를 넘었는데 TTL이 없으면(만료 직전이거나 TTL 설정 실패) 오래된 기록으로 보고 지운다.
     */
    public LockStatus isLocked(String username) {
        long attempts;
        try {
            attempts = cacheService.getCounter(CachePrefix.LOGIN_ATTEMPTS, username);
        } catch (CacheUnavailableException e) {
            return onCounterFailure(username, e);
        }

        if (attempts < properties.getMaxAttempts()) {
            return LockStatus.unlocked();
        }

        long remaining = cacheService.ttl(CachePrefix.LOGIN_ATTEMPTS, username);
        if (remaining <= 0) {
            cacheService.delete(CachePrefix.LOGIN_ATTEMPTS, username);
            log.info("[만료된 잠금 기록 삭제] username={}, attempts={}", username, attempts);
            return LockStatus.unlocked();
        }
        return LockStatus.locked(remaining);
    }

    public int getAttempts(String username) {
        try {
            return (int) cacheService.getCounter(CachePrefix.LOGIN_ATTEMPTS, username);
        } catch (CacheUnavailableException e) {
            log.error("[로그인 실패 횟수 조회 불가] username={}, cause={}", username, e.getMessage());
            return 0;
        }
    }

    /**
     * 로그인 성공 또는 관리자 잠금 해제
     */
    public void resetOnSuccess(String username) {
        if (cacheService.delete(CachePrefix.LOGIN_ATTEMPTS, username)) {
            log.debug("[로그인 실패 기록 초기화] username={}", username);
        }
    }

    private LockStatus onCounterFailure(String username, CacheUnavailableException e) {
        if (properties.isFailClosed()) {
            log.error("[잠금 상태 확인 불가 - 잠금으로 처리] username={}, cause={}", username, e.getMessage());
            return LockStatus.locked(properties.lockoutDuration().getSeconds());
        }
        log.error("[잠금 상태 확인 불가 - 허용으로 처리] username={}, cause={}", username, e.getMessage());
        return LockStatus.unlocked();
    }
}
