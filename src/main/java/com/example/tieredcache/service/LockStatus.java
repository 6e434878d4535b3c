package com.example.tieredcache.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 로그인 잠금 상태 (잠금 여부 + 남은 시간)
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LockStatus {

    private static final LockStatus UNLOCKED = new LockStatus(false, 0L);

    private final boolean locked;
    private final long remainingSeconds;

    public static LockStatus unlocked() {
        return UNLOCKED;
    }

    public static LockStatus locked(long remainingSeconds) {
        return new LockStatus(true, remainingSeconds);
    }
}
