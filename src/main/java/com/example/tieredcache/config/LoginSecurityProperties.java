package com.example.tieredcache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "security.login")
public class LoginSecurityProperties {

    /**
     * 잠금까지 허용하는 실패 횟수 (MAX_LOGIN_ATTEMPTS)
     */
    private int maxAttempts = 5;

    /**
     * 잠금 시간 (분, LOCKOUT_DURATION)
     */
    private int lockoutDurationMinutes = 15;

    /**
     * 잠금 전 실패 기록 유지 시간 (초). 산발적인 실패는 이 시간이 지나면 사라진다
     */
    private int softWindowSeconds = 300;

    /**
     * 카운터 저장소 장애 시 잠금으로 간주할지 여부
     */
    private boolean failClosed = false;

    public Duration lockoutDuration() {
        return Duration.ofMinutes(lockoutDurationMinutes);
    }

    public Duration softWindow() {
        return Duration.ofSeconds(softWindowSeconds);
    }
}
