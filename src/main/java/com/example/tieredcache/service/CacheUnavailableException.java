package com.example.tieredcache.service;

/**
 * 카운터 연산 실패
 * 일반 캐시 연산은 실패를 삼키지만, 보안 카운터(로그인 잠금)는 호출자가 정책을 정해야 하므로 예외로 알린다
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
