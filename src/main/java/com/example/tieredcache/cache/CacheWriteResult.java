package com.example.tieredcache.cache;

/**
 * 캐시 쓰기 결과
 * 인증 토큰처럼 유실이 신경 쓰이는 경로에서는 호출자가 이 값을 보고 진행 여부를 결정한다
 */
public enum CacheWriteResult {

    /** 선택된 모든 티어에 저장 */
    STORED,

    /** 분산 티어에 닿지 못해 로컬 티어에만 저장 */
    STORED_LOCAL_ONLY,

    /** 값을 직렬화하지 못해 어디에도 저장하지 않음 */
    SERIALIZATION_FAILED,

    /** 백엔드 오류로 어느 티어에도 저장하지 못함 */
    NOT_STORED;

    public boolean isStored() {
        return this == STORED || this == STORED_LOCAL_ONLY;
    }
}
