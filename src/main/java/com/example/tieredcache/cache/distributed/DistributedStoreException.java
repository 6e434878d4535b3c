package com.example.tieredcache.cache.distributed;

/**
 * 분산 저장소 일시 장애 (연결 실패, 타임아웃)
 * DistributedTier가 잡아서 로컬 전용 모드로 전환하며, 캐시 호출자에게는 전달되지 않는다.
 * 명령 자체가 거부된 경우는 DistributedCommandException
 */
public class DistributedStoreException extends RuntimeException {

    private final String operation;

    public DistributedStoreException(String operation, String key, Throwable cause) {
        super("Distributed store " + operation + " failed for key=" + key + ": " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
