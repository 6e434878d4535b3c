package com.example.tieredcache.cache.distributed;

/**
 * 분산 저장소가 응답은 했지만 명령을 거부한 경우 (타입 불일치, 정수 아님 등)
 * 연결 문제가 아니므로 DistributedTier는 로컬 전용 모드로 내려가지 않고 호출자에게 그대로 전달한다
 */
public class DistributedCommandException extends RuntimeException {

    private final String operation;

    public DistributedCommandException(String operation, String key, Throwable cause) {
        super("Distributed store rejected " + operation + " for key=" + key + ": " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
