package com.example.tieredcache.cache.distributed;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 분산 티어 + 사용 가능 여부
 *
 * 생성 시 제한 시간 안의 헬스체크로 사용 여부를 정하고, 실패하거나 이후 호출에서 일시 장애가 나면
 * 프로세스가 끝날 때까지 로컬 전용 모드로 내려간다. 전환 로그는 한 번만 남긴다.
 * 자동 재검사는 하지 않는다.
 *
 * 서버가 명령을 거부한 DistributedCommandException은 사용 여부를 바꾸지 않고 호출자에게 그대로 던진다.
 */
@Slf4j
public class DistributedTier implements AutoCloseable {

    private final DistributedStore store;
    private final AtomicBoolean available;

    public DistributedTier(DistributedStore store, Duration probeTimeout) {
        this.store = store;
        boolean reachable = store.ping(probeTimeout);
        this.available = new AtomicBoolean(reachable);
        if (reachable) {
            log.info("[분산 캐시 연결] 헬스체크 성공 - timeout={}ms", probeTimeout.toMillis());
        } else {
            log.warn("[분산 캐시 비활성화] 헬스체크 실패, 로컬 캐시만 사용 - timeout={}ms", probeTimeout.toMillis());
        }
    }

    public boolean isAvailable() {
        return available.get();
    }

    /**
     * 분산 티어에서 값을 읽는다
     * @return 사용 불가이거나 호출이 실패하면 empty
     */
    public <T> Optional<T> call(String operation, String key, Function<DistributedStore, T> command) {
        if (!available.get()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(command.apply(store));
        } catch (DistributedStoreException e) {
            markUnavailable(operation, key, e);
            return Optional.empty();
        }
    }

    /**
     * 분산 티어에 쓴다
     * @return 실제로 반영됐으면 true
     */
    public boolean run(String operation, String key, Consumer<DistributedStore> command) {
        if (!available.get()) {
            return false;
        }
        try {
            command.accept(store);
            return true;
        } catch (DistributedStoreException e) {
            markUnavailable(operation, key, e);
            return false;
        }
    }

    @Override
    public void close() {
        store.close();
    }

    private void markUnavailable(String operation, String key, DistributedStoreException e) {
        if (available.compareAndSet(true, false)) {
            log.warn("[분산 캐시 비활성화] {} 실패로 로컬 캐시만 사용 - key={}, cause={}",
                    operation, key, e.getMessage());
        } else {
            log.debug("[분산 캐시 호출 실패] operation={}, key={}", operation, key);
        }
    }
}
