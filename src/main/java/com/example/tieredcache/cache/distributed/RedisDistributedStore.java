package com.example.tieredcache.cache.distributed;

import io.lettuce.core.RedisCommandExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStringCommands.SetOption;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.types.Expiration;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Redis 기반 DistributedStore (Spring Data Redis + Lettuce)
 *
 * 키는 문자열, 값은 바이트 그대로 저장한다. 카운터는 ASCII 10진수라 INCRBY와 호환된다.
 * Lettuce 연결은 스레드 안전하므로 RedisTemplate 하나를 모든 요청이 공유한다.
 */
@Slf4j
public class RedisDistributedStore implements DistributedStore {

    private static final int SCAN_COUNT = 1000;

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final boolean ownsConnectionFactory;

    /**
     * @param ownsConnectionFactory true면 close() 시 연결 팩토리까지 정리한다 (스프링 컨테이너 밖에서 만든 경우)
     */
    public RedisDistributedStore(RedisTemplate<String, byte[]> redisTemplate, boolean ownsConnectionFactory) {
        this.redisTemplate = redisTemplate;
        this.ownsConnectionFactory = ownsConnectionFactory;
    }

    @Override
    public Optional<byte[]> get(String key) {
        return execute("get", key, () -> Optional.ofNullable(redisTemplate.opsForValue().get(key)));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        execute("set", key, () -> {
            if (hasTtl(ttl)) {
                redisTemplate.opsForValue().set(key, value, ttl);
            } else {
                redisTemplate.opsForValue().set(key, value);
            }
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        return execute("delete", key, () -> Boolean.TRUE.equals(redisTemplate.delete(key)));
    }

    @Override
    public long deleteAll(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0L;
        }
        return execute("deleteAll", keys.size() + " keys", () -> {
            Long deleted = redisTemplate.delete(keys);
            return deleted == null ? 0L : deleted;
        });
    }

    @Override
    public boolean exists(String key) {
        return execute("exists", key, () -> Boolean.TRUE.equals(redisTemplate.hasKey(key)));
    }

    @Override
    public Set<String> scanByPrefix(String prefix) {
        return execute("scan", prefix + "*", () -> {
            ScanOptions options = ScanOptions.scanOptions()
                    .match(prefix + "*")
                    .count(SCAN_COUNT)
                    .build();
            Set<String> keys = new HashSet<>();
            try (Cursor<String> cursor = redisTemplate.scan(options)) {
                cursor.forEachRemaining(keys::add);
            }
            return keys;
        });
    }

    @Override
    public void pipelineSet(Map<String, byte[]> entries, Duration ttl) {
        if (entries.isEmpty()) {
            return;
        }
        execute("pipelineSet", entries.size() + " keys", () -> {
            Expiration expiration = hasTtl(ttl) ? Expiration.from(ttl) : Expiration.persistent();
            redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
                entries.forEach((key, value) -> connection.stringCommands().set(
                        key.getBytes(StandardCharsets.UTF_8), value, expiration, SetOption.upsert()));
                return null;
            });
            return null;
        });
    }

    @Override
    public long incrBy(String key, long amount) {
        return execute("incrBy", key, () -> {
            Long value = redisTemplate.opsForValue().increment(key, amount);
            if (value == null) {
                throw new IllegalStateException("INCRBY returned no value");
            }
            return value;
        });
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return execute("expire", key, () -> Boolean.TRUE.equals(redisTemplate.expire(key, ttl)));
    }

    @Override
    public long ttl(String key) {
        return execute("ttl", key, () -> {
            Long seconds = redisTemplate.getExpire(key, TimeUnit.SECONDS);
            return seconds == null ? TTL_MISSING : seconds;
        });
    }

    @Override
    public boolean ping(Duration timeout) {
        CompletableFuture<String> pong = CompletableFuture.supplyAsync(() ->
                redisTemplate.execute((RedisCallback<String>) connection -> connection.ping()));
        try {
            String reply = pong.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return "PONG".equalsIgnoreCase(reply);
        } catch (TimeoutException e) {
            pong.cancel(true);
            log.warn("[Redis 헬스체크 타임아웃] timeout={}ms", timeout.toMillis());
            return false;
        } catch (ExecutionException e) {
            log.warn("[Redis 헬스체크 실패] cause={}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        if (!ownsConnectionFactory) {
            return;
        }
        RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
        if (connectionFactory instanceof DisposableBean disposable) {
            try {
                disposable.destroy();
                log.info("[Redis 연결 종료]");
            } catch (Exception e) {
                log.warn("[Redis 연결 종료 실패] cause={}", e.getMessage());
            }
        }
    }

    private <T> T execute(String operation, String key, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException e) {
            if (isConnectivityFailure(e)) {
                throw new DistributedStoreException(operation, key, e);
            }
            throw new DistributedCommandException(operation, key, e);
        } catch (IllegalStateException e) {
            throw new DistributedCommandException(operation, key, e);
        }
    }

    /**
     * 연결 실패, 타임아웃만 일시 장애로 본다.
     * 서버가 돌려준 오류 응답(ERR, WRONGTYPE)은 어떤 예외로 감싸져 있어도 명령 오류다
     */
    static boolean isConnectivityFailure(DataAccessException e) {
        if (hasCause(e, RedisCommandExecutionException.class)) {
            return false;
        }
        return e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof RedisSystemException;
    }

    private static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        for (Throwable current = e; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static boolean hasTtl(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }
}
