package com.example.tieredcache.cache.distributed;

import com.example.tieredcache.cache.CachePrefix;
import com.example.tieredcache.cache.CacheWriteResult;
import com.example.tieredcache.cache.CounterCodec;
import com.example.tieredcache.service.CacheService;
import com.example.tieredcache.service.CacheUnavailableException;
import com.example.tieredcache.support.CacheFixtures;
import com.example.tieredcache.support.EmbeddedRedis;
import com.example.tieredcache.support.MutableClock;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/*
 * 실제 Redis 프로토콜로 DistributedStore 계약을 확인한다
 * - Embedded Redis를 띄울 수 없는 환경에서는 전체를 건너뛴다
 */
@DisplayName("RedisDistributedStore (Embedded Redis)")
class RedisDistributedStoreTest {

    private static final int PORT = 6390;

    private static EmbeddedRedis embeddedRedis;
    private static boolean redisStarted;

    private RedisDistributedStore store;

    @BeforeAll
    static void startRedis() {
        embeddedRedis = new EmbeddedRedis(PORT);
        redisStarted = embeddedRedis.start();
    }

    @AfterAll
    static void stopRedis() throws IOException {
        embeddedRedis.stop();
    }

    @BeforeEach
    void setUp() {
        assumeTrue(redisStarted, "embedded redis not available");
        store = new RedisDistributedStore(EmbeddedRedis.bytesTemplate("localhost", PORT), true);
        store.deleteAll(store.scanByPrefix(""));
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    @Test
    @DisplayName("ping은 제한 시간 안에 PONG을 받으면 true")
    void pingSucceeds() {
        assertThat(store.ping(Duration.ofSeconds(1))).isTrue();
    }

    @Test
    @DisplayName("값은 바이트 그대로 저장되고 TTL 규칙은 -1/-2를 따른다")
    void setGetAndTtl() {
        store.set("user:1", bytes("alice"), Duration.ofSeconds(30));
        store.set("user:2", bytes("bob"), null);

        assertThat(store.get("user:1")).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("alice")));
        assertThat(store.ttl("user:1")).isBetween(29L, 30L);
        assertThat(store.ttl("user:2")).isEqualTo(DistributedStore.TTL_NO_EXPIRY);
        assertThat(store.ttl("user:3")).isEqualTo(DistributedStore.TTL_MISSING);
        assertThat(store.get("user:3")).isEmpty();
    }

    @Test
    @DisplayName("INCRBY는 로컬 카운터 인코딩과 호환되고 기존 TTL을 유지한다")
    void incrByIsCompatibleWithCounterCodec() {
        store.set("login_attempts:bob", CounterCodec.encode(4), Duration.ofSeconds(300));

        long value = store.incrBy("login_attempts:bob", 1);

        assertThat(value).isEqualTo(5);
        assertThat(CounterCodec.decode(store.get("login_attempts:bob").orElseThrow())).isEqualTo(5);
        assertThat(store.ttl("login_attempts:bob")).isGreaterThan(0);
        assertThat(store.incrBy("login_attempts:new", 1)).isEqualTo(1);
    }

    @Test
    @DisplayName("scanByPrefix는 구분자까지 포함한 prefix로만 찾는다")
    void scanIsPrefixIsolated() {
        store.set("recipe:1", bytes("a"), null);
        store.set("recipe:2", bytes("b"), null);
        store.set("recipes_index:1", bytes("c"), null);

        assertThat(store.scanByPrefix("recipe:")).containsExactlyInAnyOrder("recipe:1", "recipe:2");
        assertThat(store.deleteAll(store.scanByPrefix("recipe:"))).isEqualTo(2);
        assertThat(store.exists("recipes_index:1")).isTrue();
        assertThat(store.deleteAll(List.of())).isZero();
    }

    @Test
    @DisplayName("pipelineSet은 모든 항목을 같은 TTL로 저장한다")
    void pipelineSet() {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        for (int i = 0; i < 50; i++) {
            entries.put("recipe:" + i, bytes("r" + i));
        }

        store.pipelineSet(entries, Duration.ofSeconds(60));

        assertThat(store.scanByPrefix("recipe:")).hasSize(50);
        assertThat(store.ttl("recipe:49")).isBetween(59L, 60L);
    }

    @Test
    @DisplayName("expire는 존재하는 키에만 적용된다")
    void expire() {
        store.set("token:u1", bytes("jwt"), null);

        assertThat(store.expire("token:u1", Duration.ofSeconds(10))).isTrue();
        assertThat(store.expire("token:none", Duration.ofSeconds(10))).isFalse();
        assertThat(store.delete("token:u1")).isTrue();
        assertThat(store.delete("token:u1")).isFalse();
    }

    @Nested
    @DisplayName("명령 오류")
    class CommandError {

        @Test
        @DisplayName("정수가 아닌 값에 INCRBY 하면 DistributedCommandException")
        void incrByOnNonCounter() {
            store.set("stats:x", bytes("not-a-number"), null);

            assertThatThrownBy(() -> store.incrBy("stats:x", 1))
                    .isInstanceOf(DistributedCommandException.class);
            assertThat(store.get("stats:x")).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("not-a-number")));
        }

        @Test
        @DisplayName("MULTI에서 카운터가 아닌 키를 증가시켜도 분산 티어는 계속 사용한다")
        void multiStaysDistributedAfterCommandError() {
            MutableClock clock = new MutableClock();
            CacheService multi = CacheFixtures.tieredService(clock, store);
            multi.set(CachePrefix.STATS, "x", "not-a-number");

            assertThatThrownBy(() -> multi.increment(CachePrefix.STATS, "x", 1))
                    .isInstanceOf(CacheUnavailableException.class);

            assertThat(multi.getStats().isDistributedAvailable()).isTrue();
            assertThat(multi.write(CachePrefix.RECIPE, "r1", "kimchi", Duration.ofSeconds(60)))
                    .isEqualTo(CacheWriteResult.STORED);
            assertThat(store.exists(CachePrefix.RECIPE.key("r1"))).isTrue();
        }
    }

    @Nested
    @DisplayName("연결할 수 없는 서버")
    class Unreachable {

        @Test
        @DisplayName("ping은 false, 명령은 DistributedStoreException으로 바뀐다")
        void translatesConnectionFailure() {
            RedisDistributedStore dead = new RedisDistributedStore(EmbeddedRedis.bytesTemplate("localhost", 1), true);
            try {
                assertThat(dead.ping(Duration.ofSeconds(2))).isFalse();
                assertThatThrownBy(() -> dead.get("user:1"))
                        .isInstanceOf(DistributedStoreException.class);
            } finally {
                dead.close();
            }
        }
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
