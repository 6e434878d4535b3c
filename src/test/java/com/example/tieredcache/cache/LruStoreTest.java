package com.example.tieredcache.cache;

import com.example.tieredcache.support.CacheTestSupport;
import com.example.tieredcache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LruStore")
class LruStoreTest {

    private MutableClock clock;
    private List<String> evicted;
    private LruStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        evicted = Collections.synchronizedList(new ArrayList<>());
        store = new LruStore(2, clock, evicted::add);
    }

    @Nested
    @DisplayName("용량과 제거 순서")
    class Eviction {

        @Test
        @DisplayName("C=2에서 a, b 저장 후 a를 읽고 c를 넣으면 b가 제거된다")
        void getPromotesSoLeastRecentlyUsedIsEvicted() {
            store.put("a", bytes("1"), null);
            store.put("b", bytes("2"), null);
            store.get("a");

            store.put("c", bytes("3"), null);

            assertThat(store.keys()).containsExactlyInAnyOrder("a", "c");
            assertThat(evicted).containsExactly("b");
        }

        @Test
        @DisplayName("기존 키를 다시 쓰면 제거 없이 교체되고 MRU가 된다")
        void putExistingKeyReplacesAndPromotes() {
            store.put("a", bytes("1"), null);
            store.put("b", bytes("2"), null);

            store.put("a", bytes("10"), null);
            store.put("c", bytes("3"), null);

            assertThat(store.get("a")).hasValueSatisfying(v -> assertThat(text(v)).isEqualTo("10"));
            assertThat(store.exists("b")).isFalse();
            assertThat(evicted).containsExactly("b");
        }

        @Test
        @DisplayName("미스는 순서에 영향을 주지 않는다")
        void missHasNoSideEffect() {
            store.put("a", bytes("1"), null);
            store.put("b", bytes("2"), null);

            assertThat(store.get("zzz")).isEmpty();
            store.put("c", bytes("3"), null);

            assertThat(store.keys()).containsExactlyInAnyOrder("b", "c");
        }

        @Test
        @DisplayName("크기는 용량을 넘지 않는다")
        void sizeNeverExceedsCapacity() {
            LruStore bounded = new LruStore(3);
            for (int i = 0; i < 100; i++) {
                bounded.put("k" + i, bytes(String.valueOf(i)), null);
                assertThat(bounded.size()).isLessThanOrEqualTo(3);
            }
            assertThat(bounded.keys()).containsExactlyInAnyOrder("k97", "k98", "k99");
        }

        @Test
        @DisplayName("용량 1 미만은 거부한다")
        void rejectsNonPositiveCapacity() {
            assertThatThrownBy(() -> new LruStore(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("만료")
    class Expiry {

        @Test
        @DisplayName("만료된 항목은 읽는 시점에 지워지고 제거 콜백이 호출된다")
        void expiredEntryIsPurgedOnRead() {
            store.put("a", bytes("1"), Duration.ofSeconds(10));
            clock.advance(Duration.ofSeconds(11));

            assertThat(store.get("a")).isEmpty();
            assertThat(store.ttl("a")).isEqualTo(LocalStore.TTL_MISSING);
            assertThat(evicted).containsExactly("a");
        }

        @Test
        @DisplayName("ttl은 남은 초, 만료 없음 -1, 없는 키 -2")
        void ttlConventions() {
            store.put("a", bytes("1"), Duration.ofSeconds(10));
            store.put("b", bytes("2"), null);
            clock.advance(Duration.ofMillis(2500));

            assertThat(store.ttl("a")).isEqualTo(8);
            assertThat(store.ttl("b")).isEqualTo(LocalStore.TTL_NO_EXPIRY);
            assertThat(store.ttl("missing")).isEqualTo(LocalStore.TTL_MISSING);
        }
    }

    @Nested
    @DisplayName("카운터")
    class Counter {

        @Test
        @DisplayName("increment는 기존 TTL을 유지한다")
        void incrementKeepsTtl() {
            store.increment("cnt", 1);
            store.expire("cnt", Duration.ofSeconds(60));

            long value = store.increment("cnt", 4);

            assertThat(value).isEqualTo(5);
            assertThat(store.ttl("cnt")).isEqualTo(60);
        }

        @Test
        @DisplayName("동시 증가도 하나의 잠금 아래에서 유실되지 않는다")
        void concurrentIncrementsAreSerialized() throws InterruptedException {
            LruStore counters = new LruStore(10);
            AtomicInteger calls = new AtomicInteger();

            CacheTestSupport.runConcurrent(500, 16, () -> {
                counters.increment("cnt", 1);
                calls.incrementAndGet();
            });

            assertThat(calls.get()).isEqualTo(500);
            assertThat(CounterCodec.decode(counters.get("cnt").orElseThrow())).isEqualTo(500);
        }
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }
}
