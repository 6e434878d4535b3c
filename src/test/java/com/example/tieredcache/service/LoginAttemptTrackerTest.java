package com.example.tieredcache.service;

import com.example.tieredcache.cache.CachePrefix;
import com.example.tieredcache.cache.CacheStrategy;
import com.example.tieredcache.cache.backend.CacheBackendFactory;
import com.example.tieredcache.config.LoginSecurityProperties;
import com.example.tieredcache.support.CacheFixtures;
import com.example.tieredcache.support.CacheTestSupport;
import com.example.tieredcache.support.InMemoryDistributedStore;
import com.example.tieredcache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LoginAttemptTracker 로그인 잠금")
class LoginAttemptTrackerTest {

    private static final String USERNAME = "bob";

    private MutableClock clock;
    private LoginSecurityProperties properties;
    private CacheService cacheService;
    private LoginAttemptTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        properties = new LoginSecurityProperties();
        cacheService = CacheFixtures.memoryService(clock);
        tracker = new LoginAttemptTracker(cacheService, properties);
    }

    @Nested
    @DisplayName("잠금 임계치")
    class Threshold {

        @Test
        @DisplayName("MAX=5: 1~4회 실패는 잠기지 않고 5회째에 잠금 시간 전체로 잠긴다")
        void locksOnFifthFailure() {
            for (int i = 1; i <= 4; i++) {
                assertThat(tracker.incrementFailedAttempt(USERNAME)).isEqualTo(i);
                assertThat(tracker.isLocked(USERNAME).isLocked()).isFalse();
            }

            assertThat(tracker.incrementFailedAttempt(USERNAME)).isEqualTo(5);

            LockStatus status = tracker.isLocked(USERNAME);
            assertThat(status.isLocked()).isTrue();
            assertThat(status.getRemainingSeconds()).isBetween(15 * 60L - 1, 15 * 60L);
        }

        @Test
        @DisplayName("성공하면 기록이 지워지고 다음 실패는 1부터 센다")
        void resetOnSuccessStartsOver() {
            for (int i = 0; i < 5; i++) {
                tracker.incrementFailedAttempt(USERNAME);
            }

            tracker.resetOnSuccess(USERNAME);

            assertThat(tracker.isLocked(USERNAME).isLocked()).isFalse();
            assertThat(tracker.getAttempts(USERNAME)).isZero();
            assertThat(tracker.incrementFailedAttempt(USERNAME)).isEqualTo(1);
        }

        @Test
        @DisplayName("잠금 시간 동안 남은 시간이 줄어든다")
        void remainingSecondsDecrease() {
            for (int i = 0; i < 5; i++) {
                tracker.incrementFailedAttempt(USERNAME);
            }

            clock.advance(Duration.ofMinutes(10));

            assertThat(tracker.isLocked(USERNAME).getRemainingSeconds()).isEqualTo(5 * 60L);
        }

        @Test
        @DisplayName("MAX_LOGIN_ATTEMPTS 설정을 따른다")
        void honoursConfiguredMaximum() {
            properties.setMaxAttempts(2);
            properties.setLockoutDurationMinutes(1);

            tracker.incrementFailedAttempt(USERNAME);
            tracker.incrementFailedAttempt(USERNAME);

            assertThat(tracker.isLocked(USERNAME).isLocked()).isTrue();
            assertThat(tracker.isLocked(USERNAME).getRemainingSeconds()).isEqualTo(60L);
        }
    }

    @Nested
    @DisplayName("TTL")
    class Ttl {

        @Test
        @DisplayName("잠금 전 실패는 soft window가 지나면 사라진다")
        void softWindowExpires() {
            tracker.incrementFailedAttempt(USERNAME);
            tracker.incrementFailedAttempt(USERNAME);

            clock.advance(Duration.ofSeconds(301));

            assertThat(tracker.getAttempts(USERNAME)).isZero();
            assertThat(tracker.incrementFailedAttempt(USERNAME)).isEqualTo(1);
        }

        @Test
        @DisplayName("잠금 시간이 지나면 풀리고 기록도 남지 않는다")
        void lockoutExpires() {
            for (int i = 0; i < 5; i++) {
                tracker.incrementFailedAttempt(USERNAME);
            }

            clock.advance(Duration.ofMinutes(15).plusSeconds(1));

            assertThat(tracker.isLocked(USERNAME).isLocked()).isFalse();
            assertThat(cacheService.exists(CachePrefix.LOGIN_ATTEMPTS, USERNAME)).isFalse();
        }

        @Test
        @DisplayName("임계치를 넘었지만 TTL이 없는 기록은 오래된 것으로 보고 지운다")
        void staleRecordIsPurged() {
            cacheService.increment(CachePrefix.LOGIN_ATTEMPTS, USERNAME, 7);

            assertThat(tracker.isLocked(USERNAME).isLocked()).isFalse();
            assertThat(cacheService.exists(CachePrefix.LOGIN_ATTEMPTS, USERNAME)).isFalse();
        }
    }

    @Nested
    @DisplayName("동시성")
    class Concurrency {

        @Test
        @DisplayName("N개의 동시 실패 후 기록은 1~N 사이이고 계정은 잠긴다")
        void concurrentFailuresEventuallyLock() throws InterruptedException {
            int failures = 20;

            CacheTestSupport.runConcurrent(failures, 8, () -> tracker.incrementFailedAttempt(USERNAME));

            assertThat(tracker.getAttempts(USERNAME)).isBetween(1, failures);
            assertThat(tracker.isLocked(USERNAME).isLocked()).isTrue();
        }

        @Test
        @DisplayName("분산 티어를 공유하는 두 인스턴스는 같은 카운터를 본다")
        void sharedDistributedCounter() {
            InMemoryDistributedStore redis = new InMemoryDistributedStore(clock);
            LoginAttemptTracker nodeA = new LoginAttemptTracker(CacheFixtures.tieredService(clock, redis), properties);
            LoginAttemptTracker nodeB = new LoginAttemptTracker(CacheFixtures.tieredService(clock, redis), properties);

            nodeA.incrementFailedAttempt(USERNAME);
            nodeA.incrementFailedAttempt(USERNAME);
            assertThat(nodeA.isLocked(USERNAME).isLocked()).isFalse();
            nodeB.incrementFailedAttempt(USERNAME);
            nodeB.incrementFailedAttempt(USERNAME);
            nodeB.incrementFailedAttempt(USERNAME);

            assertThat(nodeA.isLocked(USERNAME).isLocked()).isTrue();
            assertThat(nodeB.getAttempts(USERNAME)).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("용량 제한 로컬 티어")
    class BoundedLocalTier {

        private static final int LRU_CAPACITY = 100;

        @Test
        @DisplayName("LRU 백엔드에서 캐시 쓰기가 용량을 넘겨도 잠금은 잠금 시간 동안 유지된다")
        void lockSurvivesLruEviction() {
            CacheService lruService = CacheFixtures.service(factory(new InMemoryDistributedStore(clock)).create(CacheStrategy.LRU));
            LoginAttemptTracker lruTracker = new LoginAttemptTracker(lruService, properties);
            lockOut(lruTracker);

            fillCache(lruService);

            assertThat(lruService.getStats().getEvictions()).isPositive();
            LockStatus status = lruTracker.isLocked(USERNAME);
            assertThat(status.isLocked()).isTrue();
            assertThat(status.getRemainingSeconds()).isBetween(15 * 60L - 1, 15 * 60L);
        }

        @Test
        @DisplayName("multi(L1=lru)가 로컬 전용으로 내려간 뒤에도 잠금은 밀려나지 않는다")
        void lockSurvivesLruEvictionAfterDowngrade() {
            CacheService multiService = CacheFixtures.service(
                    factory(InMemoryDistributedStore.unreachable(clock)).create(CacheStrategy.MULTI));
            LoginAttemptTracker multiTracker = new LoginAttemptTracker(multiService, properties);
            lockOut(multiTracker);

            fillCache(multiService);

            assertThat(multiTracker.isLocked(USERNAME).isLocked()).isTrue();
            assertThat(multiTracker.getAttempts(USERNAME)).isEqualTo(5);
        }

        private CacheBackendFactory factory(InMemoryDistributedStore remote) {
            return new CacheBackendFactory(() -> remote, CacheFixtures.PROBE_TIMEOUT, LRU_CAPACITY, CacheStrategy.LRU, clock);
        }

        private void lockOut(LoginAttemptTracker target) {
            for (int i = 0; i < 5; i++) {
                target.incrementFailedAttempt(USERNAME);
            }
            assertThat(target.isLocked(USERNAME).isLocked()).isTrue();
        }

        private void fillCache(CacheService target) {
            for (int i = 0; i < LRU_CAPACITY * 10; i++) {
                target.set(CachePrefix.RECIPE, "r" + i, "recipe-" + i);
            }
        }
    }

    @Nested
    @DisplayName("카운터 저장소 장애")
    class StoreFailure {

        private LoginAttemptTracker brokenTracker;

        @BeforeEach
        void setUp() {
            brokenTracker = new LoginAttemptTracker(
                    CacheFixtures.service(CacheFixtures.failingBackend("counter store down")), properties);
        }

        @Test
        @DisplayName("기본(fail-open)은 잠기지 않은 것으로 본다")
        void failOpenByDefault() {
            assertThat(brokenTracker.incrementFailedAttempt(USERNAME)).isZero();
            assertThat(brokenTracker.isLocked(USERNAME).isLocked()).isFalse();
        }

        @Test
        @DisplayName("fail-closed면 잠금 시간 전체만큼 잠긴 것으로 본다")
        void failClosedLocks() {
            properties.setFailClosed(true);

            LockStatus status = brokenTracker.isLocked(USERNAME);

            assertThat(status.isLocked()).isTrue();
            assertThat(status.getRemainingSeconds()).isEqualTo(15 * 60L);
        }
    }
}
