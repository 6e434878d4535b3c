package com.example.tieredcache.support;

import com.example.tieredcache.repository.InMemoryWarmupSourceRepository;
import com.example.tieredcache.service.CacheService;
import com.example.tieredcache.service.LoginAttemptTracker;
import com.example.tieredcache.service.WarmupService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

@SpringBootTest
@ActiveProfiles("test")
public abstract class CacheTestSupport {

    @Autowired
    protected CacheService cacheService;

    @Autowired
    protected LoginAttemptTracker loginAttemptTracker;

    @Autowired
    protected WarmupService warmupService;

    @Autowired
    protected InMemoryWarmupSourceRepository repository;

    @BeforeEach
    void setUp() {
        cacheService.clear();
        repository.resetQueryCount();
        repository.resetData();
    }

    public static void runConcurrent(int tasks, int threads, Runnable action) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(tasks);

        for (int i = 0; i < tasks; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    action.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        boolean completed = endLatch.await(30, TimeUnit.SECONDS);
        executor.shutdown();
        if (!completed) {
            throw new IllegalStateException("Concurrent run timed out");
        }
    }
}
