package com.example.incidentengine.ingress;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private final RateLimiter limiter = new RateLimiter();

    @Test
    void sixthRequestInsideWindowIsRejectedWithRetryAfter() {
        for (int i = 0; i < 5; i++) {
            RateLimitDecision decision = limiter.tryAcquire("acme", 5, 5, T0.plusSeconds(i * 2L));
            assertTrue(decision.allowed(), "request " + (i + 1) + " should pass");
        }

        RateLimitDecision sixth = limiter.tryAcquire("acme", 5, 5, T0.plusSeconds(10));

        assertFalse(sixth.allowed());
        assertEquals(50, sixth.retryAfterSeconds());
        assertEquals(0, sixth.remaining());
    }

    @Test
    void burstRaisesTheCeilingAboveThePerMinuteLimit() {
        int allowed = 0;
        for (int i = 0; i < 12; i++) {
            if (limiter.tryAcquire("acme", 5, 10, T0).allowed()) allowed++;
        }
        assertEquals(10, allowed);
    }

    @Test
    void windowResetsSixtySecondsAfterItOpened() {
        limiter.tryAcquire("acme", 1, 1, T0);
        assertFalse(limiter.tryAcquire("acme", 1, 1, T0.plusSeconds(59)).allowed());

        assertTrue(limiter.tryAcquire("acme", 1, 1, T0.plusSeconds(60)).allowed());
    }

    @Test
    void retryAfterIsAtLeastOneSecond() {
        limiter.tryAcquire("acme", 1, 1, T0);
        RateLimitDecision decision = limiter.tryAcquire("acme", 1, 1, T0.plusMillis(59_900));

        assertFalse(decision.allowed());
        assertEquals(1, decision.retryAfterSeconds());
    }

    @Test
    void tenantsHaveIndependentWindows() {
        limiter.tryAcquire("acme", 1, 1, T0);

        assertFalse(limiter.tryAcquire("acme", 1, 1, T0).allowed());
        assertTrue(limiter.tryAcquire("globex", 1, 1, T0).allowed());
    }

    @Test
    void resetForgetsTheWindow() {
        limiter.tryAcquire("acme", 1, 1, T0);
        limiter.reset("acme");

        assertTrue(limiter.tryAcquire("acme", 1, 1, T0.plusSeconds(1)).allowed());
    }

    @Test
    void concurrentRequestsNeverExceedTheCeiling() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger allowed = new AtomicInteger();
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            tasks.add(() -> {
                try {
                    start.await();
                    if (limiter.tryAcquire("acme", 50, 50, T0).allowed()) allowed.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        tasks.forEach(pool::submit);
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(50, allowed.get());
    }
}
