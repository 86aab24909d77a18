package com.example.incidentengine.ingress;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-tenant 60 second window counter.
 * <p>
 * A window opens on the first request and resets once 60 seconds have passed since it opened.
 * Inside a window a tenant may send up to {@code max(limitPerMinute, burstSize)} requests;
 * the burst size lets short spikes overshoot the steady per-minute limit.
 * Each tenant's window is updated under its own monitor, so concurrent deliveries for one
 * tenant never double-spend a slot while other tenants proceed in parallel.
 */
@Slf4j
@Component
public class RateLimiter {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public RateLimitDecision tryAcquire(String tenantId, int limitPerMinute, int burstSize, Instant now) {
        Window window = windows.computeIfAbsent(tenantId, k -> new Window());
        RateLimitDecision decision = window.tryAcquire(now, limitPerMinute, burstSize);
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded for tenant {} (limit {}, burst {}, retry after {}s)",
                    tenantId, limitPerMinute, burstSize, decision.retryAfterSeconds());
        }
        return decision;
    }

    /** Forget a tenant's window, e.g. after its limits were reconfigured. */
    public void reset(String tenantId) {
        windows.remove(tenantId);
    }

    private static final class Window {
        private Instant windowStart;
        private int count;

        synchronized RateLimitDecision tryAcquire(Instant now, int limit, int burst) {
            if (windowStart == null || !now.isBefore(windowStart.plus(WINDOW))) {
                windowStart = now;
                count = 0;
            }
            int ceiling = Math.max(limit, burst);
            if (count >= ceiling) {
                long elapsed = Math.max(0, Duration.between(windowStart, now).getSeconds());
                long retryAfter = Math.max(1, WINDOW.getSeconds() - elapsed);
                return new RateLimitDecision(false, limit, burst, 0, retryAfter);
            }
            count++;
            return new RateLimitDecision(true, limit, burst, ceiling - count, 0);
        }
    }
}
