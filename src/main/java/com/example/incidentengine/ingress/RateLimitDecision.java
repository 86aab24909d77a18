package com.example.incidentengine.ingress;

/**
 * Outcome of one rate-limit check, with the numbers surfaced in response headers.
 */
public record RateLimitDecision(boolean allowed, int limit, int burst, int remaining, long retryAfterSeconds) {

    public static RateLimitDecision unlimited() {
        return new RateLimitDecision(true, 0, 0, Integer.MAX_VALUE, 0);
    }

    public boolean isLimited() {
        return limit > 0;
    }
}
