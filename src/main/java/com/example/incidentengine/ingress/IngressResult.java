package com.example.incidentengine.ingress;

/**
 * Successful outcome of a delivery: a new alert, or a duplicate of an earlier one.
 * Rejections are thrown instead.
 */
public record IngressResult(String alertId, boolean duplicate, String deliveryId, RateLimitDecision rateLimit) {

    public static IngressResult accepted(String alertId, String deliveryId, RateLimitDecision rateLimit) {
        return new IngressResult(alertId, false, deliveryId, rateLimit);
    }

    public static IngressResult duplicate(String alertId, String deliveryId, RateLimitDecision rateLimit) {
        return new IngressResult(alertId, true, deliveryId, rateLimit);
    }
}
