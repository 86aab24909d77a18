package com.example.incidentengine.exception;

import com.example.incidentengine.ingress.RateLimitDecision;
import lombok.Getter;

@Getter
public class RateLimitedException extends RuntimeException {

    private final RateLimitDecision decision;

    public RateLimitedException(RateLimitDecision decision) {
        super("Rate limit exceeded. Retry after " + decision.retryAfterSeconds() + " seconds");
        this.decision = decision;
    }
}
