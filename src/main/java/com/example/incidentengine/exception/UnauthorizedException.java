package com.example.incidentengine.exception;

import lombok.Getter;

/**
 * Delivery or caller could not be authenticated. The reason is for logs and metrics only;
 * responses never reveal it.
 */
@Getter
public class UnauthorizedException extends RuntimeException {

    public enum Reason {
        UNKNOWN_KEY, MISSING_SIGNATURE, BAD_SIGNATURE, MALFORMED_TIMESTAMP, STALE_TIMESTAMP
    }

    private final Reason reason;

    public UnauthorizedException(Reason reason) {
        super("Unauthorized: " + reason);
        this.reason = reason;
    }
}
