package com.example.incidentengine.approval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Locale;

/**
 * Result of asking to run a remediation action: dispatched now, parked for approval, or refused.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchOutcome(
        Outcome outcome,
        String incidentId,
        String executionId,
        String requestId,
        Instant expiresAt,
        String reason) {

    public enum Outcome {
        DISPATCHED, PENDING_APPROVAL, REJECTED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static DispatchOutcome dispatched(String incidentId, String executionId) {
        return new DispatchOutcome(Outcome.DISPATCHED, incidentId, executionId, null, null, null);
    }

    public static DispatchOutcome pendingApproval(String incidentId, String requestId, Instant expiresAt) {
        return new DispatchOutcome(Outcome.PENDING_APPROVAL, incidentId, null, requestId, expiresAt, null);
    }

    public static DispatchOutcome rejected(String incidentId, String reason) {
        return new DispatchOutcome(Outcome.REJECTED, incidentId, null, null, null, reason);
    }
}
