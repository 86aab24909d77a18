package com.example.incidentengine.ingress;

import java.util.Optional;

/**
 * Optional classifier that may suggest a different severity for an incoming alert.
 * The gate applies a suggestion only above the configured confidence and ignores
 * advisors that fail.
 */
public interface SeverityAdvisor {

    Optional<SeverityAdvice> advise(AlertPayload payload);
}
