package com.example.incidentengine.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Published after the ingress gate persisted a new alert.
 */
@Getter
@AllArgsConstructor
public class AlertAcceptedEvent {
    private final String tenantId;
    private final String alertId;
    private final Instant receivedAt;
}
