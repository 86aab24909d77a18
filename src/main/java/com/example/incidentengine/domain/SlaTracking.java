package com.example.incidentengine.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * SLA deadlines fixed when the incident is created, plus the outcome flags
 * recorded on assignment and resolution.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaTracking {

    @Column(name = "sla_enabled")
    private boolean enabled;

    @Column(name = "sla_response_minutes")
    private Integer responseMinutes;

    @Column(name = "sla_resolution_minutes")
    private Integer resolutionMinutes;

    @Column(name = "sla_response_deadline")
    private Instant responseDeadline;

    @Column(name = "sla_resolution_deadline")
    private Instant resolutionDeadline;

    /** Null until the incident is assigned. */
    @Column(name = "sla_response_met")
    private Boolean responseMet;

    /** Null until the incident is resolved. */
    @Column(name = "sla_resolution_met")
    private Boolean resolutionMet;

    @Column(name = "sla_response_warning_sent_at")
    private Instant responseWarningSentAt;

    @Column(name = "sla_resolution_warning_sent_at")
    private Instant resolutionWarningSentAt;

    public static SlaTracking disabled() {
        return SlaTracking.builder().enabled(false).build();
    }
}
