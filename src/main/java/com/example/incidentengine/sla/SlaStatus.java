package com.example.incidentengine.sla;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Point-in-time SLA view of one incident.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlaStatus(
        String incidentId,
        boolean enabled,
        String status,
        String severity,
        Instant responseDeadline,
        Instant resolutionDeadline,
        Long responseRemainingMinutes,
        Long resolutionRemainingMinutes,
        boolean responseSlaBreached,
        boolean resolutionSlaBreached,
        Boolean responseSlaMet,
        Boolean resolutionSlaMet,
        Long actualResponseMinutes,
        Long actualResolutionMinutes,
        String assignedTo,
        boolean escalated,
        int escalationLevel) {

    public static final String ON_TRACK = "on_track";
    public static final String RESPONSE_WARNING = "response_warning";
    public static final String RESOLUTION_WARNING = "resolution_warning";
    public static final String RESPONSE_BREACHED = "response_breached";
    public static final String RESOLUTION_BREACHED = "resolution_breached";
    public static final String RESOLVED = "resolved";
    public static final String UNTRACKED = "untracked";
}
