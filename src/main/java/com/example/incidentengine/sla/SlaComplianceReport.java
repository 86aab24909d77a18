package com.example.incidentengine.sla;

import java.time.Instant;
import java.util.Map;

/**
 * SLA compliance over a trailing window of days.
 */
public record SlaComplianceReport(
        String companyId,
        int periodDays,
        Instant from,
        Instant to,
        int totalIncidents,
        int responseSlaMet,
        int resolutionSlaMet,
        double responseCompliancePct,
        double resolutionCompliancePct,
        double avgResponseMinutes,
        double avgResolutionMinutes,
        Map<String, SeverityBreakdown> bySeverity) {

    public record SeverityBreakdown(int total, int responseMet, int resolutionMet) {}
}
