package com.example.incidentengine.sla;

import com.example.incidentengine.domain.Incident;
import com.example.incidentengine.domain.Severity;
import com.example.incidentengine.domain.SlaConfig;
import com.example.incidentengine.domain.SlaTracking;
import com.example.incidentengine.repository.IncidentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SLA deadlines and status.
 * <p>
 * Deadlines are fixed at incident creation from the tenant's targets for the incident severity.
 * Assignment settles the response SLA for good; resolution settles the resolution SLA and
 * records MTTR.
 */
@Service
@RequiredArgsConstructor
public class SlaTracker {

    static final int FALLBACK_RESPONSE_MINUTES = 1440;
    static final int FALLBACK_RESOLUTION_MINUTES = 2880;

    private final SlaConfigService slaConfigService;
    private final IncidentRepository incidentRepository;

    public SlaTracking computeDeadlines(String tenantId, Severity severity, Instant createdAt) {
        return computeDeadlines(slaConfigService.forTenant(tenantId), severity, createdAt);
    }

    public SlaTracking computeDeadlines(SlaConfig config, Severity severity, Instant createdAt) {
        if (!config.isEnabled()) {
            return SlaTracking.disabled();
        }
        int response = config.getResponseMinutes().getOrDefault(severity, FALLBACK_RESPONSE_MINUTES);
        int resolution = config.getResolutionMinutes().getOrDefault(severity, FALLBACK_RESOLUTION_MINUTES);
        return SlaTracking.builder()
                .enabled(true)
                .responseMinutes(response)
                .resolutionMinutes(resolution)
                .responseDeadline(createdAt.plus(Duration.ofMinutes(response)))
                .resolutionDeadline(createdAt.plus(Duration.ofMinutes(resolution)))
                .build();
    }

    /** First assignment. Later reassignments do not move the response outcome. */
    public void onAssigned(Incident incident, Instant assignedAt) {
        if (incident.getAssignedAt() != null) return;
        incident.setAssignedAt(assignedAt);
        SlaTracking sla = incident.getSla();
        if (sla != null && sla.isEnabled() && sla.getResponseDeadline() != null) {
            sla.setResponseMet(!assignedAt.isAfter(sla.getResponseDeadline()));
        }
    }

    public void onResolved(Incident incident, Instant resolvedAt) {
        incident.setResolvedAt(resolvedAt);
        incident.setMttrMinutes(Duration.between(incident.getCreatedAt(), resolvedAt).toMinutes());
        SlaTracking sla = incident.getSla();
        if (sla != null && sla.isEnabled() && sla.getResolutionDeadline() != null) {
            sla.setResolutionMet(!resolvedAt.isAfter(sla.getResolutionDeadline()));
            if (sla.getResponseMet() == null && sla.getResponseDeadline() != null) {
                // Resolved without an assignment: the resolution is the first response.
                sla.setResponseMet(!resolvedAt.isAfter(sla.getResponseDeadline()));
            }
        }
    }

    public boolean isResponseBreached(Incident incident, Instant now) {
        SlaTracking sla = incident.getSla();
        if (sla == null || !sla.isEnabled() || sla.getResponseDeadline() == null) return false;
        if (sla.getResponseMet() != null) return !sla.getResponseMet();
        return now.isAfter(sla.getResponseDeadline());
    }

    public boolean isResolutionBreached(Incident incident, Instant now) {
        SlaTracking sla = incident.getSla();
        if (sla == null || !sla.isEnabled() || sla.getResolutionDeadline() == null) return false;
        if (sla.getResolutionMet() != null) return !sla.getResolutionMet();
        return now.isAfter(sla.getResolutionDeadline());
    }

    public SlaStatus status(Incident incident, Instant now) {
        SlaTracking sla = incident.getSla();
        boolean enabled = sla != null && sla.isEnabled() && sla.getResponseDeadline() != null;
        String severity = incident.getSeverity() == null ? null : incident.getSeverity().value();

        if (incident.isResolved()) {
            Long actualResponse = incident.getAssignedAt() == null ? null
                    : Duration.between(incident.getCreatedAt(), incident.getAssignedAt()).toMinutes();
            Long actualResolution = incident.getResolvedAt() == null ? null
                    : Duration.between(incident.getCreatedAt(), incident.getResolvedAt()).toMinutes();
            return new SlaStatus(incident.getId(), enabled, SlaStatus.RESOLVED, severity,
                    enabled ? sla.getResponseDeadline() : null, enabled ? sla.getResolutionDeadline() : null,
                    null, null,
                    isResponseBreached(incident, now), isResolutionBreached(incident, now),
                    enabled ? sla.getResponseMet() : null, enabled ? sla.getResolutionMet() : null,
                    actualResponse, actualResolution,
                    incident.getAssignee(), incident.isEscalated(), incident.getEscalationLevel());
        }

        if (!enabled) {
            return new SlaStatus(incident.getId(), false, SlaStatus.UNTRACKED, severity, null, null, null, null,
                    false, false, null, null, null, null,
                    incident.getAssignee(), incident.isEscalated(), incident.getEscalationLevel());
        }

        int threshold = slaConfigService.forTenant(incident.getTenantId()).getWarningThresholdMinutes();
        long responseRemaining = remainingMinutes(sla.getResponseDeadline(), now);
        long resolutionRemaining = remainingMinutes(sla.getResolutionDeadline(), now);
        boolean responseBreached = isResponseBreached(incident, now);
        boolean resolutionBreached = isResolutionBreached(incident, now);
        boolean awaitingResponse = incident.getAssignedAt() == null;

        String status;
        if (resolutionBreached) {
            status = SlaStatus.RESOLUTION_BREACHED;
        } else if (responseBreached) {
            status = SlaStatus.RESPONSE_BREACHED;
        } else if (awaitingResponse && responseRemaining <= threshold) {
            status = SlaStatus.RESPONSE_WARNING;
        } else if (resolutionRemaining <= threshold) {
            status = SlaStatus.RESOLUTION_WARNING;
        } else {
            status = SlaStatus.ON_TRACK;
        }

        Long actualResponse = awaitingResponse ? null
                : Duration.between(incident.getCreatedAt(), incident.getAssignedAt()).toMinutes();
        return new SlaStatus(incident.getId(), true, status, severity,
                sla.getResponseDeadline(), sla.getResolutionDeadline(),
                awaitingResponse ? responseRemaining : null, resolutionRemaining,
                responseBreached, resolutionBreached,
                sla.getResponseMet(), sla.getResolutionMet(),
                actualResponse, null,
                incident.getAssignee(), incident.isEscalated(), incident.getEscalationLevel());
    }

    /**
     * Compliance over incidents created in the last {@code days} days that carry SLA deadlines.
     * Response counts as met only when assigned by the response deadline, resolution only when
     * resolved by the resolution deadline; open incidents count against both until they make it.
     */
    public SlaComplianceReport complianceReport(String tenantId, int days, Instant now) {
        Instant from = now.minus(Duration.ofDays(days));
        List<Incident> incidents = incidentRepository.findCreatedSince(tenantId, from).stream()
                .filter(i -> i.getSla() != null && i.getSla().isEnabled() && i.getSla().getResponseDeadline() != null)
                .toList();

        Map<Severity, int[]> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, new int[3]);
        }
        int responseMet = 0;
        int resolutionMet = 0;
        long responseMinutesTotal = 0;
        int responded = 0;
        long resolutionMinutesTotal = 0;
        int resolved = 0;

        for (Incident incident : incidents) {
            SlaTracking sla = incident.getSla();
            int[] counts = bySeverity.get(incident.getSeverity());
            counts[0]++;
            if (incident.getAssignedAt() != null) {
                responded++;
                responseMinutesTotal += Duration.between(incident.getCreatedAt(), incident.getAssignedAt()).toMinutes();
                if (!incident.getAssignedAt().isAfter(sla.getResponseDeadline())) {
                    responseMet++;
                    counts[1]++;
                }
            }
            if (incident.getResolvedAt() != null) {
                resolved++;
                resolutionMinutesTotal += Duration.between(incident.getCreatedAt(), incident.getResolvedAt()).toMinutes();
                if (!incident.getResolvedAt().isAfter(sla.getResolutionDeadline())) {
                    resolutionMet++;
                    counts[2]++;
                }
            }
        }

        Map<String, SlaComplianceReport.SeverityBreakdown> breakdown = new LinkedHashMap<>();
        bySeverity.forEach((severity, counts) -> breakdown.put(severity.value(),
                new SlaComplianceReport.SeverityBreakdown(counts[0], counts[1], counts[2])));

        int total = incidents.size();
        return new SlaComplianceReport(tenantId, days, from, now, total, responseMet, resolutionMet,
                percent(responseMet, total), percent(resolutionMet, total),
                average(responseMinutesTotal, responded), average(resolutionMinutesTotal, resolved),
                breakdown);
    }

    private static long remainingMinutes(Instant deadline, Instant now) {
        return Math.max(0, Duration.between(now, deadline).toMinutes());
    }

    private static double percent(int part, int total) {
        if (total == 0) return 0.0;
        return Math.round(part * 1000.0 / total) / 10.0;
    }

    private static double average(long sum, int count) {
        if (count == 0) return 0.0;
        return Math.round(sum * 10.0 / count) / 10.0;
    }
}
