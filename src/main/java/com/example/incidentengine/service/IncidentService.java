package com.example.incidentengine.service;

import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.domain.Incident;
import com.example.incidentengine.exception.ConflictException;
import com.example.incidentengine.exception.NotFoundException;
import com.example.incidentengine.exception.ValidationException;
import com.example.incidentengine.gateway.GatewayWebSocketHandler;
import com.example.incidentengine.repository.AlertRepository;
import com.example.incidentengine.repository.IncidentRepository;
import com.example.incidentengine.sla.SlaStatus;
import com.example.incidentengine.sla.SlaTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Incident reads and the manual lifecycle: assignment, work start and resolution.
 * A resolved incident is frozen.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncidentService {

    private final IncidentRepository incidentRepository;
    private final AlertRepository alertRepository;
    private final TenantService tenantService;
    private final SlaTracker slaTracker;
    private final AuditService auditService;
    private final GatewayWebSocketHandler gatewayHandler;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public List<Incident> list(String tenantId, String status) {
        tenantService.require(tenantId);
        if (status == null || status.isBlank()) {
            return incidentRepository.findByTenantIdOrderByCreatedAtDesc(tenantId);
        }
        return incidentRepository.findByTenantIdAndStatusOrderByCreatedAtDesc(tenantId, parseStatus(status));
    }

    public Incident get(String incidentId) {
        return incidentRepository.findById(incidentId)
                .orElseThrow(() -> new NotFoundException("Incident not found: " + incidentId));
    }

    public List<Alert> alerts(String incidentId) {
        get(incidentId);
        return alertRepository.findByIncidentIdOrderByReceivedAtAsc(incidentId);
    }

    public SlaStatus slaStatus(String incidentId) {
        return slaTracker.status(get(incidentId), clock.instant());
    }

    public Incident update(String incidentId, IncidentUpdate update, String actor) {
        Incident updated = transactionTemplate.execute(status -> apply(incidentId, update, actor));
        gatewayHandler.broadcast("incident.updated", updated);
        return updated;
    }

    private Incident apply(String incidentId, IncidentUpdate update, String actor) {
        Incident incident = get(incidentId);
        if (incident.isResolved()) {
            throw new ConflictException("Incident " + incidentId + " is resolved and can no longer change");
        }
        Instant now = clock.instant();
        Incident.IncidentStatus target = update.getStatus() == null || update.getStatus().isBlank()
                ? null : parseStatus(update.getStatus());

        if (update.getAssignedTo() != null && !update.getAssignedTo().isBlank()) {
            assign(incident, update.getAssignedTo().trim(), actor, now);
        }

        if (target != null && target != incident.getStatus()) {
            switch (target) {
                case ASSIGNED -> {
                    if (incident.getAssignee() == null) {
                        throw new ValidationException("assigned_to is required to mark an incident assigned");
                    }
                    changeStatus(incident, target, actor, now);
                }
                case IN_PROGRESS -> {
                    if (incident.getStatus() != Incident.IncidentStatus.ASSIGNED
                            && incident.getStatus() != Incident.IncidentStatus.ESCALATED) {
                        throw new ConflictException("Cannot move incident from " + incident.getStatus().value()
                                + " to in_progress");
                    }
                    changeStatus(incident, target, actor, now);
                }
                case RESOLVED -> resolve(incident, update, actor, now);
                case NEW, ESCALATED -> throw new ValidationException(
                        "Status " + target.value() + " is set by the engine, not by hand");
            }
        } else if (update.getResolutionNotes() != null) {
            incident.setResolutionNotes(update.getResolutionNotes());
        }

        incident.setUpdatedAt(now);
        return incidentRepository.save(incident);
    }

    private void assign(Incident incident, String assignee, String actor, Instant now) {
        String previous = incident.getAssignee();
        incident.setAssignee(assignee);
        slaTracker.onAssigned(incident, now);
        if (incident.getStatus() == Incident.IncidentStatus.NEW
                || incident.getStatus() == Incident.IncidentStatus.ESCALATED) {
            incident.setStatus(Incident.IncidentStatus.ASSIGNED);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("assigned_to", assignee);
        details.put("previous_assignee", previous);
        details.put("response_sla_met", incident.getSla().getResponseMet());
        auditService.log(actor, "INCIDENT_ASSIGNED", incident.getTenantId(), incident.getId(), assignee, details);
        log.info("Incident {} assigned to {} by {}", incident.getId(), assignee, actor);
    }

    private void changeStatus(Incident incident, Incident.IncidentStatus target, String actor, Instant now) {
        Incident.IncidentStatus from = incident.getStatus();
        incident.setStatus(target);
        auditService.log(actor, "INCIDENT_STATUS_CHANGED", incident.getTenantId(), incident.getId(),
                target.value(), Map.of("from", from.value(), "to", target.value()));
        log.info("Incident {} moved {} -> {} by {}", incident.getId(), from.value(), target.value(), actor);
    }

    private void resolve(Incident incident, IncidentUpdate update, String actor, Instant now) {
        String resolvedBy = update.getResolvedBy() != null && !update.getResolvedBy().isBlank()
                ? update.getResolvedBy().trim() : actor;
        incident.setStatus(Incident.IncidentStatus.RESOLVED);
        incident.setResolvedBy(resolvedBy);
        incident.setResolutionNotes(update.getResolutionNotes());
        slaTracker.onResolved(incident, now);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resolved_by", resolvedBy);
        details.put("mttr_minutes", incident.getMttrMinutes());
        details.put("resolution_sla_met", incident.getSla().getResolutionMet());
        auditService.log(actor, "INCIDENT_RESOLVED", incident.getTenantId(), incident.getId(), resolvedBy, details);
        log.info("Incident {} resolved by {} after {} minutes", incident.getId(), resolvedBy, incident.getMttrMinutes());
    }

    private static Incident.IncidentStatus parseStatus(String status) {
        try {
            return Incident.IncidentStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown incident status '" + status
                    + "', expected one of new, assigned, in_progress, resolved, escalated");
        }
    }
}
