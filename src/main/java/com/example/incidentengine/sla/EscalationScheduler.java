package com.example.incidentengine.sla;

import com.example.incidentengine.domain.Incident;
import com.example.incidentengine.domain.SlaConfig;
import com.example.incidentengine.domain.SlaTracking;
import com.example.incidentengine.gateway.GatewayWebSocketHandler;
import com.example.incidentengine.notification.NotificationService;
import com.example.incidentengine.repository.IncidentRepository;
import com.example.incidentengine.scoring.PriorityScorer;
import com.example.incidentengine.service.AuditService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Escalation Engine - walks every open incident once per tick and moves it up the
 * tenant's escalation chain when its SLA deadlines pass.
 * <ul>
 *   <li>level 1: still unassigned after the response deadline</li>
 *   <li>level 2: unresolved after the resolution deadline</li>
 *   <li>level 3: resolution breach still open on a later tick</li>
 * </ul>
 * An incident moves at most one level per tick and never moves down. Incidents that have not
 * escalated get a single warning per deadline once they are inside the warning threshold.
 * <p>
 * Each incident is evaluated in its own transaction; notifications are written to the outbox
 * in that transaction and delivered after it commits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationScheduler {

    static final int MAX_LEVEL = 3;

    private final IncidentRepository incidentRepository;
    private final SlaConfigService slaConfigService;
    private final PriorityScorer priorityScorer;
    private final NotificationService notificationService;
    private final AuditService auditService;
    private final GatewayWebSocketHandler gatewayHandler;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, ReentrantLock> tenantLocks = new ConcurrentHashMap<>();

    @Scheduled(fixedDelayString = "${incident-engine.escalation.tick-interval-ms:300000}")
    public void tick() {
        try {
            notificationService.retryPending();
        } catch (RuntimeException e) {
            log.error("Outbox retry failed: {}", e.getMessage(), e);
        }

        List<String> tenants = incidentRepository.findTenantsWithIncidentsNotIn(Incident.IncidentStatus.RESOLVED);
        for (String tenantId : tenants) {
            try {
                runTenant(tenantId);
            } catch (RuntimeException e) {
                log.error("Escalation tick failed for tenant {}: {}", tenantId, e.getMessage(), e);
            }
        }
    }

    void runTenant(String tenantId) {
        ReentrantLock lock = tenantLocks.computeIfAbsent(tenantId, k -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.warn("Escalation tick still running for tenant {}, skipping", tenantId);
            return;
        }
        try {
            SlaConfig config = slaConfigService.forTenant(tenantId);
            Instant now = clock.instant();
            for (String incidentId : incidentRepository.findIncidentIdsNotIn(tenantId, Incident.IncidentStatus.RESOLVED)) {
                try {
                    Evaluation evaluation = transactionTemplate.execute(status -> evaluate(incidentId, config, now));
                    if (evaluation != null) {
                        evaluation.events().forEach(event -> gatewayHandler.broadcast(event.method(), event.payload()));
                        notificationService.deliverAll(evaluation.outboxIds());
                    }
                } catch (OptimisticLockingFailureException e) {
                    log.info("Incident {} changed during the tick, re-evaluating next time", incidentId);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private Evaluation evaluate(String incidentId, SlaConfig config, Instant now) {
        Incident incident = incidentRepository.findById(incidentId).orElse(null);
        if (incident == null || incident.isResolved()) return null;

        double score = priorityScorer.score(incident, now);
        if (score != incident.getPriorityScore()) {
            incident.setPriorityScore(score);
        }

        SlaTracking sla = incident.getSla();
        if (sla == null || !sla.isEnabled() || sla.getResponseDeadline() == null) return null;

        Evaluation evaluation = new Evaluation(new ArrayList<>(), new ArrayList<>());
        int nextLevel = nextLevel(incident, sla, now);
        if (nextLevel > 0) {
            escalate(incident, config, nextLevel, now, evaluation);
        } else if (incident.getEscalationLevel() == 0 && !incident.isEscalated()) {
            warnIfApproaching(incident, config, sla, now, evaluation);
        }
        incidentRepository.save(incident);
        return evaluation;
    }

    /** Level the incident should move to on this tick, or 0 to stay put. */
    static int nextLevel(Incident incident, SlaTracking sla, Instant now) {
        int level = incident.getEscalationLevel();
        boolean resolutionPassed = sla.getResolutionDeadline() != null && now.isAfter(sla.getResolutionDeadline());
        if (level < 1 && incident.getAssignedAt() == null && now.isAfter(sla.getResponseDeadline())) {
            return 1;
        }
        if (level < 2 && resolutionPassed) {
            return 2;
        }
        if (level == 2 && resolutionPassed) {
            return MAX_LEVEL;
        }
        return 0;
    }

    private void escalate(Incident incident, SlaConfig config, int level, Instant now, Evaluation evaluation) {
        String reason = level == 1 ? "Response SLA breached: not assigned within "
                + incident.getSla().getResponseMinutes() + " minutes"
                : "Resolution SLA breached: not resolved within " + incident.getSla().getResolutionMinutes() + " minutes";
        String target = config.targetForLevel(level);

        incident.setEscalationLevel(level);
        incident.setEscalated(true);
        incident.setEscalationReason(reason);
        if (incident.getEscalatedAt() == null) {
            incident.setEscalatedAt(now);
        }
        incident.setLastEscalatedAt(now);
        incident.setUpdatedAt(now);
        if (level == 1) {
            incident.setStatus(Incident.IncidentStatus.ESCALATED);
        }

        long openMinutes = Duration.between(incident.getCreatedAt(), now).toMinutes();
        String subject = String.format("ESCALATION (Level %d) [%s] %s on %s",
                level, incident.getSeverity().value(), incident.getSignature(), incident.getAssetName());
        String body = String.format("Incident: %s%nReason: %s%nOpen for: %d minutes%nAssigned to: %s%nPriority: %.0f",
                incident.getId(), reason, openMinutes,
                incident.getAssignee() != null ? incident.getAssignee() : "unassigned", incident.getPriorityScore());
        evaluation.outboxIds().add(notificationService.enqueue(incident.getTenantId(), incident.getId(),
                "ESCALATION", target, subject, body).getId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("level", level);
        details.put("target", target);
        details.put("reason", reason);
        auditService.log("escalation-scheduler", "ESCALATION", incident.getTenantId(), incident.getId(),
                target, details);

        Map<String, Object> event = new LinkedHashMap<>(details);
        event.put("incident_id", incident.getId());
        event.put("company_id", incident.getTenantId());
        event.put("severity", incident.getSeverity().value());
        event.put("status", incident.getStatus().value());
        evaluation.events().add(new Broadcast("incident.escalated", event));

        Counter.builder("escalation.escalated")
                .tag("level", String.valueOf(level))
                .register(meterRegistry)
                .increment();
        log.warn("Escalating incident {} to level {} ({}): {}", incident.getId(), level, target, reason);
    }

    private void warnIfApproaching(Incident incident, SlaConfig config, SlaTracking sla, Instant now,
                                   Evaluation evaluation) {
        Duration threshold = Duration.ofMinutes(config.getWarningThresholdMinutes());
        if (incident.getAssignedAt() == null && sla.getResponseWarningSentAt() == null
                && isApproaching(sla.getResponseDeadline(), threshold, now)) {
            sla.setResponseWarningSentAt(now);
            warn(incident, config, "response", sla.getResponseDeadline(), now, evaluation);
        }
        if (sla.getResolutionWarningSentAt() == null && isApproaching(sla.getResolutionDeadline(), threshold, now)) {
            sla.setResolutionWarningSentAt(now);
            warn(incident, config, "resolution", sla.getResolutionDeadline(), now, evaluation);
        }
    }

    private static boolean isApproaching(Instant deadline, Duration threshold, Instant now) {
        return deadline != null && !now.isAfter(deadline) && !now.isBefore(deadline.minus(threshold));
    }

    private void warn(Incident incident, SlaConfig config, String deadlineKind, Instant deadline, Instant now,
                      Evaluation evaluation) {
        long remaining = Duration.between(now, deadline).toMinutes();
        String target = config.targetForLevel(1);
        String subject = String.format("SLA WARNING [%s] %s deadline in %d minutes: %s on %s",
                incident.getSeverity().value(), deadlineKind, remaining, incident.getSignature(), incident.getAssetName());
        String body = String.format("Incident: %s%n%s deadline: %s%nAssigned to: %s",
                incident.getId(), deadlineKind, deadline,
                incident.getAssignee() != null ? incident.getAssignee() : "unassigned");
        evaluation.outboxIds().add(notificationService.enqueue(incident.getTenantId(), incident.getId(),
                "SLA_WARNING", target, subject, body).getId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("deadline", deadlineKind);
        details.put("deadline_at", deadline.toString());
        details.put("remaining_minutes", remaining);
        auditService.log("escalation-scheduler", "SLA_WARNING", incident.getTenantId(), incident.getId(),
                target, details);

        Map<String, Object> event = new LinkedHashMap<>(details);
        event.put("incident_id", incident.getId());
        event.put("company_id", incident.getTenantId());
        evaluation.events().add(new Broadcast("sla.warning", event));
        log.info("SLA warning for incident {}: {} deadline in {} minutes", incident.getId(), deadlineKind, remaining);
    }

    private record Evaluation(List<String> outboxIds, List<Broadcast> events) {
    }

    private record Broadcast(String method, Object payload) {
    }
}
