package com.example.incidentengine.approval;

import com.example.incidentengine.config.EngineProperties;
import com.example.incidentengine.domain.Actor;
import com.example.incidentengine.domain.ActorRole;
import com.example.incidentengine.domain.ApprovalRequest;
import com.example.incidentengine.domain.Incident;
import com.example.incidentengine.domain.RiskLevel;
import com.example.incidentengine.exception.ApprovalExpiredException;
import com.example.incidentengine.exception.ConflictException;
import com.example.incidentengine.exception.ForbiddenException;
import com.example.incidentengine.exception.NotFoundException;
import com.example.incidentengine.exception.ValidationException;
import com.example.incidentengine.gateway.GatewayWebSocketHandler;
import com.example.incidentengine.repository.ApprovalRequestRepository;
import com.example.incidentengine.repository.IncidentRepository;
import com.example.incidentengine.service.AuditService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Approval Gate - decides whether a remediation action runs now or waits for sign-off.
 * <p>
 * Low risk actions go straight to the executor. Medium and high risk actions become an
 * {@link ApprovalRequest} that expires after the configured window; medium may be decided by a
 * company admin of the same tenant or an MSP admin, high only by an MSP admin. Nothing is
 * dispatched for a request that expired or was rejected. Every transition is audited in the
 * transaction that makes it, and the executor is only called once that transaction committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalGate {

    private final ApprovalRequestRepository approvalRepository;
    private final IncidentRepository incidentRepository;
    private final RemediationExecutor executor;
    private final AuditService auditService;
    private final GatewayWebSocketHandler gatewayHandler;
    private final TransactionTemplate transactionTemplate;
    private final EngineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public DispatchOutcome requestDispatch(String incidentId, String action, String riskLevel, Actor actor) {
        if (action == null || action.isBlank()) {
            throw new ValidationException("action is required");
        }
        RiskLevel risk = RiskLevel.parse(riskLevel)
                .orElseThrow(() -> new ValidationException("risk_level must be one of low, medium, high"));

        Decision decision = transactionTemplate.execute(status -> decide(incidentId, action.trim(), risk, actor));
        publish(decision);
        return decision.outcome();
    }

    private Decision decide(String incidentId, String action, RiskLevel risk, Actor actor) {
        Incident incident = requireIncident(incidentId);
        requireTenantScope(actor, incident.getTenantId());
        Instant now = clock.instant();

        if (incident.isResolved()) {
            auditService.log(actor.id(), "ACTION_REJECTED", incident.getTenantId(), incidentId, action,
                    Map.of("risk_level", risk.value(), "reason", "incident resolved"));
            count("rejected");
            log.info("Refused '{}' for incident {}: incident already resolved", action, incidentId);
            return new Decision(DispatchOutcome.rejected(incidentId, "Incident is resolved"), null, null);
        }

        if (!risk.requiresApproval()) {
            RemediationCommand command = markDispatched(incident, action, risk, actor.id(), null, now);
            return new Decision(DispatchOutcome.dispatched(incidentId, command.executionId()), command, null);
        }

        ApprovalRequest request = approvalRepository.save(ApprovalRequest.builder()
                .tenantId(incident.getTenantId())
                .incidentId(incidentId)
                .action(action)
                .riskLevel(risk)
                .status(ApprovalRequest.ApprovalStatus.PENDING)
                .requestedBy(actor.id())
                .createdAt(now)
                .expiresAt(now.plus(Duration.ofMinutes(properties.getApprovals().getExpiryMinutes())))
                .build());
        incident.setRemediationStatus("pending_approval");
        incident.setUpdatedAt(now);
        incidentRepository.save(incident);

        auditService.log(actor.id(), "APPROVAL_REQUESTED", incident.getTenantId(), incidentId, action,
                Map.of("approval_id", request.getId(), "risk_level", risk.value(),
                        "expires_at", request.getExpiresAt().toString()));
        count("requested");
        log.info("Approval requested for '{}' ({} risk) on incident {} by {} (id: {})",
                action, risk.value(), incidentId, actor.id(), request.getId());
        return new Decision(DispatchOutcome.pendingApproval(incidentId, request.getId(), request.getExpiresAt()),
                null, request);
    }

    public ApprovalRequest approve(String requestId, Actor actor, String notes) {
        return respond(requestId, actor, notes, true);
    }

    public ApprovalRequest reject(String requestId, Actor actor, String notes) {
        return respond(requestId, actor, notes, false);
    }

    private ApprovalRequest respond(String requestId, Actor actor, String notes, boolean approved) {
        Decision decision = transactionTemplate.execute(status -> {
            ApprovalRequest request = requireRequest(requestId);
            Instant now = clock.instant();
            if (request.isExpiredAt(now)) {
                expire(request, now);
                return new Decision(null, null, request);
            }
            if (request.getStatus() == ApprovalRequest.ApprovalStatus.EXPIRED) {
                return new Decision(null, null, request);
            }
            if (request.getStatus() != ApprovalRequest.ApprovalStatus.PENDING) {
                throw new ConflictException("Approval request already " + request.getStatus().value());
            }
            if (!request.getRiskLevel().canBeDecidedBy(actor.role(), actor.tenantId(), request.getTenantId())) {
                log.warn("{} ({}) may not decide {} risk request {}", actor.id(),
                        actor.role() != null ? actor.role().value() : "none", request.getRiskLevel().value(), requestId);
                throw new ForbiddenException("Role " + (actor.role() != null ? actor.role().value() : "none")
                        + " may not decide " + request.getRiskLevel().value() + " risk actions");
            }
            return approved ? grant(request, actor, notes, now) : deny(request, actor, notes, now);
        });

        ApprovalRequest request = decision.request();
        if (request.getStatus() == ApprovalRequest.ApprovalStatus.EXPIRED) {
            gatewayHandler.broadcast("approval.responded", responseEvent(request));
            throw new ApprovalExpiredException("Approval request " + requestId + " expired at " + request.getExpiresAt());
        }
        publish(decision);
        return request;
    }

    private Decision grant(ApprovalRequest request, Actor actor, String notes, Instant now) {
        Incident incident = requireIncident(request.getIncidentId());
        request.setRespondedAt(now);
        request.setApprovedBy(actor.id());
        request.setNotes(notes);

        if (incident.isResolved()) {
            request.setStatus(ApprovalRequest.ApprovalStatus.REJECTED);
            approvalRepository.save(request);
            auditService.log(actor.id(), "ACTION_REJECTED", request.getTenantId(), request.getIncidentId(),
                    request.getAction(), Map.of("approval_id", request.getId(), "reason", "incident resolved"));
            count("rejected");
            log.info("Approval {} closed without dispatch: incident {} already resolved",
                    request.getId(), request.getIncidentId());
            return new Decision(DispatchOutcome.rejected(request.getIncidentId(), "Incident is resolved"), null, request);
        }

        request.setStatus(ApprovalRequest.ApprovalStatus.APPROVED);
        auditService.log(actor.id(), "APPROVAL_GRANTED", request.getTenantId(), request.getIncidentId(),
                request.getAction(), Map.of("approval_id", request.getId(), "risk_level", request.getRiskLevel().value()));
        count("approved");
        RemediationCommand command = markDispatched(incident, request.getAction(), request.getRiskLevel(),
                actor.id(), request.getId(), now);
        request.setExecutionId(command.executionId());
        approvalRepository.save(request);
        log.info("APPROVAL_GRANTED for '{}' on incident {} by {} (id: {})",
                request.getAction(), request.getIncidentId(), actor.id(), request.getId());
        return new Decision(DispatchOutcome.dispatched(request.getIncidentId(), command.executionId()), command, request);
    }

    private Decision deny(ApprovalRequest request, Actor actor, String notes, Instant now) {
        request.setStatus(ApprovalRequest.ApprovalStatus.REJECTED);
        request.setRespondedAt(now);
        request.setApprovedBy(actor.id());
        request.setNotes(notes);
        approvalRepository.save(request);

        incidentRepository.findById(request.getIncidentId()).ifPresent(incident -> {
            if (!incident.isResolved()) {
                incident.setRemediationStatus("rejected");
                incident.setUpdatedAt(now);
                incidentRepository.save(incident);
            }
        });

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("approval_id", request.getId());
        details.put("risk_level", request.getRiskLevel().value());
        details.put("notes", notes);
        auditService.log(actor.id(), "APPROVAL_REJECTED", request.getTenantId(), request.getIncidentId(),
                request.getAction(), details);
        count("rejected");
        log.info("APPROVAL_REJECTED for '{}' on incident {} by {} (id: {})",
                request.getAction(), request.getIncidentId(), actor.id(), request.getId());
        return new Decision(DispatchOutcome.rejected(request.getIncidentId(), "Rejected by " + actor.id()), null, request);
    }

    private RemediationCommand markDispatched(Incident incident, String action, RiskLevel risk, String actorId,
                                              String approvalId, Instant now) {
        String executionId = UUID.randomUUID().toString();
        incident.setRemediationStatus("dispatched");
        incident.setLastExecutionId(executionId);
        incident.setUpdatedAt(now);
        incidentRepository.save(incident);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("execution_id", executionId);
        details.put("risk_level", risk.value());
        details.put("approval_id", approvalId);
        auditService.log(actorId, "ACTION_DISPATCHED", incident.getTenantId(), incident.getId(), action, details);
        count("dispatched");
        log.info("Dispatching '{}' ({} risk) for incident {} (execution {})",
                action, risk.value(), incident.getId(), executionId);
        return new RemediationCommand(executionId, incident.getId(), incident.getTenantId(), action, risk);
    }

    /**
     * Pending requests, newest first. Requests past their expiry are expired before they are returned.
     */
    public List<ApprovalRequest> list(String tenantId, String status) {
        sweepExpired();
        ApprovalRequest.ApprovalStatus filter = status == null || status.isBlank() ? null : parseStatus(status);
        if (tenantId != null && !tenantId.isBlank()) {
            return filter == null
                    ? approvalRepository.findByTenantIdOrderByCreatedAtDesc(tenantId)
                    : approvalRepository.findByTenantIdAndStatusOrderByCreatedAtDesc(tenantId, filter);
        }
        return filter == null
                ? approvalRepository.findAllByOrderByCreatedAtDesc()
                : approvalRepository.findByStatusOrderByCreatedAtDesc(filter);
    }

    public ApprovalRequest get(String requestId) {
        ApprovalRequest request = requireRequest(requestId);
        if (request.isExpiredAt(clock.instant())) {
            sweepExpired();
            return requireRequest(requestId);
        }
        return request;
    }

    /**
     * Expire every pending request past its deadline.
     *
     * @return number of requests expired
     */
    @Scheduled(fixedDelayString = "${incident-engine.approvals.sweep-interval-ms:60000}")
    public int sweepExpired() {
        List<ApprovalRequest> expired = transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            List<ApprovalRequest> due = approvalRepository
                    .findByStatusAndExpiresAtLessThanEqual(ApprovalRequest.ApprovalStatus.PENDING, now);
            due.forEach(request -> expire(request, now));
            return due;
        });
        expired.forEach(request -> gatewayHandler.broadcast("approval.responded", responseEvent(request)));
        if (!expired.isEmpty()) {
            log.info("Expired {} approval requests", expired.size());
        }
        return expired.size();
    }

    private void expire(ApprovalRequest request, Instant now) {
        request.setStatus(ApprovalRequest.ApprovalStatus.EXPIRED);
        request.setRespondedAt(now);
        approvalRepository.save(request);
        incidentRepository.findById(request.getIncidentId()).ifPresent(incident -> {
            if (!incident.isResolved() && "pending_approval".equals(incident.getRemediationStatus())) {
                incident.setRemediationStatus("expired");
                incidentRepository.save(incident);
            }
        });
        auditService.log("approval-gate", "APPROVAL_EXPIRED", request.getTenantId(), request.getIncidentId(),
                request.getAction(), Map.of("approval_id", request.getId(),
                        "expires_at", request.getExpiresAt().toString()));
        count("expired");
        log.info("Approval {} for '{}' on incident {} expired", request.getId(), request.getAction(),
                request.getIncidentId());
    }

    /**
     * Status report from the executor for a dispatched action.
     */
    public Incident remediationStatus(String incidentId, String executionId, String status, String actor) {
        if (executionId == null || executionId.isBlank() || status == null || status.isBlank()) {
            throw new ValidationException("execution_id and status are required");
        }
        Incident incident = transactionTemplate.execute(tx -> {
            Incident current = requireIncident(incidentId);
            if (!executionId.equals(current.getLastExecutionId())) {
                throw new ConflictException("Execution " + executionId + " is not the latest for incident " + incidentId);
            }
            current.setRemediationStatus(status.trim());
            current.setUpdatedAt(clock.instant());
            Incident saved = incidentRepository.save(current);
            auditService.log(actor, "REMEDIATION_STATUS", saved.getTenantId(), incidentId, executionId,
                    Map.of("status", status.trim()));
            return saved;
        });
        log.info("Execution {} for incident {} reported {}", executionId, incidentId, status);
        gatewayHandler.broadcast("incident.updated", incident);
        return incident;
    }

    private void publish(Decision decision) {
        if (decision.request() != null) {
            ApprovalRequest request = decision.request();
            String method = request.getStatus() == ApprovalRequest.ApprovalStatus.PENDING
                    ? "approval.requested" : "approval.responded";
            gatewayHandler.broadcast(method, responseEvent(request));
        }
        if (decision.command() != null) {
            RemediationCommand command = decision.command();
            executor.dispatch(command);
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("execution_id", command.executionId());
            event.put("incident_id", command.incidentId());
            event.put("company_id", command.tenantId());
            event.put("action", command.action());
            event.put("risk_level", command.riskLevel().value());
            gatewayHandler.broadcast("remediation.dispatched", event);
        }
    }

    private static Map<String, Object> responseEvent(ApprovalRequest request) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("approval_id", request.getId());
        event.put("incident_id", request.getIncidentId());
        event.put("company_id", request.getTenantId());
        event.put("action", request.getAction());
        event.put("risk_level", request.getRiskLevel().value());
        event.put("status", request.getStatus().value());
        event.put("expires_at", request.getExpiresAt());
        event.put("approved_by", request.getApprovedBy());
        return event;
    }

    private void requireTenantScope(Actor actor, String tenantId) {
        if (actor.role() != ActorRole.MSP_ADMIN && actor.tenantId() != null && !actor.tenantId().equals(tenantId)) {
            throw new ForbiddenException("Actor " + actor.id() + " is not scoped to company " + tenantId);
        }
    }

    private Incident requireIncident(String incidentId) {
        return incidentRepository.findById(incidentId)
                .orElseThrow(() -> new NotFoundException("Incident not found: " + incidentId));
    }

    private ApprovalRequest requireRequest(String requestId) {
        return approvalRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("Approval request not found: " + requestId));
    }

    private static ApprovalRequest.ApprovalStatus parseStatus(String status) {
        for (ApprovalRequest.ApprovalStatus value : ApprovalRequest.ApprovalStatus.values()) {
            if (value.name().equalsIgnoreCase(status.trim())) {
                return value;
            }
        }
        throw new ValidationException("Unknown approval status '" + status
                + "', expected one of pending, approved, rejected, expired");
    }

    private void count(String action) {
        Counter.builder("approval.transitions")
                .tag("action", action)
                .register(meterRegistry)
                .increment();
    }

    private record Decision(DispatchOutcome outcome, RemediationCommand command, ApprovalRequest request) {
    }
}
