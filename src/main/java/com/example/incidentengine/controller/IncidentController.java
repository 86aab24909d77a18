package com.example.incidentengine.controller;

import com.example.incidentengine.approval.ApprovalGate;
import com.example.incidentengine.approval.DispatchOutcome;
import com.example.incidentengine.correlation.CorrelationEngine;
import com.example.incidentengine.correlation.CorrelationResult;
import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.domain.Incident;
import com.example.incidentengine.domain.NotificationOutbox;
import com.example.incidentengine.notification.NotificationService;
import com.example.incidentengine.service.IncidentService;
import com.example.incidentengine.service.IncidentUpdate;
import com.example.incidentengine.sla.SlaStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Incident Management REST API Controller.
 */
@RestController
@RequestMapping("/api/incidents")
@RequiredArgsConstructor
public class IncidentController {

    private final IncidentService incidentService;
    private final CorrelationEngine correlationEngine;
    private final ApprovalGate approvalGate;
    private final NotificationService notificationService;

    /**
     * List a company's incidents, newest first.
     */
    @GetMapping
    public ResponseEntity<List<Incident>> listIncidents(
            @RequestParam(name = "company_id") String companyId,
            @RequestParam(required = false) String status) {
        return ResponseEntity.ok(incidentService.list(companyId, status));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Incident> getIncident(@PathVariable String id) {
        return ResponseEntity.ok(incidentService.get(id));
    }

    @GetMapping("/{id}/alerts")
    public ResponseEntity<List<Alert>> getIncidentAlerts(@PathVariable String id) {
        return ResponseEntity.ok(incidentService.alerts(id));
    }

    /**
     * Run a correlation pass now. 409 while a pass for the company is already running.
     */
    @PostMapping("/correlate")
    public ResponseEntity<CorrelationResult> correlate(@RequestParam(name = "company_id") String companyId) {
        return ResponseEntity.ok(correlationEngine.correlate(companyId));
    }

    /**
     * Assign, start or resolve an incident.
     */
    @PutMapping("/{id}")
    public ResponseEntity<Incident> updateIncident(
            @PathVariable String id,
            @RequestBody IncidentUpdate update,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId) {
        return ResponseEntity.ok(incidentService.update(id, update, ActorHeaders.name(actorId)));
    }

    @GetMapping("/{id}/sla-status")
    public ResponseEntity<SlaStatus> getSlaStatus(@PathVariable String id) {
        return ResponseEntity.ok(incidentService.slaStatus(id));
    }

    @GetMapping("/{id}/notifications")
    public ResponseEntity<List<NotificationOutbox>> getNotifications(@PathVariable String id) {
        incidentService.get(id);
        return ResponseEntity.ok(notificationService.forIncident(id));
    }

    /**
     * Request a remediation action. Low risk runs now; medium and high wait for approval.
     */
    @PostMapping("/{id}/remediations")
    public ResponseEntity<DispatchOutcome> requestRemediation(
            @PathVariable String id,
            @RequestBody Map<String, Object> body,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId,
            @RequestHeader(name = ActorHeaders.ROLE, required = false) String actorRole,
            @RequestHeader(name = ActorHeaders.TENANT, required = false) String actorTenant) {
        String action = body.get("action") != null ? body.get("action").toString() : null;
        String riskLevel = body.get("risk_level") != null ? body.get("risk_level").toString() : null;
        return ResponseEntity.ok(approvalGate.requestDispatch(id, action, riskLevel,
                ActorHeaders.resolve(actorId, actorRole, actorTenant)));
    }

    /**
     * Callback from the remediation executor.
     */
    @PostMapping("/{id}/remediation-status")
    public ResponseEntity<Incident> remediationStatus(
            @PathVariable String id,
            @RequestBody Map<String, Object> body,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId) {
        String executionId = body.get("execution_id") != null ? body.get("execution_id").toString() : null;
        String status = body.get("status") != null ? body.get("status").toString() : null;
        String actor = actorId == null || actorId.isBlank() ? "executor" : actorId.trim();
        return ResponseEntity.ok(approvalGate.remediationStatus(id, executionId, status, actor));
    }
}
