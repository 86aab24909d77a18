package com.example.incidentengine.controller;

import com.example.incidentengine.approval.ApprovalGate;
import com.example.incidentengine.domain.ApprovalRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Approval Workflow REST API Controller.
 */
@RestController
@RequestMapping("/api/approval-requests")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalGate approvalGate;

    /**
     * List approval requests, newest first. Expired requests are marked before listing.
     */
    @GetMapping
    public ResponseEntity<List<ApprovalRequest>> listRequests(
            @RequestParam(name = "company_id", required = false) String companyId,
            @RequestParam(required = false) String status) {
        return ResponseEntity.ok(approvalGate.list(companyId, status));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApprovalRequest> getRequest(@PathVariable String id) {
        return ResponseEntity.ok(approvalGate.get(id));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<ApprovalRequest> approve(
            @PathVariable String id,
            @RequestBody(required = false) Map<String, Object> body,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId,
            @RequestHeader(name = ActorHeaders.ROLE, required = false) String actorRole,
            @RequestHeader(name = ActorHeaders.TENANT, required = false) String actorTenant) {
        return ResponseEntity.ok(approvalGate.approve(id,
                ActorHeaders.resolve(actorId, actorRole, actorTenant), notes(body)));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<ApprovalRequest> reject(
            @PathVariable String id,
            @RequestBody(required = false) Map<String, Object> body,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId,
            @RequestHeader(name = ActorHeaders.ROLE, required = false) String actorRole,
            @RequestHeader(name = ActorHeaders.TENANT, required = false) String actorTenant) {
        return ResponseEntity.ok(approvalGate.reject(id,
                ActorHeaders.resolve(actorId, actorRole, actorTenant), notes(body)));
    }

    private static String notes(Map<String, Object> body) {
        return body != null && body.get("notes") != null ? body.get("notes").toString() : null;
    }
}
