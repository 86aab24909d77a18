package com.example.incidentengine.controller;

import com.example.incidentengine.domain.AuditLog;
import com.example.incidentengine.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Audit trail queries.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping
    public ResponseEntity<List<AuditLog>> getAuditLog(
            @RequestParam(name = "company_id", required = false) String companyId,
            @RequestParam(name = "incident_id", required = false) String incidentId,
            @RequestParam(required = false) String action,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(auditService.filter(blankToNull(companyId), blankToNull(incidentId),
                blankToNull(action), limit));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
