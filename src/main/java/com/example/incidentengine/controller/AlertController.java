package com.example.incidentengine.controller;

import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.exception.NotFoundException;
import com.example.incidentengine.exception.ValidationException;
import com.example.incidentengine.repository.AlertRepository;
import com.example.incidentengine.service.TenantService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read access to accepted alerts.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertRepository alertRepository;
    private final TenantService tenantService;

    @GetMapping
    public ResponseEntity<List<Alert>> listAlerts(
            @RequestParam(name = "company_id") String companyId,
            @RequestParam(required = false) String status) {
        tenantService.require(companyId);
        if (status == null || status.isBlank()) {
            return ResponseEntity.ok(alertRepository.findByTenantIdOrderByReceivedAtDesc(companyId));
        }
        Alert.AlertStatus alertStatus;
        try {
            alertStatus = Alert.AlertStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown alert status '" + status + "', expected active or correlated");
        }
        return ResponseEntity.ok(alertRepository.findByTenantIdAndStatusOrderByReceivedAtDesc(companyId, alertStatus));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Alert> getAlert(@PathVariable String id) {
        return ResponseEntity.ok(alertRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Alert not found: " + id)));
    }
}
