package com.example.incidentengine.controller;

import com.example.incidentengine.correlation.CorrelationConfigService;
import com.example.incidentengine.domain.Asset;
import com.example.incidentengine.domain.CorrelationConfig;
import com.example.incidentengine.domain.RateLimitConfig;
import com.example.incidentengine.exception.ValidationException;
import com.example.incidentengine.ingress.RateLimitConfigService;
import com.example.incidentengine.service.AssetService;
import com.example.incidentengine.service.TenantService;
import com.example.incidentengine.sla.SlaComplianceReport;
import com.example.incidentengine.sla.SlaConfigService;
import com.example.incidentengine.sla.SlaConfigUpdate;
import com.example.incidentengine.sla.SlaTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Per-company settings: SLA targets and report, correlation, rate limit, webhook signing and assets.
 */
@RestController
@RequestMapping("/api/companies/{companyId}")
@RequiredArgsConstructor
public class CompanyConfigController {

    private final TenantService tenantService;
    private final SlaConfigService slaConfigService;
    private final SlaTracker slaTracker;
    private final CorrelationConfigService correlationConfigService;
    private final RateLimitConfigService rateLimitConfigService;
    private final AssetService assetService;
    private final Clock clock;

    // SLA
    @GetMapping("/sla-config")
    public ResponseEntity<Map<String, Object>> getSlaConfig(@PathVariable String companyId) {
        tenantService.require(companyId);
        return ResponseEntity.ok(slaConfigService.toView(slaConfigService.forTenant(companyId)));
    }

    @PutMapping("/sla-config")
    public ResponseEntity<Map<String, Object>> updateSlaConfig(
            @PathVariable String companyId,
            @RequestBody SlaConfigUpdate update,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId) {
        tenantService.require(companyId);
        return ResponseEntity.ok(slaConfigService.toView(
                slaConfigService.update(companyId, update, ActorHeaders.name(actorId))));
    }

    @GetMapping("/sla-report")
    public ResponseEntity<SlaComplianceReport> getSlaReport(
            @PathVariable String companyId,
            @RequestParam(defaultValue = "30") int days) {
        tenantService.require(companyId);
        if (days < 1 || days > 365) {
            throw new ValidationException("days must be between 1 and 365");
        }
        return ResponseEntity.ok(slaTracker.complianceReport(companyId, days, clock.instant()));
    }

    // Correlation
    @GetMapping("/correlation-config")
    public ResponseEntity<CorrelationConfig> getCorrelationConfig(@PathVariable String companyId) {
        tenantService.require(companyId);
        return ResponseEntity.ok(correlationConfigService.forTenant(companyId));
    }

    @PutMapping("/correlation-config")
    public ResponseEntity<CorrelationConfig> updateCorrelationConfig(
            @PathVariable String companyId,
            @RequestBody Map<String, Object> body,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId) {
        tenantService.require(companyId);
        return ResponseEntity.ok(correlationConfigService.update(companyId,
                intValue(body, "time_window_minutes"),
                body.get("aggregation_key") != null ? body.get("aggregation_key").toString() : null,
                boolValue(body, "auto_correlate"),
                intValue(body, "interval_seconds"),
                ActorHeaders.name(actorId)));
    }

    // Rate limit
    @GetMapping("/rate-limit")
    public ResponseEntity<RateLimitConfig> getRateLimit(@PathVariable String companyId) {
        tenantService.require(companyId);
        return ResponseEntity.ok(rateLimitConfigService.forTenant(companyId));
    }

    @PutMapping("/rate-limit")
    public ResponseEntity<RateLimitConfig> updateRateLimit(
            @PathVariable String companyId,
            @RequestBody Map<String, Object> body,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId) {
        tenantService.require(companyId);
        return ResponseEntity.ok(rateLimitConfigService.update(companyId,
                intValue(body, "requests_per_minute"),
                intValue(body, "burst_size"),
                boolValue(body, "enabled"),
                ActorHeaders.name(actorId)));
    }

    // Webhook security
    @GetMapping("/webhook-security")
    public ResponseEntity<Map<String, Object>> getWebhookSecurity(@PathVariable String companyId) {
        return ResponseEntity.ok(tenantService.webhookSecurity(companyId));
    }

    @PostMapping("/webhook-security/enable")
    public ResponseEntity<Map<String, Object>> enableWebhookSecurity(
            @PathVariable String companyId,
            @RequestBody(required = false) Map<String, Object> body,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId) {
        Integer maxDiff = body != null ? intValue(body, "max_timestamp_diff_seconds") : null;
        return ResponseEntity.ok(tenantService.enableHmac(companyId,
                maxDiff != null ? maxDiff.longValue() : null, ActorHeaders.name(actorId)));
    }

    @PostMapping("/webhook-security/disable")
    public ResponseEntity<Map<String, Object>> disableWebhookSecurity(
            @PathVariable String companyId,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId) {
        return ResponseEntity.ok(tenantService.disableHmac(companyId, ActorHeaders.name(actorId)));
    }

    @PostMapping("/webhook-security/regenerate-secret")
    public ResponseEntity<Map<String, Object>> regenerateSecret(
            @PathVariable String companyId,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId) {
        return ResponseEntity.ok(tenantService.regenerateSecret(companyId, ActorHeaders.name(actorId)));
    }

    // Assets
    @GetMapping("/assets")
    public ResponseEntity<List<Asset>> listAssets(@PathVariable String companyId) {
        tenantService.require(companyId);
        return ResponseEntity.ok(assetService.list(companyId));
    }

    @PutMapping("/assets/{assetId}")
    public ResponseEntity<Asset> updateAsset(
            @PathVariable String companyId,
            @PathVariable String assetId,
            @RequestBody Map<String, Object> body,
            @RequestHeader(name = ActorHeaders.ID, required = false) String actorId) {
        tenantService.require(companyId);
        Boolean critical = boolValue(body, "critical");
        if (critical == null) {
            throw new ValidationException("critical is required");
        }
        return ResponseEntity.ok(assetService.setCritical(companyId, assetId, critical, ActorHeaders.name(actorId)));
    }

    private static Integer intValue(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) return null;
        if (value instanceof Number number) return number.intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(field + " must be a number");
        }
    }

    private static Boolean boolValue(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) return null;
        if (value instanceof Boolean bool) return bool;
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new ValidationException(field + " must be true or false");
    }
}
