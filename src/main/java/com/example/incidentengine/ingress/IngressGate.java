package com.example.incidentengine.ingress;

import com.example.incidentengine.config.EngineProperties;
import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.domain.Asset;
import com.example.incidentengine.domain.RateLimitConfig;
import com.example.incidentengine.domain.Severity;
import com.example.incidentengine.domain.Tenant;
import com.example.incidentengine.event.AlertAcceptedEvent;
import com.example.incidentengine.exception.RateLimitedException;
import com.example.incidentengine.exception.UnauthorizedException;
import com.example.incidentengine.exception.ValidationException;
import com.example.incidentengine.gateway.GatewayWebSocketHandler;
import com.example.incidentengine.repository.AlertRepository;
import com.example.incidentengine.repository.TenantRepository;
import com.example.incidentengine.scoring.PriorityScorer;
import com.example.incidentengine.service.AssetService;
import com.example.incidentengine.service.AuditService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Ingress Gate - every alert delivery passes these gates in order, failing closed:
 * <ol>
 *   <li>tenant resolution by API key</li>
 *   <li>per-tenant rate limit</li>
 *   <li>HMAC signature and timestamp, when the tenant enabled it</li>
 *   <li>idempotency claim on the delivery id</li>
 *   <li>schema validation, asset discovery and persistence</li>
 * </ol>
 * Rejections are thrown; duplicates are a successful result pointing at the original alert.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngressGate {

    private static final int MAX_FIELD_LENGTH = 255;
    private static final int MAX_MESSAGE_LENGTH = 4096;

    private final TenantRepository tenantRepository;
    private final AlertRepository alertRepository;
    private final RateLimitConfigService rateLimitConfigService;
    private final RateLimiter rateLimiter;
    private final WebhookSignatureVerifier signatureVerifier;
    private final DeliveryLedger deliveryLedger;
    private final AssetService assetService;
    private final SeverityAdvisor severityAdvisor;
    private final PriorityScorer priorityScorer;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final GatewayWebSocketHandler gatewayHandler;
    private final ObjectMapper objectMapper;
    private final EngineProperties properties;
    private final MeterRegistry meterRegistry;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public IngressResult accept(String apiKey, DeliveryHeaders headers, byte[] rawBody) {
        Instant now = clock.instant();

        Tenant tenant = resolveTenant(apiKey);
        RateLimitDecision rateLimit = applyRateLimit(tenant.getId(), now);

        if (tenant.isHmacEnabled()) {
            try {
                signatureVerifier.verify(tenant.getHmacSecret(), headers.timestamp(), headers.signature(),
                        rawBody, now, tenant.getMaxTimestampDiffSeconds());
            } catch (UnauthorizedException e) {
                count("unauthorized");
                log.warn("Signature check failed for tenant {}: {}", tenant.getId(), e.getReason());
                throw e;
            }
        }

        AlertPayload payload = parse(rawBody);
        String deliveryId = isBlank(headers.deliveryId())
                ? DeliveryLedger.deriveDeliveryId(payload.getAssetName(), payload.getSignature(), payload.getMessage())
                : headers.deliveryId().trim();

        String candidateId = UUID.randomUUID().toString();
        DeliveryLedger.Claim claim = deliveryLedger.claim(tenant.getId(), deliveryId, candidateId);
        while (!claim.owned()) {
            if (deliveryLedger.awaitSettled(tenant.getId(), deliveryId, claim.alertId())) {
                return duplicate(tenant.getId(), deliveryId, claim.alertId(), rateLimit);
            }
            // the earlier delivery was rejected; this one gets its own chance
            claim = deliveryLedger.claim(tenant.getId(), deliveryId, candidateId);
        }

        Alert alert;
        try {
            alert = admit(tenant, payload, candidateId, deliveryId, now);
        } catch (RuntimeException e) {
            deliveryLedger.release(tenant.getId(), deliveryId, candidateId);
            if (e instanceof ValidationException) {
                count("invalid");
            }
            throw e;
        }
        deliveryLedger.confirm(tenant.getId(), deliveryId, alert.getId());
        count("accepted");
        broadcast(alert);
        return IngressResult.accepted(alert.getId(), deliveryId, rateLimit);
    }

    private Tenant resolveTenant(String apiKey) {
        if (isBlank(apiKey)) {
            count("unauthorized");
            throw new UnauthorizedException(UnauthorizedException.Reason.UNKNOWN_KEY);
        }
        return tenantRepository.findByApiKey(apiKey).orElseThrow(() -> {
            count("unauthorized");
            return new UnauthorizedException(UnauthorizedException.Reason.UNKNOWN_KEY);
        });
    }

    private RateLimitDecision applyRateLimit(String tenantId, Instant now) {
        RateLimitConfig config = rateLimitConfigService.forTenant(tenantId);
        if (!config.isEnabled()) {
            return RateLimitDecision.unlimited();
        }
        RateLimitDecision decision = rateLimiter.tryAcquire(tenantId,
                config.getRequestsPerMinute(), config.getBurstSize(), now);
        if (!decision.allowed()) {
            count("rate_limited");
            throw new RateLimitedException(decision);
        }
        return decision;
    }

    private AlertPayload parse(byte[] rawBody) {
        if (rawBody == null || rawBody.length == 0) {
            count("invalid");
            throw new ValidationException("Request body is required");
        }
        try {
            AlertPayload payload = objectMapper.readValue(rawBody, AlertPayload.class);
            if (payload == null) {
                throw new ValidationException("Request body must be a JSON object");
            }
            return payload;
        } catch (IOException e) {
            count("invalid");
            throw new ValidationException("Malformed JSON payload");
        }
    }

    private IngressResult duplicate(String tenantId, String deliveryId, String alertId, RateLimitDecision rateLimit) {
        int updated = alertRepository.incrementDeliveryAttempts(alertId);
        if (updated == 0) {
            // owner outlived the wait; the claim alone is authoritative
            log.debug("Duplicate delivery {} arrived before alert {} was stored", deliveryId, alertId);
        }
        log.info("Duplicate delivery {} for tenant {} -> alert {}", deliveryId, tenantId, alertId);
        count("duplicate");
        return IngressResult.duplicate(alertId, deliveryId, rateLimit);
    }

    private Alert admit(Tenant tenant, AlertPayload payload, String alertId, String deliveryId, Instant now) {
        Severity reported = validate(payload);
        Asset asset = assetService.resolveOrCreate(tenant.getId(), payload.getAssetName().trim(),
                payload.getToolSource().trim());
        Severity severity = advise(payload, reported);

        Alert alert = Alert.builder()
                .id(alertId)
                .tenantId(tenant.getId())
                .assetId(asset.getId())
                .assetName(asset.getName())
                .signature(payload.getSignature().trim())
                .severity(severity)
                .reportedSeverity(reported)
                .message(payload.getMessage())
                .toolSource(payload.getToolSource().trim())
                .deliveryId(deliveryId)
                .deliveryAttempts(1)
                .receivedAt(now)
                .status(Alert.AlertStatus.ACTIVE)
                .build();
        alert.setPriorityScore(priorityScorer.score(alert, asset.isCritical(), now));

        Alert saved = transactionTemplate.execute(status -> {
            Alert stored = alertRepository.save(alert);
            auditService.log("ingress", "ALERT_ACCEPTED", tenant.getId(), null, stored.getId(), Map.of(
                    "delivery_id", deliveryId,
                    "asset_name", stored.getAssetName(),
                    "signature", stored.getSignature(),
                    "severity", stored.getSeverity().value()));
            eventPublisher.publishEvent(new AlertAcceptedEvent(tenant.getId(), stored.getId(), now));
            return stored;
        });
        log.info("Accepted alert {} for tenant {}: {} on {} ({})", saved.getId(), tenant.getId(),
                saved.getSignature(), saved.getAssetName(), saved.getSeverity().value());
        return saved;
    }

    private void broadcast(Alert alert) {
        Map<String, Object> event = new HashMap<>();
        event.put("alert_id", alert.getId());
        event.put("company_id", alert.getTenantId());
        event.put("asset_name", alert.getAssetName());
        event.put("signature", alert.getSignature());
        event.put("severity", alert.getSeverity().value());
        event.put("tool_source", alert.getToolSource());
        event.put("priority_score", alert.getPriorityScore());
        gatewayHandler.broadcast("alert.accepted", event);
    }

    private Severity validate(AlertPayload payload) {
        requireField("asset_name", payload.getAssetName(), MAX_FIELD_LENGTH);
        requireField("signature", payload.getSignature(), MAX_FIELD_LENGTH);
        requireField("severity", payload.getSeverity(), MAX_FIELD_LENGTH);
        requireField("message", payload.getMessage(), MAX_MESSAGE_LENGTH);
        requireField("tool_source", payload.getToolSource(), MAX_FIELD_LENGTH);
        return Severity.parse(payload.getSeverity())
                .orElseThrow(() -> new ValidationException("Unknown severity '" + payload.getSeverity()
                        + "', expected one of low, medium, high, critical"));
    }

    private Severity advise(AlertPayload payload, Severity reported) {
        Optional<SeverityAdvice> advice;
        try {
            advice = severityAdvisor.advise(payload);
        } catch (RuntimeException e) {
            log.warn("Severity advisor failed, keeping reported severity: {}", e.getMessage());
            return reported;
        }
        if (advice.isEmpty() || advice.get().severity() == null) {
            return reported;
        }
        SeverityAdvice suggestion = advice.get();
        if (suggestion.confidence() < properties.getAdvisory().getMinConfidence()
                || suggestion.severity() == reported) {
            return reported;
        }
        log.info("Severity for {} on {} adjusted {} -> {} (confidence {})", payload.getSignature(),
                payload.getAssetName(), reported.value(), suggestion.severity().value(), suggestion.confidence());
        return suggestion.severity();
    }

    private static void requireField(String name, String value, int maxLength) {
        if (isBlank(value)) {
            throw new ValidationException("Missing required field: " + name);
        }
        if (value.length() > maxLength) {
            throw new ValidationException("Field " + name + " exceeds " + maxLength + " characters");
        }
    }

    private void count(String outcome) {
        Counter.builder("ingress.deliveries")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
