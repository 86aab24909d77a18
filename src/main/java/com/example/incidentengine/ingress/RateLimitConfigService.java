package com.example.incidentengine.ingress;

import com.example.incidentengine.config.EngineProperties;
import com.example.incidentengine.domain.RateLimitConfig;
import com.example.incidentengine.exception.ValidationException;
import com.example.incidentengine.repository.RateLimitConfigRepository;
import com.example.incidentengine.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;

/**
 * Effective rate limit per tenant: the stored override, or the configured defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitConfigService {

    static final int MIN_RPM = 1;
    static final int MAX_RPM = 1000;

    private final RateLimitConfigRepository repository;
    private final EngineProperties properties;
    private final RateLimiter rateLimiter;
    private final AuditService auditService;
    private final Clock clock;

    public RateLimitConfig forTenant(String tenantId) {
        return repository.findById(tenantId).orElseGet(() -> defaults(tenantId));
    }

    @Transactional
    public RateLimitConfig update(String tenantId, Integer requestsPerMinute, Integer burstSize,
                                  Boolean enabled, String actor) {
        RateLimitConfig config = forTenant(tenantId);
        if (requestsPerMinute != null) config.setRequestsPerMinute(requestsPerMinute);
        if (burstSize != null) config.setBurstSize(burstSize);
        if (enabled != null) config.setEnabled(enabled);

        if (config.getRequestsPerMinute() < MIN_RPM || config.getRequestsPerMinute() > MAX_RPM) {
            throw new ValidationException("requests_per_minute must be between " + MIN_RPM + " and " + MAX_RPM);
        }
        if (config.getBurstSize() < config.getRequestsPerMinute()) {
            throw new ValidationException("burst_size must be greater than or equal to requests_per_minute");
        }

        config.setUpdatedAt(clock.instant());
        RateLimitConfig saved = repository.save(config);
        rateLimiter.reset(tenantId);
        auditService.log(actor, "CONFIG_CHANGED", tenantId, null, "rate-limit", Map.of(
                "requests_per_minute", saved.getRequestsPerMinute(),
                "burst_size", saved.getBurstSize(),
                "enabled", saved.isEnabled()));
        log.info("Rate limit for tenant {} set to {}/min (burst {}, enabled {})",
                tenantId, saved.getRequestsPerMinute(), saved.getBurstSize(), saved.isEnabled());
        return saved;
    }

    private RateLimitConfig defaults(String tenantId) {
        EngineProperties.IngressConfig ingress = properties.getIngress();
        return RateLimitConfig.builder()
                .tenantId(tenantId)
                .requestsPerMinute(ingress.getRequestsPerMinute())
                .burstSize(ingress.getBurstSize())
                .enabled(ingress.isRateLimitEnabled())
                .build();
    }
}
