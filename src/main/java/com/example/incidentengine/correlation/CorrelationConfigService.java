package com.example.incidentengine.correlation;

import com.example.incidentengine.config.EngineProperties;
import com.example.incidentengine.domain.CorrelationConfig;
import com.example.incidentengine.exception.ValidationException;
import com.example.incidentengine.repository.CorrelationConfigRepository;
import com.example.incidentengine.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-tenant correlation settings. Tenants without a stored row get one built
 * from the configured defaults on first use.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrelationConfigService {

    static final Set<Integer> ALLOWED_INTERVALS = Set.of(1, 5, 10, 15, 30, 60, 120, 300);

    private final CorrelationConfigRepository repository;
    private final EngineProperties properties;
    private final AuditService auditService;
    private final Clock clock;

    /** Stored settings, or the defaults if nothing was stored yet (not persisted). */
    public CorrelationConfig forTenant(String tenantId) {
        return repository.findById(tenantId).orElseGet(() -> defaults(tenantId));
    }

    @Transactional
    public CorrelationConfig update(String tenantId, Integer timeWindowMinutes, String aggregationKey,
                                    Boolean autoCorrelate, Integer intervalSeconds, String actor) {
        CorrelationConfig config = forTenant(tenantId);
        if (timeWindowMinutes != null) {
            if (timeWindowMinutes < CorrelationConfig.MIN_WINDOW_MINUTES
                    || timeWindowMinutes > CorrelationConfig.MAX_WINDOW_MINUTES) {
                throw new ValidationException("time_window_minutes must be between "
                        + CorrelationConfig.MIN_WINDOW_MINUTES + " and " + CorrelationConfig.MAX_WINDOW_MINUTES);
            }
            config.setTimeWindowMinutes(timeWindowMinutes);
        }
        if (aggregationKey != null) {
            config.setAggregationKey(AggregationKeys.parse(aggregationKey).pattern());
        }
        if (autoCorrelate != null) {
            config.setAutoCorrelate(autoCorrelate);
        }
        if (intervalSeconds != null) {
            if (!ALLOWED_INTERVALS.contains(intervalSeconds)) {
                throw new ValidationException("interval_seconds must be one of " + ALLOWED_INTERVALS);
            }
            config.setIntervalSeconds(intervalSeconds);
        }
        config.setUpdatedAt(clock.instant());
        CorrelationConfig saved = repository.save(config);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("time_window_minutes", saved.getTimeWindowMinutes());
        details.put("aggregation_key", saved.getAggregationKey());
        details.put("auto_correlate", saved.isAutoCorrelate());
        details.put("interval_seconds", saved.getIntervalSeconds());
        auditService.log(actor, "CONFIG_CHANGED", tenantId, null, "correlation-config", details);
        log.info("Correlation config for tenant {} updated: window {}m, key {}, auto {}, every {}s",
                tenantId, saved.getTimeWindowMinutes(), saved.getAggregationKey(),
                saved.isAutoCorrelate(), saved.getIntervalSeconds());
        return saved;
    }

    /** Record a completed pass. Runs inside the pass's transaction. */
    void markRun(String tenantId) {
        if (repository.updateLastRunAt(tenantId, clock.instant()) == 0) {
            CorrelationConfig config = defaults(tenantId);
            config.setLastRunAt(clock.instant());
            repository.save(config);
        }
    }

    private CorrelationConfig defaults(String tenantId) {
        EngineProperties.CorrelationConfig defaults = properties.getCorrelation();
        int window = Math.max(CorrelationConfig.MIN_WINDOW_MINUTES,
                Math.min(CorrelationConfig.MAX_WINDOW_MINUTES, defaults.getTimeWindowMinutes()));
        return CorrelationConfig.builder()
                .tenantId(tenantId)
                .timeWindowMinutes(window)
                .aggregationKey(AggregationKeys.parse(defaults.getAggregationKey()).pattern())
                .autoCorrelate(defaults.isAutoCorrelate())
                .intervalSeconds(defaults.getIntervalSeconds())
                .build();
    }
}
