package com.example.incidentengine.correlation;

import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.domain.CorrelationConfig;
import com.example.incidentengine.domain.Tenant;
import com.example.incidentengine.event.AlertAcceptedEvent;
import com.example.incidentengine.exception.ConflictException;
import com.example.incidentengine.repository.AlertRepository;
import com.example.incidentengine.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs correlation passes in the background for tenants with auto-correlation on.
 * A tenant is due once its interval has elapsed since the last pass and it has
 * alerts waiting. One tenant failing never stops the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrelationScheduler {

    private final CorrelationEngine correlationEngine;
    private final CorrelationConfigService configService;
    private final TenantRepository tenantRepository;
    private final AlertRepository alertRepository;
    private final Clock clock;

    private final Set<String> pendingTenants = ConcurrentHashMap.newKeySet();

    @EventListener
    public void onAlertAccepted(AlertAcceptedEvent event) {
        pendingTenants.add(event.getTenantId());
    }

    @Scheduled(fixedDelayString = "${incident-engine.correlation.tick-interval-ms:5000}")
    public void tick() {
        Instant now = clock.instant();
        for (Tenant tenant : tenantRepository.findAll()) {
            String tenantId = tenant.getId();
            try {
                CorrelationConfig config = configService.forTenant(tenantId);
                if (!isDue(config, now)) continue;
                pendingTenants.remove(tenantId);
                correlationEngine.correlate(tenantId);
            } catch (ConflictException e) {
                log.debug("Skipping tenant {}: {}", tenantId, e.getMessage());
            } catch (RuntimeException e) {
                pendingTenants.add(tenantId);
                log.error("Correlation pass failed for tenant {}: {}", tenantId, e.getMessage(), e);
            }
        }
    }

    boolean isDue(CorrelationConfig config, Instant now) {
        if (!config.isAutoCorrelate()) return false;
        Instant lastRun = config.getLastRunAt();
        if (lastRun != null && now.isBefore(lastRun.plus(Duration.ofSeconds(config.getIntervalSeconds())))) {
            return false;
        }
        return pendingTenants.contains(config.getTenantId())
                || alertRepository.countByTenantIdAndStatus(config.getTenantId(), Alert.AlertStatus.ACTIVE) > 0;
    }
}
