package com.example.incidentengine.service;

import com.example.incidentengine.config.EngineProperties;
import com.example.incidentengine.domain.Tenant;
import com.example.incidentengine.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates the tenants listed under {@code incident-engine.tenants} on startup.
 * Company management lives in another system; this only makes its tenants known here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TenantBootstrap {

    private final EngineProperties properties;
    private final TenantRepository tenantRepository;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void seedTenants() {
        int created = 0;
        for (EngineProperties.TenantSeed seed : properties.getTenants()) {
            if (seed.getId() == null || seed.getApiKey() == null) {
                log.warn("Skipping tenant seed without id or api-key (id: {})", seed.getId());
                continue;
            }
            if (tenantRepository.existsById(seed.getId())) continue;
            tenantRepository.save(Tenant.builder()
                    .id(seed.getId())
                    .name(seed.getName() != null ? seed.getName() : seed.getId())
                    .apiKey(seed.getApiKey())
                    .maxTimestampDiffSeconds(properties.getIngress().getMaxTimestampDiffSeconds())
                    .createdAt(clock.instant())
                    .build());
            created++;
        }
        if (created > 0) {
            log.info("Seeded {} tenant(s) from configuration", created);
        }
    }
}
