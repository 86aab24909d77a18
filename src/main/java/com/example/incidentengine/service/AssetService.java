package com.example.incidentengine.service;

import com.example.incidentengine.domain.Asset;
import com.example.incidentengine.exception.NotFoundException;
import com.example.incidentengine.repository.AssetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Asset lookup and lazy discovery from incoming alerts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssetService {

    private final AssetRepository assetRepository;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Find the named asset or create it as a non-critical server tagged with the reporting tool.
     * Two deliveries discovering the same asset at once end up with the same row: the loser of
     * the insert race re-reads the winner's.
     */
    public Asset resolveOrCreate(String tenantId, String name, String toolSource) {
        return assetRepository.findByTenantIdAndName(tenantId, name)
                .orElseGet(() -> discover(tenantId, name, toolSource));
    }

    private Asset discover(String tenantId, String name, String toolSource) {
        List<String> tags = new ArrayList<>();
        if (toolSource != null) tags.add(toolSource);
        Asset asset = Asset.builder()
                .tenantId(tenantId)
                .name(name)
                .type("server")
                .critical(false)
                .tags(tags)
                .createdAt(clock.instant())
                .build();
        try {
            Asset saved = assetRepository.saveAndFlush(asset);
            log.info("Discovered new asset '{}' for tenant {} from {}", name, tenantId, toolSource);
            auditService.log("system", "ASSET_DISCOVERED", tenantId, null, name,
                    Map.of("asset_id", saved.getId(), "tool_source", String.valueOf(toolSource)));
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.debug("Asset '{}' for tenant {} created concurrently, re-reading", name, tenantId);
            return assetRepository.findByTenantIdAndName(tenantId, name).orElseThrow(() -> e);
        }
    }

    /** Whether any of the named assets is marked critical. */
    public boolean anyCritical(String tenantId, Collection<String> names) {
        if (names.isEmpty()) return false;
        return assetRepository.findByTenantIdAndNameIn(tenantId, names).stream().anyMatch(Asset::isCritical);
    }

    public List<Asset> list(String tenantId) {
        return assetRepository.findByTenantId(tenantId);
    }

    @Transactional
    public Asset setCritical(String tenantId, String assetId, boolean critical, String actor) {
        Asset asset = assetRepository.findById(assetId)
                .filter(a -> a.getTenantId().equals(tenantId))
                .orElseThrow(() -> new NotFoundException("Asset not found: " + assetId));
        asset.setCritical(critical);
        Asset saved = assetRepository.save(asset);
        auditService.log(actor, "CONFIG_CHANGED", tenantId, null, asset.getName(),
                Map.of("asset_id", assetId, "critical", critical));
        return saved;
    }
}
