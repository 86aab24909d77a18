package com.example.incidentengine.service;

import com.example.incidentengine.domain.Tenant;
import com.example.incidentengine.exception.NotFoundException;
import com.example.incidentengine.exception.ValidationException;
import com.example.incidentengine.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tenant lookup and webhook signing settings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantService {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final TenantRepository tenantRepository;
    private final AuditService auditService;

    public Tenant require(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("company_id is required");
        }
        return tenantRepository.findById(tenantId)
                .orElseThrow(() -> new NotFoundException("Company not found: " + tenantId));
    }

    public Map<String, Object> webhookSecurity(String tenantId) {
        return describe(require(tenantId), false);
    }

    @Transactional
    public Map<String, Object> enableHmac(String tenantId, Long maxTimestampDiffSeconds, String actor) {
        Tenant tenant = require(tenantId);
        if (tenant.getHmacSecret() == null) {
            tenant.setHmacSecret(generateSecret());
        }
        if (maxTimestampDiffSeconds != null) {
            if (maxTimestampDiffSeconds < 30 || maxTimestampDiffSeconds > 3600) {
                throw new ValidationException("max_timestamp_diff_seconds must be between 30 and 3600");
            }
            tenant.setMaxTimestampDiffSeconds(maxTimestampDiffSeconds);
        }
        tenant.setHmacEnabled(true);
        tenantRepository.save(tenant);
        auditService.log(actor, "CONFIG_CHANGED", tenantId, null, "webhook-security",
                Map.of("hmac_enabled", true, "max_timestamp_diff_seconds", tenant.getMaxTimestampDiffSeconds()));
        log.info("HMAC verification enabled for tenant {}", tenantId);
        return describe(tenant, true);
    }

    @Transactional
    public Map<String, Object> disableHmac(String tenantId, String actor) {
        Tenant tenant = require(tenantId);
        tenant.setHmacEnabled(false);
        tenantRepository.save(tenant);
        auditService.log(actor, "CONFIG_CHANGED", tenantId, null, "webhook-security",
                Map.of("hmac_enabled", false));
        log.info("HMAC verification disabled for tenant {}", tenantId);
        return describe(tenant, false);
    }

    @Transactional
    public Map<String, Object> regenerateSecret(String tenantId, String actor) {
        Tenant tenant = require(tenantId);
        tenant.setHmacSecret(generateSecret());
        tenantRepository.save(tenant);
        auditService.log(actor, "CONFIG_CHANGED", tenantId, null, "webhook-security",
                Map.of("secret_regenerated", true));
        log.info("HMAC secret regenerated for tenant {}", tenantId);
        return describe(tenant, true);
    }

    private Map<String, Object> describe(Tenant tenant, boolean includeSecret) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("company_id", tenant.getId());
        view.put("enabled", tenant.isHmacEnabled());
        view.put("max_timestamp_diff_seconds", tenant.getMaxTimestampDiffSeconds());
        view.put("signature_header", "X-Signature");
        view.put("timestamp_header", "X-Timestamp");
        view.put("signature_format", "sha256=<hex(HMAC_SHA256(secret, timestamp + \".\" + body))>");
        if (includeSecret) {
            view.put("hmac_secret", tenant.getHmacSecret());
        }
        return view;
    }

    private static String generateSecret() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
