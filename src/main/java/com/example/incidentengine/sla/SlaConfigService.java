package com.example.incidentengine.sla;

import com.example.incidentengine.config.EngineProperties;
import com.example.incidentengine.domain.Severity;
import com.example.incidentengine.domain.SlaConfig;
import com.example.incidentengine.exception.ValidationException;
import com.example.incidentengine.repository.SlaConfigRepository;
import com.example.incidentengine.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-tenant SLA targets. Tenants without stored targets use the configured defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlaConfigService {

    private final SlaConfigRepository repository;
    private final EngineProperties properties;
    private final AuditService auditService;
    private final Clock clock;

    public SlaConfig forTenant(String tenantId) {
        return repository.findById(tenantId).orElseGet(() -> defaults(tenantId));
    }

    /**
     * Apply a partial update. Severity maps are merged into the current targets;
     * the escalation chain is replaced when given.
     */
    @Transactional
    public SlaConfig update(String tenantId, SlaConfigUpdate update, String actor) {
        SlaConfig config = forTenant(tenantId);
        if (update.getEnabled() != null) {
            config.setEnabled(update.getEnabled());
        }
        if (update.getResponseMinutes() != null) {
            config.getResponseMinutes().putAll(parseMinutes("response_minutes", update.getResponseMinutes()));
        }
        if (update.getResolutionMinutes() != null) {
            config.getResolutionMinutes().putAll(parseMinutes("resolution_minutes", update.getResolutionMinutes()));
        }
        if (update.getWarningThresholdMinutes() != null) {
            if (update.getWarningThresholdMinutes() < 0) {
                throw new ValidationException("warning_threshold_minutes must not be negative");
            }
            config.setWarningThresholdMinutes(update.getWarningThresholdMinutes());
        }
        if (update.getEscalationChain() != null) {
            List<String> chain = new ArrayList<>();
            for (String target : update.getEscalationChain()) {
                if (target == null || target.isBlank()) {
                    throw new ValidationException("escalation_chain entries must not be blank");
                }
                chain.add(target.trim());
            }
            if (chain.isEmpty()) {
                throw new ValidationException("escalation_chain must name at least one target");
            }
            config.setEscalationChain(chain);
        }
        for (Severity severity : Severity.values()) {
            Integer response = config.getResponseMinutes().get(severity);
            Integer resolution = config.getResolutionMinutes().get(severity);
            if (response != null && resolution != null && resolution < response) {
                throw new ValidationException("resolution_minutes." + severity.value()
                        + " must not be shorter than response_minutes." + severity.value());
            }
        }
        config.setUpdatedAt(clock.instant());
        SlaConfig saved = repository.save(config);
        auditService.log(actor, "CONFIG_CHANGED", tenantId, null, "sla-config", toView(saved));
        log.info("SLA config for tenant {} updated (enabled: {})", tenantId, saved.isEnabled());
        return saved;
    }

    /** JSON view with lower-case severity keys. */
    public Map<String, Object> toView(SlaConfig config) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("company_id", config.getTenantId());
        view.put("enabled", config.isEnabled());
        view.put("response_minutes", byValue(config.getResponseMinutes()));
        view.put("resolution_minutes", byValue(config.getResolutionMinutes()));
        view.put("warning_threshold_minutes", config.getWarningThresholdMinutes());
        view.put("escalation_chain", List.copyOf(config.getEscalationChain()));
        view.put("updated_at", config.getUpdatedAt());
        return view;
    }

    private static Map<String, Integer> byValue(Map<Severity, Integer> minutes) {
        Map<String, Integer> view = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            if (minutes.containsKey(severity)) {
                view.put(severity.value(), minutes.get(severity));
            }
        }
        return view;
    }

    private static Map<Severity, Integer> parseMinutes(String field, Map<String, Integer> raw) {
        Map<Severity, Integer> parsed = new EnumMap<>(Severity.class);
        raw.forEach((key, minutes) -> {
            Severity severity = Severity.parse(key)
                    .orElseThrow(() -> new ValidationException("Unknown severity '" + key + "' in " + field));
            if (minutes == null || minutes <= 0) {
                throw new ValidationException(field + "." + severity.value() + " must be a positive number of minutes");
            }
            parsed.put(severity, minutes);
        });
        return parsed;
    }

    private SlaConfig defaults(String tenantId) {
        EngineProperties.SlaConfig defaults = properties.getSla();
        return SlaConfig.builder()
                .tenantId(tenantId)
                .enabled(defaults.isEnabled())
                .responseMinutes(parseMinutes("response_minutes", defaults.getResponseMinutes()))
                .resolutionMinutes(parseMinutes("resolution_minutes", defaults.getResolutionMinutes()))
                .warningThresholdMinutes(defaults.getWarningThresholdMinutes())
                .escalationChain(new ArrayList<>(defaults.getEscalationChain()))
                .build();
    }
}
