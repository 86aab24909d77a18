package com.example.incidentengine.correlation;

import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.domain.CorrelationConfig;
import com.example.incidentengine.domain.Incident;
import com.example.incidentengine.domain.Severity;
import com.example.incidentengine.exception.ConflictException;
import com.example.incidentengine.gateway.GatewayWebSocketHandler;
import com.example.incidentengine.repository.AlertRepository;
import com.example.incidentengine.repository.IncidentRepository;
import com.example.incidentengine.scoring.PriorityScorer;
import com.example.incidentengine.service.AssetService;
import com.example.incidentengine.service.AuditService;
import com.example.incidentengine.service.TenantService;
import com.example.incidentengine.sla.SlaTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Correlation Engine - folds active alerts into incidents.
 * <p>
 * A pass selects the tenant's active alerts received within the configured window looking
 * back from the pass's start, groups them by aggregation key and either appends each group
 * to the open incident with that key or opens a new one. Alerts older than the window stay
 * active. Passes for one tenant are serialized by a per-tenant lock held until the pass's
 * transaction has committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrelationEngine {

    private final AlertRepository alertRepository;
    private final IncidentRepository incidentRepository;
    private final CorrelationConfigService configService;
    private final TenantService tenantService;
    private final AssetService assetService;
    private final PriorityScorer priorityScorer;
    private final SlaTracker slaTracker;
    private final AuditService auditService;
    private final GatewayWebSocketHandler gatewayHandler;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, ReentrantLock> tenantLocks = new ConcurrentHashMap<>();

    /**
     * Run one pass for the tenant.
     *
     * @throws ConflictException when a pass for the same tenant is already running
     */
    public CorrelationResult correlate(String tenantId) {
        tenantService.require(tenantId);
        ReentrantLock lock = tenantLocks.computeIfAbsent(tenantId, k -> new ReentrantLock());
        if (!lock.tryLock()) {
            throw new ConflictException("Correlation already running for company " + tenantId);
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            CorrelationResult result = transactionTemplate.execute(status -> runPass(tenantId));
            publish(result);
            return result;
        } finally {
            lock.unlock();
            sample.stop(Timer.builder("correlation.run.duration")
                    .tag("tenant", tenantId)
                    .register(meterRegistry));
        }
    }

    private CorrelationResult runPass(String tenantId) {
        CorrelationConfig config = configService.forTenant(tenantId);
        AggregationKeys keys = AggregationKeys.parse(config.getAggregationKey());
        Instant now = clock.instant();
        Instant windowStart = now.minus(Duration.ofMinutes(config.getTimeWindowMinutes()));

        List<Alert> alerts = alertRepository.findWindow(tenantId, Alert.AlertStatus.ACTIVE, windowStart, now);
        Map<String, List<Alert>> groups = alerts.stream()
                .collect(Collectors.groupingBy(keys::keyFor, LinkedHashMap::new, Collectors.toList()));

        List<String> created = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        for (Map.Entry<String, List<Alert>> group : groups.entrySet()) {
            Optional<Incident> existing = incidentRepository
                    .findFirstByTenantIdAndAggregationKeyAndStatusNotOrderByCreatedAtDesc(
                            tenantId, group.getKey(), Incident.IncidentStatus.RESOLVED);
            if (existing.isPresent()) {
                if (appendTo(existing.get(), group.getValue(), now)) {
                    updated.add(existing.get().getId());
                }
            } else {
                created.add(open(tenantId, group.getKey(), group.getValue(), now).getId());
            }
        }

        configService.markRun(tenantId);

        int alertsBefore = alerts.size();
        int alertsAfter = groups.size();
        CorrelationResult result = new CorrelationResult(tenantId, alertsBefore, alertsAfter,
                created.size(), updated.size(), alertsBefore - created.size(),
                CorrelationResult.noiseReduction(alertsBefore, alertsAfter), created, updated);
        if (alertsBefore > 0) {
            log.info("Correlated {} alerts for tenant {} into {} incidents ({} new, {} updated, {}% noise reduction)",
                    alertsBefore, tenantId, alertsAfter, created.size(), updated.size(), result.noiseReductionPct());
        }
        return result;
    }

    /** True when the open incident changed. */
    private boolean appendTo(Incident incident, List<Alert> group, Instant now) {
        Set<String> known = new LinkedHashSet<>(incident.getAlertIds());
        List<Alert> fresh = group.stream().filter(a -> !known.contains(a.getId())).toList();
        if (fresh.isEmpty()) {
            markCorrelated(group, incident.getId());
            return false;
        }
        for (Alert alert : fresh) {
            incident.getAlertIds().add(alert.getId());
            incident.getToolSources().add(alert.getToolSource());
            incident.setSeverity(Severity.max(incident.getSeverity(), alert.getSeverity()));
        }
        if (!incident.isCriticalAsset()) {
            incident.setCriticalAsset(assetService.anyCritical(incident.getTenantId(), assetNames(fresh)));
        }
        incident.setUpdatedAt(now);
        incident.setPriorityScore(priorityScorer.score(incident, now));
        Incident saved = incidentRepository.save(incident);
        markCorrelated(fresh, saved.getId());

        auditService.log("correlation-engine", "INCIDENT_UPDATED", saved.getTenantId(), saved.getId(),
                saved.getAggregationKey(), Map.of(
                        "added_alerts", fresh.size(),
                        "alert_count", saved.getAlertCount(),
                        "severity", saved.getSeverity().value(),
                        "priority_score", saved.getPriorityScore()));
        return true;
    }

    private Incident open(String tenantId, String aggregationKey, List<Alert> group, Instant now) {
        Alert first = group.get(0);
        Severity severity = group.stream().map(Alert::getSeverity).reduce(Severity::max).orElse(first.getSeverity());
        Set<String> toolSources = group.stream().map(Alert::getToolSource)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Incident incident = Incident.builder()
                .tenantId(tenantId)
                .aggregationKey(aggregationKey)
                .assetName(first.getAssetName())
                .signature(first.getSignature())
                .category(IncidentCategories.classify(first.getSignature(), first.getAssetName()))
                .alertIds(group.stream().map(Alert::getId).collect(Collectors.toCollection(ArrayList::new)))
                .toolSources(toolSources)
                .severity(severity)
                .criticalAsset(assetService.anyCritical(tenantId, assetNames(group)))
                .status(Incident.IncidentStatus.NEW)
                .createdAt(now)
                .updatedAt(now)
                .sla(slaTracker.computeDeadlines(tenantId, severity, now))
                .build();
        incident.setPriorityScore(priorityScorer.score(incident, now));
        Incident saved = incidentRepository.save(incident);
        markCorrelated(group, saved.getId());

        Counter.builder("correlation.incidents.created")
                .tag("severity", severity.value())
                .register(meterRegistry)
                .increment();
        auditService.log("correlation-engine", "INCIDENT_CREATED", tenantId, saved.getId(), aggregationKey, Map.of(
                "alert_count", saved.getAlertCount(),
                "severity", severity.value(),
                "category", saved.getCategory(),
                "priority_score", saved.getPriorityScore()));
        log.info("Opened incident {} for tenant {}: {} ({} alerts, severity {}, score {})", saved.getId(),
                tenantId, aggregationKey, saved.getAlertCount(), severity.value(), saved.getPriorityScore());
        return saved;
    }

    private void markCorrelated(List<Alert> alerts, String incidentId) {
        for (Alert alert : alerts) {
            alert.setStatus(Alert.AlertStatus.CORRELATED);
            alert.setIncidentId(incidentId);
        }
        alertRepository.saveAll(alerts);
    }

    private static Set<String> assetNames(List<Alert> alerts) {
        return alerts.stream().map(Alert::getAssetName).collect(Collectors.toSet());
    }

    private void publish(CorrelationResult result) {
        if (result.incidentsCreated() == 0 && result.incidentsUpdated() == 0) return;
        result.createdIncidentIds().forEach(id -> incidentRepository.findById(id)
                .ifPresent(incident -> gatewayHandler.broadcast("incident.created", incident)));
        result.updatedIncidentIds().forEach(id -> incidentRepository.findById(id)
                .ifPresent(incident -> gatewayHandler.broadcast("incident.updated", incident)));
        gatewayHandler.broadcast("correlation.completed", result);
    }
}
