package com.example.incidentengine.service;

import com.example.incidentengine.domain.AuditLog;
import com.example.incidentengine.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Central audit trail. Writes run in the caller's transaction, so a transition
 * whose audit entry cannot be stored is rolled back with it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditLog log(String actor, String action, String tenantId, String incidentId,
                        String target, Map<String, Object> details) {
        return log(actor, action, tenantId, incidentId, target, details, true);
    }

    public AuditLog log(String actor, String action, String tenantId, String incidentId,
                        String target, Map<String, Object> details, boolean success) {
        String detailsJson;
        try {
            detailsJson = details != null ? objectMapper.writeValueAsString(details) : null;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit details for " + action + " are not serializable", e);
        }
        AuditLog entry = AuditLog.builder()
                .actor(actor != null ? actor : "unknown")
                .action(action)
                .tenantId(tenantId)
                .incidentId(incidentId)
                .target(target)
                .details(detailsJson)
                .success(success)
                .timestamp(clock.instant())
                .build();
        AuditLog saved = auditLogRepository.save(entry);
        log.debug("Audit: [{}] {} -> {} ({})", actor, action, target, success ? "OK" : "FAIL");
        return saved;
    }

    /** Filter audit entries, newest first. Null filters match everything. */
    public List<AuditLog> filter(String tenantId, String incidentId, String action, int limit) {
        int pageSize = Math.max(1, Math.min(limit, 1000));
        return auditLogRepository.findFiltered(tenantId, incidentId, action, PageRequest.of(0, pageSize));
    }
}
