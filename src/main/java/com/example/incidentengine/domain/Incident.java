package com.example.incidentengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * An aggregation of alerts sharing an aggregation key. Terminal at RESOLVED;
 * a later alert with the same key starts a new incident.
 */
@Entity
@Table(name = "incidents", indexes = {
        @Index(name = "idx_incident_tenant_key_status", columnList = "tenant_id,aggregation_key,status"),
        @Index(name = "idx_incident_tenant_created", columnList = "tenant_id,created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** Optimistic lock shared by the correlation pass, the escalation tick and API updates. */
    @Version
    private Long version;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "aggregation_key", nullable = false)
    private String aggregationKey;

    @Column(name = "asset_name")
    private String assetName;

    private String signature;

    private String category;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_alerts", joinColumns = @JoinColumn(name = "incident_id"))
    @Column(name = "alert_id")
    @OrderColumn(name = "alert_order")
    @Builder.Default
    private List<String> alertIds = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_tool_sources", joinColumns = @JoinColumn(name = "incident_id"))
    @Column(name = "tool_source")
    @Builder.Default
    private Set<String> toolSources = new LinkedHashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @Column(name = "critical_asset")
    private boolean criticalAsset;

    @Column(name = "priority_score")
    private double priorityScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private IncidentStatus status = IncidentStatus.NEW;

    private String assignee;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "resolution_notes", length = 4096)
    private String resolutionNotes;

    @Column(name = "mttr_minutes")
    private Long mttrMinutes;

    @Embedded
    @Builder.Default
    private SlaTracking sla = SlaTracking.disabled();

    private boolean escalated;

    @Column(name = "escalation_level")
    @Builder.Default
    private int escalationLevel = 0;

    @Column(name = "escalation_reason")
    private String escalationReason;

    @Column(name = "escalated_at")
    private Instant escalatedAt;

    @Column(name = "last_escalated_at")
    private Instant lastEscalatedAt;

    @Column(name = "remediation_status")
    private String remediationStatus;

    @Column(name = "last_execution_id")
    private String lastExecutionId;

    public int getAlertCount() {
        return alertIds == null ? 0 : alertIds.size();
    }

    public boolean isResolved() {
        return status == IncidentStatus.RESOLVED;
    }

    public enum IncidentStatus {
        NEW, ASSIGNED, IN_PROGRESS, RESOLVED, ESCALATED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static IncidentStatus fromValue(String value) {
            for (IncidentStatus status : values()) {
                if (status.name().equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown incident status: " + value);
        }
    }
}
