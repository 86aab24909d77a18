package com.example.incidentengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-tenant SLA targets and escalation chain.
 */
@Entity
@Table(name = "sla_configs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaConfig {

    @Id
    @Column(name = "tenant_id")
    private String tenantId;

    @Builder.Default
    private boolean enabled = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sla_response_minutes", joinColumns = @JoinColumn(name = "tenant_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "severity")
    @Column(name = "minutes")
    @Builder.Default
    private Map<Severity, Integer> responseMinutes = new EnumMap<>(Severity.class);

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sla_resolution_minutes", joinColumns = @JoinColumn(name = "tenant_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "severity")
    @Column(name = "minutes")
    @Builder.Default
    private Map<Severity, Integer> resolutionMinutes = new EnumMap<>(Severity.class);

    @Column(name = "warning_threshold_minutes")
    private int warningThresholdMinutes;

    /** Notify targets by escalation level: index 0 is level 1. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sla_escalation_chain", joinColumns = @JoinColumn(name = "tenant_id"))
    @Column(name = "target")
    @OrderColumn(name = "level_index")
    @Builder.Default
    private List<String> escalationChain = new ArrayList<>();

    @Column(name = "updated_at")
    private Instant updatedAt;

    /** Target notified when an incident reaches the given level; the last entry covers deeper levels. */
    public String targetForLevel(int level) {
        if (escalationChain == null || escalationChain.isEmpty()) return null;
        int index = Math.min(Math.max(level, 1), escalationChain.size()) - 1;
        return escalationChain.get(index);
    }
}
