package com.example.incidentengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable audit trail entry. Records every state transition made by the
 * ingress gate, the schedulers and the people working incidents.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_tenant", columnList = "tenant_id"),
        @Index(name = "idx_audit_incident", columnList = "incident_id"),
        @Index(name = "idx_audit_action", columnList = "action"),
        @Index(name = "idx_audit_timestamp", columnList = "timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** Who performed the action: a user id, "system" or "escalation-scheduler" */
    @Column(nullable = false)
    private String actor;

    /** What happened: ALERT_ACCEPTED, INCIDENT_CREATED, ESCALATION, APPROVAL_GRANTED, ... */
    @Column(nullable = false)
    private String action;

    @Column(name = "tenant_id")
    private String tenantId;

    @Column(name = "incident_id")
    private String incidentId;

    /** The target of the action (alert id, approval id, asset name, config name) */
    private String target;

    /** JSON details about the action */
    @Column(length = 8192)
    private String details;

    @Builder.Default
    private boolean success = true;

    @Column(nullable = false)
    private Instant timestamp;
}
