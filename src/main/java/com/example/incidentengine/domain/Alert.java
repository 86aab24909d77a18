package com.example.incidentengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * One accepted alert delivery. The id is assigned before persisting so the
 * idempotency ledger can hand it out to duplicate deliveries immediately.
 */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alert_tenant_status_received", columnList = "tenant_id,status,received_at"),
        @Index(name = "idx_alert_tenant_delivery", columnList = "tenant_id,delivery_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    @Id
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "asset_id")
    private String assetId;

    @Column(name = "asset_name", nullable = false)
    private String assetName;

    @Column(nullable = false)
    private String signature;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    /** Severity as delivered, kept when an advisory override changed it. */
    @Enumerated(EnumType.STRING)
    @Column(name = "reported_severity")
    private Severity reportedSeverity;

    @Column(length = 4096)
    private String message;

    @Column(name = "tool_source", nullable = false)
    private String toolSource;

    @Column(name = "delivery_id", nullable = false)
    private String deliveryId;

    @Column(name = "delivery_attempts")
    @Builder.Default
    private int deliveryAttempts = 1;

    @Column(name = "priority_score")
    private double priorityScore;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private AlertStatus status = AlertStatus.ACTIVE;

    @Column(name = "incident_id")
    private String incidentId;

    public enum AlertStatus {
        ACTIVE, CORRELATED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
