package com.example.incidentengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A notification written in the same transaction as the state change that caused it.
 * Undelivered entries are retried on every escalation tick.
 */
@Entity
@Table(name = "notification_outbox", indexes = {
        @Index(name = "idx_outbox_delivered", columnList = "delivered_at,created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationOutbox {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "tenant_id")
    private String tenantId;

    @Column(name = "incident_id")
    private String incidentId;

    /** ESCALATION or SLA_WARNING */
    @Column(nullable = false)
    private String kind;

    /** "slack:...", "email:address" or a role name for in-app delivery */
    @Column(nullable = false)
    private String target;

    @Column(nullable = false)
    private String subject;

    @Column(length = 4096)
    private String body;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Builder.Default
    private int attempts = 0;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "last_error", length = 1024)
    private String lastError;
}
