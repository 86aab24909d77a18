package com.example.incidentengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * A medium or high risk remediation action waiting for human sign-off.
 */
@Entity
@Table(name = "approval_requests", indexes = {
        @Index(name = "idx_approval_status_expires", columnList = "status,expires_at"),
        @Index(name = "idx_approval_tenant", columnList = "tenant_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Version
    private Long version;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "incident_id", nullable = false)
    private String incidentId;

    @Column(nullable = false)
    private String action;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false)
    private RiskLevel riskLevel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private ApprovalStatus status = ApprovalStatus.PENDING;

    @Column(name = "requested_by")
    private String requestedBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "responded_at")
    private Instant respondedAt;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(length = 1024)
    private String notes;

    @Column(name = "execution_id")
    private String executionId;

    public boolean isExpiredAt(Instant now) {
        return status == ApprovalStatus.PENDING && !now.isBefore(expiresAt);
    }

    public enum ApprovalStatus {
        PENDING, APPROVED, REJECTED, EXPIRED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
