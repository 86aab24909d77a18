package com.example.incidentengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-tenant ingress rate limit.
 */
@Entity
@Table(name = "rate_limit_configs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitConfig {

    @Id
    @Column(name = "tenant_id")
    private String tenantId;

    @Column(name = "requests_per_minute", nullable = false)
    private int requestsPerMinute;

    @Column(name = "burst_size", nullable = false)
    private int burstSize;

    @Builder.Default
    private boolean enabled = true;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
