package com.example.incidentengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-tenant correlation settings and the time of the last completed pass.
 */
@Entity
@Table(name = "correlation_configs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationConfig {

    public static final int MIN_WINDOW_MINUTES = 5;
    public static final int MAX_WINDOW_MINUTES = 15;

    @Id
    @Column(name = "tenant_id")
    private String tenantId;

    @Column(name = "time_window_minutes", nullable = false)
    private int timeWindowMinutes;

    @Column(name = "aggregation_key", nullable = false)
    private String aggregationKey;

    @Column(name = "auto_correlate")
    private boolean autoCorrelate;

    @Column(name = "interval_seconds")
    private int intervalSeconds;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
