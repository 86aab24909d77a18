package com.example.incidentengine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A customer company whose monitoring tools deliver alerts. Holds the ingress
 * credential and the webhook signing settings.
 */
@Entity
@Table(name = "tenants", indexes = {
        @Index(name = "idx_tenant_api_key", columnList = "api_key", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tenant {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    @JsonIgnore
    @Column(name = "api_key", nullable = false, unique = true)
    private String apiKey;

    @Column(name = "hmac_enabled")
    @Builder.Default
    private boolean hmacEnabled = false;

    @JsonIgnore
    @Column(name = "hmac_secret")
    private String hmacSecret;

    @Column(name = "max_timestamp_diff_seconds")
    @Builder.Default
    private long maxTimestampDiffSeconds = 300;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
