package com.example.incidentengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A host or service alerts are raised against. Discovered on first alert;
 * criticality feeds the priority score.
 */
@Entity
@Table(name = "assets", uniqueConstraints = {
        @UniqueConstraint(name = "uk_asset_tenant_name", columnNames = {"tenant_id", "name"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Asset {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Builder.Default
    private String type = "server";

    @Builder.Default
    private boolean critical = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "asset_tags", joinColumns = @JoinColumn(name = "asset_id"))
    @Column(name = "tag")
    @OrderColumn(name = "tag_order")
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
