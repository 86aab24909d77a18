package com.example.incidentengine.repository;

import com.example.incidentengine.domain.Incident;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface IncidentRepository extends JpaRepository<Incident, String> {

    List<Incident> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    List<Incident> findByTenantIdAndStatusOrderByCreatedAtDesc(String tenantId, Incident.IncidentStatus status);

    List<Incident> findByStatusOrderByCreatedAtDesc(Incident.IncidentStatus status);

    Optional<Incident> findFirstByTenantIdAndAggregationKeyAndStatusNotOrderByCreatedAtDesc(
            String tenantId, String aggregationKey, Incident.IncidentStatus status);

    @Query("SELECT DISTINCT i.tenantId FROM Incident i WHERE i.status <> :terminal")
    List<String> findTenantsWithIncidentsNotIn(Incident.IncidentStatus terminal);

    @Query("SELECT i.id FROM Incident i WHERE i.tenantId = :tenantId AND i.status <> :terminal " +
           "ORDER BY i.createdAt ASC")
    List<String> findIncidentIdsNotIn(String tenantId, Incident.IncidentStatus terminal);

    @Query("SELECT i FROM Incident i WHERE i.tenantId = :tenantId AND i.createdAt >= :since " +
           "ORDER BY i.createdAt DESC")
    List<Incident> findCreatedSince(String tenantId, Instant since);
}
