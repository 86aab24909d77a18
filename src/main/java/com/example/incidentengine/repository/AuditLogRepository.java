package com.example.incidentengine.repository;

import com.example.incidentengine.domain.AuditLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, String> {

    @Query("SELECT a FROM AuditLog a WHERE " +
           "(:tenantId IS NULL OR a.tenantId = :tenantId) AND " +
           "(:incidentId IS NULL OR a.incidentId = :incidentId) AND " +
           "(:action IS NULL OR a.action = :action) " +
           "ORDER BY a.timestamp DESC")
    List<AuditLog> findFiltered(String tenantId, String incidentId, String action, Pageable pageable);
}
