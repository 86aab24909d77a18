package com.example.incidentengine.repository;

import com.example.incidentengine.domain.Alert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AlertRepository extends JpaRepository<Alert, String> {

    List<Alert> findByTenantIdOrderByReceivedAtDesc(String tenantId);

    List<Alert> findByTenantIdAndStatusOrderByReceivedAtDesc(String tenantId, Alert.AlertStatus status);

    @Query("SELECT a FROM Alert a WHERE a.tenantId = :tenantId AND a.status = :status " +
           "AND a.receivedAt >= :from AND a.receivedAt <= :to ORDER BY a.receivedAt ASC, a.id ASC")
    List<Alert> findWindow(String tenantId, Alert.AlertStatus status, Instant from, Instant to);

    Optional<Alert> findFirstByTenantIdAndDeliveryIdAndReceivedAtGreaterThanEqualOrderByReceivedAtDesc(
            String tenantId, String deliveryId, Instant since);

    List<Alert> findByIncidentIdOrderByReceivedAtAsc(String incidentId);

    long countByTenantIdAndStatus(String tenantId, Alert.AlertStatus status);

    @Transactional
    @Modifying
    @Query("UPDATE Alert a SET a.deliveryAttempts = a.deliveryAttempts + 1 WHERE a.id = :id")
    int incrementDeliveryAttempts(String id);
}
