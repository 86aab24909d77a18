package com.example.incidentengine.repository;

import com.example.incidentengine.domain.ApprovalRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ApprovalRequestRepository extends JpaRepository<ApprovalRequest, String> {

    List<ApprovalRequest> findAllByOrderByCreatedAtDesc();

    List<ApprovalRequest> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    List<ApprovalRequest> findByStatusOrderByCreatedAtDesc(ApprovalRequest.ApprovalStatus status);

    List<ApprovalRequest> findByTenantIdAndStatusOrderByCreatedAtDesc(String tenantId,
                                                                      ApprovalRequest.ApprovalStatus status);

    List<ApprovalRequest> findByIncidentIdOrderByCreatedAtDesc(String incidentId);

    List<ApprovalRequest> findByStatusAndExpiresAtLessThanEqual(ApprovalRequest.ApprovalStatus status, Instant now);
}
