package com.example.incidentengine.repository;

import com.example.incidentengine.domain.NotificationOutbox;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NotificationOutboxRepository extends JpaRepository<NotificationOutbox, String> {

    List<NotificationOutbox> findByDeliveredAtIsNullOrderByCreatedAtAsc();

    List<NotificationOutbox> findByIncidentIdOrderByCreatedAtAsc(String incidentId);
}
