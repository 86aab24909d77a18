package com.example.incidentengine.repository;

import com.example.incidentengine.domain.CorrelationConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface CorrelationConfigRepository extends JpaRepository<CorrelationConfig, String> {

    /** Touches only {@code last_run_at}, leaving settings written by a concurrent update intact. */
    @Modifying
    @Query("UPDATE CorrelationConfig c SET c.lastRunAt = :lastRunAt WHERE c.tenantId = :tenantId")
    int updateLastRunAt(String tenantId, Instant lastRunAt);
}
