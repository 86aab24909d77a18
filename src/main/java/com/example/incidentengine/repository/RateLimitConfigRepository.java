package com.example.incidentengine.repository;

import com.example.incidentengine.domain.RateLimitConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RateLimitConfigRepository extends JpaRepository<RateLimitConfig, String> {
}
