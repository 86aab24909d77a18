package com.example.incidentengine.repository;

import com.example.incidentengine.domain.SlaConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SlaConfigRepository extends JpaRepository<SlaConfig, String> {
}
