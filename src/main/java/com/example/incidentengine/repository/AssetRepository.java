package com.example.incidentengine.repository;

import com.example.incidentengine.domain.Asset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AssetRepository extends JpaRepository<Asset, String> {

    Optional<Asset> findByTenantIdAndName(String tenantId, String name);

    List<Asset> findByTenantIdAndNameIn(String tenantId, Collection<String> names);

    List<Asset> findByTenantId(String tenantId);
}
