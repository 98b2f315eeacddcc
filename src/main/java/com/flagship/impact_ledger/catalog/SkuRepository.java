package com.flagship.impact_ledger.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SkuRepository extends JpaRepository<SkuEntity, UUID> {

    Optional<SkuEntity> findByCodeAndActiveTrue(String code);

    boolean existsByCode(String code);

    List<SkuEntity> findByActiveTrueOrderByCodeAsc();
}
