package com.tbmerch.backoffice.domain;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SupplierRepository extends JpaRepository<Supplier, UUID> {

    List<Supplier> findByActiveTrue();

    Optional<Supplier> findFirstByTypeAndActiveTrueOrderByCreatedAtAsc(SupplierType type);

    long countByActiveTrue();
}
