package com.example.ledger.repository;

import com.example.ledger.domain.Vendor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VendorRepository extends JpaRepository<Vendor, Long> {

    List<Vendor> findByOrgIdOrderByName(Long orgId);

    Optional<Vendor> findByIdAndOrgId(Long id, Long orgId);
}
