package com.example.ledger.repository;

import com.example.ledger.domain.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerRepository extends JpaRepository<Customer, Long> {

    List<Customer> findByOrgIdOrderByName(Long orgId);

    Optional<Customer> findByIdAndOrgId(Long id, Long orgId);
}
