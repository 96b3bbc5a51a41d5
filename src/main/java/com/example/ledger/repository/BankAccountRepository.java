package com.example.ledger.repository;

import com.example.ledger.domain.BankAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BankAccountRepository extends JpaRepository<BankAccount, Long> {

    List<BankAccount> findByOrgIdOrderByName(Long orgId);

    Optional<BankAccount> findByIdAndOrgId(Long id, Long orgId);

    Optional<BankAccount> findByOrgIdAndName(Long orgId, String name);
}
