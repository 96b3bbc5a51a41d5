package com.example.ledger.repository;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

    List<Account> findByOrgIdOrderByCode(Long orgId);

    List<Account> findByOrgIdAndActiveTrueOrderByCode(Long orgId);

    List<Account> findByOrgIdAndTypeOrderByCode(Long orgId, AccountType type);

    List<Account> findByOrgIdAndTypeInOrderByCode(Long orgId, List<AccountType> types);

    Optional<Account> findByOrgIdAndCode(Long orgId, String code);

    Optional<Account> findByIdAndOrgId(Long id, Long orgId);

    boolean existsByOrgIdAndCode(Long orgId, String code);

    // Used by the payment-method fallback: first active account of a type whose name contains a hint
    Optional<Account> findFirstByOrgIdAndTypeAndActiveTrueAndNameContainingIgnoreCaseOrderByCode(
            Long orgId, AccountType type, String nameHint);
}
