package com.example.ledger.repository;

import com.example.ledger.domain.CreditNoteStatus;
import com.example.ledger.domain.CustomerCreditNote;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerCreditNoteRepository extends JpaRepository<CustomerCreditNote, Long> {

    Optional<CustomerCreditNote> findByIdAndOrgId(Long id, Long orgId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CustomerCreditNote c WHERE c.id = :id AND c.orgId = :orgId")
    Optional<CustomerCreditNote> findByIdForUpdate(@Param("id") Long id, @Param("orgId") Long orgId);

    List<CustomerCreditNote> findByOrgIdOrderByCreditDateDesc(Long orgId);

    List<CustomerCreditNote> findByOrgIdAndStatusOrderByCreditDateDesc(Long orgId, CreditNoteStatus status);

    @Query("SELECT c.number FROM CustomerCreditNote c WHERE c.orgId = :orgId AND c.number IS NOT NULL")
    List<String> findAllNumbersByOrgId(@Param("orgId") Long orgId);
}
