package com.example.ledger.repository;

import com.example.ledger.domain.CreditNoteStatus;
import com.example.ledger.domain.VendorCreditNote;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VendorCreditNoteRepository extends JpaRepository<VendorCreditNote, Long> {

    Optional<VendorCreditNote> findByIdAndOrgId(Long id, Long orgId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM VendorCreditNote c WHERE c.id = :id AND c.orgId = :orgId")
    Optional<VendorCreditNote> findByIdForUpdate(@Param("id") Long id, @Param("orgId") Long orgId);

    List<VendorCreditNote> findByOrgIdOrderByCreditDateDesc(Long orgId);

    List<VendorCreditNote> findByOrgIdAndStatusOrderByCreditDateDesc(Long orgId, CreditNoteStatus status);

    @Query("SELECT c.number FROM VendorCreditNote c WHERE c.orgId = :orgId AND c.number IS NOT NULL")
    List<String> findAllNumbersByOrgId(@Param("orgId") Long orgId);
}
