package com.example.ledger.repository;

import com.example.ledger.domain.VendorCreditAllocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VendorCreditAllocationRepository extends JpaRepository<VendorCreditAllocation, Long> {

    Optional<VendorCreditAllocation> findByIdAndCreditNote_Id(Long id, Long creditNoteId);

    List<VendorCreditAllocation> findByCreditNote_IdOrderByAppliedAtAsc(Long creditNoteId);

    List<VendorCreditAllocation> findByBill_Id(Long billId);

    boolean existsByCreditNote_Id(Long creditNoteId);
}
