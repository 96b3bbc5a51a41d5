package com.example.ledger.repository;

import com.example.ledger.domain.CustomerCreditAllocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerCreditAllocationRepository extends JpaRepository<CustomerCreditAllocation, Long> {

    Optional<CustomerCreditAllocation> findByIdAndCreditNote_Id(Long id, Long creditNoteId);

    List<CustomerCreditAllocation> findByCreditNote_IdOrderByAppliedAtAsc(Long creditNoteId);

    List<CustomerCreditAllocation> findByInvoice_Id(Long invoiceId);

    boolean existsByCreditNote_Id(Long creditNoteId);
}
