package com.example.ledger.repository;

import com.example.ledger.domain.CustomerReceipt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerReceiptRepository extends JpaRepository<CustomerReceipt, Long> {

    Optional<CustomerReceipt> findByIdAndOrgId(Long id, Long orgId);

    List<CustomerReceipt> findByOrgIdOrderByReceivedAtDesc(Long orgId);

    List<CustomerReceipt> findByInvoice_IdOrderByReceivedAtAsc(Long invoiceId);

    List<CustomerReceipt> findByOrgIdAndReceivedAtBetween(Long orgId, LocalDate from, LocalDate to);
}
