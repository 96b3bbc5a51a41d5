package com.example.ledger.repository;

import com.example.ledger.domain.VendorPayment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface VendorPaymentRepository extends JpaRepository<VendorPayment, Long> {

    Optional<VendorPayment> findByIdAndOrgId(Long id, Long orgId);

    List<VendorPayment> findByOrgIdOrderByPaidAtDesc(Long orgId);

    List<VendorPayment> findByBill_IdOrderByPaidAtAsc(Long billId);

    List<VendorPayment> findByOrgIdAndPaidAtBetween(Long orgId, LocalDate from, LocalDate to);
}
