package com.example.ledger.repository;

import com.example.ledger.domain.VendorCreditRefund;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface VendorCreditRefundRepository extends JpaRepository<VendorCreditRefund, Long> {

    List<VendorCreditRefund> findByCreditNote_IdOrderByRefundDateAsc(Long creditNoteId);

    boolean existsByCreditNote_Id(Long creditNoteId);

    List<VendorCreditRefund> findByCreditNote_OrgIdAndRefundDateBetween(Long orgId, LocalDate from,
                                                                       LocalDate to);
}
