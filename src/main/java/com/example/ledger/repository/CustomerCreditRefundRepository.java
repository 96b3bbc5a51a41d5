package com.example.ledger.repository;

import com.example.ledger.domain.CustomerCreditRefund;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface CustomerCreditRefundRepository extends JpaRepository<CustomerCreditRefund, Long> {

    List<CustomerCreditRefund> findByCreditNote_IdOrderByRefundDateAsc(Long creditNoteId);

    boolean existsByCreditNote_Id(Long creditNoteId);

    List<CustomerCreditRefund> findByCreditNote_OrgIdAndRefundDateBetween(Long orgId, LocalDate from,
                                                                       LocalDate to);
}
