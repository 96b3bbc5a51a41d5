package com.example.ledger.repository;

import com.example.ledger.domain.CustomerInvoice;
import com.example.ledger.domain.CustomerInvoice.InvoiceStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerInvoiceRepository extends JpaRepository<CustomerInvoice, Long> {

    Optional<CustomerInvoice> findByIdAndOrgId(Long id, Long orgId);

    // Row lock so concurrent receipts against one invoice serialize
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM CustomerInvoice i WHERE i.id = :id AND i.orgId = :orgId")
    Optional<CustomerInvoice> findByIdForUpdate(@Param("id") Long id, @Param("orgId") Long orgId);

    List<CustomerInvoice> findByOrgIdOrderByInvoiceDateDesc(Long orgId);

    List<CustomerInvoice> findByOrgIdAndStatusOrderByInvoiceDateDesc(Long orgId, InvoiceStatus status);

    List<CustomerInvoice> findByOrgIdAndCustomer_IdOrderByInvoiceDateDesc(Long orgId, Long customerId);

    List<CustomerInvoice> findByOrgIdAndStatusInOrderByDueDateAsc(Long orgId,
                                                            Collection<InvoiceStatus> statuses);

    @Query("SELECT i.number FROM CustomerInvoice i WHERE i.orgId = :orgId AND i.number IS NOT NULL")
    List<String> findAllNumbersByOrgId(@Param("orgId") Long orgId);
}
