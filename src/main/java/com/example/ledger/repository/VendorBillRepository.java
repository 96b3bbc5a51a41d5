package com.example.ledger.repository;

import com.example.ledger.domain.VendorBill;
import com.example.ledger.domain.VendorBill.BillStatus;
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
public interface VendorBillRepository extends JpaRepository<VendorBill, Long> {

    Optional<VendorBill> findByIdAndOrgId(Long id, Long orgId);

    // Row lock so concurrent payments against one bill serialize
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM VendorBill b WHERE b.id = :id AND b.orgId = :orgId")
    Optional<VendorBill> findByIdForUpdate(@Param("id") Long id, @Param("orgId") Long orgId);

    List<VendorBill> findByOrgIdOrderByBillDateDesc(Long orgId);

    List<VendorBill> findByOrgIdAndStatusOrderByBillDateDesc(Long orgId, BillStatus status);

    List<VendorBill> findByOrgIdAndVendor_IdOrderByBillDateDesc(Long orgId, Long vendorId);

    List<VendorBill> findByOrgIdAndStatusInOrderByDueDateAsc(Long orgId,
                                                            Collection<BillStatus> statuses);

    @Query("SELECT b.number FROM VendorBill b WHERE b.orgId = :orgId AND b.number IS NOT NULL")
    List<String> findAllNumbersByOrgId(@Param("orgId") Long orgId);
}
