package com.example.ledger.repository;

import com.example.ledger.domain.BankTxn;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface BankTxnRepository extends JpaRepository<BankTxn, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM BankTxn t WHERE t.id = :id AND t.orgId = :orgId")
    Optional<BankTxn> findByIdForUpdate(@Param("id") Long id, @Param("orgId") Long orgId);

    List<BankTxn> findByBankAccount_IdOrderByTxnDateAsc(Long bankAccountId);

    List<BankTxn> findByBankAccount_IdAndReconciledFalseOrderByTxnDateAsc(Long bankAccountId);

    // Duplicate detection on import: same account, date, amount and description
    boolean existsByBankAccount_IdAndTxnDateAndAmountAndDescription(Long bankAccountId,
                                                                    LocalDate txnDate,
                                                                    BigDecimal amount,
                                                                    String description);
}
