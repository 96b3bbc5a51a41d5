package com.example.ledger.repository;

import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface JournalLineRepository extends JpaRepository<JournalLine, Long> {

    boolean existsByAccount_Id(Long accountId);

    @Query("SELECT l.account.id AS accountId, COALESCE(SUM(l.debit), 0) AS debits, " +
           "COALESCE(SUM(l.credit), 0) AS credits FROM JournalLine l " +
           "WHERE l.entry.orgId = :orgId AND l.entry.status IN :statuses " +
           "AND l.entry.entryDate <= :asOf GROUP BY l.account.id")
    List<AccountTotals> sumByAccountAsOf(@Param("orgId") Long orgId,
                                         @Param("statuses") Collection<JournalEntry.Status> statuses,
                                         @Param("asOf") LocalDate asOf);

    @Query("SELECT l.account.id AS accountId, COALESCE(SUM(l.debit), 0) AS debits, " +
           "COALESCE(SUM(l.credit), 0) AS credits FROM JournalLine l " +
           "WHERE l.entry.orgId = :orgId AND l.entry.status IN :statuses " +
           "AND l.entry.entryDate <= :asOf AND l.branchId = :branchId GROUP BY l.account.id")
    List<AccountTotals> sumByAccountAsOfAndBranch(@Param("orgId") Long orgId,
                                                  @Param("statuses") Collection<JournalEntry.Status> statuses,
                                                  @Param("asOf") LocalDate asOf,
                                                  @Param("branchId") Long branchId);

    @Query("SELECT l.account.id AS accountId, COALESCE(SUM(l.debit), 0) AS debits, " +
           "COALESCE(SUM(l.credit), 0) AS credits FROM JournalLine l " +
           "WHERE l.entry.orgId = :orgId AND l.entry.status IN :statuses " +
           "AND l.entry.entryDate BETWEEN :from AND :to GROUP BY l.account.id")
    List<AccountTotals> sumByAccountBetween(@Param("orgId") Long orgId,
                                            @Param("statuses") Collection<JournalEntry.Status> statuses,
                                            @Param("from") LocalDate from,
                                            @Param("to") LocalDate to);

    @Query("SELECT l.account.id AS accountId, COALESCE(SUM(l.debit), 0) AS debits, " +
           "COALESCE(SUM(l.credit), 0) AS credits FROM JournalLine l " +
           "WHERE l.entry.orgId = :orgId AND l.entry.status IN :statuses " +
           "AND l.entry.entryDate BETWEEN :from AND :to AND l.branchId = :branchId " +
           "GROUP BY l.account.id")
    List<AccountTotals> sumByAccountBetweenAndBranch(@Param("orgId") Long orgId,
                                                     @Param("statuses") Collection<JournalEntry.Status> statuses,
                                                     @Param("from") LocalDate from,
                                                     @Param("to") LocalDate to,
                                                     @Param("branchId") Long branchId);
}
