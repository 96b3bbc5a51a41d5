package com.example.ledger.repository;

import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, Long>,
        JpaSpecificationExecutor<JournalEntry> {

    Optional<JournalEntry> findByIdAndOrgId(Long id, Long orgId);

    // Idempotency guard: one entry per business event
    Optional<JournalEntry> findFirstByOrgIdAndSourceAndSourceId(Long orgId, JournalSource source,
                                                                String sourceId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM JournalEntry e WHERE e.id = :id")
    Optional<JournalEntry> findByIdForUpdate(@Param("id") Long id);

    List<JournalEntry> findByOrgIdAndSourceAndStatusInAndEntryDateBetween(
            Long orgId, JournalSource source, Collection<JournalEntry.Status> statuses,
            LocalDate from, LocalDate to);

    // Lines and their accounts fetched in one query for exports
    @Query("SELECT DISTINCT e FROM JournalEntry e LEFT JOIN FETCH e.lines l LEFT JOIN FETCH l.account "
            + "WHERE e.orgId = :orgId AND e.entryDate BETWEEN :from AND :to ORDER BY e.entryDate, e.id")
    List<JournalEntry> findWithLinesBetween(@Param("orgId") Long orgId, @Param("from") LocalDate from,
                                            @Param("to") LocalDate to);
}
