package com.example.ledger.repository;

import com.example.ledger.domain.FiscalPeriod;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface FiscalPeriodRepository extends JpaRepository<FiscalPeriod, Long> {

    List<FiscalPeriod> findByOrgIdOrderByStartsAt(Long orgId);

    List<FiscalPeriod> findByOrgIdAndStatusOrderByStartsAt(Long orgId, FiscalPeriod.Status status);

    Optional<FiscalPeriod> findByIdAndOrgId(Long id, Long orgId);

    @Query("SELECT p FROM FiscalPeriod p WHERE p.orgId = :orgId " +
           "AND :date BETWEEN p.startsAt AND p.endsAt")
    Optional<FiscalPeriod> findByOrgIdAndDate(@Param("orgId") Long orgId,
                                              @Param("date") LocalDate date);

    /**
     * Periods overlapping the given inclusive range: start <= rangeEnd AND end >= rangeStart.
     */
    @Query("SELECT p FROM FiscalPeriod p WHERE p.orgId = :orgId " +
           "AND p.startsAt <= :endsAt AND p.endsAt >= :startsAt ORDER BY p.startsAt")
    List<FiscalPeriod> findOverlapping(@Param("orgId") Long orgId,
                                       @Param("startsAt") LocalDate startsAt,
                                       @Param("endsAt") LocalDate endsAt);
}
