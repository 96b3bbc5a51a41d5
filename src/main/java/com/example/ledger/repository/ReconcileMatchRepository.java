package com.example.ledger.repository;

import com.example.ledger.domain.ReconcileMatch;
import com.example.ledger.domain.ReconcileMatch.MatchSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ReconcileMatchRepository extends JpaRepository<ReconcileMatch, Long> {

    Optional<ReconcileMatch> findByBankTxn_Id(Long bankTxnId);

    boolean existsByBankTxn_Id(Long bankTxnId);

    boolean existsByOrgIdAndSourceAndSourceId(Long orgId, MatchSource source, String sourceId);
}
