package com.example.ledger.service;

import com.example.ledger.domain.ReconcileMatch.MatchSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Supplies the internal records a bank statement row may be matched against. Amounts are signed
 * from the bank's point of view: money in positive, money out negative.
 */
public interface ReconcileCandidateProvider {

    record Candidate(MatchSource source, String sourceId, LocalDate date, BigDecimal amount) {
    }

    /**
     * Completed payments and refunds dated within the range, inclusive, in date order.
     */
    List<Candidate> findCandidates(Long orgId, LocalDate from, LocalDate to);
}
