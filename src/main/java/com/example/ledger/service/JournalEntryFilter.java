package com.example.ledger.service;

import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Optional criteria for listing journal entries; null fields are ignored. */
public record JournalEntryFilter(LocalDate from, LocalDate to, JournalSource source,
                                 JournalEntry.Status status, Long branchId) {

    public static JournalEntryFilter none() {
        return new JournalEntryFilter(null, null, null, null, null);
    }

    Specification<JournalEntry> toSpecification(Long orgId) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("orgId"), orgId));
            if (from != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("entryDate"), from));
            }
            if (to != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("entryDate"), to));
            }
            if (source != null) {
                predicates.add(cb.equal(root.get("source"), source));
            }
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (branchId != null) {
                predicates.add(cb.equal(root.get("branchId"), branchId));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
