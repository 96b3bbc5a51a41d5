package com.example.ledger.service;

import com.example.ledger.domain.JournalSource;

import java.time.LocalDate;
import java.util.List;

/**
 * A system-generated posting for one business event. {@code (source, sourceId)} identifies the
 * event; posting the same pair twice yields the entry created the first time.
 */
public record PostingRequest(Long orgId, Long branchId, LocalDate date, String memo,
                             JournalSource source, String sourceId, List<JournalLineRequest> lines,
                             Long userId) {

    public PostingRequest {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }
}
