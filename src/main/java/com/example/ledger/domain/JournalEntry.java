package com.example.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A balanced set of debit/credit lines recording one financial event.
 * Lifecycle: DRAFT → POSTED → REVERSED.
 * Posted entries are never edited or deleted; a reversal is a new entry with every line's sides
 * swapped, linked through {@code reversesEntryId} and the back-reference {@code reversedByEntryId}.
 */
@Entity
@Table(name = "journal_entry",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_journal_entry_source",
            columnNames = {"org_id", "source", "source_id"})
    },
    indexes = {
        @Index(name = "idx_journal_entry_org_date", columnList = "org_id, entry_date"),
        @Index(name = "idx_journal_entry_reverses", columnList = "reverses_entry_id")
    })
public class JournalEntry {

    public enum Status {
        DRAFT,     // Manual entry, not yet affecting reports
        POSTED,    // Part of the ledger, append-only
        REVERSED   // Offset by a reversal entry, still part of the ledger
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @Column(name = "branch_id")
    private Long branchId;

    @NotNull
    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Size(max = 500)
    @Column(length = 500)
    private String memo;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private JournalSource source = JournalSource.MANUAL;

    @Size(max = 64)
    @Column(name = "source_id", length = 64)
    private String sourceId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Status status = Status.DRAFT;

    @Column(name = "created_by_id")
    private Long createdById;

    @Column(name = "posted_by_id")
    private Long postedById;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "reverses_entry_id")
    private Long reversesEntryId;

    @Column(name = "reversed_by_entry_id")
    private Long reversedByEntryId;

    @Column(name = "reversed_by_id")
    private Long reversedById;

    @Column(name = "reversed_at")
    private Instant reversedAt;

    @OneToMany(mappedBy = "entry", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineIndex ASC")
    private List<JournalLine> lines = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    // Constructors
    public JournalEntry() {
    }

    public JournalEntry(Long orgId, LocalDate entryDate, String memo, JournalSource source,
                        String sourceId) {
        this.orgId = orgId;
        this.entryDate = entryDate;
        this.memo = memo;
        this.source = source;
        this.sourceId = sourceId;
    }

    // Helper methods
    public void addLine(JournalLine line) {
        lines.add(line);
        line.setEntry(this);
        line.setLineIndex(lines.size());
    }

    public BigDecimal getTotalDebits() {
        BigDecimal total = BigDecimal.ZERO;
        for (JournalLine line : lines) {
            total = total.add(line.getDebit());
        }
        return total;
    }

    public BigDecimal getTotalCredits() {
        BigDecimal total = BigDecimal.ZERO;
        for (JournalLine line : lines) {
            total = total.add(line.getCredit());
        }
        return total;
    }

    public boolean isBalanced() {
        return Amounts.isBalanced(getTotalDebits(), getTotalCredits());
    }

    public boolean isDraft() {
        return status == Status.DRAFT;
    }

    public boolean isPosted() {
        return status == Status.POSTED;
    }

    public boolean isReversed() {
        return status == Status.REVERSED;
    }

    public void markPosted(Long userId) {
        this.status = Status.POSTED;
        this.postedById = userId;
        this.postedAt = Instant.now();
    }

    public void markReversed(Long userId, Long reversalEntryId) {
        this.status = Status.REVERSED;
        this.reversedById = userId;
        this.reversedAt = Instant.now();
        this.reversedByEntryId = reversalEntryId;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getOrgId() {
        return orgId;
    }

    public void setOrgId(Long orgId) {
        this.orgId = orgId;
    }

    public Long getBranchId() {
        return branchId;
    }

    public void setBranchId(Long branchId) {
        this.branchId = branchId;
    }

    public LocalDate getEntryDate() {
        return entryDate;
    }

    public void setEntryDate(LocalDate entryDate) {
        this.entryDate = entryDate;
    }

    public String getMemo() {
        return memo;
    }

    public void setMemo(String memo) {
        this.memo = memo;
    }

    public JournalSource getSource() {
        return source;
    }

    public void setSource(JournalSource source) {
        this.source = source;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public Long getCreatedById() {
        return createdById;
    }

    public void setCreatedById(Long createdById) {
        this.createdById = createdById;
    }

    public Long getPostedById() {
        return postedById;
    }

    public Instant getPostedAt() {
        return postedAt;
    }

    public Long getReversesEntryId() {
        return reversesEntryId;
    }

    public void setReversesEntryId(Long reversesEntryId) {
        this.reversesEntryId = reversesEntryId;
    }

    public Long getReversedByEntryId() {
        return reversedByEntryId;
    }

    public Long getReversedById() {
        return reversedById;
    }

    public Instant getReversedAt() {
        return reversedAt;
    }

    public List<JournalLine> getLines() {
        return lines;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
