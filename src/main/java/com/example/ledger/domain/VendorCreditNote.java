package com.example.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Credit received from a vendor. Opening posts Dr AP / Cr Expense; the credit is then used by
 * allocating it against bills or by taking it back as a cash refund.
 * Invariant: {@code allocatedAmount + refundedAmount <= amount}.
 */
@Entity
@Table(name = "vendor_credit_note")
public class VendorCreditNote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "vendor_id", nullable = false)
    private Vendor vendor;

    @Size(max = 50)
    @Column(name = "credit_number", length = 50)
    private String number;

    @NotNull
    @Column(name = "credit_date", nullable = false)
    private LocalDate creditDate;

    @NotNull
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @NotNull
    @Column(name = "allocated_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal allocatedAmount = BigDecimal.ZERO;

    @NotNull
    @Column(name = "refunded_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal refundedAmount = BigDecimal.ZERO;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CreditNoteStatus status = CreditNoteStatus.DRAFT;

    @Size(max = 255)
    @Column(length = 255)
    private String reason;

    @Size(max = 500)
    @Column(length = 500)
    private String memo;

    @Column(name = "journal_entry_id")
    private Long journalEntryId;

    @Column(name = "opened_by_id")
    private Long openedById;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public VendorCreditNote() {
    }

    public VendorCreditNote(Long orgId, Vendor vendor, LocalDate creditDate, BigDecimal amount) {
        this.orgId = orgId;
        this.vendor = vendor;
        this.creditDate = creditDate;
        this.amount = amount;
    }

    public boolean isDraft() {
        return status == CreditNoteStatus.DRAFT;
    }

    /** Allocations and refunds are accepted only while OPEN or PARTIALLY_APPLIED. */
    public boolean isUsable() {
        return status == CreditNoteStatus.OPEN || status == CreditNoteStatus.PARTIALLY_APPLIED;
    }

    public BigDecimal getUsedAmount() {
        return allocatedAmount.add(refundedAmount);
    }

    public BigDecimal getRemaining() {
        return amount.subtract(getUsedAmount());
    }

    public void addAllocated(BigDecimal delta) {
        allocatedAmount = allocatedAmount.add(delta).max(BigDecimal.ZERO);
        recalculateStatus();
    }

    public void addRefunded(BigDecimal delta) {
        refundedAmount = refundedAmount.add(delta);
        recalculateStatus();
    }

    public void recalculateStatus() {
        if (status == CreditNoteStatus.DRAFT || status == CreditNoteStatus.VOID) {
            return;
        }
        status = switch (Settlement.of(getUsedAmount(), amount)) {
            case NONE -> CreditNoteStatus.OPEN;
            case PARTIAL -> CreditNoteStatus.PARTIALLY_APPLIED;
            case FULL -> CreditNoteStatus.APPLIED;
        };
    }

    public void markOpened(Long userId, Long journalEntryId) {
        this.status = CreditNoteStatus.OPEN;
        this.openedById = userId;
        this.openedAt = Instant.now();
        this.journalEntryId = journalEntryId;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getOrgId() {
        return orgId;
    }

    public Vendor getVendor() {
        return vendor;
    }

    public String getNumber() {
        return number;
    }

    public void setNumber(String number) {
        this.number = number;
    }

    public LocalDate getCreditDate() {
        return creditDate;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public BigDecimal getAllocatedAmount() {
        return allocatedAmount;
    }

    public void setAllocatedAmount(BigDecimal allocatedAmount) {
        this.allocatedAmount = allocatedAmount;
    }

    public BigDecimal getRefundedAmount() {
        return refundedAmount;
    }

    public void setRefundedAmount(BigDecimal refundedAmount) {
        this.refundedAmount = refundedAmount;
    }

    public CreditNoteStatus getStatus() {
        return status;
    }

    public void setStatus(CreditNoteStatus status) {
        this.status = status;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getMemo() {
        return memo;
    }

    public void setMemo(String memo) {
        this.memo = memo;
    }

    public Long getJournalEntryId() {
        return journalEntryId;
    }

    public Long getOpenedById() {
        return openedById;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
