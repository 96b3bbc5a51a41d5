package com.example.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * An invoice issued to a customer (A/R).
 * Workflow: DRAFT → OPEN → PARTIALLY_PAID → PAID, VOID from any non-draft state.
 * Opening posts Dr AR / Cr Revenue. Once open, the status is derived from
 * {@code paidAmount} against {@code total} after every change; VOID is terminal.
 */
@Entity
@Table(name = "customer_invoice", indexes = {
    @Index(name = "idx_customer_invoice_org_status", columnList = "org_id, status")
})
public class CustomerInvoice {

    public enum InvoiceStatus {
        DRAFT,           // Editable, not in the ledger
        OPEN,            // Posted, nothing paid
        PARTIALLY_PAID,
        PAID,
        VOID             // Terminal, no further payments
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "customer_id", nullable = false)
    private Customer customer;

    @Size(max = 50)
    @Column(name = "invoice_number", length = 50)
    private String number;

    @NotNull
    @Column(name = "invoice_date", nullable = false)
    private LocalDate invoiceDate;

    @NotNull
    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @NotNull
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal tax;

    @NotNull
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal total = BigDecimal.ZERO;

    @NotNull
    @Column(name = "paid_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal paidAmount = BigDecimal.ZERO;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InvoiceStatus status = InvoiceStatus.DRAFT;

    // Revenue account to credit on open; the configured default when null
    @Column(name = "revenue_account_id")
    private Long revenueAccountId;

    @Size(max = 500)
    @Column(length = 500)
    private String memo;

    @Column(name = "journal_entry_id")
    private Long journalEntryId;

    @Column(name = "opened_by_id")
    private Long openedById;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "voided_by_id")
    private Long voidedById;

    @Column(name = "voided_at")
    private Instant voidedAt;

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

    // Constructors
    public CustomerInvoice() {
    }

    public CustomerInvoice(Long orgId, Customer customer, LocalDate invoiceDate,
                           LocalDate dueDate, BigDecimal subtotal, BigDecimal tax,
                           BigDecimal total) {
        this.orgId = orgId;
        this.customer = customer;
        this.invoiceDate = invoiceDate;
        this.dueDate = dueDate;
        this.subtotal = subtotal;
        this.tax = tax;
        this.total = total;
    }

    // Helper methods
    public boolean isDraft() {
        return status == InvoiceStatus.DRAFT;
    }

    public boolean isVoid() {
        return status == InvoiceStatus.VOID;
    }

    /** Receipts and credit allocations are accepted only while OPEN or PARTIALLY_PAID. */
    public boolean isPayable() {
        return status == InvoiceStatus.OPEN || status == InvoiceStatus.PARTIALLY_PAID;
    }

    public BigDecimal getOutstanding() {
        return total.subtract(paidAmount);
    }

    public void applyPayment(BigDecimal amount) {
        paidAmount = paidAmount.add(amount);
        recalculateStatus();
    }

    /** Takes back a previously applied amount, never going below zero. */
    public void reversePayment(BigDecimal amount) {
        paidAmount = paidAmount.subtract(amount).max(BigDecimal.ZERO);
        recalculateStatus();
    }

    /**
     * Re-derives the status from the running paid total. DRAFT and VOID are not settlement
     * states and are left alone.
     */
    public void recalculateStatus() {
        if (status == InvoiceStatus.DRAFT || status == InvoiceStatus.VOID) {
            return;
        }
        status = switch (Settlement.of(paidAmount, total)) {
            case NONE -> InvoiceStatus.OPEN;
            case PARTIAL -> InvoiceStatus.PARTIALLY_PAID;
            case FULL -> InvoiceStatus.PAID;
        };
    }

    public void markOpened(Long userId, Long journalEntryId) {
        this.status = InvoiceStatus.OPEN;
        this.openedById = userId;
        this.openedAt = Instant.now();
        this.journalEntryId = journalEntryId;
        recalculateStatus();
    }

    public void markVoid(Long userId) {
        this.status = InvoiceStatus.VOID;
        this.voidedById = userId;
        this.voidedAt = Instant.now();
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

    public Customer getCustomer() {
        return customer;
    }

    public void setCustomer(Customer customer) {
        this.customer = customer;
    }

    public String getNumber() {
        return number;
    }

    public void setNumber(String number) {
        this.number = number;
    }

    public LocalDate getInvoiceDate() {
        return invoiceDate;
    }

    public void setInvoiceDate(LocalDate invoiceDate) {
        this.invoiceDate = invoiceDate;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public void setDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
    }

    public BigDecimal getSubtotal() {
        return subtotal;
    }

    public void setSubtotal(BigDecimal subtotal) {
        this.subtotal = subtotal;
    }

    public BigDecimal getTax() {
        return tax;
    }

    public void setTax(BigDecimal tax) {
        this.tax = tax;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public void setTotal(BigDecimal total) {
        this.total = total;
    }

    public BigDecimal getPaidAmount() {
        return paidAmount;
    }

    public void setPaidAmount(BigDecimal paidAmount) {
        this.paidAmount = paidAmount;
    }

    public InvoiceStatus getStatus() {
        return status;
    }

    public void setStatus(InvoiceStatus status) {
        this.status = status;
    }

    public Long getRevenueAccountId() {
        return revenueAccountId;
    }

    public void setRevenueAccountId(Long revenueAccountId) {
        this.revenueAccountId = revenueAccountId;
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

    public void setJournalEntryId(Long journalEntryId) {
        this.journalEntryId = journalEntryId;
    }

    public Long getOpenedById() {
        return openedById;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public Long getVoidedById() {
        return voidedById;
    }

    public Instant getVoidedAt() {
        return voidedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
