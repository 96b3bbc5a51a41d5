package com.example.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Money received from a customer, optionally against a specific invoice. Posted as Dr Cash / Cr AR.
 */
@Entity
@Table(name = "customer_receipt", indexes = {
    @Index(name = "idx_customer_receipt_invoice", columnList = "invoice_id")
})
public class CustomerReceipt {

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

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "invoice_id")
    private CustomerInvoice invoice;

    @NotNull
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @NotNull
    @Column(name = "received_at", nullable = false)
    private LocalDate receivedAt;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod method;

    @Size(max = 100)
    @Column(length = 100)
    private String ref;

    @Column(name = "journal_entry_id")
    private Long journalEntryId;

    @Column(name = "created_by_id")
    private Long createdById;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public CustomerReceipt() {
    }

    public CustomerReceipt(Long orgId, Customer customer, CustomerInvoice invoice,
                           BigDecimal amount, LocalDate receivedAt, PaymentMethod method) {
        this.orgId = orgId;
        this.customer = customer;
        this.invoice = invoice;
        this.amount = amount;
        this.receivedAt = receivedAt;
        this.method = method;
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

    public Customer getCustomer() {
        return customer;
    }

    public CustomerInvoice getInvoice() {
        return invoice;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public LocalDate getReceivedAt() {
        return receivedAt;
    }

    public PaymentMethod getMethod() {
        return method;
    }

    public String getRef() {
        return ref;
    }

    public void setRef(String ref) {
        this.ref = ref;
    }

    public Long getJournalEntryId() {
        return journalEntryId;
    }

    public void setJournalEntryId(Long journalEntryId) {
        this.journalEntryId = journalEntryId;
    }

    public Long getCreatedById() {
        return createdById;
    }

    public void setCreatedById(Long createdById) {
        this.createdById = createdById;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
