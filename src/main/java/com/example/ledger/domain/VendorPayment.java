package com.example.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Money paid to a vendor, optionally against a specific bill. Posted as Dr AP / Cr Cash.
 */
@Entity
@Table(name = "vendor_payment", indexes = {
    @Index(name = "idx_vendor_payment_bill", columnList = "bill_id")
})
public class VendorPayment {

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

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "bill_id")
    private VendorBill bill;

    @NotNull
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @NotNull
    @Column(name = "paid_at", nullable = false)
    private LocalDate paidAt;

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

    public VendorPayment() {
    }

    public VendorPayment(Long orgId, Vendor vendor, VendorBill bill, BigDecimal amount,
                         LocalDate paidAt, PaymentMethod method) {
        this.orgId = orgId;
        this.vendor = vendor;
        this.bill = bill;
        this.amount = amount;
        this.paidAt = paidAt;
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

    public Vendor getVendor() {
        return vendor;
    }

    public VendorBill getBill() {
        return bill;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public LocalDate getPaidAt() {
        return paidAt;
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
