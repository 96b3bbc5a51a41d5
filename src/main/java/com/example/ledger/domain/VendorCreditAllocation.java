package com.example.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * Applies part of a vendor credit note against a bill. Allocations create no journal lines: the
 * GL effect happened when the credit note was opened.
 */
@Entity
@Table(
    name = "vendor_credit_allocation",
    indexes = {
      @Index(name = "idx_vendor_credit_alloc_note", columnList = "credit_note_id"),
      @Index(name = "idx_vendor_credit_alloc_bill", columnList = "bill_id")
    })
public class VendorCreditAllocation {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "credit_note_id", nullable = false)
  private VendorCreditNote creditNote;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "bill_id", nullable = false)
  private VendorBill bill;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @Column(name = "applied_at", nullable = false)
  private Instant appliedAt;

  @Column(name = "applied_by_id")
  private Long appliedById;

  @PrePersist
  protected void onCreate() {
    appliedAt = Instant.now();
  }

  public VendorCreditAllocation() {}

  public VendorCreditAllocation(
      VendorCreditNote creditNote, VendorBill bill, BigDecimal amount, Long appliedById) {
    this.creditNote = creditNote;
    this.bill = bill;
    this.amount = amount;
    this.appliedById = appliedById;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public VendorCreditNote getCreditNote() {
    return creditNote;
  }

  public VendorBill getBill() {
    return bill;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public Instant getAppliedAt() {
    return appliedAt;
  }

  public Long getAppliedById() {
    return appliedById;
  }
}
