package com.example.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * Applies part of a customer credit note against an invoice. Allocations create no journal lines: the
 * GL effect happened when the credit note was opened.
 */
@Entity
@Table(
    name = "customer_credit_allocation",
    indexes = {
      @Index(name = "idx_customer_credit_alloc_note", columnList = "credit_note_id"),
      @Index(name = "idx_customer_credit_alloc_invoice", columnList = "invoice_id")
    })
public class CustomerCreditAllocation {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "credit_note_id", nullable = false)
  private CustomerCreditNote creditNote;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "invoice_id", nullable = false)
  private CustomerInvoice invoice;

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

  public CustomerCreditAllocation() {}

  public CustomerCreditAllocation(
      CustomerCreditNote creditNote, CustomerInvoice invoice, BigDecimal amount, Long appliedById) {
    this.creditNote = creditNote;
    this.invoice = invoice;
    this.amount = amount;
    this.appliedById = appliedById;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public CustomerCreditNote getCreditNote() {
    return creditNote;
  }

  public CustomerInvoice getInvoice() {
    return invoice;
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
