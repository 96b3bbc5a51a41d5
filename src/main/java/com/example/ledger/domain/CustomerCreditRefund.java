package com.example.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Cash paid out to a customer against the unused part of a credit note. */
@Entity
@Table(
    name = "customer_credit_refund",
    indexes = {@Index(name = "idx_customer_credit_refund_note", columnList = "credit_note_id")})
public class CustomerCreditRefund {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "credit_note_id", nullable = false)
  private CustomerCreditNote creditNote;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @NotNull
  @Column(name = "refund_date", nullable = false)
  private LocalDate refundDate;

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

  public CustomerCreditRefund() {}

  public CustomerCreditRefund(
      CustomerCreditNote creditNote, BigDecimal amount, LocalDate refundDate, PaymentMethod method) {
    this.creditNote = creditNote;
    this.amount = amount;
    this.refundDate = refundDate;
    this.method = method;
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

  public BigDecimal getAmount() {
    return amount;
  }

  public LocalDate getRefundDate() {
    return refundDate;
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
