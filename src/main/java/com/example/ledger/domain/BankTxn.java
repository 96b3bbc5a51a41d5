package com.example.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One imported bank statement row. Positive amounts are money in, negative money out. A row is
 * reconciled exactly when a {@link ReconcileMatch} exists for it.
 */
@Entity
@Table(
    name = "bank_txn",
    indexes = {
      @Index(name = "idx_bank_txn_account_date", columnList = "bank_account_id, txn_date"),
      @Index(name = "idx_bank_txn_reconciled", columnList = "bank_account_id, is_reconciled")
    })
public class BankTxn {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "org_id", nullable = false)
  private Long orgId;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "bank_account_id", nullable = false)
  private BankAccount bankAccount;

  @NotNull
  @Column(name = "txn_date", nullable = false)
  private LocalDate txnDate;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @Size(max = 500)
  @Column(length = 500)
  private String description;

  @Size(max = 100)
  @Column(length = 100)
  private String reference;

  @Column(name = "is_reconciled", nullable = false)
  private boolean reconciled = false;

  @Column(name = "imported_at", nullable = false, updatable = false)
  private Instant importedAt;

  @PrePersist
  protected void onCreate() {
    importedAt = Instant.now();
  }

  public BankTxn() {}

  public BankTxn(
      Long orgId, BankAccount bankAccount, LocalDate txnDate, BigDecimal amount, String description) {
    this.orgId = orgId;
    this.bankAccount = bankAccount;
    this.txnDate = txnDate;
    this.amount = amount;
    this.description = description;
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

  public BankAccount getBankAccount() {
    return bankAccount;
  }

  public LocalDate getTxnDate() {
    return txnDate;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getDescription() {
    return description;
  }

  public String getReference() {
    return reference;
  }

  public void setReference(String reference) {
    this.reference = reference;
  }

  public boolean isReconciled() {
    return reconciled;
  }

  public void setReconciled(boolean reconciled) {
    this.reconciled = reconciled;
  }

  public Instant getImportedAt() {
    return importedAt;
  }
}
