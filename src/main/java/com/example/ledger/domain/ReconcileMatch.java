package com.example.ledger.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Links a bank statement row to the internal record that explains it. At most one match exists
 * per bank row, enforced by a unique key on {@code bank_txn_id}.
 */
@Entity
@Table(
    name = "reconcile_match",
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_reconcile_match_txn", columnNames = {"bank_txn_id"})
    },
    indexes = {@Index(name = "idx_reconcile_match_source", columnList = "source, source_id")})
public class ReconcileMatch {

  /** The kind of internal record a bank row is matched to. */
  public enum MatchSource {
    PAYMENT,
    REFUND,
    CASH_SAFE_DROP,
    CASH_PICKUP
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "org_id", nullable = false)
  private Long orgId;

  @NotNull
  @OneToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "bank_txn_id", nullable = false)
  private BankTxn bankTxn;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private MatchSource source;

  @NotBlank
  @Size(max = 64)
  @Column(name = "source_id", nullable = false, length = 64)
  private String sourceId;

  /** True when created by the heuristic matcher rather than a person. */
  @Column(name = "is_auto", nullable = false)
  private boolean auto;

  @Column(name = "matched_by_id")
  private Long matchedById;

  @Column(name = "matched_at", nullable = false)
  private Instant matchedAt;

  @PrePersist
  protected void onCreate() {
    matchedAt = Instant.now();
  }

  public ReconcileMatch() {}

  public ReconcileMatch(
      BankTxn bankTxn, MatchSource source, String sourceId, boolean auto, Long matchedById) {
    this.orgId = bankTxn.getOrgId();
    this.bankTxn = bankTxn;
    this.source = source;
    this.sourceId = sourceId;
    this.auto = auto;
    this.matchedById = matchedById;
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

  public BankTxn getBankTxn() {
    return bankTxn;
  }

  public MatchSource getSource() {
    return source;
  }

  public String getSourceId() {
    return sourceId;
  }

  public boolean isAuto() {
    return auto;
  }

  public Long getMatchedById() {
    return matchedById;
  }

  public Instant getMatchedAt() {
    return matchedAt;
  }
}
