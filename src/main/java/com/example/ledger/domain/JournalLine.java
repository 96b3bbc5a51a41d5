package com.example.ledger.domain;

import java.math.BigDecimal;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One side of a journal entry. Exactly one of {@code debit} / {@code credit} is positive, the
 * other is zero.
 */
@Entity
@Table(
    name = "journal_line",
    indexes = {
      @Index(name = "idx_journal_line_entry", columnList = "entry_id"),
      @Index(name = "idx_journal_line_account", columnList = "account_id")
    })
public class JournalLine {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "entry_id", nullable = false)
  private JournalEntry entry;

  @Column(name = "line_index", nullable = false)
  private int lineIndex;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "account_id", nullable = false)
  private Account account;

  @Column(name = "branch_id")
  private Long branchId;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal debit = BigDecimal.ZERO;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal credit = BigDecimal.ZERO;

  @Size(max = 255)
  @Column(length = 255)
  private String memo;

  public JournalLine() {}

  public JournalLine(Account account, Long branchId, BigDecimal debit, BigDecimal credit) {
    this.account = account;
    this.branchId = branchId;
    this.debit = Amounts.normalize(debit);
    this.credit = Amounts.normalize(credit);
  }

  public static JournalLine debit(Account account, Long branchId, BigDecimal amount) {
    return new JournalLine(account, branchId, amount, BigDecimal.ZERO);
  }

  public static JournalLine credit(Account account, Long branchId, BigDecimal amount) {
    return new JournalLine(account, branchId, BigDecimal.ZERO, amount);
  }

  /** Copy of this line with debit and credit swapped. */
  public JournalLine inverted() {
    JournalLine inverted = new JournalLine(account, branchId, credit, debit);
    inverted.setMemo(memo);
    return inverted;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public JournalEntry getEntry() {
    return entry;
  }

  public void setEntry(JournalEntry entry) {
    this.entry = entry;
  }

  public int getLineIndex() {
    return lineIndex;
  }

  public void setLineIndex(int lineIndex) {
    this.lineIndex = lineIndex;
  }

  public Account getAccount() {
    return account;
  }

  public Long getBranchId() {
    return branchId;
  }

  public BigDecimal getDebit() {
    return debit;
  }

  public BigDecimal getCredit() {
    return credit;
  }

  public String getMemo() {
    return memo;
  }

  public void setMemo(String memo) {
    this.memo = memo;
  }
}
