package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionOperations;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountType;
import com.example.ledger.domain.CashMovementType;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.exception.MissingAccountMappingException;
import com.example.ledger.exception.ValidationException;

@ExtendWith(MockitoExtension.class)
class OperationalPostingServiceTest {

  private static final Long ORG = 1L;
  private static final Long BRANCH = 4L;
  private static final Long USER = 9L;
  private static final LocalDate DATE = LocalDate.of(2024, 9, 14);

  @Mock private JournalService journalService;

  @Mock private AccountService accountService;

  private OperationalPostingService postingService;

  @BeforeEach
  void setUp() {
    postingService =
        new OperationalPostingService(
            journalService, accountService, new LedgerProperties(), TransactionOperations.withoutTransaction());
  }

  private void stubAccount(Long id, String code, String purpose, AccountType type) {
    Account account = new Account(ORG, code, purpose, type);
    account.setId(id);
    when(accountService.requireByCode(ORG, code, purpose)).thenReturn(account);
  }

  private PostingRequest capturePosting() {
    ArgumentCaptor<PostingRequest> captor = ArgumentCaptor.forClass(PostingRequest.class);
    verify(journalService).postDirect(captor.capture());
    return captor.getValue();
  }

  private void stubPostDirect() {
    JournalEntry entry = new JournalEntry(ORG, DATE, "posted", JournalSource.MANUAL, null);
    entry.setId(300L);
    when(journalService.postDirect(any(PostingRequest.class))).thenReturn(entry);
  }

  private static BigDecimal amount(String value) {
    return new BigDecimal(value);
  }

  @Test
  void postSale_paidOrder_splitsRevenueServiceChargeAndTax() {
    // Arrange
    stubAccount(1L, "1000", "cash", AccountType.ASSET);
    stubAccount(40L, "4000", "sales revenue", AccountType.REVENUE);
    stubAccount(21L, "2100", "tax payable", AccountType.LIABILITY);
    stubPostDirect();

    // Act
    postingService.postSale(
        new OperationalPostingService.SaleEvent(
            ORG, BRANCH, "ord-0000-1234abcd", DATE, amount("100.00"), amount("10.00"),
            amount("5.00"), amount("115.00"), true, USER));

    // Assert
    PostingRequest request = capturePosting();
    assertEquals(JournalSource.ORDER, request.source());
    assertEquals("ord-0000-1234abcd", request.sourceId());
    assertEquals("Sale - Order #1234abcd", request.memo());
    assertEquals(BRANCH, request.branchId());

    List<JournalLineRequest> lines = request.lines();
    assertEquals(4, lines.size());
    assertEquals(1L, lines.get(0).accountId());
    assertEquals(0, amount("115.00").compareTo(lines.get(0).debit()));
    assertEquals(40L, lines.get(1).accountId());
    assertEquals(0, amount("100.00").compareTo(lines.get(1).credit()));
    assertEquals("Service charge", lines.get(2).memo());
    assertEquals(21L, lines.get(3).accountId());
    assertEquals("Tax", lines.get(3).memo());
  }

  @Test
  void postSale_unpaidOrder_debitsReceivable() {
    stubAccount(11L, "1100", "accounts receivable", AccountType.ASSET);
    stubAccount(40L, "4000", "sales revenue", AccountType.REVENUE);
    stubPostDirect();

    postingService.postSale(
        new OperationalPostingService.SaleEvent(
            ORG, BRANCH, "ord-2", DATE, amount("50.00"), null, null, amount("50.00"), false, USER));

    List<JournalLineRequest> lines = capturePosting().lines();
    assertEquals(2, lines.size());
    assertEquals(11L, lines.get(0).accountId());
  }

  @Test
  void postSale_unpaidWithoutReceivableAccount_throwsMissingAccountMapping() {
    when(accountService.requireByCode(ORG, "1100", "accounts receivable"))
        .thenThrow(new MissingAccountMappingException("No accounts receivable account"));

    assertThrows(
        MissingAccountMappingException.class,
        () ->
            postingService.postSale(
                new OperationalPostingService.SaleEvent(
                    ORG, BRANCH, "ord-3", DATE, amount("50.00"), null, null, amount("50.00"),
                    false, USER)));
    verifyNoInteractions(journalService);
  }

  @Test
  void postSale_withoutOrderId_throwsValidation() {
    assertThrows(
        ValidationException.class,
        () ->
            postingService.postSale(
                new OperationalPostingService.SaleEvent(
                    ORG, BRANCH, " ", DATE, amount("1.00"), null, null, amount("1.00"), true, USER)));
    verifyNoInteractions(accountService, journalService);
  }

  @Test
  void postCogs_whenZeroCost_skipsPosting() {
    Optional<JournalEntry> result =
        postingService.postCogs(
            new OperationalPostingService.CogsEvent(ORG, BRANCH, "ord-4", DATE, BigDecimal.ZERO, USER));

    assertTrue(result.isEmpty());
    verifyNoInteractions(accountService, journalService);
  }

  @Test
  void postCogs_postsCostAgainstInventory() {
    stubAccount(50L, "5000", "cost of goods sold", AccountType.COGS);
    stubAccount(12L, "1200", "inventory", AccountType.ASSET);
    stubPostDirect();

    Optional<JournalEntry> result =
        postingService.postCogs(
            new OperationalPostingService.CogsEvent(ORG, BRANCH, "ord-5", DATE, amount("42.50"), USER));

    assertTrue(result.isPresent());
    PostingRequest request = capturePosting();
    assertEquals(JournalSource.COGS, request.source());
    assertEquals(50L, request.lines().get(0).accountId());
    assertEquals(12L, request.lines().get(1).accountId());
  }

  @Test
  void postCogs_whenNegative_throwsValidation() {
    assertThrows(
        ValidationException.class,
        () ->
            postingService.postCogs(
                new OperationalPostingService.CogsEvent(
                    ORG, BRANCH, "ord-6", DATE, amount("-1.00"), USER)));
  }

  @Test
  void postRefund_debitsRevenueCreditsCash() {
    stubAccount(40L, "4000", "sales revenue", AccountType.REVENUE);
    stubAccount(1L, "1000", "cash", AccountType.ASSET);
    stubPostDirect();

    postingService.postRefund(
        new OperationalPostingService.RefundEvent(
            ORG, BRANCH, "rf-1", DATE, amount("20.00"), "Cold food", USER));

    PostingRequest request = capturePosting();
    assertEquals(JournalSource.REFUND, request.source());
    assertEquals("Refund - Cold food", request.memo());
    assertEquals(40L, request.lines().get(0).accountId());
    assertEquals(1L, request.lines().get(1).accountId());
  }

  @Test
  void postCashMovement_paidIn_debitsCash() {
    stubAccount(1L, "1000", "cash", AccountType.ASSET);
    stubAccount(30L, "3000", "owner's equity", AccountType.EQUITY);
    stubPostDirect();

    postingService.postCashMovement(
        new OperationalPostingService.CashMovementEvent(
            ORG, BRANCH, "cm-1", DATE, CashMovementType.PAID_IN, amount("200.00"), "Float", USER));

    PostingRequest request = capturePosting();
    assertEquals(JournalSource.CASH_MOVEMENT, request.source());
    assertEquals(1L, request.lines().get(0).accountId());
    assertEquals(30L, request.lines().get(1).accountId());
  }

  @Test
  void postCashMovement_safeDrop_creditsCash() {
    stubAccount(1L, "1000", "cash", AccountType.ASSET);
    stubAccount(30L, "3000", "owner's equity", AccountType.EQUITY);
    stubPostDirect();

    postingService.postCashMovement(
        new OperationalPostingService.CashMovementEvent(
            ORG, BRANCH, "cm-2", DATE, CashMovementType.SAFE_DROP, amount("500.00"), null, USER));

    PostingRequest request = capturePosting();
    assertEquals(30L, request.lines().get(0).accountId());
    assertEquals(1L, request.lines().get(1).accountId());
    assertEquals("Cash SAFE_DROP", request.memo());
  }

  @Test
  void postRefund_whenConcurrentDuplicateWins_returnsCommittedEntry() {
    // Arrange
    stubAccount(40L, "4000", "sales revenue", AccountType.REVENUE);
    stubAccount(1L, "1000", "cash", AccountType.ASSET);
    when(journalService.postDirect(any(PostingRequest.class)))
        .thenThrow(new DataIntegrityViolationException("uk_journal_entry_source"));
    JournalEntry winner = new JournalEntry(ORG, DATE, "Refund - Cold food", JournalSource.REFUND, "rf-9");
    winner.setId(301L);
    when(journalService.findBySource(ORG, JournalSource.REFUND, "rf-9")).thenReturn(Optional.of(winner));

    // Act
    JournalEntry entry =
        postingService.postRefund(
            new OperationalPostingService.RefundEvent(
                ORG, BRANCH, "rf-9", DATE, amount("12.00"), "Cold food", USER));

    // Assert
    assertSame(winner, entry);
  }

  @Test
  void postRefund_whenConstraintFailsWithoutStoredEntry_rethrows() {
    stubAccount(40L, "4000", "sales revenue", AccountType.REVENUE);
    stubAccount(1L, "1000", "cash", AccountType.ASSET);
    when(journalService.postDirect(any(PostingRequest.class)))
        .thenThrow(new DataIntegrityViolationException("fk_journal_line_account"));
    when(journalService.findBySource(ORG, JournalSource.REFUND, "rf-10")).thenReturn(Optional.empty());

    assertThrows(
        DataIntegrityViolationException.class,
        () ->
            postingService.postRefund(
                new OperationalPostingService.RefundEvent(
                    ORG, BRANCH, "rf-10", DATE, amount("12.00"), "Cold food", USER)));
  }
}
