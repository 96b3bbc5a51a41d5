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

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountType;
import com.example.ledger.domain.CreditNoteStatus;
import com.example.ledger.domain.Customer;
import com.example.ledger.domain.CustomerCreditAllocation;
import com.example.ledger.domain.CustomerCreditNote;
import com.example.ledger.domain.CustomerInvoice;
import com.example.ledger.domain.CustomerInvoice.InvoiceStatus;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.domain.PaymentMethod;
import com.example.ledger.exception.InsufficientBalanceException;
import com.example.ledger.exception.InvalidStateException;
import com.example.ledger.exception.PeriodLockedException;
import com.example.ledger.repository.CustomerCreditAllocationRepository;
import com.example.ledger.repository.CustomerCreditNoteRepository;
import com.example.ledger.repository.CustomerCreditRefundRepository;

@ExtendWith(MockitoExtension.class)
class CustomerCreditNoteServiceTest {

  private static final Long ORG = 1L;
  private static final Long USER = 9L;
  private static final LocalDate CREDIT_DATE = LocalDate.of(2024, 10, 2);

  @Mock private CustomerCreditNoteRepository creditNoteRepository;

  @Mock private CustomerCreditAllocationRepository allocationRepository;

  @Mock private CustomerCreditRefundRepository refundRepository;

  @Mock private ReceivablesService receivablesService;

  @Mock private AccountService accountService;

  @Mock private JournalService journalService;

  @Mock private FiscalPeriodService periodService;

  @Mock private PaymentMethodMappingService paymentMethodMappingService;

  @Mock private AuditService auditService;

  private CustomerCreditNoteService creditNoteService;

  private Customer customer;

  @BeforeEach
  void setUp() {
    creditNoteService =
        new CustomerCreditNoteService(
            creditNoteRepository,
            allocationRepository,
            refundRepository,
            receivablesService,
            accountService,
            journalService,
            periodService,
            paymentMethodMappingService,
            auditService,
            new LedgerProperties());

    customer = new Customer(ORG, "Harbour Cafe");
    customer.setId(8L);
  }

  private CustomerCreditNote note(String amount) {
    CustomerCreditNote note =
        new CustomerCreditNote(ORG, customer, CREDIT_DATE, new BigDecimal(amount));
    note.setId(45L);
    note.setNumber("CCN-1");
    when(creditNoteRepository.findByIdForUpdate(45L, ORG)).thenReturn(Optional.of(note));
    return note;
  }

  @Test
  void open_postsRevenueAgainstReceivable() {
    // Arrange
    CustomerCreditNote note = note("80.00");
    Account receivable = new Account(ORG, "1100", "AR", AccountType.ASSET);
    receivable.setId(4L);
    Account revenue = new Account(ORG, "4000", "Sales", AccountType.REVENUE);
    revenue.setId(7L);
    when(accountService.requireByCode(ORG, "1100", "accounts receivable")).thenReturn(receivable);
    when(accountService.requireByCode(ORG, "4000", "revenue")).thenReturn(revenue);
    JournalEntry entry = new JournalEntry(ORG, CREDIT_DATE, "credit", JournalSource.MANUAL, null);
    entry.setId(950L);
    when(journalService.postDirect(any(PostingRequest.class))).thenReturn(entry);
    when(creditNoteRepository.save(note)).thenReturn(note);

    // Act
    CustomerCreditNote opened = creditNoteService.open(ORG, 45L, USER);

    // Assert
    assertEquals(CreditNoteStatus.OPEN, opened.getStatus());
    ArgumentCaptor<PostingRequest> posted = ArgumentCaptor.forClass(PostingRequest.class);
    verify(journalService).postDirect(posted.capture());
    assertEquals(JournalSource.CUSTOMER_CREDIT_NOTE, posted.getValue().source());
    assertEquals(7L, posted.getValue().lines().get(0).accountId());
    assertEquals(4L, posted.getValue().lines().get(1).accountId());
  }

  @Test
  void allocate_fullCredit_marksNoteApplied() {
    // Arrange
    CustomerCreditNote note = note("80.00");
    note.markOpened(USER, 950L);
    CustomerInvoice invoice =
        new CustomerInvoice(
            ORG, customer, CREDIT_DATE, CREDIT_DATE.plusDays(14), new BigDecimal("200.00"), null,
            new BigDecimal("200.00"));
    invoice.setId(20L);
    invoice.markOpened(USER, 800L);
    when(receivablesService.lockInvoice(ORG, 20L)).thenReturn(invoice);
    when(allocationRepository.save(any(CustomerCreditAllocation.class)))
        .thenAnswer(inv -> inv.getArgument(0));

    // Act
    creditNoteService.allocate(
        ORG, 45L, USER,
        List.of(new CustomerCreditNoteService.AllocationLine(20L, new BigDecimal("80.00"))));

    // Assert
    assertEquals(CreditNoteStatus.APPLIED, note.getStatus());
    assertEquals(0, note.getRemaining().signum());
    assertEquals(InvoiceStatus.PARTIALLY_PAID, invoice.getStatus());
    assertEquals(0, new BigDecimal("120.00").compareTo(invoice.getOutstanding()));
  }

  @Test
  void createRefund_whenExceedingRemaining_throwsInsufficientBalance() {
    CustomerCreditNote note = note("80.00");
    note.markOpened(USER, 950L);
    note.addAllocated(new BigDecimal("50.00"));

    assertThrows(
        InsufficientBalanceException.class,
        () ->
            creditNoteService.createRefund(
                ORG,
                45L,
                new CustomerCreditNoteService.RefundRequest(
                    new BigDecimal("40.00"), CREDIT_DATE, PaymentMethod.CASH, null),
                USER));
    verifyNoInteractions(journalService, refundRepository);
  }

  @Test
  void createRefund_oneCentOverRemaining_keepsNoteWithinAmount() {
    CustomerCreditNote note = note("80.00");
    note.markOpened(USER, 950L);
    note.addAllocated(new BigDecimal("50.00"));

    assertThrows(
        InsufficientBalanceException.class,
        () ->
            creditNoteService.createRefund(
                ORG,
                45L,
                new CustomerCreditNoteService.RefundRequest(
                    new BigDecimal("30.01"), CREDIT_DATE, PaymentMethod.CASH, null),
                USER));
    assertEquals(0, note.getRefundedAmount().signum());
    assertTrue(note.getAllocatedAmount().add(note.getRefundedAmount()).compareTo(note.getAmount()) <= 0);
    verifyNoInteractions(journalService, refundRepository);
  }

  @Test
  void createRefund_inLockedPeriod_keepsRemainingCredit() {
    CustomerCreditNote note = note("80.00");
    note.markOpened(USER, 950L);
    doThrow(new PeriodLockedException(CREDIT_DATE, "Q4", "LOCKED"))
        .when(periodService).assertPostable(ORG, CREDIT_DATE);

    assertThrows(
        PeriodLockedException.class,
        () ->
            creditNoteService.createRefund(
                ORG,
                45L,
                new CustomerCreditNoteService.RefundRequest(
                    new BigDecimal("30.00"), CREDIT_DATE, PaymentMethod.CASH, null),
                USER));
    assertEquals(0, note.getRefundedAmount().signum());
    assertEquals(0, new BigDecimal("80.00").compareTo(note.getRemaining()));
    assertEquals(CreditNoteStatus.OPEN, note.getStatus());
    verifyNoInteractions(journalService, refundRepository, auditService);
    verify(creditNoteRepository, never()).save(any(CustomerCreditNote.class));
  }

  @Test
  void createRefund_onDraftNote_throwsInvalidState() {
    note("80.00");

    assertThrows(
        InvalidStateException.class,
        () ->
            creditNoteService.createRefund(
                ORG,
                45L,
                new CustomerCreditNoteService.RefundRequest(
                    new BigDecimal("10.00"), CREDIT_DATE, PaymentMethod.CASH, null),
                USER));
  }
}
