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
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.domain.PaymentMethod;
import com.example.ledger.domain.Vendor;
import com.example.ledger.domain.VendorBill;
import com.example.ledger.domain.VendorBill.BillStatus;
import com.example.ledger.domain.VendorCreditAllocation;
import com.example.ledger.domain.VendorCreditNote;
import com.example.ledger.domain.VendorCreditRefund;
import com.example.ledger.exception.InsufficientBalanceException;
import com.example.ledger.exception.InvalidStateException;
import com.example.ledger.exception.PeriodLockedException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.VendorCreditAllocationRepository;
import com.example.ledger.repository.VendorCreditNoteRepository;
import com.example.ledger.repository.VendorCreditRefundRepository;

/**
 * Unit tests for VendorCreditNoteService. The amount of a credit note is always split between
 * allocations, refunds and what remains.
 */
@ExtendWith(MockitoExtension.class)
class VendorCreditNoteServiceTest {

  private static final Long ORG = 1L;
  private static final Long USER = 9L;
  private static final LocalDate CREDIT_DATE = LocalDate.of(2024, 8, 12);

  @Mock private VendorCreditNoteRepository creditNoteRepository;

  @Mock private VendorCreditAllocationRepository allocationRepository;

  @Mock private VendorCreditRefundRepository refundRepository;

  @Mock private PayablesService payablesService;

  @Mock private AccountService accountService;

  @Mock private JournalService journalService;

  @Mock private FiscalPeriodService periodService;

  @Mock private PaymentMethodMappingService paymentMethodMappingService;

  @Mock private AuditService auditService;

  private VendorCreditNoteService creditNoteService;

  private Vendor vendor;

  @BeforeEach
  void setUp() {
    creditNoteService =
        new VendorCreditNoteService(
            creditNoteRepository,
            allocationRepository,
            refundRepository,
            payablesService,
            accountService,
            journalService,
            periodService,
            paymentMethodMappingService,
            auditService,
            new LedgerProperties());

    vendor = new Vendor(ORG, "Acme Produce");
    vendor.setId(5L);
  }

  private VendorCreditNote openNote(String amount) {
    VendorCreditNote note = new VendorCreditNote(ORG, vendor, CREDIT_DATE, new BigDecimal(amount));
    note.setId(40L);
    note.setNumber("VCN-1");
    note.markOpened(USER, 900L);
    when(creditNoteRepository.findByIdForUpdate(40L, ORG)).thenReturn(Optional.of(note));
    return note;
  }

  private VendorBill openBill(Long id, Vendor owner, String total) {
    BigDecimal amount = new BigDecimal(total);
    VendorBill bill =
        new VendorBill(ORG, owner, CREDIT_DATE, CREDIT_DATE.plusDays(30), amount, null, amount);
    bill.setId(id);
    bill.setNumber("BILL-" + id);
    bill.markOpened(USER, 800L + id);
    return bill;
  }

  private static void assertConserved(VendorCreditNote note) {
    BigDecimal split =
        note.getAllocatedAmount().add(note.getRefundedAmount()).add(note.getRemaining());
    assertEquals(0, note.getAmount().compareTo(split));
  }

  @Test
  void allocate_acrossTwoBills_updatesBothSides() {
    // Arrange
    VendorCreditNote note = openNote("500.00");
    VendorBill first = openBill(11L, vendor, "300.00");
    VendorBill second = openBill(12L, vendor, "400.00");
    when(payablesService.lockBill(ORG, 11L)).thenReturn(first);
    when(payablesService.lockBill(ORG, 12L)).thenReturn(second);
    when(allocationRepository.save(any(VendorCreditAllocation.class)))
        .thenAnswer(inv -> inv.getArgument(0));

    // Act
    List<VendorCreditAllocation> allocations =
        creditNoteService.allocate(
            ORG,
            40L,
            USER,
            List.of(
                new VendorCreditNoteService.AllocationLine(11L, new BigDecimal("300.00")),
                new VendorCreditNoteService.AllocationLine(12L, new BigDecimal("150.00"))));

    // Assert
    assertEquals(2, allocations.size());
    assertEquals(BillStatus.PAID, first.getStatus());
    assertEquals(BillStatus.PARTIALLY_PAID, second.getStatus());
    assertEquals(CreditNoteStatus.PARTIALLY_APPLIED, note.getStatus());
    assertEquals(0, new BigDecimal("50.00").compareTo(note.getRemaining()));
    assertConserved(note);
    verify(creditNoteRepository).save(note);
    verifyNoInteractions(journalService);
  }

  @Test
  void allocate_whenTotalExceedsRemainingCredit_throwsInsufficientBalance() {
    VendorCreditNote note = openNote("100.00");

    assertThrows(
        InsufficientBalanceException.class,
        () ->
            creditNoteService.allocate(
                ORG,
                40L,
                USER,
                List.of(
                    new VendorCreditNoteService.AllocationLine(11L, new BigDecimal("60.00")),
                    new VendorCreditNoteService.AllocationLine(12L, new BigDecimal("60.00")))));
    assertEquals(0, note.getAllocatedAmount().signum());
    verifyNoInteractions(payablesService, allocationRepository);
  }

  @Test
  void allocate_whenExceedingBillOutstanding_throwsInsufficientBalance() {
    openNote("500.00");
    VendorBill bill = openBill(11L, vendor, "100.00");
    when(payablesService.lockBill(ORG, 11L)).thenReturn(bill);

    assertThrows(
        InsufficientBalanceException.class,
        () ->
            creditNoteService.allocate(
                ORG,
                40L,
                USER,
                List.of(new VendorCreditNoteService.AllocationLine(11L, new BigDecimal("120.00")))));
    assertEquals(BillStatus.OPEN, bill.getStatus());
  }

  @Test
  void allocate_oneCentOverRemainingCredit_throwsInsufficientBalance() {
    VendorCreditNote note = openNote("100.00");

    assertThrows(
        InsufficientBalanceException.class,
        () ->
            creditNoteService.allocate(
                ORG,
                40L,
                USER,
                List.of(new VendorCreditNoteService.AllocationLine(11L, new BigDecimal("100.01")))));
    assertEquals(0, note.getAllocatedAmount().signum());
    assertEquals(CreditNoteStatus.OPEN, note.getStatus());
    assertConserved(note);
  }

  @Test
  void allocate_oneCentOverBillOutstanding_leavesBillUntouched() {
    VendorCreditNote note = openNote("500.00");
    VendorBill bill = openBill(11L, vendor, "100.00");
    when(payablesService.lockBill(ORG, 11L)).thenReturn(bill);

    assertThrows(
        InsufficientBalanceException.class,
        () ->
            creditNoteService.allocate(
                ORG,
                40L,
                USER,
                List.of(new VendorCreditNoteService.AllocationLine(11L, new BigDecimal("100.01")))));
    assertEquals(0, bill.getPaidAmount().signum());
    assertEquals(0, note.getAllocatedAmount().signum());
  }

  @Test
  void allocate_exactRemainingCredit_appliesNoteInFull() {
    // Arrange
    VendorCreditNote note = openNote("100.00");
    VendorBill bill = openBill(11L, vendor, "100.00");
    when(payablesService.lockBill(ORG, 11L)).thenReturn(bill);
    when(allocationRepository.save(any(VendorCreditAllocation.class)))
        .thenAnswer(inv -> inv.getArgument(0));

    // Act
    creditNoteService.allocate(
        ORG,
        40L,
        USER,
        List.of(new VendorCreditNoteService.AllocationLine(11L, new BigDecimal("100.00"))));

    // Assert
    assertEquals(CreditNoteStatus.APPLIED, note.getStatus());
    assertEquals(BillStatus.PAID, bill.getStatus());
    assertEquals(0, note.getRemaining().signum());
    assertConserved(note);
  }

  @Test
  void allocate_toAnotherVendorsBill_throwsValidation() {
    openNote("500.00");
    Vendor other = new Vendor(ORG, "Other Supplies");
    other.setId(6L);
    when(payablesService.lockBill(ORG, 11L)).thenReturn(openBill(11L, other, "100.00"));

    assertThrows(
        ValidationException.class,
        () ->
            creditNoteService.allocate(
                ORG,
                40L,
                USER,
                List.of(new VendorCreditNoteService.AllocationLine(11L, new BigDecimal("10.00")))));
  }

  @Test
  void deleteAllocation_restoresBillAndCredit() {
    // Arrange
    VendorCreditNote note = openNote("500.00");
    VendorBill bill = openBill(11L, vendor, "300.00");
    bill.applyPayment(new BigDecimal("300.00"));
    note.addAllocated(new BigDecimal("300.00"));
    VendorCreditAllocation allocation =
        new VendorCreditAllocation(note, bill, new BigDecimal("300.00"), USER);
    allocation.setId(70L);
    when(allocationRepository.findById(70L)).thenReturn(Optional.of(allocation));
    when(payablesService.lockBill(ORG, 11L)).thenReturn(bill);

    // Act
    creditNoteService.deleteAllocation(ORG, 70L, USER);

    // Assert
    assertEquals(BillStatus.OPEN, bill.getStatus());
    assertEquals(0, bill.getPaidAmount().signum());
    assertEquals(CreditNoteStatus.OPEN, note.getStatus());
    assertEquals(0, new BigDecimal("500.00").compareTo(note.getRemaining()));
    verify(allocationRepository).delete(allocation);
  }

  @Test
  void createRefund_postsCashAgainstPayable() {
    // Arrange
    VendorCreditNote note = openNote("500.00");
    Account cash = new Account(ORG, "1000", "Cash", AccountType.ASSET);
    cash.setId(1L);
    Account payable = new Account(ORG, "2000", "AP", AccountType.LIABILITY);
    payable.setId(3L);
    when(accountService.requireByCode(ORG, "2000", "accounts payable")).thenReturn(payable);
    when(paymentMethodMappingService.resolveAccount(ORG, PaymentMethod.CASH)).thenReturn(cash);
    when(refundRepository.save(any(VendorCreditRefund.class)))
        .thenAnswer(
            inv -> {
              VendorCreditRefund r = inv.getArgument(0);
              r.setId(60L);
              return r;
            });
    JournalEntry entry = new JournalEntry(ORG, CREDIT_DATE, "refund", JournalSource.MANUAL, null);
    entry.setId(901L);
    when(journalService.postDirect(any(PostingRequest.class))).thenReturn(entry);

    // Act
    VendorCreditRefund refund =
        creditNoteService.createRefund(
            ORG,
            40L,
            new VendorCreditNoteService.RefundRequest(
                new BigDecimal("200.00"), CREDIT_DATE.plusDays(2), PaymentMethod.CASH, null),
            USER);

    // Assert
    assertEquals(901L, refund.getJournalEntryId());
    assertEquals(0, new BigDecimal("200.00").compareTo(note.getRefundedAmount()));
    assertEquals(CreditNoteStatus.PARTIALLY_APPLIED, note.getStatus());
    assertConserved(note);

    ArgumentCaptor<PostingRequest> posted = ArgumentCaptor.forClass(PostingRequest.class);
    verify(journalService).postDirect(posted.capture());
    assertEquals(JournalSource.VENDOR_CREDIT_REFUND, posted.getValue().source());
    assertEquals("60", posted.getValue().sourceId());
    assertEquals(1L, posted.getValue().lines().get(0).accountId());
    assertEquals(3L, posted.getValue().lines().get(1).accountId());
  }

  @Test
  void createRefund_inLockedPeriod_keepsRemainingCredit() {
    VendorCreditNote note = openNote("200.00");
    doThrow(new PeriodLockedException(CREDIT_DATE, "August", "LOCKED"))
        .when(periodService).assertPostable(ORG, CREDIT_DATE);

    assertThrows(
        PeriodLockedException.class,
        () ->
            creditNoteService.createRefund(
                ORG,
                40L,
                new VendorCreditNoteService.RefundRequest(
                    new BigDecimal("75.00"), CREDIT_DATE, PaymentMethod.BANK_TRANSFER, null),
                USER));
    assertEquals(0, note.getRefundedAmount().signum());
    assertConserved(note);
    verifyNoInteractions(journalService, refundRepository, auditService);
    verify(creditNoteRepository, never()).save(any(VendorCreditNote.class));
  }

  @Test
  void voidCreditNote_withAllocations_throwsInvalidState() {
    openNote("500.00");
    when(allocationRepository.existsByCreditNote_Id(40L)).thenReturn(true);

    assertThrows(
        InvalidStateException.class, () -> creditNoteService.voidCreditNote(ORG, 40L, USER));
    verifyNoInteractions(journalService);
  }

  @Test
  void voidCreditNote_whenUnused_reversesOpeningEntry() {
    VendorCreditNote note = openNote("500.00");
    when(allocationRepository.existsByCreditNote_Id(40L)).thenReturn(false);
    when(refundRepository.existsByCreditNote_Id(40L)).thenReturn(false);
    when(creditNoteRepository.save(note)).thenReturn(note);

    VendorCreditNote voided = creditNoteService.voidCreditNote(ORG, 40L, USER);

    assertEquals(CreditNoteStatus.VOID, voided.getStatus());
    verify(journalService)
        .reverse(
            eq(ORG), eq(900L), eq(USER), any(LocalDate.class),
            eq(JournalSource.VENDOR_CREDIT_NOTE_VOID), eq("40"));
  }

  @Test
  void voidCreditNote_whenDraft_postsNothing() {
    VendorCreditNote draft =
        new VendorCreditNote(ORG, vendor, CREDIT_DATE, new BigDecimal("75.00"));
    draft.setId(41L);
    when(creditNoteRepository.findByIdForUpdate(41L, ORG)).thenReturn(Optional.of(draft));
    when(creditNoteRepository.save(draft)).thenReturn(draft);

    VendorCreditNote voided = creditNoteService.voidCreditNote(ORG, 41L, USER);

    assertEquals(CreditNoteStatus.VOID, voided.getStatus());
    verifyNoInteractions(journalService);
  }
}
