package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.domain.PaymentMethod;
import com.example.ledger.domain.Vendor;
import com.example.ledger.domain.VendorBill;
import com.example.ledger.domain.VendorBill.BillStatus;
import com.example.ledger.domain.FiscalPeriod;
import com.example.ledger.exception.InvalidStateException;
import com.example.ledger.exception.PeriodLockedException;
import com.example.ledger.repository.AuditEventRepository;
import com.example.ledger.repository.JournalEntryRepository;
import com.example.ledger.security.OrgPermissionEvaluator;

/**
 * Runs a vendor bill from draft to fully paid against an in-memory database and checks the
 * resulting ledger through the reporting queries.
 */
@DataJpaTest
@EnableConfigurationProperties(LedgerProperties.class)
@Import({
  AuditService.class,
  AccountService.class,
  OrgPermissionEvaluator.class,
  FiscalPeriodService.class,
  JournalService.class,
  PaymentMethodMappingService.class,
  PayablesService.class,
  ReportingService.class
})
class PayablesLedgerFlowTest {

  private static final Long ORG = 1L;
  private static final Long USER = 9L;
  private static final LocalDate BILL_DATE = LocalDate.of(2024, 6, 3);

  @Autowired private AccountService accountService;

  @Autowired private PayablesService payablesService;

  @Autowired private ReportingService reportingService;

  @Autowired private FiscalPeriodService periodService;

  @Autowired private JournalService journalService;

  @Autowired private JournalEntryRepository entryRepository;

  @Autowired private AuditEventRepository auditEventRepository;

  private Vendor vendor;

  @BeforeEach
  void setUp() {
    accountService.seedDefaultChart(ORG, USER);
    vendor = payablesService.createVendor(ORG, "Acme Produce", null, null, null, USER);
  }

  private VendorBill openBill(String subtotal) {
    VendorBill bill =
        payablesService.createBill(
            ORG,
            new PayablesService.BillRequest(
                vendor.getId(), null, BILL_DATE, null, new BigDecimal(subtotal), null, null, null),
            USER);
    return payablesService.openBill(ORG, bill.getId(), USER);
  }

  private void pay(Long billId, String amount, PaymentMethod method) {
    payablesService.createPayment(
        ORG,
        new PayablesService.PaymentRequest(
            null, billId, new BigDecimal(amount), BILL_DATE.plusDays(10), method, null),
        USER);
  }

  private FiscalPeriod lockedPeriod(String name, LocalDate start, LocalDate end) {
    FiscalPeriod period = periodService.createPeriod(ORG, name, start, end, USER);
    periodService.closePeriod(ORG, period.getId(), USER);
    return periodService.lockPeriod(ORG, period.getId(), USER);
  }

  private LocalDate currentMonthStart() {
    return LocalDate.now().withDayOfMonth(1);
  }

  private LocalDate currentMonthEnd() {
    LocalDate today = LocalDate.now();
    return today.withDayOfMonth(today.lengthOfMonth());
  }

  private ReportingService.TrialBalanceLine payableLine(LocalDate asOf) {
    return reportingService.getTrialBalance(ORG, asOf, null).lines().stream()
        .filter(l -> l.account().getCode().equals("2000"))
        .findFirst()
        .orElseThrow();
  }

  @Test
  void billPaidInTwoParts_settlesPayableAndKeepsLedgerBalanced() {
    // Arrange
    VendorBill bill = openBill("100000.00");
    assertEquals(BillStatus.OPEN, bill.getStatus());

    // Act
    pay(bill.getId(), "60000.00", PaymentMethod.CASH);
    assertEquals(BillStatus.PARTIALLY_PAID, payablesService.getBill(ORG, bill.getId()).getStatus());
    pay(bill.getId(), "40000.00", PaymentMethod.BANK_TRANSFER);

    // Assert
    VendorBill paid = payablesService.getBill(ORG, bill.getId());
    assertEquals(BillStatus.PAID, paid.getStatus());
    assertEquals(0, payablesService.getOutstanding(ORG, bill.getId()).signum());

    ReportingService.TrialBalance tb = reportingService.getTrialBalance(ORG, BILL_DATE.plusDays(30), null);
    assertTrue(tb.isBalanced());
    ReportingService.TrialBalanceLine payable =
        tb.lines().stream().filter(l -> l.account().getCode().equals("2000")).findFirst().orElseThrow();
    assertEquals(0, payable.balance().signum());
    assertEquals(0, new BigDecimal("100000.00").compareTo(payable.credits()));

    List<JournalEntry> entries = entryRepository.findAll();
    assertEquals(3, entries.size());
    assertTrue(entries.stream().allMatch(JournalEntry::isBalanced));
    assertEquals(
        1, entries.stream().filter(e -> e.getSource() == JournalSource.VENDOR_BILL).count());
    assertFalse(auditEventRepository.findAll().isEmpty());
  }

  @Test
  void paymentAfterSettlement_isRefused() {
    VendorBill bill = openBill("500.00");
    pay(bill.getId(), "500.00", PaymentMethod.CASH);

    assertThrows(
        InvalidStateException.class, () -> pay(bill.getId(), "0.50", PaymentMethod.CASH));
  }

  @Test
  void voidingPaidBill_reversesOnlyTheOpeningEntry() {
    // Arrange
    VendorBill bill = openBill("800.00");
    pay(bill.getId(), "300.00", PaymentMethod.CASH);

    // Act
    payablesService.voidBill(ORG, bill.getId(), USER);

    // Assert
    List<JournalEntry> entries = entryRepository.findAll();
    assertEquals(3, entries.size());
    JournalEntry opening =
        entries.stream().filter(e -> e.getSource() == JournalSource.VENDOR_BILL).findFirst().orElseThrow();
    assertTrue(opening.isReversed());
    assertEquals(
        1, entries.stream().filter(e -> e.getSource() == JournalSource.VENDOR_BILL_VOID).count());
    assertTrue(reportingService.getTrialBalance(ORG, LocalDate.now().plusDays(1), null).isBalanced());
  }

  @Test
  void voidAfterFullPayment_leavesPaymentsStandingAgainstPayable() {
    // Arrange
    VendorBill bill = openBill("100000.00");
    pay(bill.getId(), "60000.00", PaymentMethod.CASH);
    pay(bill.getId(), "40000.00", PaymentMethod.BANK_TRANSFER);

    // Act
    VendorBill voided = payablesService.voidBill(ORG, bill.getId(), USER);

    // Assert
    assertEquals(BillStatus.VOID, voided.getStatus());
    assertEquals(0, new BigDecimal("100000.00").compareTo(voided.getPaidAmount()));

    ReportingService.TrialBalanceLine payable = payableLine(LocalDate.now().plusDays(1));
    assertEquals(0, new BigDecimal("200000.00").compareTo(payable.debits()));
    assertEquals(0, new BigDecimal("100000.00").compareTo(payable.credits()));
    assertTrue(reportingService.getTrialBalance(ORG, LocalDate.now().plusDays(1), null).isBalanced());
    assertEquals(4, entryRepository.findAll().size());
  }

  @Test
  void paymentIntoLockedPeriod_isRefusedAndBillUnchanged() {
    // Arrange
    VendorBill bill = openBill("900.00");
    lockedPeriod("June 2024 close", BILL_DATE.plusDays(5), BILL_DATE.plusDays(20));
    long entriesBefore = entryRepository.count();

    // Act
    assertThrows(
        PeriodLockedException.class, () -> pay(bill.getId(), "400.00", PaymentMethod.CASH));

    // Assert
    VendorBill unchanged = payablesService.getBill(ORG, bill.getId());
    assertEquals(BillStatus.OPEN, unchanged.getStatus());
    assertEquals(0, unchanged.getPaidAmount().signum());
    assertTrue(payablesService.listPayments(ORG, bill.getId()).isEmpty());
    assertEquals(entriesBefore, entryRepository.count());
  }

  @Test
  void voidWhileTodayIsLocked_isRefusedAndOpeningEntryStaysPosted() {
    // Arrange
    VendorBill bill = openBill("250.00");
    lockedPeriod("Current month", currentMonthStart(), currentMonthEnd());
    long entriesBefore = entryRepository.count();

    // Act
    assertThrows(
        PeriodLockedException.class, () -> payablesService.voidBill(ORG, bill.getId(), USER));

    // Assert
    VendorBill unchanged = payablesService.getBill(ORG, bill.getId());
    assertEquals(BillStatus.OPEN, unchanged.getStatus());
    assertEquals(entriesBefore, entryRepository.count());
    JournalEntry opening = entryRepository.findById(unchanged.getJournalEntryId()).orElseThrow();
    assertTrue(opening.isPosted());
    assertFalse(opening.isReversed());
  }

  @Test
  void reverseIntoLockedPeriod_isRefusedAndEntryStaysPosted() {
    // Arrange
    VendorBill bill = openBill("120.00");
    lockedPeriod("Current month", currentMonthStart(), currentMonthEnd());
    long entriesBefore = entryRepository.count();

    // Act
    assertThrows(
        PeriodLockedException.class,
        () -> journalService.reverse(ORG, bill.getJournalEntryId(), USER, LocalDate.now()));

    // Assert
    assertEquals(entriesBefore, entryRepository.count());
    JournalEntry opening = entryRepository.findById(bill.getJournalEntryId()).orElseThrow();
    assertTrue(opening.isPosted());
  }
}
