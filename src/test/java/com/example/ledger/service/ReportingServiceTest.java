package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountType;
import com.example.ledger.domain.Vendor;
import com.example.ledger.domain.VendorBill;
import com.example.ledger.domain.VendorBill.BillStatus;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.AccountTotals;
import com.example.ledger.repository.CustomerInvoiceRepository;
import com.example.ledger.repository.JournalLineRepository;
import com.example.ledger.repository.VendorBillRepository;

/**
 * Unit tests for ReportingService over a small ledger:
 *
 * <pre>
 * Owner funds      Dr Cash 1000      Cr Equity 1000
 * Sale             Dr Cash 500       Cr Sales 500
 * Cost of sale     Dr COGS 200       Cr Cash 200
 * Supplier bill    Dr Expense 100    Cr AP 100
 * </pre>
 */
@ExtendWith(MockitoExtension.class)
class ReportingServiceTest {

  private static final Long ORG = 1L;
  private static final LocalDate AS_OF = LocalDate.of(2024, 2, 15);

  @Mock private AccountRepository accountRepository;

  @Mock private JournalLineRepository lineRepository;

  @Mock private VendorBillRepository billRepository;

  @Mock private CustomerInvoiceRepository invoiceRepository;

  private ReportingService reportingService;

  private List<Account> chart;
  private List<AccountTotals> totals;

  @BeforeEach
  void setUp() {
    reportingService =
        new ReportingService(accountRepository, lineRepository, billRepository, invoiceRepository);

    chart =
        List.of(
            account(1L, "1000", AccountType.ASSET),
            account(2L, "2000", AccountType.LIABILITY),
            account(3L, "3000", AccountType.EQUITY),
            account(4L, "4000", AccountType.REVENUE),
            account(5L, "5000", AccountType.COGS),
            account(6L, "6000", AccountType.EXPENSE),
            account(7L, "6100", AccountType.EXPENSE));
    totals =
        List.of(
            totals(1L, "1500.00", "200.00"),
            totals(2L, "0", "100.00"),
            totals(3L, "0", "1000.00"),
            totals(4L, "0", "500.00"),
            totals(5L, "200.00", "0"),
            totals(6L, "100.00", "0"));
  }

  private static Account account(Long id, String code, AccountType type) {
    Account account = new Account(ORG, code, code, type);
    account.setId(id);
    return account;
  }

  private static AccountTotals totals(Long accountId, String debits, String credits) {
    return new AccountTotals() {
      @Override
      public Long getAccountId() {
        return accountId;
      }

      @Override
      public BigDecimal getDebits() {
        return new BigDecimal(debits);
      }

      @Override
      public BigDecimal getCredits() {
        return new BigDecimal(credits);
      }
    };
  }

  private void stubChartByType() {
    when(accountRepository.findByOrgIdAndTypeOrderByCode(eq(ORG), any(AccountType.class)))
        .thenAnswer(
            inv -> {
              AccountType type = inv.getArgument(1);
              return chart.stream().filter(a -> a.getType() == type).toList();
            });
  }

  private static void assertAmount(String expected, BigDecimal actual) {
    assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
  }

  @Test
  void getTrialBalance_listsActiveAccountsAndBalances() {
    // Arrange
    when(lineRepository.sumByAccountAsOf(ORG, ReportingService.REPORTED_STATUSES, AS_OF))
        .thenReturn(totals);
    when(accountRepository.findByOrgIdOrderByCode(ORG)).thenReturn(chart);

    // Act
    ReportingService.TrialBalance tb = reportingService.getTrialBalance(ORG, AS_OF, null);

    // Assert
    assertEquals(6, tb.lines().size());
    assertAmount("1800.00", tb.totalDebits());
    assertAmount("1800.00", tb.totalCredits());
    assertTrue(tb.isBalanced());
    assertAmount("1300.00", tb.lines().get(0).balance());
  }

  @Test
  void getProfitAndLoss_computesGrossAndNetProfit() {
    // Arrange
    LocalDate from = LocalDate.of(2024, 1, 1);
    when(lineRepository.sumByAccountBetween(ORG, ReportingService.REPORTED_STATUSES, from, AS_OF))
        .thenReturn(totals);
    stubChartByType();

    // Act
    ReportingService.ProfitAndLoss pl = reportingService.getProfitAndLoss(ORG, from, AS_OF, null);

    // Assert
    assertAmount("500.00", pl.totalRevenue());
    assertAmount("200.00", pl.totalCogs());
    assertAmount("100.00", pl.totalExpenses());
    assertAmount("300.00", pl.grossProfit());
    assertAmount("200.00", pl.netProfit());
    assertEquals(1, pl.expenses().size(), "accounts without activity are left out");
  }

  @Test
  void getProfitAndLoss_whenRangeInverted_throwsValidation() {
    assertThrows(
        ValidationException.class,
        () -> reportingService.getProfitAndLoss(ORG, AS_OF, AS_OF.minusDays(1), null));
    verifyNoInteractions(lineRepository);
  }

  @Test
  void getBalanceSheet_includesCurrentEarningsInEquity() {
    // Arrange
    when(lineRepository.sumByAccountAsOfAndBranch(ORG, ReportingService.REPORTED_STATUSES, AS_OF, 4L))
        .thenReturn(totals);
    stubChartByType();

    // Act
    ReportingService.BalanceSheet bs = reportingService.getBalanceSheet(ORG, AS_OF, 4L);

    // Assert
    assertAmount("1300.00", bs.totalAssets());
    assertAmount("100.00", bs.totalLiabilities());
    assertAmount("200.00", bs.currentEarnings());
    assertAmount("1200.00", bs.totalEquity());
    assertTrue(bs.isBalanced());
    assertEquals(4L, bs.branchId());
  }

  @Test
  void getApAging_bucketsByDaysPastDue() {
    // Arrange
    Vendor vendor = new Vendor(ORG, "Acme Produce");
    VendorBill overdue = bill(vendor, 11L, LocalDate.of(2023, 12, 2), LocalDate.of(2024, 1, 1), "400.00");
    overdue.applyPayment(new BigDecimal("150.00"));
    VendorBill notYetDue = bill(vendor, 12L, LocalDate.of(2024, 2, 1), LocalDate.of(2024, 3, 2), "90.00");
    VendorBill veryLate = bill(vendor, 13L, LocalDate.of(2023, 9, 1), LocalDate.of(2023, 10, 1), "70.00");
    VendorBill future = bill(vendor, 14L, LocalDate.of(2024, 2, 20), LocalDate.of(2024, 3, 20), "999.00");
    when(billRepository.findByOrgIdAndStatusInOrderByDueDateAsc(
            ORG, List.of(BillStatus.OPEN, BillStatus.PARTIALLY_PAID)))
        .thenReturn(List.of(veryLate, overdue, notYetDue, future));

    // Act
    ReportingService.AgingReport aging = reportingService.getApAging(ORG, AS_OF);

    // Assert
    assertEquals(3, aging.lines().size());
    assertEquals(45, aging.lines().get(1).daysOverdue());
    assertAmount("250.00", aging.days31To60());
    assertAmount("90.00", aging.current());
    assertAmount("0", aging.days61To90());
    assertAmount("70.00", aging.over90());
    assertAmount("410.00", aging.total());
  }

  private static VendorBill bill(
      Vendor vendor, Long id, LocalDate billDate, LocalDate dueDate, String total) {
    BigDecimal amount = new BigDecimal(total);
    VendorBill bill = new VendorBill(ORG, vendor, billDate, dueDate, amount, null, amount);
    bill.setId(id);
    bill.setNumber("BILL-" + id);
    bill.markOpened(9L, 500L + id);
    return bill;
  }
}
