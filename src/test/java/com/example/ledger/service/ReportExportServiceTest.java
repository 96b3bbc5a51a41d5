package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountType;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalLine;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.service.ReportingService.AgingLine;
import com.example.ledger.service.ReportingService.AgingReport;
import com.example.ledger.service.ReportingService.TrialBalance;
import com.example.ledger.service.ReportingService.TrialBalanceLine;

class ReportExportServiceTest {

  private final ReportExportService exportService = new ReportExportService();

  @Test
  void exportTrialBalanceToCsv_writesBomTitleAndEscapedNames() {
    // Arrange
    Account cash = new Account(1L, "1000", "Cash, front till", AccountType.ASSET);
    Account sales = new Account(1L, "4000", "Sales", AccountType.REVENUE);
    BigDecimal amount = new BigDecimal("250.00");
    TrialBalance tb =
        new TrialBalance(
            LocalDate.of(2024, 5, 31),
            null,
            List.of(
                new TrialBalanceLine(cash, amount, BigDecimal.ZERO, amount),
                new TrialBalanceLine(sales, BigDecimal.ZERO, amount, amount)),
            amount,
            amount);

    // Act
    String csv = new String(exportService.exportTrialBalanceToCsv(tb), StandardCharsets.UTF_8);

    // Assert
    assertTrue(csv.startsWith("\uFEFFTrial Balance\r\n"));
    assertTrue(csv.contains("As of,2024-05-31\r\n"));
    assertTrue(csv.contains("Status,BALANCED\r\n"));
    assertTrue(csv.contains("Code,Account,Type,Debits,Credits,Balance\r\n"));
    assertTrue(csv.contains("1000,\"Cash, front till\",ASSET,250.00,0.00,250.00\r\n"));
    assertTrue(csv.contains(",Totals,,250.00,250.00,\r\n"));
  }

  @Test
  void exportApAgingToCsv_includesBucketSummary() {
    // Arrange
    AgingReport report =
        AgingReport.of(
            LocalDate.of(2024, 2, 15),
            List.of(
                new AgingLine(
                    11L, "BILL-11", "Acme Produce", LocalDate.of(2023, 12, 2),
                    LocalDate.of(2024, 1, 1), new BigDecimal("400.00"), new BigDecimal("250.00"), 45),
                new AgingLine(
                    12L, "BILL-12", "Acme Produce", LocalDate.of(2024, 2, 1),
                    LocalDate.of(2024, 3, 2), new BigDecimal("90.00"), new BigDecimal("90.00"), -16)));

    // Act
    String csv = new String(exportService.exportApAgingToCsv(report), StandardCharsets.UTF_8);

    // Assert
    assertTrue(csv.contains("Number,Vendor,Date,Due Date,Total,Outstanding,Days Overdue\r\n"));
    assertTrue(csv.contains("BILL-11,Acme Produce,2023-12-02,2024-01-01,400.00,250.00,45\r\n"));
    assertTrue(csv.contains("Current,31-60,61-90,90+,Total\r\n90.00,250.00,0.00,0.00,340.00\r\n"));
  }

  @Test
  void exportArAgingToCsv_labelsCustomerColumn() {
    AgingReport report = AgingReport.of(LocalDate.of(2024, 2, 15), List.of());

    String csv = new String(exportService.exportArAgingToCsv(report), StandardCharsets.UTF_8);

    assertTrue(csv.startsWith("\uFEFFAR Aging\r\n"));
    assertTrue(csv.contains("Number,Customer,"));
  }

  @Test
  void exportAccountsToCsv_writesParentCodeAndActiveFlag() {
    // Arrange
    Account assets = new Account(1L, "1000", "Cash", AccountType.ASSET);
    assets.setId(10L);
    Account till = new Account(1L, "1001", "Till \"A\"", AccountType.ASSET);
    till.setId(11L);
    till.setParentId(10L);
    till.setActive(false);

    // Act
    String csv =
        new String(exportService.exportAccountsToCsv(List.of(assets, till)), StandardCharsets.UTF_8);

    // Assert
    assertTrue(csv.startsWith("\uFEFFChart of Accounts\r\n"));
    assertTrue(csv.contains("Code,Name,Type,Parent,Active\r\n"));
    assertTrue(csv.contains("1000,Cash,ASSET,,Yes\r\n"));
    assertTrue(csv.contains("1001,\"Till \"\"A\"\"\",ASSET,1000,No\r\n"));
  }

  @Test
  void exportJournalToCsv_writesOneRowPerLineWithTotals() {
    // Arrange
    Account cash = new Account(1L, "1000", "Cash", AccountType.ASSET);
    Account sales = new Account(1L, "4000", "Sales", AccountType.REVENUE);
    JournalEntry entry =
        new JournalEntry(1L, LocalDate.of(2024, 6, 1), "Sale, table 4", JournalSource.ORDER, "ord-1");
    entry.setId(77L);
    entry.addLine(JournalLine.debit(cash, null, new BigDecimal("42.00")));
    JournalLine credit = JournalLine.credit(sales, null, new BigDecimal("42.00"));
    credit.setMemo("Food");
    entry.addLine(credit);
    entry.markPosted(9L);

    // Act
    String csv = new String(exportService.exportJournalToCsv(List.of(entry)), StandardCharsets.UTF_8);

    // Assert
    assertTrue(csv.startsWith("\uFEFFJournal Entries\r\n"));
    assertTrue(
        csv.contains(
            "Date,Entry,Status,Source,Source Id,Memo,Account Code,Account,Debit,Credit,Line Memo\r\n"));
    assertTrue(
        csv.contains("2024-06-01,77,POSTED,ORDER,ord-1,\"Sale, table 4\",1000,Cash,42.00,0.00,\r\n"));
    assertTrue(
        csv.contains("2024-06-01,77,POSTED,ORDER,ord-1,\"Sale, table 4\",4000,Sales,0.00,42.00,Food\r\n"));
    assertTrue(csv.endsWith(",,,,,,,Totals,42.00,42.00,\r\n"));
  }

  @Test
  void escapeCsvField_quotesOnlyWhenNeeded() {
    assertEquals("plain", ReportExportService.escapeCsvField("plain"));
    assertEquals("\"a,b\"", ReportExportService.escapeCsvField("a,b"));
    assertEquals("\"say \"\"hi\"\"\"", ReportExportService.escapeCsvField("say \"hi\""));
    assertEquals("\"two\nlines\"", ReportExportService.escapeCsvField("two\nlines"));
    assertEquals("", ReportExportService.escapeCsvField(null));
  }
}
