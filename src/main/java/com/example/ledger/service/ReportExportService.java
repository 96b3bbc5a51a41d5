package com.example.ledger.service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalLine;
import com.example.ledger.service.ReportingService.AgingLine;
import com.example.ledger.service.ReportingService.AgingReport;
import com.example.ledger.service.ReportingService.BalanceSheet;
import com.example.ledger.service.ReportingService.ProfitAndLoss;
import com.example.ledger.service.ReportingService.ReportLine;
import com.example.ledger.service.ReportingService.TrialBalance;
import com.example.ledger.service.ReportingService.TrialBalanceLine;

/**
 * Exports financial reports, the chart of accounts and the journal to CSV, and the statements
 * to Excel. CSV output is UTF-8 with a byte order mark so spreadsheet programs detect the
 * encoding; fields are quoted per RFC 4180.
 */
@Service
public class ReportExportService {

  private static final Logger log = LoggerFactory.getLogger(ReportExportService.class);

  private static final String MONEY_FORMAT = "#,##0.00";

  private final DateTimeFormatter dateFormatter = DateTimeFormatter.ISO_LOCAL_DATE;

  // ==================== TRIAL BALANCE EXPORTS ====================

  /** Exports Trial Balance report to CSV format. */
  public byte[] exportTrialBalanceToCsv(TrialBalance report) {
    StringBuilder csv = startCsv("Trial Balance");
    csv.append("As of,").append(report.asOf().format(dateFormatter)).append("\r\n");
    csv.append("Status,").append(report.isBalanced() ? "BALANCED" : "OUT OF BALANCE").append("\r\n");
    csv.append("\r\n");

    csv.append("Code,Account,Type,Debits,Credits,Balance\r\n");
    for (TrialBalanceLine line : report.lines()) {
      csvRow(
          csv,
          line.account().getCode(),
          line.account().getName(),
          line.account().getType().name(),
          money(line.debits()),
          money(line.credits()),
          money(line.balance()));
    }
    csvRow(csv, "", "Totals", "", money(report.totalDebits()), money(report.totalCredits()), "");

    return finishCsv(csv, "Trial Balance");
  }

  /** Exports Trial Balance report to Excel format. */
  public byte[] exportTrialBalanceToExcel(TrialBalance report) {
    try (XSSFWorkbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

      Sheet sheet = workbook.createSheet("Trial Balance");
      Styles styles = new Styles(workbook);
      int rowNum = writeTitle(sheet, styles, "Trial Balance", "As of " + report.asOf().format(dateFormatter), 4);
      sheet.createRow(rowNum++).createCell(0)
          .setCellValue(report.isBalanced() ? "BALANCED" : "OUT OF BALANCE");
      rowNum++;

      rowNum = writeHeader(sheet, styles, rowNum, "Code", "Account", "Debits", "Credits", "Balance");
      for (TrialBalanceLine line : report.lines()) {
        Row row = sheet.createRow(rowNum++);
        row.createCell(0).setCellValue(line.account().getCode());
        row.createCell(1).setCellValue(line.account().getName());
        moneyCell(row, 2, line.debits(), styles.currency);
        moneyCell(row, 3, line.credits(), styles.currency);
        moneyCell(row, 4, line.balance(), styles.currency);
      }

      Row totalRow = sheet.createRow(rowNum);
      Cell label = totalRow.createCell(1);
      label.setCellValue("Totals");
      label.setCellStyle(styles.total);
      moneyCell(totalRow, 2, report.totalDebits(), styles.total);
      moneyCell(totalRow, 3, report.totalCredits(), styles.total);

      return finishWorkbook(workbook, sheet, baos, 5, "Trial Balance");
    } catch (IOException e) {
      log.error("Failed to generate Trial Balance Excel", e);
      throw new RuntimeException("Failed to generate Trial Balance Excel: " + e.getMessage(), e);
    }
  }

  // ==================== PROFIT & LOSS EXPORTS ====================

  /** Exports Profit & Loss report to CSV format. */
  public byte[] exportProfitAndLossToCsv(ProfitAndLoss report) {
    StringBuilder csv = startCsv("Profit & Loss");
    csv.append("Period,")
        .append(report.from().format(dateFormatter))
        .append(" to ")
        .append(report.to().format(dateFormatter))
        .append("\r\n\r\n");

    csv.append("Section,Code,Account,Amount\r\n");
    sectionCsv(csv, "Revenue", report.revenue());
    csvRow(csv, "Total Revenue", "", "", money(report.totalRevenue()));
    sectionCsv(csv, "Cost of Goods Sold", report.cogs());
    csvRow(csv, "Total COGS", "", "", money(report.totalCogs()));
    csvRow(csv, "Gross Profit", "", "", money(report.grossProfit()));
    sectionCsv(csv, "Expenses", report.expenses());
    csvRow(csv, "Total Expenses", "", "", money(report.totalExpenses()));
    csvRow(csv, "Net Profit", "", "", money(report.netProfit()));

    return finishCsv(csv, "Profit & Loss");
  }

  /** Exports Profit & Loss report to Excel format. */
  public byte[] exportProfitAndLossToExcel(ProfitAndLoss report) {
    try (XSSFWorkbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

      Sheet sheet = workbook.createSheet("Profit & Loss");
      Styles styles = new Styles(workbook);
      int rowNum = writeTitle(sheet, styles, "Profit & Loss",
          "Period: " + report.from().format(dateFormatter) + " to " + report.to().format(dateFormatter), 2);
      rowNum++;

      rowNum = writeHeader(sheet, styles, rowNum, "Code", "Account", "Amount");
      rowNum = sectionRows(sheet, styles, rowNum, "Revenue", report.revenue());
      rowNum = totalRow(sheet, styles, rowNum, "Total Revenue", report.totalRevenue());
      rowNum = sectionRows(sheet, styles, rowNum, "Cost of Goods Sold", report.cogs());
      rowNum = totalRow(sheet, styles, rowNum, "Total COGS", report.totalCogs());
      rowNum = totalRow(sheet, styles, rowNum, "Gross Profit", report.grossProfit());
      rowNum = sectionRows(sheet, styles, rowNum, "Expenses", report.expenses());
      rowNum = totalRow(sheet, styles, rowNum, "Total Expenses", report.totalExpenses());
      totalRow(sheet, styles, rowNum, "Net Profit", report.netProfit());

      return finishWorkbook(workbook, sheet, baos, 3, "Profit & Loss");
    } catch (IOException e) {
      log.error("Failed to generate Profit & Loss Excel", e);
      throw new RuntimeException("Failed to generate Profit & Loss Excel: " + e.getMessage(), e);
    }
  }

  // ==================== BALANCE SHEET EXPORTS ====================

  /** Exports Balance Sheet report to CSV format. */
  public byte[] exportBalanceSheetToCsv(BalanceSheet report) {
    StringBuilder csv = startCsv("Balance Sheet");
    csv.append("As of,").append(report.asOf().format(dateFormatter)).append("\r\n");
    csv.append("Status,").append(report.isBalanced() ? "BALANCED" : "OUT OF BALANCE").append("\r\n");
    csv.append("\r\n");

    csv.append("Section,Code,Account,Amount\r\n");
    sectionCsv(csv, "Assets", report.assets());
    csvRow(csv, "Total Assets", "", "", money(report.totalAssets()));
    sectionCsv(csv, "Liabilities", report.liabilities());
    csvRow(csv, "Total Liabilities", "", "", money(report.totalLiabilities()));
    sectionCsv(csv, "Equity", report.equity());
    csvRow(csv, "Equity", "", "Current Earnings", money(report.currentEarnings()));
    csvRow(csv, "Total Equity", "", "", money(report.totalEquity()));

    return finishCsv(csv, "Balance Sheet");
  }

  /** Exports Balance Sheet report to Excel format. */
  public byte[] exportBalanceSheetToExcel(BalanceSheet report) {
    try (XSSFWorkbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

      Sheet sheet = workbook.createSheet("Balance Sheet");
      Styles styles = new Styles(workbook);
      int rowNum = writeTitle(sheet, styles, "Balance Sheet", "As of " + report.asOf().format(dateFormatter), 2);
      sheet.createRow(rowNum++).createCell(0)
          .setCellValue(report.isBalanced() ? "BALANCED" : "OUT OF BALANCE");
      rowNum++;

      rowNum = writeHeader(sheet, styles, rowNum, "Code", "Account", "Amount");
      rowNum = sectionRows(sheet, styles, rowNum, "Assets", report.assets());
      rowNum = totalRow(sheet, styles, rowNum, "Total Assets", report.totalAssets());
      rowNum = sectionRows(sheet, styles, rowNum, "Liabilities", report.liabilities());
      rowNum = totalRow(sheet, styles, rowNum, "Total Liabilities", report.totalLiabilities());
      rowNum = sectionRows(sheet, styles, rowNum, "Equity", report.equity());
      Row earnings = sheet.createRow(rowNum++);
      earnings.createCell(1).setCellValue("Current Earnings");
      moneyCell(earnings, 2, report.currentEarnings(), styles.currency);
      totalRow(sheet, styles, rowNum, "Total Equity", report.totalEquity());

      return finishWorkbook(workbook, sheet, baos, 3, "Balance Sheet");
    } catch (IOException e) {
      log.error("Failed to generate Balance Sheet Excel", e);
      throw new RuntimeException("Failed to generate Balance Sheet Excel: " + e.getMessage(), e);
    }
  }

  // ==================== LEDGER DATA EXPORTS ====================

  /** Exports the chart of accounts. The parent column holds the parent's code. */
  public byte[] exportAccountsToCsv(List<Account> accounts) {
    Map<Long, String> codesById = new HashMap<>();
    for (Account account : accounts) {
      codesById.put(account.getId(), account.getCode());
    }

    StringBuilder csv = startCsv("Chart of Accounts");
    csv.append("\r\n");
    csvRow(csv, "Code", "Name", "Type", "Parent", "Active");
    for (Account account : accounts) {
      csvRow(
          csv,
          account.getCode(),
          account.getName(),
          account.getType().name(),
          account.getParentId() != null
              ? codesById.getOrDefault(account.getParentId(), String.valueOf(account.getParentId()))
              : "",
          account.isActive() ? "Yes" : "No");
    }
    return finishCsv(csv, "Chart of Accounts");
  }

  /** Exports journal entries, one row per line. Entries must have their lines loaded. */
  public byte[] exportJournalToCsv(List<JournalEntry> entries) {
    StringBuilder csv = startCsv("Journal Entries");
    csv.append("\r\n");
    csvRow(
        csv, "Date", "Entry", "Status", "Source", "Source Id", "Memo", "Account Code", "Account",
        "Debit", "Credit", "Line Memo");
    BigDecimal totalDebits = BigDecimal.ZERO;
    BigDecimal totalCredits = BigDecimal.ZERO;
    for (JournalEntry entry : entries) {
      for (JournalLine line : entry.getLines()) {
        csvRow(
            csv,
            entry.getEntryDate().format(dateFormatter),
            String.valueOf(entry.getId()),
            entry.getStatus().name(),
            entry.getSource().name(),
            entry.getSourceId(),
            entry.getMemo(),
            line.getAccount().getCode(),
            line.getAccount().getName(),
            money(line.getDebit()),
            money(line.getCredit()),
            line.getMemo());
        totalDebits = totalDebits.add(line.getDebit());
        totalCredits = totalCredits.add(line.getCredit());
      }
    }
    csvRow(csv, "", "", "", "", "", "", "", "Totals", money(totalDebits), money(totalCredits), "");
    return finishCsv(csv, "Journal Entries");
  }

  // ==================== AGING EXPORTS ====================

  /** Exports AP aging to CSV format. */
  public byte[] exportApAgingToCsv(AgingReport report) {
    return agingCsv(report, "AP Aging", "Vendor");
  }

  /** Exports AR aging to CSV format. */
  public byte[] exportArAgingToCsv(AgingReport report) {
    return agingCsv(report, "AR Aging", "Customer");
  }

  private byte[] agingCsv(AgingReport report, String title, String counterpartyLabel) {
    StringBuilder csv = startCsv(title);
    csv.append("As of,").append(report.asOf().format(dateFormatter)).append("\r\n\r\n");

    csvRow(csv, "Number", counterpartyLabel, "Date", "Due Date", "Total", "Outstanding", "Days Overdue");
    for (AgingLine line : report.lines()) {
      csvRow(
          csv,
          line.number(),
          line.counterparty(),
          line.documentDate().format(dateFormatter),
          line.dueDate() != null ? line.dueDate().format(dateFormatter) : "",
          money(line.total()),
          money(line.outstanding()),
          String.valueOf(line.daysOverdue()));
    }
    csv.append("\r\n");
    csvRow(csv, "Current", "31-60", "61-90", "90+", "Total");
    csvRow(
        csv,
        money(report.current()),
        money(report.days31To60()),
        money(report.days61To90()),
        money(report.over90()),
        money(report.total()));

    return finishCsv(csv, title);
  }

  // ==================== CSV HELPER METHODS ====================

  private StringBuilder startCsv(String title) {
    StringBuilder csv = new StringBuilder();
    csv.append('\uFEFF'); // UTF-8 BOM
    csv.append(escapeCsvField(title)).append("\r\n");
    return csv;
  }

  private byte[] finishCsv(StringBuilder csv, String title) {
    byte[] bytes = csv.toString().getBytes(StandardCharsets.UTF_8);
    log.info("Generated {} CSV ({} bytes)", title, bytes.length);
    return bytes;
  }

  private void sectionCsv(StringBuilder csv, String section, List<ReportLine> lines) {
    for (ReportLine line : lines) {
      csvRow(csv, section, line.account().getCode(), line.account().getName(), money(line.amount()));
    }
  }

  private void csvRow(StringBuilder csv, String... fields) {
    for (int i = 0; i < fields.length; i++) {
      if (i > 0) csv.append(',');
      csv.append(escapeCsvField(fields[i]));
    }
    csv.append("\r\n");
  }

  static String escapeCsvField(String value) {
    if (value == null) return "";
    if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }

  private static String money(BigDecimal amount) {
    return amount != null ? amount.setScale(2, RoundingMode.HALF_UP).toPlainString() : "";
  }

  // ==================== EXCEL HELPER METHODS ====================

  /** Cell styles for one workbook; POI styles cannot be shared across workbooks. */
  private static final class Styles {
    final CellStyle title;
    final CellStyle header;
    final CellStyle section;
    final CellStyle currency;
    final CellStyle total;

    Styles(Workbook workbook) {
      DataFormat format = workbook.createDataFormat();

      title = workbook.createCellStyle();
      Font titleFont = workbook.createFont();
      titleFont.setBold(true);
      titleFont.setFontHeightInPoints((short) 14);
      title.setFont(titleFont);

      header = workbook.createCellStyle();
      header.setFillForegroundColor(IndexedColors.DARK_BLUE.getIndex());
      header.setFillPattern(FillPatternType.SOLID_FOREGROUND);
      Font headerFont = workbook.createFont();
      headerFont.setBold(true);
      headerFont.setColor(IndexedColors.WHITE.getIndex());
      header.setFont(headerFont);
      header.setBorderBottom(BorderStyle.THIN);

      section = workbook.createCellStyle();
      Font sectionFont = workbook.createFont();
      sectionFont.setBold(true);
      sectionFont.setFontHeightInPoints((short) 12);
      section.setFont(sectionFont);

      currency = workbook.createCellStyle();
      currency.setDataFormat(format.getFormat(MONEY_FORMAT));

      total = workbook.createCellStyle();
      Font totalFont = workbook.createFont();
      totalFont.setBold(true);
      total.setFont(totalFont);
      total.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
      total.setFillPattern(FillPatternType.SOLID_FOREGROUND);
      total.setBorderTop(BorderStyle.DOUBLE);
      total.setDataFormat(format.getFormat(MONEY_FORMAT));
    }
  }

  private int writeTitle(Sheet sheet, Styles styles, String title, String subtitle, int lastCol) {
    Cell titleCell = sheet.createRow(0).createCell(0);
    titleCell.setCellValue(title);
    titleCell.setCellStyle(styles.title);
    sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, lastCol));

    sheet.createRow(1).createCell(0).setCellValue(subtitle);
    sheet.addMergedRegion(new CellRangeAddress(1, 1, 0, lastCol));
    return 2;
  }

  private int writeHeader(Sheet sheet, Styles styles, int rowNum, String... headers) {
    Row headerRow = sheet.createRow(rowNum);
    for (int i = 0; i < headers.length; i++) {
      Cell cell = headerRow.createCell(i);
      cell.setCellValue(headers[i]);
      cell.setCellStyle(styles.header);
    }
    return rowNum + 1;
  }

  private int sectionRows(Sheet sheet, Styles styles, int rowNum, String section, List<ReportLine> lines) {
    Cell sectionCell = sheet.createRow(rowNum++).createCell(0);
    sectionCell.setCellValue(section);
    sectionCell.setCellStyle(styles.section);
    for (ReportLine line : lines) {
      Row row = sheet.createRow(rowNum++);
      row.createCell(0).setCellValue(line.account().getCode());
      row.createCell(1).setCellValue(line.account().getName());
      moneyCell(row, 2, line.amount(), styles.currency);
    }
    return rowNum;
  }

  private int totalRow(Sheet sheet, Styles styles, int rowNum, String label, BigDecimal amount) {
    Row row = sheet.createRow(rowNum);
    Cell labelCell = row.createCell(1);
    labelCell.setCellValue(label);
    labelCell.setCellStyle(styles.total);
    moneyCell(row, 2, amount, styles.total);
    return rowNum + 1;
  }

  private void moneyCell(Row row, int col, BigDecimal amount, CellStyle style) {
    Cell cell = row.createCell(col);
    cell.setCellValue(amount != null ? amount.doubleValue() : 0d);
    cell.setCellStyle(style);
  }

  private byte[] finishWorkbook(
      Workbook workbook, Sheet sheet, ByteArrayOutputStream baos, int columns, String title)
      throws IOException {
    for (int i = 0; i < columns; i++) {
      sheet.autoSizeColumn(i);
    }
    workbook.write(baos);
    log.info("Generated {} Excel ({} bytes)", title, baos.size());
    return baos.toByteArray();
  }
}
