package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.ledger.exception.InvalidFormatException;
import com.example.ledger.service.BankStatementCsvParser.BankStatementRow;

class BankStatementCsvParserTest {

  private final BankStatementCsvParser parser = new BankStatementCsvParser();

  @Test
  void parse_amountColumn_readsQuotedFieldsAndReference() {
    String csv =
        "\uFEFFDate,Description,Amount,Reference\r\n"
            + "2024-03-01,\"Acme Produce, invoice \"\"BILL-4\"\"\",-1250.00,TRX-1\r\n"
            + "2024-03-02,Card settlement,\"1,980.40\",\r\n";

    List<BankStatementRow> rows = parser.parse(csv);

    assertEquals(2, rows.size());
    BankStatementRow first = rows.get(0);
    assertEquals(LocalDate.of(2024, 3, 1), first.date());
    assertEquals(new BigDecimal("-1250.00"), first.amount());
    assertEquals("Acme Produce, invoice \"BILL-4\"", first.description());
    assertEquals("TRX-1", first.reference());

    BankStatementRow second = rows.get(1);
    assertEquals(new BigDecimal("1980.40"), second.amount());
    assertNull(second.reference());
  }

  @Test
  void parse_debitAndCreditColumns_signsMoneyOutNegative() {
    String csv =
        "Posted Date,Details,Money Out,Money In\n"
            + "05/04/2024,Rent,900.00,\n"
            + "06/04/2024,Deposit,,250.5\n";

    List<BankStatementRow> rows = parser.parse(csv);

    assertEquals(LocalDate.of(2024, 4, 5), rows.get(0).date());
    assertEquals(new BigDecimal("-900.00"), rows.get(0).amount());
    assertEquals(new BigDecimal("250.50"), rows.get(1).amount());
  }

  @Test
  void parse_skipsRowsWithUnreadableDateOrAmount() {
    String csv =
        "date,amount,memo\n"
            + "not a date,10.00,bad date\n"
            + "2024-05-01,n/a,bad amount\n"
            + "2024-05-02,10.00,good\n";

    List<BankStatementRow> rows = parser.parse(csv);

    assertEquals(1, rows.size());
    assertEquals("good", rows.get(0).description());
  }

  @Test
  void parse_skipsImpossibleCalendarDates() {
    String csv =
        "Date,Amount,Description\n"
            + "31/02/2024,10.00,February 31\n"
            + "2024-04-31,5.00,April 31\n"
            + "29-02-2024,7.00,leap day\n";

    List<BankStatementRow> rows = parser.parse(csv);

    assertEquals(1, rows.size());
    assertEquals(LocalDate.of(2024, 2, 29), rows.get(0).date());
    assertEquals("leap day", rows.get(0).description());
  }

  @Test
  void parse_whenEveryRowIsUnreadable_throwsInvalidFormat() {
    InvalidFormatException ex =
        assertThrows(
            InvalidFormatException.class,
            () -> parser.parse("Date,Amount\n31/02/2024,10.00\n2024-04-31,5.00\n"));
    assertTrue(ex.getMessage().contains("2 line(s) skipped"));
  }

  @Test
  void parse_headerOnly_throwsInvalidFormat() {
    assertThrows(InvalidFormatException.class, () -> parser.parse("Date,Amount\n\n"));
  }

  @Test
  void parse_blank_throwsInvalidFormat() {
    assertThrows(InvalidFormatException.class, () -> parser.parse("  "));
  }

  @Test
  void parse_withoutAmountColumns_throwsInvalidFormat() {
    assertThrows(
        InvalidFormatException.class, () -> parser.parse("Date,Description\n2024-01-01,Coffee\n"));
  }

  @Test
  void parseAmount_handlesParenthesesAndCurrencySymbols() {
    assertEquals(new BigDecimal("-45.00"), BankStatementCsvParser.parseAmount("(45.00)"));
    assertEquals(new BigDecimal("-12.00"), BankStatementCsvParser.parseAmount("$-12.00"));
    assertEquals(new BigDecimal("1234.50"), BankStatementCsvParser.parseAmount("1,234.50"));
    assertNull(BankStatementCsvParser.parseAmount("  "));
  }

  @Test
  void parseDate_acceptsThreeFormats() {
    LocalDate expected = LocalDate.of(2024, 12, 31);
    assertEquals(expected, BankStatementCsvParser.parseDate("2024-12-31"));
    assertEquals(expected, BankStatementCsvParser.parseDate("31/12/2024"));
    assertEquals(expected, BankStatementCsvParser.parseDate("31-12-2024"));
    assertNull(BankStatementCsvParser.parseDate("12/31/2024"));
    assertNull(BankStatementCsvParser.parseDate("2023-02-29"));
  }
}
