package com.example.ledger.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.ledger.exception.InvalidFormatException;

/**
 * Parses bank statement CSV exports into normalized rows. Stateless; touches no repository.
 *
 * <p>The first non-blank line must be a header naming a date column and either an amount column
 * or debit/credit columns, in any order. With split columns the amount is credit minus debit, so
 * money in is positive. Rows whose date or amount cannot be read are skipped with a warning.
 */
@Component
public class BankStatementCsvParser {

  private static final Logger log = LoggerFactory.getLogger(BankStatementCsvParser.class);

  private static final List<DateTimeFormatter> DATE_FORMATS =
      List.of(
          strict("uuuu-MM-dd"),
          strict("dd/MM/uuuu"),
          strict("dd-MM-uuuu"));

  private static final Set<String> DATE_HEADERS =
      Set.of("date", "posted", "posted date", "posting date", "transaction date", "txn date");
  private static final Set<String> AMOUNT_HEADERS = Set.of("amount", "value");
  private static final Set<String> DEBIT_HEADERS = Set.of("debit", "withdrawal", "money out");
  private static final Set<String> CREDIT_HEADERS = Set.of("credit", "deposit", "money in");
  private static final Set<String> DESCRIPTION_HEADERS =
      Set.of("description", "memo", "details", "payee", "narrative");
  private static final Set<String> REFERENCE_HEADERS =
      Set.of("ref", "reference", "transaction", "transaction id", "transaction ref");

  /** One statement line. Positive amounts are money in. */
  public record BankStatementRow(
      LocalDate date, BigDecimal amount, String description, String reference) {}

  /**
   * Parses statement text.
   *
   * @throws InvalidFormatException if the text is empty, has no data rows, the header lacks a
   *     date or amount column, or every data row is unreadable
   */
  public List<BankStatementRow> parse(String text) {
    if (text == null || text.isBlank()) {
      throw new InvalidFormatException("Bank statement is empty");
    }
    List<String> lines = new ArrayList<>();
    for (String line : text.replace("\uFEFF", "").split("\r?\n")) {
      if (!line.isBlank()) {
        lines.add(line);
      }
    }
    if (lines.size() < 2) {
      throw new InvalidFormatException("Bank statement has a header but no transaction rows");
    }

    List<String> headers = splitLine(lines.get(0));
    int dateCol = findColumn(headers, DATE_HEADERS);
    int amountCol = findColumn(headers, AMOUNT_HEADERS);
    int debitCol = findColumn(headers, DEBIT_HEADERS);
    int creditCol = findColumn(headers, CREDIT_HEADERS);
    int descCol = findColumn(headers, DESCRIPTION_HEADERS);
    int refCol = findColumn(headers, REFERENCE_HEADERS);

    if (dateCol < 0) {
      throw new InvalidFormatException("Bank statement header has no date column: " + headers);
    }
    if (amountCol < 0 && debitCol < 0 && creditCol < 0) {
      throw new InvalidFormatException(
          "Bank statement header has no amount or debit/credit column: " + headers);
    }

    List<BankStatementRow> rows = new ArrayList<>();
    for (int i = 1; i < lines.size(); i++) {
      List<String> values = splitLine(lines.get(i));
      int lineNo = i + 1;

      LocalDate date = parseDate(cell(values, dateCol));
      if (date == null) {
        log.warn("Skipping statement line {}: unreadable date '{}'", lineNo, cell(values, dateCol));
        continue;
      }

      BigDecimal amount;
      if (amountCol >= 0) {
        amount = parseAmount(cell(values, amountCol));
      } else {
        BigDecimal debit = parseAmount(cell(values, debitCol));
        BigDecimal credit = parseAmount(cell(values, creditCol));
        amount =
            debit == null && credit == null
                ? null
                : orZero(credit).subtract(orZero(debit).abs());
      }
      if (amount == null) {
        log.warn("Skipping statement line {}: unreadable amount", lineNo);
        continue;
      }

      rows.add(
          new BankStatementRow(
              date, amount.setScale(2, RoundingMode.HALF_UP),
              emptyToNull(cell(values, descCol)), emptyToNull(cell(values, refCol))));
    }

    int skipped = lines.size() - 1 - rows.size();
    if (rows.isEmpty()) {
      throw new InvalidFormatException(
          "Bank statement has no readable transaction rows; " + skipped + " line(s) skipped");
    }
    log.debug("Parsed {} of {} statement rows", rows.size(), lines.size() - 1);
    return rows;
  }

  private static DateTimeFormatter strict(String pattern) {
    return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
  }

  static LocalDate parseDate(String value) {
    if (value == null || value.isBlank()) return null;
    String trimmed = value.trim();
    for (DateTimeFormatter format : DATE_FORMATS) {
      try {
        return LocalDate.parse(trimmed, format);
      } catch (DateTimeParseException e) {
        // next format
      }
    }
    return null;
  }

  /** Reads "1,234.50", "$-12.00", "(45.00)" and similar. Parentheses mean negative. */
  static BigDecimal parseAmount(String value) {
    if (value == null || value.isBlank()) return null;
    String trimmed = value.trim();
    boolean negative = false;
    if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
      negative = true;
      trimmed = trimmed.substring(1, trimmed.length() - 1);
    }
    if (trimmed.contains("-")) {
      negative = !negative;
    }
    String digits = trimmed.replaceAll("[^0-9.]", "");
    if (digits.isEmpty()) return null;
    try {
      BigDecimal amount = new BigDecimal(digits);
      return negative ? amount.negate() : amount;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Splits one CSV line, honouring double quotes and "" escapes inside quoted fields. */
  static List<String> splitLine(String line) {
    List<String> values = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inQuotes = false;

    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (c == '"') {
        if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
          current.append('"');
          i++;
        } else {
          inQuotes = !inQuotes;
        }
      } else if (c == ',' && !inQuotes) {
        values.add(current.toString().trim());
        current = new StringBuilder();
      } else {
        current.append(c);
      }
    }
    values.add(current.toString().trim());
    return values;
  }

  private static int findColumn(List<String> headers, Set<String> aliases) {
    for (int i = 0; i < headers.size(); i++) {
      if (aliases.contains(headers.get(i).toLowerCase().trim())) {
        return i;
      }
    }
    return -1;
  }

  private static String cell(List<String> values, int col) {
    return col >= 0 && col < values.size() ? values.get(col) : null;
  }

  private static String emptyToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value != null ? value : BigDecimal.ZERO;
  }
}
