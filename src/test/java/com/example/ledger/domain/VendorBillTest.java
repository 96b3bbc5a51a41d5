package com.example.ledger.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.ledger.domain.VendorBill.BillStatus;

class VendorBillTest {

  private VendorBill bill;

  @BeforeEach
  void setUp() {
    Vendor vendor = new Vendor(1L, "Acme Supplies");
    bill =
        new VendorBill(
            1L,
            vendor,
            LocalDate.of(2024, 3, 1),
            LocalDate.of(2024, 3, 31),
            new BigDecimal("100000.00"),
            BigDecimal.ZERO,
            new BigDecimal("100000.00"));
  }

  @Test
  void newBill_isDraftAndNotPayable() {
    assertTrue(bill.isDraft());
    assertFalse(bill.isPayable());
  }

  @Test
  void applyPayment_movesThroughPartialToPaid() {
    // Arrange
    bill.markOpened(9L, 50L);
    assertEquals(BillStatus.OPEN, bill.getStatus());

    // Act & Assert
    bill.applyPayment(new BigDecimal("60000.00"));
    assertEquals(BillStatus.PARTIALLY_PAID, bill.getStatus());
    assertEquals(0, new BigDecimal("40000.00").compareTo(bill.getOutstanding()));

    bill.applyPayment(new BigDecimal("40000.00"));
    assertEquals(BillStatus.PAID, bill.getStatus());
    assertEquals(0, BigDecimal.ZERO.compareTo(bill.getOutstanding()));
    assertFalse(bill.isPayable());
  }

  @Test
  void reversePayment_reopensBillAndNeverGoesNegative() {
    // Arrange
    bill.markOpened(9L, 50L);
    bill.applyPayment(new BigDecimal("100000.00"));

    // Act
    bill.reversePayment(new BigDecimal("150000.00"));

    // Assert
    assertEquals(BillStatus.OPEN, bill.getStatus());
    assertEquals(0, BigDecimal.ZERO.compareTo(bill.getPaidAmount()));
  }

  @Test
  void markVoid_isTerminalForStatusRecalculation() {
    // Arrange
    bill.markOpened(9L, 50L);

    // Act
    bill.markVoid(9L);
    bill.recalculateStatus();

    // Assert
    assertTrue(bill.isVoid());
    assertFalse(bill.isPayable());
  }
}
