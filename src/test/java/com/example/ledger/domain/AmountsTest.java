package com.example.ledger.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class AmountsTest {

  @Test
  void normalize_roundsToTwoPlacesAndTreatsNullAsZero() {
    assertEquals(new BigDecimal("10.13"), Amounts.normalize(new BigDecimal("10.125")));
    assertEquals(new BigDecimal("0.00"), Amounts.normalize(null));
  }

  @Test
  void isBalanced_allowsLessThanOneCentDifference() {
    assertTrue(Amounts.isBalanced(new BigDecimal("100.00"), new BigDecimal("100.00")));
    assertTrue(Amounts.isBalanced(new BigDecimal("100.004"), new BigDecimal("100.00")));
    assertFalse(Amounts.isBalanced(new BigDecimal("100.01"), new BigDecimal("100.00")));
  }

  @Test
  void fitsWithin_rejectsAmountsOverLimitBeyondTolerance() {
    assertTrue(Amounts.fitsWithin(new BigDecimal("50.00"), new BigDecimal("50.00")));
    assertTrue(Amounts.fitsWithin(new BigDecimal("50.01"), new BigDecimal("50.00")));
    assertFalse(Amounts.fitsWithin(new BigDecimal("50.02"), new BigDecimal("50.00")));
  }
}
