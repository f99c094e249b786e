package com.receiptledger.journal;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Money {
  public static final int SCALE = 2;
  public static final BigDecimal TOLERANCE = new BigDecimal("0.01");

  private Money() {}

  public static BigDecimal round(BigDecimal value) {
    return value == null ? null : value.setScale(SCALE, RoundingMode.HALF_UP);
  }

  public static BigDecimal zero() {
    return BigDecimal.ZERO.setScale(SCALE);
  }

  public static boolean withinTolerance(BigDecimal a, BigDecimal b) {
    if (a == null || b == null) {
      return false;
    }
    return a.subtract(b).abs().compareTo(TOLERANCE) <= 0;
  }
}
