package com.receiptledger.journal;

import java.math.BigDecimal;

/**
 * Net/VAT/gross split of one receipt total. netAmount + vatAmount equals grossAmount within {@link Money#TOLERANCE}.
 */
public record VatBreakdown(BigDecimal netAmount, BigDecimal vatAmount, BigDecimal grossAmount, BigDecimal vatRate) {

  public static VatBreakdown none(BigDecimal grossAmount) {
    BigDecimal gross = Money.round(grossAmount);
    return new VatBreakdown(gross, Money.zero(), gross, BigDecimal.ZERO);
  }

  public boolean hasVat() {
    return vatAmount != null && vatAmount.signum() > 0;
  }
}
