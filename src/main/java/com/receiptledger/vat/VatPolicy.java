package com.receiptledger.vat;

import com.receiptledger.config.LedgerProperties;
import com.receiptledger.journal.Money;
import com.receiptledger.journal.VatBreakdown;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * VAT is only split out when the document itself mentions it. A rate is never assumed for a receipt that
 * shows none.
 */
@Component
public class VatPolicy {
  private static final Logger log = LoggerFactory.getLogger(VatPolicy.class);
  private static final int WORKING_SCALE = 10;

  private final LedgerProperties properties;

  public VatPolicy(LedgerProperties properties) {
    this.properties = properties;
  }

  public VatBreakdown computeVat(BigDecimal grossAmount, String ocrText) {
    return computeVat(grossAmount, ocrText, properties.standardVatRate());
  }

  public VatBreakdown computeVat(BigDecimal grossAmount, String ocrText, BigDecimal standardRate) {
    BigDecimal gross = grossAmount == null ? BigDecimal.ZERO : grossAmount;
    if (standardRate == null || standardRate.signum() <= 0 || !hasVatIndicator(ocrText, standardRate)) {
      log.info("No VAT indicator on receipt, treating total as net amount");
      return VatBreakdown.none(gross);
    }
    BigDecimal net = gross.divide(BigDecimal.ONE.add(standardRate), WORKING_SCALE, RoundingMode.HALF_UP);
    BigDecimal roundedGross = Money.round(gross);
    BigDecimal roundedNet = Money.round(net);
    // VAT is the remainder of the rounded figures so net + vat equals gross exactly.
    BigDecimal vat = roundedGross.subtract(roundedNet);
    log.info("VAT indicator found, splitting {} at rate {}", roundedGross, standardRate);
    return new VatBreakdown(roundedNet, vat, roundedGross, standardRate);
  }

  public boolean hasVatIndicator(String ocrText, BigDecimal standardRate) {
    if (ocrText == null || ocrText.isEmpty()) {
      return false;
    }
    String lower = ocrText.toLowerCase(Locale.ROOT);
    return lower.contains("vat")
        || lower.contains("tax")
        || (standardRate != null && lower.contains(percentLabel(standardRate)));
  }

  public static String percentLabel(BigDecimal rate) {
    return rate.movePointRight(2).stripTrailingZeros().toPlainString() + "%";
  }
}
