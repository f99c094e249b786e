package com.receiptledger.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "receipt.ledger")
public record LedgerProperties(
    @DecimalMin("0.00") @DecimalMax("1.00") BigDecimal standardVatRate,
    @DecimalMin("0.00") BigDecimal defaultAmount,
    String dateFormat,
    String fallbackReference,
    String cashAccount,
    String vatAccount
) {
  public static final BigDecimal DEFAULT_VAT_RATE = new BigDecimal("0.19");
  public static final BigDecimal DEFAULT_AMOUNT = new BigDecimal("10.00");

  public LedgerProperties {
    standardVatRate = standardVatRate == null ? DEFAULT_VAT_RATE : standardVatRate;
    defaultAmount = defaultAmount == null ? DEFAULT_AMOUNT : defaultAmount;
    dateFormat = isBlank(dateFormat) ? "dd/MM/uuuu" : dateFormat;
    fallbackReference = isBlank(fallbackReference) ? "AUTO-GENERATED" : fallbackReference;
    cashAccount = isBlank(cashAccount) ? "Cash/Bank Account" : cashAccount;
    vatAccount = isBlank(vatAccount) ? "VAT Input Tax" : vatAccount;
  }

  public static LedgerProperties defaults() {
    return new LedgerProperties(null, null, null, null, null, null);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
