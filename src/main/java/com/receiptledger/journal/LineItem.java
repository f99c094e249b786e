package com.receiptledger.journal;

import java.math.BigDecimal;

public record LineItem(
    String description,
    BigDecimal quantity,
    BigDecimal unitPrice,
    BigDecimal total,
    BigDecimal vatRate,
    String category
) {
  public LineItem {
    quantity = quantity == null ? BigDecimal.ONE : quantity;
    vatRate = vatRate == null ? BigDecimal.ZERO : vatRate;
  }
}
