package com.receiptledger.extraction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Amount, date and merchant pulled out of an OCR result. The amount is always set; the date may be absent.
 */
public record ExtractedFields(BigDecimal amount, LocalDate date, String merchant) {

  public Optional<LocalDate> dateValue() {
    return Optional.ofNullable(date);
  }
}
