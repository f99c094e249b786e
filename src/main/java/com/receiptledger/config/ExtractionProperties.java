package com.receiptledger.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ordered vendor key names consulted before any free-text scanning. Earlier keys win.
 */
@ConfigurationProperties(prefix = "receipt.extraction")
public record ExtractionProperties(
    List<String> amountKeys,
    List<String> dateKeys,
    List<String> merchantKeys,
    String unknownMerchant
) {
  public ExtractionProperties {
    amountKeys = amountKeys == null || amountKeys.isEmpty() ? List.of("total", "totalAmount") : List.copyOf(amountKeys);
    dateKeys = dateKeys == null || dateKeys.isEmpty() ? List.of("date", "purchaseDate") : List.copyOf(dateKeys);
    merchantKeys = merchantKeys == null || merchantKeys.isEmpty()
        ? List.of("establishment", "merchantName", "vendor")
        : List.copyOf(merchantKeys);
    unknownMerchant = unknownMerchant == null || unknownMerchant.isBlank() ? "Unknown Merchant" : unknownMerchant;
  }

  public static ExtractionProperties defaults() {
    return new ExtractionProperties(null, null, null, null);
  }
}
