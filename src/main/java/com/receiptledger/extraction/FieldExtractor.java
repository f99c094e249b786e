package com.receiptledger.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.receiptledger.config.ExtractionProperties;
import com.receiptledger.config.LedgerProperties;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves amount, date and merchant from an OCR result. Structured vendor keys are trusted first,
 * free-text scanning is the last resort, and every path ends in a documented default instead of an error.
 */
@Component
public class FieldExtractor {
  private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);
  private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");

  private final ExtractionProperties properties;
  private final LedgerProperties ledgerProperties;
  private final ReceiptDateParser dateParser;
  private final TextPatternScanner scanner;

  public FieldExtractor(ExtractionProperties properties,
                        LedgerProperties ledgerProperties,
                        ReceiptDateParser dateParser,
                        TextPatternScanner scanner) {
    this.properties = properties;
    this.ledgerProperties = ledgerProperties;
    this.dateParser = dateParser;
    this.scanner = scanner;
  }

  public ExtractedFields extract(OcrDocument ocr) {
    OcrDocument document = ocr == null ? OcrDocument.empty() : ocr;
    return new ExtractedFields(
        extractAmount(document),
        extractDate(document).orElse(null),
        extractMerchant(document));
  }

  public BigDecimal extractAmount(OcrDocument ocr) {
    for (String key : properties.amountKeys()) {
      Optional<JsonNode> node = ocr.field(key).filter(FieldExtractor::isFiniteNumber);
      if (node.isPresent() && node.get().decimalValue().signum() > 0) {
        log.debug("Amount from numeric field {}: {}", key, node.get());
        return node.get().decimalValue();
      }
    }
    for (String key : properties.amountKeys()) {
      Optional<BigDecimal> parsed = ocr.text(key).flatMap(FieldExtractor::parseAmountText);
      if (parsed.isPresent() && parsed.get().signum() > 0) {
        log.debug("Amount parsed from text field {}: {}", key, parsed.get());
        return parsed.get();
      }
    }
    Optional<BigDecimal> scanned = scanner.maxAmount(ocr.serialized());
    if (scanned.isPresent()) {
      log.info("Amount taken from text scan (largest number): {}", scanned.get());
      return scanned.get();
    }
    log.info("No amount found in OCR result, using default {}", ledgerProperties.defaultAmount());
    return ledgerProperties.defaultAmount();
  }

  public Optional<LocalDate> extractDate(OcrDocument ocr) {
    for (String key : properties.dateKeys()) {
      Optional<LocalDate> parsed = ocr.text(key).flatMap(dateParser::parse);
      if (parsed.isPresent()) {
        log.debug("Date from field {}: {}", key, parsed.get());
        return parsed;
      }
    }
    Optional<LocalDate> scanned = scanner.firstDate(ocr.serialized());
    if (scanned.isPresent()) {
      log.info("Date taken from text scan: {}", scanned.get());
      return scanned;
    }
    log.info("No date found in OCR result");
    return Optional.empty();
  }

  public String extractMerchant(OcrDocument ocr) {
    for (String key : properties.merchantKeys()) {
      Optional<String> merchant = ocr.text(key);
      if (merchant.isPresent()) {
        log.debug("Merchant from field {}: {}", key, merchant.get());
        return merchant.get();
      }
    }
    Optional<String> scanned = scanner.firstMerchant(ocr.serialized());
    if (scanned.isPresent()) {
      log.info("Merchant taken from text scan: {}", scanned.get());
      return scanned.get();
    }
    log.info("No merchant found in OCR result, using '{}'", properties.unknownMerchant());
    return properties.unknownMerchant();
  }

  // Jackson reads out-of-range literals such as 1e400 as an infinite double.
  private static boolean isFiniteNumber(JsonNode node) {
    if (!node.isNumber()) {
      return false;
    }
    return !(node.isDouble() || node.isFloat()) || Double.isFinite(node.doubleValue());
  }

  /**
   * Reads "12.50", "EUR 1,234.56" or "12,50 €". A comma is a decimal separator only when it is the last
   * separator and followed by one or two digits.
   */
  static Optional<BigDecimal> parseAmountText(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String value = raw.replaceAll("[^\\d.,]", "");
    int lastComma = value.lastIndexOf(',');
    int lastDot = value.lastIndexOf('.');
    if (lastComma > lastDot && value.length() - lastComma - 1 <= 2 && value.length() - lastComma - 1 > 0) {
      value = value.replace(".", "").replace(',', '.');
    } else {
      value = value.replace(",", "");
    }
    Matcher matcher = NUMBER.matcher(value);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of(new BigDecimal(matcher.group()));
  }
}
