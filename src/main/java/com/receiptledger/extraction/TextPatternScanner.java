package com.receiptledger.extraction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Last-resort regex search over the serialized OCR result, used only after the structured keys came up empty.
 * Each method is independent so the ordering of strategies stays in {@link FieldExtractor}.
 */
@Component
public class TextPatternScanner {
  static final int MIN_MERCHANT_LENGTH = 4;
  static final int MAX_MERCHANT_LENGTH = 49;

  private static final Pattern AMOUNT_TOKEN = Pattern.compile("\\d[\\d,]*(?:\\.\\d{1,2})?");
  private static final Pattern DATE_TOKEN = Pattern.compile("\\d{1,2}[/\\-.]\\d{1,2}[/\\-.]\\d{2,4}");
  private static final Pattern CAPITALIZED_RUN = Pattern.compile("[A-Z][A-Z\\s&]+[A-Z]");
  // JSON string token; group 2 is set when the token is an object key.
  private static final Pattern QUOTED_STRING = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"(\\s*:)?");
  private static final Pattern HAS_LETTER = Pattern.compile("[A-Za-z]");

  private final ReceiptDateParser dateParser;

  public TextPatternScanner(ReceiptDateParser dateParser) {
    this.dateParser = dateParser;
  }

  /**
   * Largest decimal-looking token in the text. The grand total is usually the biggest number on a receipt.
   */
  public Optional<BigDecimal> maxAmount(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    BigDecimal max = null;
    Matcher matcher = AMOUNT_TOKEN.matcher(text);
    while (matcher.find()) {
      BigDecimal candidate = new BigDecimal(matcher.group().replace(",", ""));
      if (max == null || candidate.compareTo(max) > 0) {
        max = candidate;
      }
    }
    return Optional.ofNullable(max);
  }

  public Optional<LocalDate> firstDate(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    Matcher matcher = DATE_TOKEN.matcher(text);
    while (matcher.find()) {
      Optional<LocalDate> parsed = dateParser.parse(matcher.group());
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    return Optional.empty();
  }

  /**
   * Capitalized word runs first, then quoted values; the first candidate of plausible length wins.
   */
  public Optional<String> firstMerchant(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    Matcher runs = CAPITALIZED_RUN.matcher(text);
    while (runs.find()) {
      Optional<String> candidate = plausibleName(runs.group());
      if (candidate.isPresent()) {
        return candidate;
      }
    }
    Matcher quoted = QUOTED_STRING.matcher(text);
    while (quoted.find()) {
      String value = quoted.group(1);
      if (quoted.group(2) != null || !HAS_LETTER.matcher(value).find()) {
        continue;
      }
      Optional<String> candidate = plausibleName(value);
      if (candidate.isPresent()) {
        return candidate;
      }
    }
    return Optional.empty();
  }

  private Optional<String> plausibleName(String raw) {
    String trimmed = raw.trim();
    if (trimmed.length() < MIN_MERCHANT_LENGTH || trimmed.length() > MAX_MERCHANT_LENGTH) {
      return Optional.empty();
    }
    return Optional.of(trimmed);
  }
}
