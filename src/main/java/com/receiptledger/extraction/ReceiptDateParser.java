package com.receiptledger.extraction;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses receipt dates. Ambiguous numeric dates are read day first.
 */
@Component
public class ReceiptDateParser {
  private static final Pattern ISO_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ].*");
  private static final List<DateTimeFormatter> FORMATS = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE,
      strict("d/M/uuuu"),
      strict("d-M-uuuu"),
      strict("d.M.uuuu"),
      strict("uuuu/M/d"),
      strict("d/M/uu"),
      strict("d-M-uu"),
      strict("d.M.uu"));

  public Optional<LocalDate> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim();
    if (ISO_PREFIX.matcher(value).matches()) {
      value = value.substring(0, 10);
    }
    for (DateTimeFormatter format : FORMATS) {
      try {
        return Optional.of(LocalDate.parse(value, format));
      } catch (DateTimeParseException ignored) {
        // next format
      }
    }
    return Optional.empty();
  }

  private static DateTimeFormatter strict(String pattern) {
    return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
  }
}
