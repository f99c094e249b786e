package com.receiptledger.export;

import com.receiptledger.journal.JournalEntry;
import com.receiptledger.journal.LedgerLine;
import com.receiptledger.journal.LineItem;
import com.receiptledger.journal.Money;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * CSV with one row per ledger line (header fields repeated), followed by a separate line-items block.
 */
@Component
public class JournalCsvExporter {
  static final String LEDGER_HEADER = "Date,Merchant,Description,Reference,Account,Account Description,Type,Amount";
  static final String LINE_ITEM_HEADER = "Description,Quantity,Unit Price,Total,Category,VAT Rate";

  public String export(JournalEntry entry) {
    StringBuilder csv = new StringBuilder(LEDGER_HEADER).append('\n');
    for (LedgerLine line : entry.entries()) {
      csv.append(row(
          entry.date(),
          entry.merchant(),
          entry.description(),
          entry.reference(),
          line.account(),
          line.description(),
          line.type() == null ? "" : line.type().json(),
          amount(line.amount())));
    }
    if (!entry.lineItems().isEmpty()) {
      csv.append("\n\nLine Items\n").append(LINE_ITEM_HEADER).append('\n');
      for (LineItem item : entry.lineItems()) {
        csv.append(row(
            item.description(),
            item.quantity().stripTrailingZeros().toPlainString(),
            amount(item.unitPrice()),
            amount(item.total()),
            item.category(),
            percent(item.vatRate())));
      }
    }
    return csv.toString();
  }

  public String filename(JournalEntry entry, long timestampMs) {
    String merchant = entry.merchant() == null || entry.merchant().isBlank() ? "receipt" : entry.merchant();
    String safe = merchant.replaceAll("[^A-Za-z0-9_-]+", "_");
    return "journal_entry_" + safe + "_" + timestampMs + ".csv";
  }

  private String row(String... values) {
    return Stream.of(values)
        .map(this::quote)
        .collect(Collectors.joining(",", "", "\n"));
  }

  private String quote(String value) {
    String safe = value == null ? "" : value;
    return "\"" + safe.replace("\"", "\"\"") + "\"";
  }

  private String amount(BigDecimal value) {
    return value == null ? "0.00" : Money.round(value).toPlainString();
  }

  private String percent(BigDecimal rate) {
    BigDecimal value = rate == null ? BigDecimal.ZERO : rate;
    return String.format(Locale.ROOT, "%s%%", value.movePointRight(2).setScale(0, RoundingMode.HALF_UP).toPlainString());
  }
}
