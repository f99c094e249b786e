package com.receiptledger.journal;

import com.receiptledger.classification.ExpenseCategory;
import com.receiptledger.config.LedgerProperties;
import com.receiptledger.extraction.ExtractedFields;
import com.receiptledger.vat.VatPolicy;
import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Deterministic journal entry from extracted fields. Debits are the net expense plus the VAT portion and the
 * single credit is the gross amount, so the entry balances by construction.
 */
@Component
public class FallbackJournalBuilder {
  private final LedgerProperties properties;
  private final DateTimeFormatter dateFormatter;

  public FallbackJournalBuilder(LedgerProperties properties) {
    this.properties = properties;
    this.dateFormatter = DateTimeFormatter.ofPattern(properties.dateFormat());
  }

  public JournalEntry build(ExtractedFields extracted, ExpenseCategory category, VatBreakdown vat) {
    BigDecimal gross = vat.grossAmount();
    BigDecimal net = vat.netAmount();

    List<LedgerLine> entries = new ArrayList<>();
    entries.add(LedgerLine.debit(category.account(), net, category.description()));
    if (vat.hasVat()) {
      entries.add(LedgerLine.debit(
          properties.vatAccount(),
          vat.vatAmount(),
          "VAT " + VatPolicy.percentLabel(vat.vatRate())));
    }
    entries.add(LedgerLine.credit(properties.cashAccount(), gross, "Payment"));

    LineItem item = new LineItem(
        category.description(),
        BigDecimal.ONE,
        net,
        net,
        vat.vatRate(),
        category.account());

    String merchant = extracted.merchant();
    return new JournalEntry(
        extracted.dateValue().map(dateFormatter::format).orElse(null),
        merchant,
        merchant + " - " + category.description(),
        properties.fallbackReference(),
        List.of(item),
        entries,
        vat,
        gross,
        gross);
  }
}
