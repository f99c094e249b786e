package com.receiptledger.journal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import java.util.List;

/**
 * A double-entry record derived from one receipt. Immutable once constructed.
 */
public record JournalEntry(
    String date,
    String merchant,
    String description,
    String reference,
    List<LineItem> lineItems,
    List<LedgerLine> entries,
    VatBreakdown vatBreakdown,
    BigDecimal totalDebit,
    BigDecimal totalCredit
) {
  public JournalEntry {
    lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    entries = entries == null ? List.of() : List.copyOf(entries);
  }

  public BigDecimal debitSum() {
    return sum(EntryType.DEBIT);
  }

  public BigDecimal creditSum() {
    return sum(EntryType.CREDIT);
  }

  @JsonIgnore
  public boolean isBalanced() {
    return Money.withinTolerance(totalDebit, totalCredit);
  }

  public JournalEntry withTotals(BigDecimal debit, BigDecimal credit) {
    return new JournalEntry(date, merchant, description, reference, lineItems, entries, vatBreakdown, debit, credit);
  }

  private BigDecimal sum(EntryType type) {
    return entries.stream()
        .filter(line -> line.type() == type && line.amount() != null)
        .map(LedgerLine::amount)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
