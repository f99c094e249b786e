package com.receiptledger.journal;

import java.math.BigDecimal;

public record LedgerLine(EntryType type, String account, BigDecimal amount, String description) {

  public static LedgerLine debit(String account, BigDecimal amount, String description) {
    return new LedgerLine(EntryType.DEBIT, account, amount, description);
  }

  public static LedgerLine credit(String account, BigDecimal amount, String description) {
    return new LedgerLine(EntryType.CREDIT, account, amount, description);
  }
}
