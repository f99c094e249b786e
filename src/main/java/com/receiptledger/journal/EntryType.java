package com.receiptledger.journal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Side of a ledger line. Serialized in lower case ("debit" / "credit").
 */
public enum EntryType {
  DEBIT,
  CREDIT;

  @JsonValue
  public String json() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static EntryType fromJson(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return EntryType.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
