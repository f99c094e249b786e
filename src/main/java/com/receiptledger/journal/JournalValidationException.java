package com.receiptledger.journal;

import java.util.List;

public class JournalValidationException extends RuntimeException {
  private final List<String> violations;

  public JournalValidationException(List<String> violations) {
    super("Journal entry failed validation: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
