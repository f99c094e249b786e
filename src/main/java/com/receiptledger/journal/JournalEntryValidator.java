package com.receiptledger.journal;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class JournalEntryValidator {

  public void validate(JournalEntry entry) {
    List<String> violations = violations(entry);
    if (!violations.isEmpty()) {
      throw new JournalValidationException(violations);
    }
  }

  public List<String> violations(JournalEntry entry) {
    List<String> violations = new ArrayList<>();
    if (entry == null) {
      violations.add("entry is missing");
      return violations;
    }
    if (isBlank(entry.date())) {
      violations.add("date is missing");
    }
    if (isBlank(entry.merchant())) {
      violations.add("merchant is missing");
    }
    if (entry.entries().isEmpty()) {
      violations.add("entries are empty");
    }
    for (int i = 0; i < entry.entries().size(); i++) {
      LedgerLine line = entry.entries().get(i);
      if (line.type() == null) {
        violations.add("entries[" + i + "].type is missing");
      }
      if (line.account() == null || line.account().isBlank()) {
        violations.add("entries[" + i + "].account is missing");
      }
      if (line.amount() == null || line.amount().signum() < 0) {
        violations.add("entries[" + i + "].amount must be non-negative");
      }
    }
    violations.addAll(vatViolations(entry.vatBreakdown()));
    BigDecimal totalDebit = entry.totalDebit();
    BigDecimal totalCredit = entry.totalCredit();
    if (totalDebit == null || totalCredit == null) {
      violations.add("totals are missing");
      return violations;
    }
    if (!Money.withinTolerance(totalDebit, totalCredit)) {
      violations.add("totalDebit " + totalDebit + " != totalCredit " + totalCredit);
    }
    if (!Money.withinTolerance(totalDebit, entry.debitSum())) {
      violations.add("totalDebit " + totalDebit + " != debit lines " + entry.debitSum());
    }
    if (!Money.withinTolerance(totalCredit, entry.creditSum())) {
      violations.add("totalCredit " + totalCredit + " != credit lines " + entry.creditSum());
    }
    return violations;
  }

  private List<String> vatViolations(VatBreakdown vat) {
    if (vat == null) {
      return List.of("vatBreakdown is missing");
    }
    if (vat.netAmount() == null || vat.vatAmount() == null || vat.grossAmount() == null || vat.vatRate() == null) {
      return List.of("vatBreakdown fields are missing");
    }
    List<String> violations = new ArrayList<>();
    if (vat.netAmount().signum() < 0 || vat.vatAmount().signum() < 0
        || vat.grossAmount().signum() < 0 || vat.vatRate().signum() < 0) {
      violations.add("vatBreakdown values must be non-negative");
    }
    BigDecimal split = vat.netAmount().add(vat.vatAmount());
    if (!Money.withinTolerance(split, vat.grossAmount())) {
      violations.add("vatBreakdown net " + vat.netAmount() + " + vat " + vat.vatAmount()
          + " != gross " + vat.grossAmount());
    }
    return violations;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
