package com.receiptledger.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Keyword rule table for expense accounts. The list order is the match priority and is never re-sorted.
 */
@ConfigurationProperties(prefix = "receipt.classification")
public record ClassificationProperties(
    List<Rule> rules,
    String defaultAccount,
    String defaultDescription
) {
  public static final List<Rule> DEFAULT_RULES = List.of(
      new Rule("Meals & Entertainment", "Restaurant/Food expense", List.of("restaurant", "cafe", "food")),
      new Rule("Fuel & Transportation", "Fuel expense", List.of("gas", "fuel", "petrol")),
      new Rule("Office Supplies", "Office supplies", List.of("office", "supplies", "stationery")),
      new Rule("Travel & Accommodation", "Travel expense", List.of("hotel", "accommodation")),
      new Rule("IT & Software", "Software/IT expense", List.of("software", "subscription", "tech"))
  );

  public ClassificationProperties {
    rules = rules == null || rules.isEmpty() ? DEFAULT_RULES : List.copyOf(rules);
    defaultAccount = defaultAccount == null || defaultAccount.isBlank() ? "General Expenses" : defaultAccount;
    defaultDescription = defaultDescription == null || defaultDescription.isBlank()
        ? "Expense Transaction (OCR processed)"
        : defaultDescription;
  }

  public static ClassificationProperties defaults() {
    return new ClassificationProperties(null, null, null);
  }

  public record Rule(String account, String description, List<String> keywords) {
    public Rule {
      keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
  }
}
