package com.receiptledger.classification;

import com.receiptledger.config.ClassificationProperties;
import com.receiptledger.extraction.OcrDocument;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class ExpenseClassifier {
  private final ClassificationProperties properties;

  public ExpenseClassifier(ClassificationProperties properties) {
    this.properties = properties;
  }

  public ExpenseCategory classify(String merchant, OcrDocument ocr) {
    String text = (merchant == null ? "" : merchant) + " " + (ocr == null ? "" : ocr.serialized());
    return classify(text);
  }

  /**
   * First rule with a keyword contained in the text wins, case-insensitively.
   */
  public ExpenseCategory classify(String merchantOrText) {
    String normalized = merchantOrText == null ? "" : merchantOrText.toLowerCase(Locale.ROOT);
    for (ClassificationProperties.Rule rule : properties.rules()) {
      for (String keyword : rule.keywords()) {
        if (!keyword.isBlank() && normalized.contains(keyword.toLowerCase(Locale.ROOT))) {
          return new ExpenseCategory(rule.account(), rule.description(), "Match on '" + keyword + "'");
        }
      }
    }
    return new ExpenseCategory(properties.defaultAccount(), properties.defaultDescription(), "No match");
  }
}
