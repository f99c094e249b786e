package com.receiptledger.generation;

import com.receiptledger.config.ClassificationProperties;
import com.receiptledger.config.LedgerProperties;
import com.receiptledger.extraction.OcrDocument;
import com.receiptledger.vat.VatPolicy;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class JournalPromptBuilder {
  static final String SYSTEM_PROMPT = "You are an expert bookkeeper preparing double-entry journal entries from "
      + "receipts and invoices. Respond with ONLY one valid JSON object, no additional text or formatting.";

  private static final String OUTPUT_SCHEMA = """
      {
        "date": "DD/MM/YYYY",
        "description": "Merchant name - Brief description",
        "reference": "Invoice/receipt number or N/A",
        "merchant": "Merchant/Vendor name",
        "entries": [
          {"type": "debit", "account": "Specific Expense Account Name", "amount": 0.00, "description": "Item/service description"},
          {"type": "debit", "account": "%s", "amount": 0.00, "description": "VAT (only if explicitly shown on the receipt)"},
          {"type": "credit", "account": "%s", "amount": 0.00, "description": "Payment method"}
        ],
        "lineItems": [
          {"description": "Item/service name", "quantity": 1, "unitPrice": 0.00, "total": 0.00, "vatRate": 0.00, "category": "Expense category"}
        ],
        "vatBreakdown": {"netAmount": 0.00, "vatAmount": 0.00, "grossAmount": 0.00, "vatRate": 0.00},
        "totalDebit": 0.00,
        "totalCredit": 0.00
      }""";

  private final LedgerProperties ledgerProperties;
  private final ClassificationProperties classificationProperties;

  public JournalPromptBuilder(LedgerProperties ledgerProperties, ClassificationProperties classificationProperties) {
    this.ledgerProperties = ledgerProperties;
    this.classificationProperties = classificationProperties;
  }

  public String systemPrompt() {
    return SYSTEM_PROMPT;
  }

  public String userPrompt(OcrDocument ocr) {
    String rate = VatPolicy.percentLabel(ledgerProperties.standardVatRate());
    String accounts = classificationProperties.rules().stream()
        .map(rule -> "   - " + String.join("/", rule.keywords()) + " -> \"" + rule.account() + "\"")
        .collect(Collectors.joining("\n"));
    return "Analyze this receipt/invoice OCR data and return ONLY a JSON object for a double-entry journal entry.\n\n"
        + "OCR Data: " + ocr.serialized() + "\n\n"
        + "INSTRUCTIONS:\n"
        + "1. Identify the merchant and choose specific expense accounts, for example:\n"
        + accounts + "\n"
        + "   - anything else -> \"" + classificationProperties.defaultAccount() + "\"\n"
        + "2. Look for individual items or services. Use multiple debit entries when items belong to different "
        + "expense categories.\n"
        + "3. VAT: do NOT assume VAT exists. Only include a VAT entry when the receipt shows a VAT line, a tax "
        + "column or an explicit VAT amount. Do not calculate " + rate + " VAT unless it is stated on the "
        + "receipt. Without VAT set vatAmount and vatRate to 0.00 and treat the total as the net amount.\n"
        + "4. The sum of debit amounts must equal the sum of credit amounts, and totalDebit and totalCredit "
        + "must both equal that sum.\n\n"
        + "Requirements:\n"
        + "- Date format: DD/MM/YYYY\n"
        + "- Amounts as plain numbers with two decimals\n\n"
        + "Return exactly this JSON structure with no additional text:\n"
        + OUTPUT_SCHEMA.formatted(ledgerProperties.vatAccount(), ledgerProperties.cashAccount());
  }
}
