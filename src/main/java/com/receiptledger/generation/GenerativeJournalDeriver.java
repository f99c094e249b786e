package com.receiptledger.generation;

import com.receiptledger.extraction.OcrDocument;
import com.receiptledger.journal.JournalEntry;
import com.receiptledger.journal.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class GenerativeJournalDeriver {
  private static final Logger log = LoggerFactory.getLogger(GenerativeJournalDeriver.class);

  private final OpenAiClient openAiClient;
  private final JournalPromptBuilder promptBuilder;
  private final JournalResponseParser responseParser;

  public GenerativeJournalDeriver(OpenAiClient openAiClient,
                                  JournalPromptBuilder promptBuilder,
                                  JournalResponseParser responseParser) {
    this.openAiClient = openAiClient;
    this.promptBuilder = promptBuilder;
    this.responseParser = responseParser;
  }

  /**
   * @throws GenerationException on transport failure, a non-success response or unparsable output
   */
  public JournalEntry derive(OcrDocument ocr) {
    String response = openAiClient.complete(promptBuilder.systemPrompt(), promptBuilder.userPrompt(ocr));
    JournalEntry parsed = responseParser.parse(response);
    if (parsed.totalDebit() == null || parsed.totalCredit() == null) {
      log.debug("Model omitted totals, summing ledger lines");
      parsed = parsed.withTotals(
          parsed.totalDebit() == null ? Money.round(parsed.debitSum()) : parsed.totalDebit(),
          parsed.totalCredit() == null ? Money.round(parsed.creditSum()) : parsed.totalCredit());
    }
    return parsed;
  }
}
