package com.receiptledger.service;

import com.receiptledger.classification.ExpenseCategory;
import com.receiptledger.classification.ExpenseClassifier;
import com.receiptledger.extraction.ExtractedFields;
import com.receiptledger.extraction.FieldExtractor;
import com.receiptledger.extraction.OcrDocument;
import com.receiptledger.generation.GenerativeJournalDeriver;
import com.receiptledger.journal.FallbackJournalBuilder;
import com.receiptledger.journal.JournalEntry;
import com.receiptledger.journal.JournalEntryValidator;
import com.receiptledger.journal.JournalValidationException;
import com.receiptledger.journal.VatBreakdown;
import com.receiptledger.vat.VatPolicy;
import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tries the generative model first and falls back to the deterministic builder on any failure, so callers
 * always receive a validated, balanced entry.
 */
@Service
public class JournalDerivationService {
  private static final Logger log = LoggerFactory.getLogger(JournalDerivationService.class);

  private final GenerativeJournalDeriver generativeDeriver;
  private final FieldExtractor fieldExtractor;
  private final ExpenseClassifier classifier;
  private final VatPolicy vatPolicy;
  private final FallbackJournalBuilder fallbackBuilder;
  private final JournalEntryValidator validator;
  private final Clock clock;

  public JournalDerivationService(GenerativeJournalDeriver generativeDeriver,
                                  FieldExtractor fieldExtractor,
                                  ExpenseClassifier classifier,
                                  VatPolicy vatPolicy,
                                  FallbackJournalBuilder fallbackBuilder,
                                  JournalEntryValidator validator,
                                  Clock clock) {
    this.generativeDeriver = generativeDeriver;
    this.fieldExtractor = fieldExtractor;
    this.classifier = classifier;
    this.vatPolicy = vatPolicy;
    this.fallbackBuilder = fallbackBuilder;
    this.validator = validator;
    this.clock = clock;
  }

  public JournalEntry derive(OcrDocument ocr) {
    return deriveDetailed(ocr).entry();
  }

  /**
   * @throws JournalValidationException only if the fallback entry itself is invalid
   */
  public DerivationResult deriveDetailed(OcrDocument ocr) {
    OcrDocument document = ocr == null ? OcrDocument.empty() : ocr;
    String fallbackReason;
    try {
      JournalEntry generated = generativeDeriver.derive(document);
      validator.validate(generated);
      log.info("Journal entry derived by model for merchant '{}'", generated.merchant());
      return new DerivationResult(generated, DerivationSource.MODEL, null);
    } catch (RuntimeException ex) {
      fallbackReason = ex.getMessage();
      log.warn("Generative derivation failed, using fallback: {}", fallbackReason);
    }

    JournalEntry fallback = buildFallback(document);
    try {
      validator.validate(fallback);
    } catch (JournalValidationException ex) {
      log.error("Fallback journal entry is invalid: {}", ex.getViolations());
      throw ex;
    }
    return new DerivationResult(fallback, DerivationSource.FALLBACK, fallbackReason);
  }

  public JournalEntry buildFallback(OcrDocument ocr) {
    ExtractedFields extracted = fieldExtractor.extract(ocr);
    if (extracted.date() == null) {
      extracted = new ExtractedFields(extracted.amount(), LocalDate.now(clock), extracted.merchant());
    }
    ExpenseCategory category = classifier.classify(extracted.merchant(), ocr);
    VatBreakdown vat = vatPolicy.computeVat(extracted.amount(), ocr.serialized());
    log.info("Fallback entry: merchant '{}', account '{}', gross {}",
        extracted.merchant(), category.account(), vat.grossAmount());
    return fallbackBuilder.build(extracted, category, vat);
  }
}
