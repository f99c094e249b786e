package com.receiptledger.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.receiptledger.dto.DerivationResponse;
import com.receiptledger.dto.HealthResponse;
import com.receiptledger.export.JournalCsvExporter;
import com.receiptledger.extraction.OcrDocument;
import com.receiptledger.journal.JournalEntry;
import com.receiptledger.journal.JournalValidationException;
import com.receiptledger.ocr.OcrProcessingException;
import com.receiptledger.ocr.TabScannerClient;
import com.receiptledger.service.DerivationResult;
import com.receiptledger.service.JournalDerivationService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api")
public class ReceiptController {
  private static final Logger log = LoggerFactory.getLogger(ReceiptController.class);
  private static final Set<String> ALLOWED_EXTENSIONS = Set.of("jpg", "jpeg", "png", "pdf");
  private static final Set<String> ALLOWED_CONTENT_TYPES = Set.of("image/jpeg", "image/jpg", "image/png", "application/pdf");
  private static final MediaType TEXT_CSV = new MediaType("text", "csv");

  private final TabScannerClient ocrClient;
  private final JournalDerivationService derivationService;
  private final JournalCsvExporter csvExporter;
  private final Clock clock;

  public ReceiptController(TabScannerClient ocrClient,
                           JournalDerivationService derivationService,
                           JournalCsvExporter csvExporter,
                           Clock clock) {
    this.ocrClient = ocrClient;
    this.derivationService = derivationService;
    this.csvExporter = csvExporter;
    this.clock = clock;
  }

  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public DerivationResponse upload(@RequestParam(value = "receipt", required = false) MultipartFile receipt) {
    validateUpload(receipt);
    OcrDocument ocr;
    try {
      log.info("Processing OCR for {}", receipt.getOriginalFilename());
      ocr = ocrClient.process(receipt.getBytes(), receipt.getOriginalFilename(), receipt.getContentType());
    } catch (IOException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Uploaded file could not be read", ex);
    } catch (OcrProcessingException ex) {
      log.warn("OCR failed: {}", ex.getMessage());
      throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "OCR processing failed", ex);
    }
    return derive(ocr);
  }

  @PostMapping(value = "/journal-entries", consumes = MediaType.APPLICATION_JSON_VALUE)
  public DerivationResponse deriveFromOcr(@RequestBody JsonNode ocrData) {
    return derive(new OcrDocument(ocrData));
  }

  @PostMapping(value = "/journal-entries/csv", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<String> exportCsv(@RequestBody JournalEntry entry) {
    String filename = csvExporter.filename(entry, clock.millis());
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
        .contentType(new MediaType(TEXT_CSV, StandardCharsets.UTF_8))
        .body(csvExporter.export(entry));
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("OK", clock.instant());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<Map<String, String>> handleTooLarge(MaxUploadSizeExceededException ex) {
    return ResponseEntity.badRequest().body(Map.of("error", "File size too large. Maximum size is 5MB."));
  }

  private DerivationResponse derive(OcrDocument ocr) {
    try {
      DerivationResult result = derivationService.deriveDetailed(ocr);
      return new DerivationResponse(
          true,
          result.source().name().toLowerCase(Locale.ROOT),
          result.entry().isBalanced(),
          ocr.root(),
          result.entry());
    } catch (JournalValidationException ex) {
      throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Processing failed");
    } catch (RuntimeException ex) {
      log.error("Journal derivation failed", ex);
      throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Processing failed");
    }
  }

  private void validateUpload(MultipartFile receipt) {
    if (receipt == null || receipt.isEmpty()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No file uploaded");
    }
    String filename = receipt.getOriginalFilename();
    if (filename == null || filename.contains("..") || filename.contains("/")) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid filename");
    }
    int dot = filename.lastIndexOf('.');
    String extension = dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    String contentType = receipt.getContentType() == null ? "" : receipt.getContentType().toLowerCase(Locale.ROOT);
    if (!ALLOWED_EXTENSIONS.contains(extension) || !ALLOWED_CONTENT_TYPES.contains(contentType)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
          "Only .png, .jpg, .jpeg and .pdf files under 5MB are allowed!");
    }
  }
}
