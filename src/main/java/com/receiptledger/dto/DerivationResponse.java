package com.receiptledger.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.receiptledger.journal.JournalEntry;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DerivationResponse {
  private boolean success;
  private String source;
  private boolean balanced;
  private JsonNode ocrData;
  private JournalEntry journalEntry;
}
