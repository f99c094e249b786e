package com.receiptledger.generation;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.receiptledger.journal.JournalEntry;
import java.io.IOException;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads a journal entry out of free model text. Tries the raw text, then the text without code fences,
 * then the span between the first '{' and the last '}'. Fails rather than guessing.
 */
@Component
public class JournalResponseParser {
  private static final Logger log = LoggerFactory.getLogger(JournalResponseParser.class);
  private static final Pattern CODE_FENCE = Pattern.compile("```[a-zA-Z]*\\s*");

  private final ObjectReader reader;

  public JournalResponseParser(ObjectMapper objectMapper) {
    this.reader = objectMapper.readerFor(JournalEntry.class)
        .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public JournalEntry parse(String response) {
    if (response == null || response.isBlank()) {
      throw new GenerationException("Model response is empty");
    }
    String raw = response.trim();
    Optional<JournalEntry> direct = tryRead(raw);
    if (direct.isPresent()) {
      return direct.get();
    }

    log.debug("Direct JSON parse failed, stripping code fences");
    String unfenced = CODE_FENCE.matcher(raw).replaceAll("").trim();
    Optional<JournalEntry> stripped = tryRead(unfenced);
    if (stripped.isPresent()) {
      return stripped.get();
    }

    int start = unfenced.indexOf('{');
    int end = unfenced.lastIndexOf('}');
    if (start < 0 || end <= start) {
      throw new GenerationException("No JSON object found in model response");
    }
    log.debug("Parsing brace span {}..{} of model response", start, end);
    return tryRead(unfenced.substring(start, end + 1))
        .orElseThrow(() -> new GenerationException("Model response is not a valid journal entry"));
  }

  private Optional<JournalEntry> tryRead(String candidate) {
    if (!candidate.startsWith("{")) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(reader.readValue(candidate));
    } catch (IOException | RuntimeException ex) {
      log.debug("JSON candidate rejected: {}", ex.getMessage());
      return Optional.empty();
    }
  }
}
