package com.receiptledger.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only view over a vendor OCR payload of unknown shape.
 */
public record OcrDocument(JsonNode root) {

  public OcrDocument {
    root = root == null || root.isMissingNode() || root.isNull()
        ? JsonNodeFactory.instance.objectNode()
        : root.deepCopy();
  }

  public static OcrDocument empty() {
    return new OcrDocument(null);
  }

  /**
   * Top-level value under {@code key}, absent when the key is missing or JSON null.
   */
  public Optional<JsonNode> field(String key) {
    if (key == null || !root.isObject()) {
      return Optional.empty();
    }
    JsonNode value = root.get(key);
    if (value == null || value.isNull() || value.isMissingNode()) {
      return Optional.empty();
    }
    return Optional.of(value);
  }

  public Optional<String> text(String key) {
    return field(key)
        .filter(JsonNode::isTextual)
        .map(JsonNode::asText)
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }

  public String serialized() {
    return root.toString();
  }

  public String lowerCaseText() {
    return serialized().toLowerCase(Locale.ROOT);
  }
}
