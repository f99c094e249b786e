package com.receiptledger.ocr;

import com.fasterxml.jackson.databind.JsonNode;
import com.receiptledger.config.TabScannerProperties;
import com.receiptledger.extraction.OcrDocument;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Receipt OCR through TabScanner: upload, wait for processing, then poll the result endpoints in order.
 */
@Component
public class TabScannerClient {
  private static final Logger log = LoggerFactory.getLogger(TabScannerClient.class);
  private static final String DEFAULT_BASE_URL = "https://api.tabscanner.com";
  private static final Duration DEFAULT_PROCESSING_WAIT = Duration.ofSeconds(5);
  private static final Duration DEFAULT_DUPLICATE_WAIT = Duration.ofSeconds(1);
  private static final List<ResultEndpoint> RESULT_ENDPOINTS = List.of(
      new ResultEndpoint(HttpMethod.GET, "/api/result?token={token}"),
      new ResultEndpoint(HttpMethod.GET, "/api/2/result?token={token}"),
      new ResultEndpoint(HttpMethod.GET, "/api/result/{token}"),
      new ResultEndpoint(HttpMethod.GET, "/result/{token}"),
      new ResultEndpoint(HttpMethod.POST, "/api/result"),
      new ResultEndpoint(HttpMethod.POST, "/api/2/result"));

  private final TabScannerProperties properties;
  private final RestClient restClient;

  @Autowired
  public TabScannerClient(TabScannerProperties properties) {
    this(properties, RestClient.builder()
        .baseUrl(properties.baseUrl() == null || properties.baseUrl().isBlank()
            ? DEFAULT_BASE_URL
            : properties.baseUrl())
        .build());
  }

  TabScannerClient(TabScannerProperties properties, RestClient restClient) {
    this.properties = properties;
    this.restClient = restClient;
  }

  public OcrDocument process(byte[] content, String filename, String contentType) {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new OcrProcessingException("TabScanner API key is not configured");
    }
    JsonNode upload = upload(content, filename, contentType);
    String token = firstText(upload, "token", "duplicateToken");
    if (token == null) {
      log.info("No token received from TabScanner, using upload response");
      return new OcrDocument(upload);
    }

    boolean duplicate = upload.path("duplicate").asBoolean(false);
    Duration wait = duplicate ? orDefault(properties.duplicateWait(), DEFAULT_DUPLICATE_WAIT)
        : orDefault(properties.processingWait(), DEFAULT_PROCESSING_WAIT);
    log.info("Got TabScanner token {}, waiting {} ms (duplicate={})", token, wait.toMillis(), duplicate);
    pause(wait);

    JsonNode result = fetchResult(token);
    if (result.hasNonNull("result")) {
      return new OcrDocument(result.get("result"));
    }
    if (result.hasNonNull("data")) {
      return new OcrDocument(result.get("data"));
    }
    return new OcrDocument(result);
  }

  private JsonNode upload(byte[] content, String filename, String contentType) {
    MultipartBodyBuilder parts = new MultipartBodyBuilder();
    parts.part("file", new ByteArrayResource(content) {
          @Override
          public String getFilename() {
            return filename;
          }
        })
        .contentType(contentType == null ? MediaType.APPLICATION_OCTET_STREAM : MediaType.parseMediaType(contentType));
    try {
      JsonNode response = restClient.post()
          .uri("/api/2/process")
          .header("apikey", properties.apiKey())
          .contentType(MediaType.MULTIPART_FORM_DATA)
          .body(parts.build())
          .retrieve()
          .body(JsonNode.class);
      if (response == null) {
        throw new OcrProcessingException("TabScanner returned an empty upload response");
      }
      return response;
    } catch (RestClientResponseException ex) {
      log.warn("TabScanner upload failed ({}): {}", ex.getStatusCode().value(), ex.getResponseBodyAsString());
      throw new OcrProcessingException("OCR processing failed", ex);
    } catch (RestClientException ex) {
      log.warn("TabScanner upload failed: {}", ex.getMessage());
      throw new OcrProcessingException("OCR processing failed", ex);
    }
  }

  private JsonNode fetchResult(String token) {
    for (ResultEndpoint endpoint : RESULT_ENDPOINTS) {
      try {
        RestClient.RequestBodySpec request = restClient.method(endpoint.method())
            .uri(endpoint.path(), Map.of("token", token))
            .header("apikey", properties.apiKey())
            .accept(MediaType.APPLICATION_JSON);
        if (endpoint.method() == HttpMethod.POST) {
          request = request.contentType(MediaType.APPLICATION_JSON).body(Map.of("token", token));
        }
        JsonNode body = request.retrieve().body(JsonNode.class);
        if (body != null) {
          log.info("TabScanner result retrieved with {} {}", endpoint.method(), endpoint.path());
          return body;
        }
      } catch (RestClientException ex) {
        log.debug("TabScanner result endpoint {} {} failed: {}", endpoint.method(), endpoint.path(), ex.getMessage());
      }
    }
    throw new OcrProcessingException("Could not retrieve results from any TabScanner endpoint");
  }

  private String firstText(JsonNode node, String... keys) {
    for (String key : keys) {
      String value = node.path(key).asText(null);
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }

  private Duration orDefault(Duration value, Duration fallback) {
    return value == null || value.isNegative() ? fallback : value;
  }

  private void pause(Duration wait) {
    if (wait.isZero()) {
      return;
    }
    try {
      Thread.sleep(wait.toMillis());
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new OcrProcessingException("Interrupted while waiting for TabScanner");
    }
  }

  private record ResultEndpoint(HttpMethod method, String path) {}
}
