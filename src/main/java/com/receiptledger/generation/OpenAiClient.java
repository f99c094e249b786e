package com.receiptledger.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.receiptledger.config.OpenAiProperties;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Chat-completions client. The configured timeout bounds each socket operation and also the whole call,
 * so a slowly trickling response cannot hold the caller past it.
 */
@Component
public class OpenAiClient {
  private static final Logger log = LoggerFactory.getLogger(OpenAiClient.class);
  private static final String DEFAULT_BASE_URL = "https://api.openai.com";
  private static final String DEFAULT_MODEL = "gpt-4";
  private static final double DEFAULT_TEMPERATURE = 0.1;
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final OpenAiProperties properties;
  private final RestClient restClient;
  private final Executor executor;

  @Autowired
  public OpenAiClient(OpenAiProperties properties, TaskExecutor taskExecutor) {
    this(properties, RestClient.builder()
        .baseUrl(resolveBaseUrl(properties))
        .requestFactory(requestFactory(properties))
        .build(), taskExecutor);
  }

  OpenAiClient(OpenAiProperties properties, RestClient restClient, Executor executor) {
    this.properties = properties;
    this.restClient = restClient;
    this.executor = executor;
  }

  public boolean isAvailable() {
    return !Boolean.FALSE.equals(properties.enabled())
        && properties.apiKey() != null
        && !properties.apiKey().isBlank();
  }

  public String complete(String systemPrompt, String userPrompt) {
    if (!isAvailable()) {
      throw new GenerationException("OpenAI is disabled or has no API key");
    }
    Map<String, Object> body = Map.of(
        "model", resolveModel(),
        "temperature", properties.temperature() == null ? DEFAULT_TEMPERATURE : properties.temperature(),
        "messages", List.of(
            Map.of("role", "system", "content", systemPrompt == null ? "" : systemPrompt),
            Map.of("role", "user", "content", userPrompt == null ? "" : userPrompt)
        )
    );

    Duration deadline = resolveTimeout(properties);
    CompletableFuture<JsonNode> call = CompletableFuture.supplyAsync(() -> exchange(body), executor);
    JsonNode response;
    try {
      response = call.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      call.cancel(true);
      log.warn("OpenAI call exceeded {} ms", deadline.toMillis());
      throw new GenerationException("OpenAI call exceeded " + deadline.toMillis() + " ms", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new GenerationException("Interrupted while waiting for OpenAI", ex);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException) {
        throw (RuntimeException) ex.getCause();
      }
      throw new GenerationException("OpenAI call failed: " + ex.getCause().getMessage(), ex.getCause());
    }

    String content = extractContent(response);
    if (content == null) {
      throw new GenerationException("OpenAI response has no message content");
    }
    log.debug("Raw OpenAI response: {}", content);
    return content;
  }

  private JsonNode exchange(Map<String, Object> body) {
    try {
      return restClient.post()
          .uri("/v1/chat/completions")
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey())
          .contentType(MediaType.APPLICATION_JSON)
          .accept(MediaType.APPLICATION_JSON)
          .body(body)
          .retrieve()
          .body(JsonNode.class);
    } catch (RestClientResponseException ex) {
      log.warn("OpenAI request failed ({}): {}", ex.getStatusCode().value(), ex.getResponseBodyAsString());
      throw new GenerationException("OpenAI returned status " + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      log.warn("OpenAI unreachable or timed out: {}", ex.getMessage());
      throw new GenerationException("OpenAI unreachable: " + ex.getMessage(), ex);
    } catch (RestClientException ex) {
      log.warn("OpenAI call failed: {}", ex.getMessage());
      throw new GenerationException("OpenAI call failed: " + ex.getMessage(), ex);
    }
  }

  private String resolveModel() {
    if (properties.model() != null && !properties.model().isBlank()) {
      return properties.model().trim();
    }
    return DEFAULT_MODEL;
  }

  private String extractContent(JsonNode response) {
    if (response == null) {
      return null;
    }
    JsonNode content = response.path("choices").path(0).path("message").path("content");
    if (!content.isTextual() || content.asText().isBlank()) {
      return null;
    }
    return content.asText();
  }

  private static String resolveBaseUrl(OpenAiProperties properties) {
    return properties.baseUrl() == null || properties.baseUrl().isBlank()
        ? DEFAULT_BASE_URL
        : properties.baseUrl();
  }

  private static Duration resolveTimeout(OpenAiProperties properties) {
    return properties.timeout() == null || properties.timeout().isZero() || properties.timeout().isNegative()
        ? DEFAULT_TIMEOUT
        : properties.timeout();
  }

  private static SimpleClientHttpRequestFactory requestFactory(OpenAiProperties properties) {
    Duration timeout = resolveTimeout(properties);
    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(timeout);
    factory.setReadTimeout(timeout);
    return factory;
  }
}
