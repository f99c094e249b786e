package com.receiptledger.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "receipt.ai.openai")
public record OpenAiProperties(
    String apiKey,
    String baseUrl,
    String model,
    Boolean enabled,
    Double temperature,
    Duration timeout
) {}
