package com.receiptledger.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "receipt.ocr.tabscanner")
public record TabScannerProperties(
    String apiKey,
    String baseUrl,
    Duration processingWait,
    Duration duplicateWait
) {}
