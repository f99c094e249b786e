package com.receiptledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "receipt.web")
public record WebProperties(String allowedOrigins) {}
