package com.receiptledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "receipt.access")
public record AccessProperties(String code) {
  public boolean enabled() {
    return code != null && !code.isBlank();
  }
}
