package com.receiptledger.config;

import java.time.Clock;
import java.util.Arrays;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {
  private final WebProperties webProperties;

  public WebConfig(WebProperties webProperties) {
    this.webProperties = webProperties;
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    String configured = webProperties.allowedOrigins();
    String[] origins = configured == null || configured.isBlank()
        ? new String[]{"*"}
        : Arrays.stream(configured.split(","))
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .toArray(String[]::new);
    registry.addMapping("/api/**")
        .allowedOrigins(origins)
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("Content-Type", "x-access-code")
        .maxAge(3600L);
  }
}
