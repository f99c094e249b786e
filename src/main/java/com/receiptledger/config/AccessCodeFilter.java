package com.receiptledger.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class AccessCodeFilter extends OncePerRequestFilter {
  private static final Logger log = LoggerFactory.getLogger(AccessCodeFilter.class);
  static final String HEADER = "x-access-code";
  static final String QUERY_PARAM = "access_code";

  private final AccessProperties accessProperties;

  public AccessCodeFilter(AccessProperties accessProperties) {
    this.accessProperties = accessProperties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return !accessProperties.enabled()
        || path == null
        || !path.startsWith("/api/")
        || path.equals("/api/health")
        || "OPTIONS".equalsIgnoreCase(request.getMethod());
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String provided = request.getHeader(HEADER);
    if (provided == null || provided.isBlank()) {
      provided = request.getParameter(QUERY_PARAM);
    }
    if (matches(provided)) {
      filterChain.doFilter(request, response);
      return;
    }
    log.warn("Access code rejected for {} {}", request.getMethod(), request.getRequestURI());
    response.setStatus(HttpStatus.UNAUTHORIZED.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.getWriter().write("{\"error\":\"Access denied. Valid access code required.\"}");
  }

  private boolean matches(String provided) {
    if (provided == null) {
      return false;
    }
    return MessageDigest.isEqual(
        provided.getBytes(StandardCharsets.UTF_8),
        accessProperties.code().getBytes(StandardCharsets.UTF_8));
  }
}
