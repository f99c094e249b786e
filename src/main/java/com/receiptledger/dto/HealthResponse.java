package com.receiptledger.dto;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp) {}
