package com.receiptledger.service;

public enum DerivationSource {
  MODEL,
  FALLBACK
}
