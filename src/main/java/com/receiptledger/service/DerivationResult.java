package com.receiptledger.service;

import com.receiptledger.journal.JournalEntry;

public record DerivationResult(JournalEntry entry, DerivationSource source, String fallbackReason) {}
