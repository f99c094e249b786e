package com.receiptledger.classification;

public record ExpenseCategory(String account, String description, String reason) {}
