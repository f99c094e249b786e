package com.receiptledger.generation;

/**
 * The generative model produced no usable journal entry.
 */
public class GenerationException extends RuntimeException {
  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
