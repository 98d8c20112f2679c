package com.flamingo.ai.beoarchive.exception;

/** Exception thrown when bundles cannot be fetched from the configured source. */
public class BundleIntakeException extends RuntimeException {

  public BundleIntakeException(String message) {
    super(message);
  }

  public BundleIntakeException(String message, Throwable cause) {
    super(message, cause);
  }
}
