package com.flamingo.ai.beoarchive.exception;

/**
 * Exception thrown when the AI classification call fails or its response does not match the
 * expected schema. Distinct from a well-formed "invalid" verdict.
 */
public class ClassificationException extends RuntimeException {

  private final boolean retryable;
  private final boolean rateLimited;

  public ClassificationException(String message) {
    this(message, true, false, null);
  }

  public ClassificationException(String message, Throwable cause) {
    this(message, true, false, cause);
  }

  public ClassificationException(
      String message, boolean retryable, boolean rateLimited, Throwable cause) {
    super(message, cause);
    this.retryable = retryable;
    this.rateLimited = rateLimited;
  }

  public static ClassificationException nonRetryable(String message, Throwable cause) {
    return new ClassificationException(message, false, false, cause);
  }

  public static ClassificationException rateLimited(String message, Throwable cause) {
    return new ClassificationException(message, true, true, cause);
  }

  public boolean isRetryable() {
    return retryable;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }
}
