package com.flamingo.ai.beoarchive.exception;

/**
 * Exception thrown when the archive backend fails. Transient failures (timeouts, 5xx, throttling)
 * are retried; permission and authorization failures are final for the item.
 */
public class ArchiveStorageException extends RuntimeException {

  private final boolean transientFailure;

  public ArchiveStorageException(String message, boolean transientFailure) {
    super(message);
    this.transientFailure = transientFailure;
  }

  public ArchiveStorageException(String message, boolean transientFailure, Throwable cause) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  public boolean isTransientFailure() {
    return transientFailure;
  }
}
