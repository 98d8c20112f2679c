package com.flamingo.ai.beoarchive.archive.graph;

import com.flamingo.ai.beoarchive.exception.ArchiveStorageException;
import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import java.util.concurrent.TimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/** Maps Microsoft Graph call failures onto the archive error taxonomy. */
public final class GraphErrors {

  private GraphErrors() {}

  /**
   * Converts a failed Graph call into an {@link ArchiveStorageException}. Configuration errors
   * are returned unchanged so they keep aborting the run.
   */
  public static RuntimeException translate(String action, Throwable error) {
    Throwable cause = Exceptions.unwrap(error);
    if (cause instanceof ArchiveStorageException || cause instanceof ConfigurationException) {
      return (RuntimeException) cause;
    }
    if (cause instanceof WebClientResponseException response) {
      int status = response.getStatusCode().value();
      String message = action + " failed with HTTP " + status;
      return new ArchiveStorageException(message, isTransientStatus(status), cause);
    }
    if (cause instanceof WebClientRequestException || cause instanceof TimeoutException) {
      return new ArchiveStorageException(
          action + " failed: " + cause.getClass().getSimpleName(), true, cause);
    }
    return new ArchiveStorageException(action + " failed: " + cause.getMessage(), false, cause);
  }

  /** Throttling, timeouts and server errors are worth retrying; 401/403 and other 4xx are not. */
  public static boolean isTransientStatus(int status) {
    return status == 408 || status == 429 || status >= 500;
  }
}
