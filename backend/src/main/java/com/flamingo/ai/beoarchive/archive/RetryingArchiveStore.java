package com.flamingo.ai.beoarchive.archive;

import io.github.resilience4j.retry.Retry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Decorates an {@link ArchiveStore} with the {@code archive} retry: transient storage failures are
 * retried with exponential backoff, permission failures surface on the first attempt. Both
 * wrapped operations are idempotent.
 */
@Slf4j
public class RetryingArchiveStore implements ArchiveStore {

  private final ArchiveStore delegate;
  private final Retry retry;

  public RetryingArchiveStore(ArchiveStore delegate, Retry retry) {
    this.delegate = delegate;
    this.retry = retry;
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Retrying {} archive call (attempt {}): {}",
                    delegate.backendName(),
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() != null
                        ? event.getLastThrowable().getMessage()
                        : "unknown error"));
  }

  @Override
  public FolderHandle ensureFolder(List<String> segments) {
    return retry.executeSupplier(() -> delegate.ensureFolder(segments));
  }

  @Override
  public WriteResult writeFileIfAbsent(FolderHandle folder, String fileName, byte[] content) {
    return retry.executeSupplier(() -> delegate.writeFileIfAbsent(folder, fileName, content));
  }

  @Override
  public void verifyAccess() {
    delegate.verifyAccess();
  }

  @Override
  public String backendName() {
    return delegate.backendName();
  }

  public ArchiveStore getDelegate() {
    return delegate;
  }
}
