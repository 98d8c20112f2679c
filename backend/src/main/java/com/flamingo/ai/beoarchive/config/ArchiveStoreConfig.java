package com.flamingo.ai.beoarchive.config;

import com.flamingo.ai.beoarchive.archive.ArchiveStore;
import com.flamingo.ai.beoarchive.archive.RetryingArchiveStore;
import com.flamingo.ai.beoarchive.archive.graph.GraphAccessTokenProvider;
import com.flamingo.ai.beoarchive.archive.graph.GraphDriveArchiveStore;
import com.flamingo.ai.beoarchive.archive.local.LocalArchiveStore;
import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import io.github.resilience4j.retry.Retry;
import java.nio.file.Path;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/** Selects the archive backend from {@code beo.archive.backend}. */
@Configuration
@Slf4j
public class ArchiveStoreConfig {

  @Bean
  public ArchiveStore archiveStore(
      BeoArchiveConfig config,
      WebClient graphWebClient,
      GraphAccessTokenProvider graphAccessTokenProvider,
      @Qualifier("archiveRetry") Retry archiveRetry) {
    String backend = config.getArchive().getBackend();
    ArchiveStore delegate =
        switch (backend == null ? "" : backend.trim().toLowerCase(Locale.ROOT)) {
          case "local" ->
              new LocalArchiveStore(Path.of(config.getArchive().getLocal().getBasePath()));
          case "onedrive" ->
              new GraphDriveArchiveStore(
                  graphWebClient,
                  config.getGraph().getBaseUrl(),
                  graphAccessTokenProvider,
                  config.getGraph().getTimeout(),
                  config.getGraph().getUploadTimeout());
          default ->
              throw new ConfigurationException(
                  "Unknown archive backend '" + backend + "'. Use 'local' or 'onedrive'.");
        };
    log.info("Archive backend: {}", delegate.backendName());
    return new RetryingArchiveStore(delegate, archiveRetry);
  }
}
