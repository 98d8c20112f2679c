package com.flamingo.ai.beoarchive.config;

import com.flamingo.ai.beoarchive.archive.graph.GraphAccessTokenProvider;
import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import com.flamingo.ai.beoarchive.intake.BundleSource;
import com.flamingo.ai.beoarchive.intake.DirectoryBundleSource;
import com.flamingo.ai.beoarchive.intake.GraphMailboxBundleSource;
import java.nio.file.Path;
import java.util.Locale;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/** Selects the bundle source from {@code beo.intake.source}. */
@Configuration
public class IntakeConfig {

  @Bean
  public BundleSource bundleSource(
      BeoArchiveConfig config,
      WebClient graphWebClient,
      GraphAccessTokenProvider graphAccessTokenProvider) {
    BeoArchiveConfig.Intake intake = config.getIntake();
    String source = intake.getSource();
    return switch (source == null ? "" : source.trim().toLowerCase(Locale.ROOT)) {
      case "mailbox" ->
          new GraphMailboxBundleSource(
              graphWebClient,
              config.getGraph().getBaseUrl(),
              graphAccessTokenProvider,
              intake.getMailbox().getFolder(),
              intake.getMailbox().getPageSize(),
              intake.getMailbox().getMaxMessages(),
              config.getGraph().getTimeout());
      case "directory" -> new DirectoryBundleSource(Path.of(intake.getDirectory().getPath()));
      default ->
          throw new ConfigurationException(
              "Unknown intake source '" + source + "'. Use 'mailbox' or 'directory'.");
    };
  }
}
