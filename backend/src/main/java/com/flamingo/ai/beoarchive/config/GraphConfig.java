package com.flamingo.ai.beoarchive.config;

import com.flamingo.ai.beoarchive.archive.graph.GraphAccessTokenProvider;
import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/** Configuration for Microsoft Graph access (mailbox intake and OneDrive archive). */
@Configuration
public class GraphConfig {

  private static final int MAX_IN_MEMORY_BYTES = 64 * 1024 * 1024;

  @Bean
  public WebClient graphWebClient(WebClient.Builder builder) {
    return builder
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
        .build();
  }

  @Bean
  public GraphAccessTokenProvider graphAccessTokenProvider(BeoArchiveConfig config) {
    return () -> {
      String token = config.getGraph().getAccessToken();
      if (token == null || token.isBlank()) {
        throw new ConfigurationException(
            "Microsoft Graph access token is required. Set GRAPH_ACCESS_TOKEN environment"
                + " variable.");
      }
      return token;
    };
  }
}
