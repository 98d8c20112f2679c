package com.flamingo.ai.beoarchive.archive.graph;

import com.flamingo.ai.beoarchive.exception.ConfigurationException;

/**
 * Supplies an already-valid Microsoft Graph bearer token. Sign-in and refresh are handled outside
 * this service.
 */
@FunctionalInterface
public interface GraphAccessTokenProvider {

  /**
   * @return the bearer token
   * @throws ConfigurationException when no token is configured
   */
  String accessToken();
}
