package com.flamingo.ai.beoarchive.exception;

/** Exception thrown when required configuration is missing or unusable. Aborts the whole run. */
public class ConfigurationException extends RuntimeException {

  private final String userMessage;

  public ConfigurationException(String message) {
    super(message);
    this.userMessage = "Service is not configured. Please contact the administrator.";
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Service is not configured. Please contact the administrator.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
