package com.flamingo.ai.beoarchive.exception;

/** Exception thrown when an attachment cannot be read as a PDF. */
public class TextExtractionException extends RuntimeException {

  private final String fileName;

  public TextExtractionException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
  }

  public TextExtractionException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
