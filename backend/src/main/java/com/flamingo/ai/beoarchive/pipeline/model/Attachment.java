package com.flamingo.ai.beoarchive.pipeline.model;

import java.util.Locale;

/** One file attached to a mail message. */
public record Attachment(String fileName, byte[] content, String contentType) {

  private static final String PDF_MIME_TYPE = "application/pdf";

  public Attachment {
    content = content != null ? content : new byte[0];
  }

  public boolean isPdf() {
    if (contentType != null && PDF_MIME_TYPE.equalsIgnoreCase(contentType.trim())) {
      return true;
    }
    return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
  }

  @Override
  public String toString() {
    return "Attachment[" + fileName + ", " + contentType + ", " + content.length + " bytes]";
  }
}
