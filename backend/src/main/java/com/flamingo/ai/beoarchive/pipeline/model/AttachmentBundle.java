package com.flamingo.ai.beoarchive.pipeline.model;

import java.time.Instant;
import java.util.List;

/**
 * The PDF attachments of one mail message, validated together.
 *
 * <p>{@code subject} and {@code receivedAt} are diagnostic only and never influence where a
 * document is filed.
 */
public record AttachmentBundle(
    String bundleId, String subject, Instant receivedAt, List<Attachment> attachments) {

  public AttachmentBundle {
    attachments = attachments != null ? List.copyOf(attachments) : List.of();
  }

  public List<Attachment> pdfAttachments() {
    return attachments.stream().filter(Attachment::isPdf).toList();
  }
}
