package com.flamingo.ai.beoarchive.intake;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.beoarchive.archive.graph.GraphAccessTokenProvider;
import com.flamingo.ai.beoarchive.exception.BundleIntakeException;
import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import com.flamingo.ai.beoarchive.pipeline.model.Attachment;
import com.flamingo.ai.beoarchive.pipeline.model.AttachmentBundle;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;

/**
 * Reads bundles from a Microsoft Graph mail folder. Each message with file attachments becomes
 * one bundle; paging follows {@code @odata.nextLink} until {@code maxMessages} is reached.
 */
@Slf4j
public class GraphMailboxBundleSource implements BundleSource {

  static final String FILE_ATTACHMENT = "#microsoft.graph.fileAttachment";

  private final WebClient webClient;
  private final String baseUrl;
  private final GraphAccessTokenProvider tokenProvider;
  private final String folder;
  private final int pageSize;
  private final int maxMessages;
  private final Duration timeout;

  public GraphMailboxBundleSource(
      WebClient webClient,
      String baseUrl,
      GraphAccessTokenProvider tokenProvider,
      String folder,
      int pageSize,
      int maxMessages,
      Duration timeout) {
    this.webClient = webClient;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.tokenProvider = tokenProvider;
    this.folder = folder;
    this.pageSize = pageSize;
    this.maxMessages = maxMessages;
    this.timeout = timeout;
  }

  @Override
  public List<AttachmentBundle> fetchBundles() {
    List<MailMessage> messages = listMessages();
    List<AttachmentBundle> bundles = new ArrayList<>(messages.size());
    for (MailMessage message : messages) {
      try {
        bundles.add(toBundle(message));
      } catch (BundleIntakeException e) {
        log.error(
            "Skipping message {} ('{}'): {}", message.id(), message.subject(), e.getMessage());
      }
    }
    log.info("Fetched {} bundle(s) from mail folder '{}'", bundles.size(), folder);
    return bundles;
  }

  @Override
  public String sourceName() {
    return "mailbox";
  }

  List<MailMessage> listMessages() {
    List<MailMessage> messages = new ArrayList<>();
    URI next =
        UriComponentsBuilder.fromUriString(baseUrl)
            .path("/me/mailFolders/{folder}/messages")
            .queryParam("$filter", "hasAttachments eq true")
            .queryParam("$select", "id,subject,receivedDateTime,hasAttachments")
            .queryParam("$top", pageSize)
            .encode()
            .buildAndExpand(folder)
            .toUri();

    while (next != null && messages.size() < maxMessages) {
      MessagePage page = get(next, MessagePage.class, "Listing messages");
      if (page == null || page.value() == null) {
        break;
      }
      for (MailMessage message : page.value()) {
        if (messages.size() >= maxMessages) {
          break;
        }
        messages.add(message);
      }
      next = page.nextLink() != null ? URI.create(page.nextLink()) : null;
    }
    log.debug("Listed {} message(s) with attachments", messages.size());
    return messages;
  }

  private AttachmentBundle toBundle(MailMessage message) {
    URI uri =
        UriComponentsBuilder.fromUriString(baseUrl)
            .path("/me/messages/{id}/attachments")
            .encode()
            .buildAndExpand(message.id())
            .toUri();
    AttachmentPage page = get(uri, AttachmentPage.class, "Reading attachments");
    List<Attachment> attachments = new ArrayList<>();
    if (page != null && page.value() != null) {
      for (MailAttachment attachment : page.value()) {
        if (!FILE_ATTACHMENT.equals(attachment.odataType()) || attachment.contentBytes() == null) {
          continue;
        }
        attachments.add(
            new Attachment(
                attachment.name(), decode(message, attachment), attachment.contentType()));
      }
    }
    return new AttachmentBundle(
        message.id(), message.subject(), message.receivedDateTime(), attachments);
  }

  private static byte[] decode(MailMessage message, MailAttachment attachment) {
    try {
      return Base64.getDecoder().decode(attachment.contentBytes());
    } catch (IllegalArgumentException e) {
      throw new BundleIntakeException(
          "Attachment " + attachment.name() + " of message " + message.id() + " is not base64",
          e);
    }
  }

  private <T> T get(URI uri, Class<T> type, String action) {
    try {
      return webClient
          .get()
          .uri(uri)
          .headers(headers -> headers.setBearerAuth(tokenProvider.accessToken()))
          .retrieve()
          .bodyToMono(type)
          .timeout(timeout)
          .block();
    } catch (RuntimeException e) {
      Throwable cause = Exceptions.unwrap(e);
      if (cause instanceof ConfigurationException configurationException) {
        throw configurationException;
      }
      if (cause instanceof WebClientResponseException response
          && (response.getStatusCode().value() == 401 || response.getStatusCode().value() == 403)) {
        throw new ConfigurationException(
            action + " was refused by Microsoft Graph (HTTP "
                + response.getStatusCode().value()
                + "); check the access token",
            cause);
      }
      throw new BundleIntakeException(action + " failed: " + cause.getMessage(), cause);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record MessagePage(
      List<MailMessage> value, @JsonProperty("@odata.nextLink") String nextLink) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record MailMessage(String id, String subject, Instant receivedDateTime) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record AttachmentPage(List<MailAttachment> value) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record MailAttachment(
      @JsonProperty("@odata.type") String odataType,
      String name,
      String contentType,
      String contentBytes) {}
}
