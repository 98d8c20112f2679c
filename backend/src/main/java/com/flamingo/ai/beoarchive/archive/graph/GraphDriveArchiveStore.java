package com.flamingo.ai.beoarchive.archive.graph;

import com.flamingo.ai.beoarchive.archive.ArchiveStore;
import com.flamingo.ai.beoarchive.archive.FolderHandle;
import com.flamingo.ai.beoarchive.archive.WriteResult;
import com.flamingo.ai.beoarchive.exception.ArchiveStorageException;
import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

/**
 * {@link ArchiveStore} on the signed-in user's OneDrive through the Microsoft Graph drive API.
 *
 * <p>Folders are created level by level with {@code conflictBehavior=fail}; a 409 means the level
 * already exists. Uploads use the same conflict behavior, so when two workers race on the same
 * file Graph accepts exactly one upload and the other sees 409 and reports the existing item.
 * Simple uploads only (Graph caps them at 250 MB).
 */
@Slf4j
public class GraphDriveArchiveStore implements ArchiveStore {

  static final String CONFLICT_FAIL = "@microsoft.graph.conflictBehavior";

  private final WebClient webClient;
  private final String baseUrl;
  private final GraphAccessTokenProvider tokenProvider;
  private final Duration timeout;
  private final Duration uploadTimeout;

  private volatile String driveId;

  public GraphDriveArchiveStore(
      WebClient webClient,
      String baseUrl,
      GraphAccessTokenProvider tokenProvider,
      Duration timeout,
      Duration uploadTimeout) {
    this.webClient = webClient;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.tokenProvider = tokenProvider;
    this.timeout = timeout;
    this.uploadTimeout = uploadTimeout;
  }

  @Override
  public FolderHandle ensureFolder(List<String> segments) {
    String drive = resolveDriveId();
    List<String> current = new ArrayList<>();
    for (String segment : segments) {
      createFolderLevel(drive, current, segment);
      current.add(segment);
    }
    return new FolderHandle(segments, String.join("/", segments));
  }

  @Override
  public WriteResult writeFileIfAbsent(FolderHandle folder, String fileName, byte[] content) {
    String drive = resolveDriveId();
    List<String> filePath = new ArrayList<>(folder.segments());
    filePath.add(fileName);

    Optional<DriveItem> existing = findItem(drive, filePath);
    if (existing.isPresent()) {
      log.debug("File already archived on OneDrive: {}", String.join("/", filePath));
      return WriteResult.alreadyPresent(locationOf(existing.get(), filePath));
    }

    Optional<DriveItem> uploaded = upload(drive, filePath, content);
    if (uploaded.isPresent()) {
      log.debug("Uploaded {} bytes to OneDrive: {}", content.length, String.join("/", filePath));
      return WriteResult.created(locationOf(uploaded.get(), filePath));
    }

    // 409: a concurrent writer got there first
    DriveItem winner =
        findItem(drive, filePath)
            .orElseThrow(
                () ->
                    new ArchiveStorageException(
                        "Upload conflicted but no item found at " + String.join("/", filePath),
                        true));
    return WriteResult.alreadyPresent(locationOf(winner, filePath));
  }

  @Override
  public void verifyAccess() {
    try {
      resolveDriveId();
    } catch (ArchiveStorageException e) {
      throw new ConfigurationException("OneDrive is not accessible: " + e.getMessage(), e);
    }
  }

  @Override
  public String backendName() {
    return "onedrive";
  }

  String resolveDriveId() {
    String cached = driveId;
    if (cached != null) {
      return cached;
    }
    try {
      DriveItem drive =
          webClient
              .get()
              .uri(URI.create(baseUrl + "/me/drive"))
              .headers(this::authorize)
              .retrieve()
              .bodyToMono(DriveItem.class)
              .timeout(timeout)
              .block();
      if (drive == null || drive.id() == null) {
        throw new ArchiveStorageException("Graph returned no drive for the signed-in user", false);
      }
      driveId = drive.id();
      log.info("Resolved OneDrive drive id {}", drive.id());
      return drive.id();
    } catch (RuntimeException e) {
      throw GraphErrors.translate("Resolving OneDrive drive", e);
    }
  }

  private void createFolderLevel(String drive, List<String> parent, String name) {
    URI uri =
        parent.isEmpty()
            ? URI.create(baseUrl + "/drives/" + drive + "/root/children")
            : URI.create(baseUrl + "/drives/" + drive + "/root:/" + encode(parent) + ":/children");
    Map<String, Object> body = Map.of("name", name, "folder", Map.of(), CONFLICT_FAIL, "fail");
    try {
      HttpStatus status =
          webClient
              .post()
              .uri(uri)
              .headers(this::authorize)
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(body)
              .exchangeToMono(this::toCreateStatus)
              .timeout(timeout)
              .block();
      log.debug("Folder '{}' under /{}: {}", name, String.join("/", parent), status);
    } catch (RuntimeException e) {
      throw GraphErrors.translate("Creating folder " + name, e);
    }
  }

  private Mono<HttpStatus> toCreateStatus(ClientResponse response) {
    int status = response.statusCode().value();
    if (response.statusCode().is2xxSuccessful()) {
      return response.releaseBody().thenReturn(HttpStatus.CREATED);
    }
    if (status == HttpStatus.CONFLICT.value()) {
      return response.releaseBody().thenReturn(HttpStatus.CONFLICT);
    }
    return response.createError();
  }

  private Optional<DriveItem> findItem(String drive, List<String> path) {
    URI uri = URI.create(baseUrl + "/drives/" + drive + "/root:/" + encode(path));
    try {
      return webClient
          .get()
          .uri(uri)
          .headers(this::authorize)
          .exchangeToMono(
              response -> {
                if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                  return response.releaseBody().then(Mono.<DriveItem>empty());
                }
                if (response.statusCode().is2xxSuccessful()) {
                  return response.bodyToMono(DriveItem.class);
                }
                return response.createError();
              })
          .timeout(timeout)
          .blockOptional();
    } catch (RuntimeException e) {
      throw GraphErrors.translate("Looking up " + String.join("/", path), e);
    }
  }

  /** Returns empty when Graph reports a conflict. */
  private Optional<DriveItem> upload(String drive, List<String> path, byte[] content) {
    URI uri =
        URI.create(
            baseUrl
                + "/drives/"
                + drive
                + "/root:/"
                + encode(path)
                + ":/content?"
                + CONFLICT_FAIL
                + "=fail");
    try {
      return webClient
          .put()
          .uri(uri)
          .headers(this::authorize)
          .contentType(MediaType.APPLICATION_PDF)
          .bodyValue(content)
          .exchangeToMono(
              response -> {
                if (response.statusCode().value() == HttpStatus.CONFLICT.value()) {
                  return response.releaseBody().then(Mono.<DriveItem>empty());
                }
                if (response.statusCode().is2xxSuccessful()) {
                  return response.bodyToMono(DriveItem.class);
                }
                return response.createError();
              })
          .timeout(uploadTimeout)
          .blockOptional();
    } catch (RuntimeException e) {
      throw GraphErrors.translate("Uploading " + String.join("/", path), e);
    }
  }

  private void authorize(HttpHeaders headers) {
    headers.setBearerAuth(tokenProvider.accessToken());
  }

  private String locationOf(DriveItem item, List<String> path) {
    return item.webUrl() != null ? item.webUrl() : String.join("/", path);
  }

  static String encode(List<String> segments) {
    return segments.stream()
        .map(segment -> UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8))
        .reduce((left, right) -> left + "/" + right)
        .orElse("");
  }
}
