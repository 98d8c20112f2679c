package com.flamingo.ai.beoarchive.api.dto.response;

import com.flamingo.ai.beoarchive.pipeline.model.BundleOutcome;
import com.flamingo.ai.beoarchive.pipeline.model.OutcomeStatus;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the outcome of one processed bundle. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BundleOutcomeResponse {

  private String bundleId;
  private String subject;
  private OutcomeStatus status;
  private String detail;
  private String location;
  private List<StoredFileResponse> files;

  /** One archived file. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class StoredFileResponse {
    private String fileName;
    private boolean created;
    private String location;
  }

  /** Creates a response from a pipeline outcome. */
  public static BundleOutcomeResponse fromOutcome(BundleOutcome outcome) {
    return BundleOutcomeResponse.builder()
        .bundleId(outcome.bundleId())
        .subject(outcome.subject())
        .status(outcome.status())
        .detail(outcome.detail())
        .location(outcome.location())
        .files(
            outcome.storedFiles().stream()
                .map(f -> new StoredFileResponse(f.fileName(), f.created(), f.location()))
                .toList())
        .build();
  }
}
