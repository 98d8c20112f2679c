package com.flamingo.ai.beoarchive.pipeline.model;

import java.util.List;

/** Result record emitted once per bundle for reporting. */
public record BundleOutcome(
    String bundleId,
    String subject,
    OutcomeStatus status,
    String detail,
    String location,
    List<StoredFile> storedFiles) {

  public BundleOutcome {
    storedFiles = storedFiles != null ? List.copyOf(storedFiles) : List.of();
  }

  public static BundleOutcome saved(
      AttachmentBundle bundle, String location, List<StoredFile> storedFiles) {
    long created = storedFiles.stream().filter(StoredFile::created).count();
    String detail =
        created == storedFiles.size()
            ? "Archived " + created + " file(s)"
            : "Archived " + created + " new file(s), " + (storedFiles.size() - created)
                + " already present";
    return new BundleOutcome(
        bundle.bundleId(), bundle.subject(), OutcomeStatus.SAVED, detail, location, storedFiles);
  }

  public static BundleOutcome rejected(AttachmentBundle bundle, String reason) {
    return new BundleOutcome(
        bundle.bundleId(), bundle.subject(), OutcomeStatus.REJECTED, reason, null, List.of());
  }

  public static BundleOutcome skipped(AttachmentBundle bundle, String reason) {
    return new BundleOutcome(
        bundle.bundleId(), bundle.subject(), OutcomeStatus.SKIPPED, reason, null, List.of());
  }

  public static BundleOutcome failed(AttachmentBundle bundle, String reason) {
    return new BundleOutcome(
        bundle.bundleId(), bundle.subject(), OutcomeStatus.FAILED, reason, null, List.of());
  }
}
