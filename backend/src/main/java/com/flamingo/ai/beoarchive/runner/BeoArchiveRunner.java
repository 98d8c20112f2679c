package com.flamingo.ai.beoarchive.runner;

import com.flamingo.ai.beoarchive.archive.ArchiveStore;
import com.flamingo.ai.beoarchive.intake.BundleSource;
import com.flamingo.ai.beoarchive.pipeline.BeoPipelineService;
import com.flamingo.ai.beoarchive.pipeline.model.AttachmentBundle;
import com.flamingo.ai.beoarchive.pipeline.model.BundleOutcome;
import com.flamingo.ai.beoarchive.pipeline.model.OutcomeStatus;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * One-shot archive run at startup: checks the archive is reachable, fetches bundles from the
 * configured source and reports one line per bundle plus a summary.
 */
@Component
@ConditionalOnProperty(prefix = "beo.runner", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BeoArchiveRunner implements ApplicationRunner {

  private final BundleSource bundleSource;
  private final ArchiveStore archiveStore;
  private final BeoPipelineService pipelineService;

  @Override
  public void run(ApplicationArguments args) {
    Map<OutcomeStatus, Integer> counts = runOnce();
    log.info(
        "Archive run finished: {} saved, {} rejected, {} skipped, {} failed",
        counts.get(OutcomeStatus.SAVED),
        counts.get(OutcomeStatus.REJECTED),
        counts.get(OutcomeStatus.SKIPPED),
        counts.get(OutcomeStatus.FAILED));
  }

  /** Runs the pipeline over every available bundle and returns the outcome counts by status. */
  public Map<OutcomeStatus, Integer> runOnce() {
    archiveStore.verifyAccess();
    log.info(
        "Starting archive run: source={}, archive={}",
        bundleSource.sourceName(),
        archiveStore.backendName());

    List<AttachmentBundle> bundles = bundleSource.fetchBundles();
    Map<OutcomeStatus, Integer> counts = new EnumMap<>(OutcomeStatus.class);
    for (OutcomeStatus status : OutcomeStatus.values()) {
      counts.put(status, 0);
    }
    if (bundles.isEmpty()) {
      log.info("No bundles to process");
      return counts;
    }

    List<BundleOutcome> outcomes =
        pipelineService.processAll(bundles, outcome -> log.info("{}", describe(outcome)));
    for (BundleOutcome outcome : outcomes) {
      counts.merge(outcome.status(), 1, Integer::sum);
    }
    return counts;
  }

  static String describe(BundleOutcome outcome) {
    StringBuilder line =
        new StringBuilder()
            .append('[')
            .append(outcome.status())
            .append("] ")
            .append(outcome.subject() != null ? outcome.subject() : outcome.bundleId())
            .append(": ")
            .append(outcome.detail());
    if (outcome.location() != null) {
      line.append(" -> ").append(outcome.location());
    }
    return line.toString();
  }
}
