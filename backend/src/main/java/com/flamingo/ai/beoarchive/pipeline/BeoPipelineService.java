package com.flamingo.ai.beoarchive.pipeline;

import com.flamingo.ai.beoarchive.archive.ArchivePathResolver;
import com.flamingo.ai.beoarchive.archive.ArchiveStore;
import com.flamingo.ai.beoarchive.archive.FolderHandle;
import com.flamingo.ai.beoarchive.archive.PathSanitizer;
import com.flamingo.ai.beoarchive.archive.WriteResult;
import com.flamingo.ai.beoarchive.classification.BeoValidationService;
import com.flamingo.ai.beoarchive.config.BeoArchiveConfig;
import com.flamingo.ai.beoarchive.exception.ArchiveStorageException;
import com.flamingo.ai.beoarchive.exception.ClassificationException;
import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import com.flamingo.ai.beoarchive.exception.TextExtractionException;
import com.flamingo.ai.beoarchive.extraction.TextExtractor;
import com.flamingo.ai.beoarchive.pipeline.model.ArchivePath;
import com.flamingo.ai.beoarchive.pipeline.model.Attachment;
import com.flamingo.ai.beoarchive.pipeline.model.AttachmentBundle;
import com.flamingo.ai.beoarchive.pipeline.model.BundleOutcome;
import com.flamingo.ai.beoarchive.pipeline.model.BundleState;
import com.flamingo.ai.beoarchive.pipeline.model.ExtractedText;
import com.flamingo.ai.beoarchive.pipeline.model.StoredFile;
import com.flamingo.ai.beoarchive.pipeline.model.StructuredFields;
import com.flamingo.ai.beoarchive.pipeline.model.ValidationVerdict;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives attachment bundles through extraction, classification, path resolution and archiving.
 *
 * <p>Every bundle ends in exactly one {@link BundleOutcome}, and failures are contained per
 * bundle. {@link ConfigurationException} is the one failure that escapes; it cancels the rest of
 * the run.
 */
@Service
@Slf4j
public class BeoPipelineService {

  private final TextExtractor textExtractor;
  private final BeoValidationService validationService;
  private final ArchivePathResolver pathResolver;
  private final ArchiveStore archiveStore;
  private final Executor bundleProcessingExecutor;
  private final MeterRegistry meterRegistry;
  private final double minConfidence;
  private final int maxInFlight;

  public BeoPipelineService(
      TextExtractor textExtractor,
      BeoValidationService validationService,
      ArchivePathResolver pathResolver,
      ArchiveStore archiveStore,
      @Qualifier("bundleProcessingExecutor") Executor bundleProcessingExecutor,
      MeterRegistry meterRegistry,
      BeoArchiveConfig config) {
    this.textExtractor = textExtractor;
    this.validationService = validationService;
    this.pathResolver = pathResolver;
    this.archiveStore = archiveStore;
    this.bundleProcessingExecutor = bundleProcessingExecutor;
    this.meterRegistry = meterRegistry;
    this.minConfidence = config.getClassification().getMinConfidence();
    this.maxInFlight = config.getPipeline().getWorkerThreads();
  }

  /** Processes bundles on the worker pool and returns outcomes in completion order. */
  public List<BundleOutcome> processAll(List<AttachmentBundle> bundles) {
    return processAll(bundles, outcome -> {});
  }

  /**
   * Processes bundles on the worker pool. At most one bundle per worker thread is submitted at a
   * time; the rest wait here until a worker frees up.
   *
   * @param bundles bundles to process
   * @param onOutcome called on the caller's thread as each bundle finishes
   * @return outcomes in completion order
   * @throws ConfigurationException if a bundle hit a configuration error; bundles that have not
   *     finished yet are cancelled
   */
  public List<BundleOutcome> processAll(
      List<AttachmentBundle> bundles, Consumer<BundleOutcome> onOutcome) {
    CompletionService<BundleOutcome> completion =
        new ExecutorCompletionService<>(bundleProcessingExecutor);
    Map<Future<BundleOutcome>, AttachmentBundle> inFlight = new HashMap<>();
    Iterator<AttachmentBundle> waiting = bundles.iterator();
    while (inFlight.size() < maxInFlight && waiting.hasNext()) {
      submit(completion, inFlight, waiting.next());
    }

    List<BundleOutcome> outcomes = new ArrayList<>(bundles.size());
    while (!inFlight.isEmpty()) {
      Future<BundleOutcome> done;
      try {
        done = completion.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelRemaining(inFlight.keySet());
        throw new IllegalStateException("Interrupted while waiting for bundle outcomes", e);
      }
      AttachmentBundle bundle = inFlight.remove(done);
      BundleOutcome outcome = collect(done, bundle, inFlight.keySet());
      outcomes.add(outcome);
      onOutcome.accept(outcome);
      if (waiting.hasNext()) {
        submit(completion, inFlight, waiting.next());
      }
    }
    return outcomes;
  }

  private void submit(
      CompletionService<BundleOutcome> completion,
      Map<Future<BundleOutcome>, AttachmentBundle> inFlight,
      AttachmentBundle bundle) {
    inFlight.put(completion.submit(() -> process(bundle)), bundle);
  }

  private BundleOutcome collect(
      Future<BundleOutcome> done,
      AttachmentBundle bundle,
      Collection<Future<BundleOutcome>> pending) {
    try {
      return done.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof ConfigurationException ce) {
        cancelRemaining(pending);
        throw ce;
      }
      log.error("Bundle {}: worker failed unexpectedly: {}", bundle.bundleId(), cause, cause);
      return BundleOutcome.failed(bundle, "Unexpected error: " + cause);
    } catch (CancellationException e) {
      return BundleOutcome.failed(bundle, "Cancelled");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelRemaining(pending);
      throw new IllegalStateException("Interrupted while waiting for bundle outcomes", e);
    }
  }

  private void cancelRemaining(Collection<Future<BundleOutcome>> futures) {
    long cancelled = futures.stream().filter(future -> future.cancel(true)).count();
    if (cancelled > 0) {
      log.warn("Cancelled {} pending bundle(s)", cancelled);
    }
  }

  /** Processes one bundle on the calling thread. */
  public BundleOutcome process(AttachmentBundle bundle) {
    BundleOutcome outcome;
    try {
      outcome = runStages(bundle);
    } catch (ConfigurationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Bundle {}: unexpected failure: {}", bundle.bundleId(), e.getMessage(), e);
      outcome = BundleOutcome.failed(bundle, "Unexpected error: " + e.getMessage());
    }

    transition(bundle, BundleState.DONE);
    meterRegistry
        .counter("beo.bundles.outcome", "status", outcome.status().name().toLowerCase(Locale.ROOT))
        .increment();
    log.info(
        "Bundle {} ('{}'): {} - {}",
        bundle.bundleId(),
        bundle.subject(),
        outcome.status(),
        outcome.detail());
    return outcome;
  }

  private BundleOutcome runStages(AttachmentBundle bundle) {
    transition(bundle, BundleState.RECEIVED);
    List<Attachment> pdfs = bundle.pdfAttachments();
    if (pdfs.isEmpty()) {
      return skip(bundle, "No PDF attachments");
    }

    List<ExtractedText> texts = new ArrayList<>(pdfs.size());
    for (Attachment pdf : pdfs) {
      try {
        texts.add(textExtractor.extract(pdf.fileName(), pdf.content()));
      } catch (TextExtractionException e) {
        log.warn("Bundle {}: {}", bundle.bundleId(), e.getMessage());
        return skip(bundle, e.getMessage());
      }
    }
    transition(bundle, BundleState.TEXT_EXTRACTED);

    if (texts.stream().allMatch(ExtractedText::isBlank)) {
      return skip(bundle, "No extractable text in " + pdfs.size() + " attachment(s)");
    }

    ValidationVerdict verdict;
    try {
      verdict = validationService.classify(bundle.bundleId(), texts);
    } catch (ClassificationException e) {
      return skip(bundle, e.getMessage());
    }
    transition(bundle, BundleState.CLASSIFIED);

    if (!verdict.valid()) {
      transition(bundle, BundleState.INVALID);
      String reason = verdict.reason() != null ? verdict.reason() : "Not a signed BEO bundle";
      return BundleOutcome.rejected(bundle, reason);
    }
    if (verdict.confidence() < minConfidence) {
      return skip(
          bundle,
          String.format(
              Locale.ROOT,
              "Confidence %.2f below %.2f; held for manual review",
              verdict.confidence(),
              minConfidence));
    }
    transition(bundle, BundleState.VALID);

    StructuredFields fields = verdict.fields().orElseThrow();
    ArchivePath path = pathResolver.resolve(fields);
    transition(bundle, BundleState.PATH_RESOLVED);
    log.debug("Bundle {}: archive path {}", bundle.bundleId(), path.asPath());

    try {
      FolderHandle folder = archiveStore.ensureFolder(path.segments());
      List<StoredFile> stored = new ArrayList<>(pdfs.size());
      for (Attachment pdf : pdfs) {
        String fileName = PathSanitizer.sanitizeFileName(pdf.fileName());
        WriteResult result = archiveStore.writeFileIfAbsent(folder, fileName, pdf.content());
        stored.add(new StoredFile(fileName, result.created(), result.location()));
      }
      transition(bundle, BundleState.STORED);
      return BundleOutcome.saved(bundle, folder.location(), stored);
    } catch (ArchiveStorageException e) {
      transition(bundle, BundleState.FAILED);
      log.warn(
          "Bundle {}: archiving to {} failed: {}",
          bundle.bundleId(),
          path.asPath(),
          e.getMessage());
      return BundleOutcome.failed(bundle, "Storage error: " + e.getMessage());
    }
  }

  private BundleOutcome skip(AttachmentBundle bundle, String reason) {
    transition(bundle, BundleState.SKIPPED);
    return BundleOutcome.skipped(bundle, reason);
  }

  private void transition(AttachmentBundle bundle, BundleState state) {
    log.debug("Bundle {} -> {}", bundle.bundleId(), state);
  }
}
