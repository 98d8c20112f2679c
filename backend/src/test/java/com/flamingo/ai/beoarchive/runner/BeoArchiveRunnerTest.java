package com.flamingo.ai.beoarchive.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.beoarchive.archive.ArchiveStore;
import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import com.flamingo.ai.beoarchive.intake.BundleSource;
import com.flamingo.ai.beoarchive.pipeline.BeoPipelineService;
import com.flamingo.ai.beoarchive.pipeline.model.AttachmentBundle;
import com.flamingo.ai.beoarchive.pipeline.model.BundleOutcome;
import com.flamingo.ai.beoarchive.pipeline.model.OutcomeStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("BeoArchiveRunner")
class BeoArchiveRunnerTest {

  @Mock private BundleSource bundleSource;

  @Mock private ArchiveStore archiveStore;

  @Mock private BeoPipelineService pipelineService;

  private BeoArchiveRunner runner;

  @BeforeEach
  void setUp() {
    lenient().when(bundleSource.sourceName()).thenReturn("directory");
    lenient().when(archiveStore.backendName()).thenReturn("local");
    runner = new BeoArchiveRunner(bundleSource, archiveStore, pipelineService);
  }

  @Test
  @DisplayName("should check the archive before fetching and count outcomes by status")
  void shouldRunOnce() {
    AttachmentBundle first = new AttachmentBundle("m1", "BEO 1", Instant.now(), List.of());
    AttachmentBundle second = new AttachmentBundle("m2", "BEO 2", Instant.now(), List.of());
    List<AttachmentBundle> bundles = List.of(first, second);
    when(bundleSource.fetchBundles()).thenReturn(bundles);
    when(pipelineService.processAll(eq(bundles), any()))
        .thenReturn(
            List.of(
                BundleOutcome.saved(first, "/archive/2026/1/1/12345 - Acme", List.of()),
                BundleOutcome.rejected(second, "Not signed")));

    Map<OutcomeStatus, Integer> counts = runner.runOnce();

    assertThat(counts)
        .containsEntry(OutcomeStatus.SAVED, 1)
        .containsEntry(OutcomeStatus.REJECTED, 1)
        .containsEntry(OutcomeStatus.SKIPPED, 0)
        .containsEntry(OutcomeStatus.FAILED, 0);
    InOrder order = inOrder(archiveStore, bundleSource, pipelineService);
    order.verify(archiveStore).verifyAccess();
    order.verify(bundleSource).fetchBundles();
    order.verify(pipelineService).processAll(eq(bundles), any());
  }

  @Test
  @DisplayName("should not start the pipeline when there is nothing to process")
  void shouldSkipPipelineWhenNoBundles() {
    when(bundleSource.fetchBundles()).thenReturn(List.of());

    Map<OutcomeStatus, Integer> counts = runner.runOnce();

    assertThat(counts.values()).allMatch(count -> count == 0);
    verifyNoInteractions(pipelineService);
  }

  @Test
  @DisplayName("should abort before fetching when the archive is unusable")
  void shouldAbortOnPreflightFailure() {
    doThrow(new ConfigurationException("Archive directory is not writable"))
        .when(archiveStore)
        .verifyAccess();

    assertThatThrownBy(() -> runner.runOnce()).isInstanceOf(ConfigurationException.class);
    verifyNoInteractions(bundleSource, pipelineService);
  }

  @Test
  @DisplayName("should describe an outcome on one line")
  void shouldDescribeOutcome() {
    AttachmentBundle bundle = new AttachmentBundle("m1", "BEO 12345", Instant.now(), List.of());

    assertThat(BeoArchiveRunner.describe(BundleOutcome.skipped(bundle, "No PDF attachments")))
        .isEqualTo("[SKIPPED] BEO 12345: No PDF attachments");
    assertThat(BeoArchiveRunner.describe(BundleOutcome.saved(bundle, "/archive/x", List.of())))
        .isEqualTo("[SAVED] BEO 12345: Archived 0 file(s) -> /archive/x");
  }
}
