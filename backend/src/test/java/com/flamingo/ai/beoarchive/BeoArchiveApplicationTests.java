package com.flamingo.ai.beoarchive;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.beoarchive.archive.ArchiveStore;
import com.flamingo.ai.beoarchive.archive.RetryingArchiveStore;
import com.flamingo.ai.beoarchive.intake.BundleSource;
import com.flamingo.ai.beoarchive.pipeline.BeoPipelineService;
import com.flamingo.ai.beoarchive.runner.BeoArchiveRunner;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.aop.TimedAspect;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Loads the full application context offline; no model or Graph call is made at startup. */
@SpringBootTest(
    properties = {
      "langchain4j.openai.api-key=test-key",
      "beo.runner.enabled=false",
      "beo.archive.backend=local",
      "beo.archive.local.base-path=${java.io.tmpdir}/beo-archive-context-test",
      "beo.intake.source=mailbox"
    })
class BeoArchiveApplicationTests {

  @Autowired private ApplicationContext context;

  @Autowired private ArchiveStore archiveStore;

  @Autowired private BundleSource bundleSource;

  @Autowired private BeoPipelineService pipelineService;

  @Autowired
  @Qualifier("classificationRetry")
  private Retry classificationRetry;

  @Autowired
  @Qualifier("archiveRetry")
  private Retry archiveRetry;

  @Autowired private Bulkhead classificationBulkhead;

  @Test
  void contextLoads() {
    assertThat(pipelineService).isNotNull();
    assertThat(archiveStore).isInstanceOf(RetryingArchiveStore.class);
    assertThat(archiveStore.backendName()).isEqualTo("local");
    assertThat(bundleSource.sourceName()).isEqualTo("mailbox");
    assertThat(classificationRetry.getRetryConfig().getMaxAttempts()).isEqualTo(3);
    assertThat(archiveRetry.getRetryConfig().getMaxAttempts()).isEqualTo(3);
    assertThat(classificationBulkhead.getBulkheadConfig().getMaxConcurrentCalls()).isEqualTo(4);
    assertThat(context.getBeansOfType(TimedAspect.class)).hasSize(1);
    assertThat(context.getBeansOfType(BeoArchiveRunner.class)).isEmpty();
  }
}
