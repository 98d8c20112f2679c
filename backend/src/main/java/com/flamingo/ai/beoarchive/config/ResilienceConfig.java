package com.flamingo.ai.beoarchive.config;

import com.flamingo.ai.beoarchive.exception.ArchiveStorageException;
import com.flamingo.ai.beoarchive.exception.ClassificationException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.micrometer.tagged.TaggedBulkheadMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry and bulkhead instances for the two network-bound stages: AI classification and archive
 * writes.
 */
@Configuration
public class ResilienceConfig {

  public static final String CLASSIFICATION = "classification";
  public static final String ARCHIVE = "archive";

  @Bean
  public RetryRegistry retryRegistry(MeterRegistry meterRegistry) {
    RetryRegistry registry = RetryRegistry.ofDefaults();
    TaggedRetryMetrics.ofRetryRegistry(registry).bindTo(meterRegistry);
    return registry;
  }

  @Bean
  public BulkheadRegistry bulkheadRegistry(MeterRegistry meterRegistry) {
    BulkheadRegistry registry = BulkheadRegistry.ofDefaults();
    TaggedBulkheadMetrics.ofBulkheadRegistry(registry).bindTo(meterRegistry);
    return registry;
  }

  @Bean
  public Retry classificationRetry(RetryRegistry registry, BeoArchiveConfig config) {
    BeoArchiveConfig.Classification classification = config.getClassification();
    return registry.retry(
        CLASSIFICATION,
        RetryConfig.custom()
            .maxAttempts(classification.getMaxAttempts())
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    classification.getInitialBackoff(), classification.getBackoffMultiplier()))
            .retryOnException(e -> e instanceof ClassificationException ce && ce.isRetryable())
            .build());
  }

  @Bean
  public Bulkhead classificationBulkhead(BulkheadRegistry registry, BeoArchiveConfig config) {
    BeoArchiveConfig.Classification classification = config.getClassification();
    return registry.bulkhead(
        CLASSIFICATION,
        BulkheadConfig.custom()
            .maxConcurrentCalls(classification.getMaxConcurrentCalls())
            .maxWaitDuration(classification.getMaxWaitForPermit())
            .build());
  }

  @Bean
  public Retry archiveRetry(RetryRegistry registry, BeoArchiveConfig config) {
    BeoArchiveConfig.Archive archive = config.getArchive();
    return registry.retry(
        ARCHIVE,
        RetryConfig.custom()
            .maxAttempts(archive.getMaxAttempts())
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    archive.getInitialBackoff(), archive.getBackoffMultiplier()))
            .retryOnException(
                e -> e instanceof ArchiveStorageException se && se.isTransientFailure())
            .build());
  }
}
