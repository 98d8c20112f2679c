package com.flamingo.ai.beoarchive.classification;

import com.flamingo.ai.beoarchive.agent.BeoDocumentAnalystAgent;
import com.flamingo.ai.beoarchive.exception.ClassificationException;
import com.flamingo.ai.beoarchive.pipeline.model.ExtractedText;
import com.flamingo.ai.beoarchive.pipeline.model.ValidationVerdict;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.RateLimitException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Classifies a bundle with the BEO analyst agent.
 *
 * <p>Each attempt passes through the classification bulkhead, which caps in-flight model calls
 * across all bundle workers. Backoff waits happen outside the bulkhead and hold no permit. Only
 * retryable {@link ClassificationException}s are retried; when attempts run out the last failure
 * is rethrown with the attempt count.
 */
@Service
@Slf4j
public class BeoValidationService {

  private final BeoDocumentAnalystAgent agent;
  private final ClassificationInputBuilder inputBuilder;
  private final VerdictParser verdictParser;
  private final Retry classificationRetry;
  private final Bulkhead classificationBulkhead;
  private final MeterRegistry meterRegistry;

  public BeoValidationService(
      BeoDocumentAnalystAgent agent,
      ClassificationInputBuilder inputBuilder,
      VerdictParser verdictParser,
      @Qualifier("classificationRetry") Retry classificationRetry,
      @Qualifier("classificationBulkhead") Bulkhead classificationBulkhead,
      MeterRegistry meterRegistry) {
    this.agent = agent;
    this.inputBuilder = inputBuilder;
    this.verdictParser = verdictParser;
    this.classificationRetry = classificationRetry;
    this.classificationBulkhead = classificationBulkhead;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Asks the model whether the bundle is a signed BEO.
   *
   * @param bundleId bundle identifier for logging
   * @param texts extracted text of the bundle's attachments, in attachment order
   * @return the schema-checked verdict
   * @throws ClassificationException when every allowed attempt failed
   */
  @Timed(value = "beo.classification", description = "Time to classify a bundle")
  public ValidationVerdict classify(String bundleId, List<ExtractedText> texts) {
    ClassificationInput input = inputBuilder.build(texts);
    AtomicInteger attempts = new AtomicInteger();

    Supplier<ValidationVerdict> attempt =
        () -> {
          int number = attempts.incrementAndGet();
          log.debug("Bundle {}: classification attempt {}", bundleId, number);
          return callAgent(bundleId, input);
        };
    Supplier<ValidationVerdict> guarded =
        Retry.decorateSupplier(
            classificationRetry, Bulkhead.decorateSupplier(classificationBulkhead, attempt));

    try {
      ValidationVerdict verdict = guarded.get();
      meterRegistry.counter("beo.classification.calls", "result", "success").increment();
      log.info(
          "Bundle {}: classified valid={} confidence={} after {} attempt(s)",
          bundleId,
          verdict.valid(),
          verdict.confidence(),
          attempts.get());
      return verdict;
    } catch (ClassificationException e) {
      meterRegistry.counter("beo.classification.calls", "result", "failure").increment();
      throw new ClassificationException(
          "Classification failed after " + attempts.get() + " attempt(s): " + e.getMessage(),
          false,
          e.isRateLimited(),
          e);
    } catch (BulkheadFullException e) {
      meterRegistry.counter("beo.classification.calls", "result", "rejected").increment();
      throw ClassificationException.nonRetryable(
          "No classification slot became available: " + e.getMessage(), e);
    }
  }

  private ValidationVerdict callAgent(String bundleId, ClassificationInput input) {
    String raw;
    try {
      raw = agent.analyze(input.documentCount(), input.content());
    } catch (AuthenticationException | InvalidRequestException e) {
      log.error("Bundle {}: AI service refused the request: {}", bundleId, e.getMessage());
      throw ClassificationException.nonRetryable("AI service refused the request", e);
    } catch (RateLimitException e) {
      log.warn("Bundle {}: AI service rate limit hit: {}", bundleId, e.getMessage());
      meterRegistry.counter("beo.classification.errors", "type", "rate_limited").increment();
      throw ClassificationException.rateLimited("AI service rate limit: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      log.warn("Bundle {}: AI call failed: {}", bundleId, e.getMessage());
      meterRegistry.counter("beo.classification.errors", "type", "transport").increment();
      throw new ClassificationException("AI call failed: " + e.getMessage(), e);
    }

    try {
      return verdictParser.parse(raw);
    } catch (ClassificationException e) {
      log.warn("Bundle {}: rejected model response: {}", bundleId, e.getMessage());
      meterRegistry.counter("beo.classification.errors", "type", "schema").increment();
      throw e;
    }
  }
}
