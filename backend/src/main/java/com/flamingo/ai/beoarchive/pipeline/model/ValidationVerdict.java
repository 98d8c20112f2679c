package com.flamingo.ai.beoarchive.pipeline.model;

import java.util.Optional;

/**
 * Outcome of classifying one bundle. {@code fields} is present exactly when the bundle is valid.
 */
public record ValidationVerdict(
    boolean valid, double confidence, Optional<StructuredFields> fields, String reason) {

  public ValidationVerdict {
    fields = fields != null ? fields : Optional.empty();
    if (valid && fields.isEmpty()) {
      throw new IllegalArgumentException("A valid verdict requires structured fields");
    }
    if (!valid && fields.isPresent()) {
      throw new IllegalArgumentException("An invalid verdict must not carry structured fields");
    }
  }

  public static ValidationVerdict valid(double confidence, StructuredFields fields, String reason) {
    return new ValidationVerdict(true, confidence, Optional.of(fields), reason);
  }

  public static ValidationVerdict invalid(double confidence, String reason) {
    return new ValidationVerdict(false, confidence, Optional.empty(), reason);
  }
}
