package com.flamingo.ai.beoarchive.pipeline.model;

import java.time.LocalDate;
import java.util.Objects;

/** Identifying fields of a valid BEO. */
public record StructuredFields(LocalDate eventDate, String documentNumber, String clientName) {

  public StructuredFields {
    Objects.requireNonNull(eventDate, "eventDate");
    if (documentNumber == null || documentNumber.isBlank()) {
      throw new IllegalArgumentException("documentNumber must not be blank");
    }
    if (clientName == null || clientName.isBlank()) {
      throw new IllegalArgumentException("clientName must not be blank");
    }
  }
}
