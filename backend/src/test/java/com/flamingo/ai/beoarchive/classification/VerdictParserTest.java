package com.flamingo.ai.beoarchive.classification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.beoarchive.exception.ClassificationException;
import com.flamingo.ai.beoarchive.pipeline.model.StructuredFields;
import com.flamingo.ai.beoarchive.pipeline.model.ValidationVerdict;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("VerdictParser")
class VerdictParserTest {

  private final VerdictParser parser = new VerdictParser(new ObjectMapper());

  @Nested
  @DisplayName("well-formed responses")
  class WellFormed {

    @Test
    @DisplayName("should read a valid verdict with its fields")
    void shouldParseValidVerdict() {
      ValidationVerdict verdict =
          parser.parse(
              """
              {"valid": true, "confidence": 0.93, "beoNumber": "12345",
               "beoDate": "January 1, 2026", "organizationName": " Acme Corp ",
               "reason": "Signed form and matching BEO"}
              """);

      assertThat(verdict.valid()).isTrue();
      assertThat(verdict.confidence()).isEqualTo(0.93);
      assertThat(verdict.reason()).isEqualTo("Signed form and matching BEO");
      assertThat(verdict.fields())
          .contains(new StructuredFields(LocalDate.of(2026, 1, 1), "12345", "Acme Corp"));
    }

    @Test
    @DisplayName("should read an invalid verdict without fields")
    void shouldParseInvalidVerdict() {
      ValidationVerdict verdict =
          parser.parse(
              """
              {"valid": false, "confidence": 0.8, "beoNumber": null, "beoDate": null,
               "organizationName": null, "reason": "Hospitality form is not signed"}
              """);

      assertThat(verdict.valid()).isFalse();
      assertThat(verdict.fields()).isEmpty();
      assertThat(verdict.reason()).isEqualTo("Hospitality form is not signed");
    }

    @Test
    @DisplayName("should accept a response wrapped in a code fence")
    void shouldStripCodeFence() {
      ValidationVerdict verdict =
          parser.parse("```json\n{\"valid\": false, \"confidence\": 1}\n```");

      assertThat(verdict.valid()).isFalse();
      assertThat(verdict.confidence()).isEqualTo(1.0);
      assertThat(verdict.reason()).isNull();
    }
  }

  @Nested
  @DisplayName("schema violations")
  class SchemaViolations {

    @Test
    @DisplayName("should reject non-JSON text as retryable")
    void shouldRejectNonJson() {
      assertThatThrownBy(() -> parser.parse("Yes, this looks like a BEO."))
          .isInstanceOf(ClassificationException.class)
          .hasMessageContaining("not valid JSON")
          .satisfies(e -> assertThat(((ClassificationException) e).isRetryable()).isTrue());
    }

    @Test
    @DisplayName("should reject an empty response")
    void shouldRejectEmpty() {
      assertThatThrownBy(() -> parser.parse("  ")).isInstanceOf(ClassificationException.class);
    }

    @Test
    @DisplayName("should reject a JSON array")
    void shouldRejectArray() {
      assertThatThrownBy(() -> parser.parse("[true, 0.9]"))
          .isInstanceOf(ClassificationException.class)
          .hasMessageContaining("not a JSON object");
    }

    @Test
    @DisplayName("should reject valid given as a string")
    void shouldRejectStringValid() {
      assertThatThrownBy(() -> parser.parse("{\"valid\": \"true\", \"confidence\": 0.9}"))
          .isInstanceOf(ClassificationException.class)
          .hasMessageContaining("'valid'");
    }

    @Test
    @DisplayName("should reject missing or out-of-range confidence")
    void shouldRejectBadConfidence() {
      assertThatThrownBy(() -> parser.parse("{\"valid\": false}"))
          .isInstanceOf(ClassificationException.class)
          .hasMessageContaining("'confidence'");
      assertThatThrownBy(() -> parser.parse("{\"valid\": false, \"confidence\": 1.5}"))
          .isInstanceOf(ClassificationException.class)
          .hasMessageContaining("between 0 and 1");
      assertThatThrownBy(() -> parser.parse("{\"valid\": false, \"confidence\": \"0.9\"}"))
          .isInstanceOf(ClassificationException.class);
    }

    @Test
    @DisplayName("should reject a valid verdict missing a field")
    void shouldRejectMissingField() {
      assertThatThrownBy(
              () ->
                  parser.parse(
                      "{\"valid\": true, \"confidence\": 0.9, \"beoNumber\": \"12345\","
                          + " \"beoDate\": \"2026-01-01\", \"organizationName\": \"\"}"))
          .isInstanceOf(ClassificationException.class)
          .hasMessageContaining("'organizationName'");
    }

    @Test
    @DisplayName("should reject a valid verdict with an unreadable date")
    void shouldRejectUnreadableDate() {
      assertThatThrownBy(
              () ->
                  parser.parse(
                      "{\"valid\": true, \"confidence\": 0.9, \"beoNumber\": \"12345\","
                          + " \"beoDate\": \"sometime in spring\","
                          + " \"organizationName\": \"Acme\"}"))
          .isInstanceOf(ClassificationException.class)
          .hasMessageContaining("'beoDate'");
    }

    @Test
    @DisplayName("should reject a non-string reason")
    void shouldRejectNonStringReason() {
      assertThatThrownBy(
              () -> parser.parse("{\"valid\": false, \"confidence\": 0.4, \"reason\": 42}"))
          .isInstanceOf(ClassificationException.class)
          .hasMessageContaining("'reason'");
    }
  }
}
