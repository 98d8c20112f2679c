package com.flamingo.ai.beoarchive.classification;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("EventDateParser")
class EventDateParserTest {

  private static final LocalDate NEW_YEAR = LocalDate.of(2026, 1, 1);

  @ParameterizedTest
  @ValueSource(
      strings = {
        "2026-01-01",
        "2026-01-01T18:30:00",
        "2026/1/1",
        "1/1/2026",
        "01/01/26",
        "1-1-2026",
        "January 1, 2026",
        "JANUARY 1, 2026",
        "January 1st, 2026",
        "Jan 1, 2026",
        "Thursday, January 1, 2026",
        "Thu, Jan 1, 2026",
        "1 January 2026",
        "1st January 2026",
        "1 Jan 2026",
        "  2026-01-01  "
      })
  @DisplayName("should parse common BEO date formats")
  void shouldParseSupportedFormats(String value) {
    assertThat(EventDateParser.parse(value)).contains(NEW_YEAR);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "   ", "next Tuesday", "13/45/2026", "2026-02-30", "TBD"})
  @DisplayName("should return empty for unreadable dates")
  void shouldRejectUnreadableDates(String value) {
    assertThat(EventDateParser.parse(value)).isEmpty();
  }

  @Test
  @DisplayName("should return empty for null")
  void shouldHandleNull() {
    assertThat(EventDateParser.parse(null)).isEmpty();
  }
}
