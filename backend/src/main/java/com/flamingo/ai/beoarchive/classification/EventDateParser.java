package com.flamingo.ai.beoarchive.classification;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/** Parses the event dates a model reports, in the formats BEO sheets commonly use. */
public final class EventDateParser {

  private static final Pattern ORDINAL_SUFFIX = Pattern.compile("(\\d)(st|nd|rd|th)\\b");
  private static final Pattern ISO_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T.*");

  private static final List<DateTimeFormatter> FORMATS =
      List.of(
          DateTimeFormatter.ISO_LOCAL_DATE,
          formatter("yyyy/M/d"),
          formatter("M/d/yyyy"),
          formatter("M/d/yy"),
          formatter("M-d-yyyy"),
          formatter("MMMM d, yyyy"),
          formatter("MMM d, yyyy"),
          formatter("EEEE, MMMM d, yyyy"),
          formatter("EEE, MMM d, yyyy"),
          formatter("d MMMM yyyy"),
          formatter("d MMM yyyy"));

  private EventDateParser() {}

  public static Optional<LocalDate> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = ORDINAL_SUFFIX.matcher(value.strip()).replaceAll("$1");
    normalized = normalized.replaceAll("\\s+", " ");
    if (ISO_DATE_TIME.matcher(normalized).matches()) {
      normalized = normalized.substring(0, 10);
    }
    String candidate = normalized;
    return FORMATS.stream()
        .map(format -> tryParse(candidate, format))
        .flatMap(Optional::stream)
        .findFirst();
  }

  private static Optional<LocalDate> tryParse(String value, DateTimeFormatter format) {
    try {
      return Optional.of(LocalDate.parse(value, format));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static DateTimeFormatter formatter(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(Locale.US);
  }
}
