package com.flamingo.ai.beoarchive.archive;

import com.flamingo.ai.beoarchive.pipeline.model.ArchivePath;
import com.flamingo.ai.beoarchive.pipeline.model.StructuredFields;
import java.time.LocalDate;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Maps BEO fields to archive folder segments: {@code year / month / day / "number - client"}.
 *
 * <p>Date parts are unpadded decimals (day {@code 1}, not {@code 01}). All-digit BEO numbers
 * shorter than five digits are zero-padded to five. No state, no I/O: equal fields always give
 * equal segments.
 */
@Component
public class ArchivePathResolver {

  static final int BEO_NUMBER_DIGITS = 5;

  public ArchivePath resolve(StructuredFields fields) {
    LocalDate date = fields.eventDate();
    String eventFolder =
        PathSanitizer.sanitizeSegment(
            normalizeDocumentNumber(fields.documentNumber())
                + " - "
                + PathSanitizer.sanitizeSegment(fields.clientName()));
    return new ArchivePath(
        List.of(
            Integer.toString(date.getYear()),
            Integer.toString(date.getMonthValue()),
            Integer.toString(date.getDayOfMonth()),
            eventFolder));
  }

  static String normalizeDocumentNumber(String documentNumber) {
    String trimmed = PathSanitizer.sanitizeSegment(documentNumber);
    if (trimmed.chars().allMatch(Character::isDigit) && trimmed.length() < BEO_NUMBER_DIGITS) {
      return "0".repeat(BEO_NUMBER_DIGITS - trimmed.length()) + trimmed;
    }
    return trimmed;
  }
}
