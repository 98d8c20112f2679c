package com.flamingo.ai.beoarchive.archive;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Makes strings safe as folder and file names on local disks and OneDrive.
 *
 * <p>Reserved characters ({@code < > : " / \ | ? *}) and control characters become {@code _};
 * surrounding whitespace and trailing dots are removed. The output contains none of the replaced
 * characters and no removable edges, so sanitizing it again returns it unchanged.
 */
public final class PathSanitizer {

  public static final String REPLACEMENT = "_";
  public static final String FALLBACK_SEGMENT = "Unknown";
  public static final String FALLBACK_FILE_NAME = "document.pdf";

  private static final Pattern ILLEGAL = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");
  private static final Pattern TRAILING_DOTS_AND_SPACE =
      Pattern.compile("[.\\p{javaWhitespace}]+$");

  private PathSanitizer() {}

  public static String sanitizeSegment(String value) {
    if (value == null) {
      return FALLBACK_SEGMENT;
    }
    String replaced = ILLEGAL.matcher(value.strip()).replaceAll(REPLACEMENT);
    String trimmed = TRAILING_DOTS_AND_SPACE.matcher(replaced).replaceAll("");
    return trimmed.isEmpty() ? FALLBACK_SEGMENT : trimmed;
  }

  /** Sanitizes an attachment name and guarantees a {@code .pdf} extension. */
  public static String sanitizeFileName(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      return FALLBACK_FILE_NAME;
    }
    String safe = sanitizeSegment(fileName);
    if (FALLBACK_SEGMENT.equals(safe)) {
      return FALLBACK_FILE_NAME;
    }
    return safe.toLowerCase(Locale.ROOT).endsWith(".pdf") ? safe : safe + ".pdf";
  }
}
