package com.flamingo.ai.beoarchive.archive;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("PathSanitizer")
class PathSanitizerTest {

  @Test
  @DisplayName("should replace a slash with an underscore")
  void shouldReplaceSlash() {
    assertThat(PathSanitizer.sanitizeSegment("Acme/Corp")).isEqualTo("Acme_Corp");
  }

  @Test
  @DisplayName("should replace every reserved and control character")
  void shouldReplaceReservedCharacters() {
    assertThat(PathSanitizer.sanitizeSegment("a<b>c:d\"e\\f|g?h*i")).isEqualTo("a_b_c_d_e_f_g_h_i");
    assertThat(PathSanitizer.sanitizeSegment("tab\there")).isEqualTo("tab_here");
  }

  @Test
  @DisplayName("should strip surrounding whitespace and trailing dots")
  void shouldStripEdges() {
    assertThat(PathSanitizer.sanitizeSegment("  Acme Corp.  ")).isEqualTo("Acme Corp");
    assertThat(PathSanitizer.sanitizeSegment("Acme Inc. . .")).isEqualTo("Acme Inc");
  }

  @Test
  @DisplayName("should fall back to Unknown when nothing is left")
  void shouldFallBackToUnknown() {
    assertThat(PathSanitizer.sanitizeSegment(null)).isEqualTo("Unknown");
    assertThat(PathSanitizer.sanitizeSegment("")).isEqualTo("Unknown");
    assertThat(PathSanitizer.sanitizeSegment(" ... ")).isEqualTo("Unknown");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "Acme/Corp",
        "  Guardian Scholars Program. ",
        "a<b>c",
        "trailing dot.",
        "x . .",
        " Cafe ",
        "",
        "12345 - Acme: Corp?"
      })
  @DisplayName("should be idempotent")
  void shouldBeIdempotent(String input) {
    String once = PathSanitizer.sanitizeSegment(input);
    assertThat(PathSanitizer.sanitizeSegment(once)).isEqualTo(once);
  }

  @Test
  @DisplayName("should keep a .pdf extension on file names")
  void shouldEnsurePdfExtension() {
    assertThat(PathSanitizer.sanitizeFileName("BEO 12345.pdf")).isEqualTo("BEO 12345.pdf");
    assertThat(PathSanitizer.sanitizeFileName("Scan.PDF")).isEqualTo("Scan.PDF");
    assertThat(PathSanitizer.sanitizeFileName("signed form")).isEqualTo("signed form.pdf");
    assertThat(PathSanitizer.sanitizeFileName("a/b.pdf")).isEqualTo("a_b.pdf");
  }

  @Test
  @DisplayName("should name unnamed attachments document.pdf")
  void shouldFallBackForMissingFileName() {
    assertThat(PathSanitizer.sanitizeFileName(null)).isEqualTo("document.pdf");
    assertThat(PathSanitizer.sanitizeFileName("   ")).isEqualTo("document.pdf");
    assertThat(PathSanitizer.sanitizeFileName("...")).isEqualTo("document.pdf");
  }
}
