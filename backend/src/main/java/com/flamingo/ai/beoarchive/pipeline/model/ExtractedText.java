package com.flamingo.ai.beoarchive.pipeline.model;

import java.util.List;

/** Page-ordered plain text of one attachment. Image-only pages are empty strings. */
public record ExtractedText(String fileName, List<String> pages) {

  public ExtractedText {
    pages = pages != null ? List.copyOf(pages) : List.of();
  }

  public boolean isBlank() {
    return pages.stream().allMatch(String::isBlank);
  }

  public int pageCount() {
    return pages.size();
  }
}
