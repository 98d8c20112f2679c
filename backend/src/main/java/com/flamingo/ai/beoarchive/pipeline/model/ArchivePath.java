package com.flamingo.ai.beoarchive.pipeline.model;

import java.util.List;

/** Sanitized folder segments: year, month, day, then "number - client". */
public record ArchivePath(List<String> segments) {

  public ArchivePath {
    segments = List.copyOf(segments);
  }

  public String eventFolder() {
    return segments.get(segments.size() - 1);
  }

  /** Forward-slash joined form, used for logging and remote paths. */
  public String asPath() {
    return String.join("/", segments);
  }
}
