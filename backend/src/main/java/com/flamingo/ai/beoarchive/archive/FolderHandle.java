package com.flamingo.ai.beoarchive.archive;

import java.util.List;

/**
 * Reference to an archive folder.
 *
 * @param segments folder names from the archive root
 * @param location backend-specific reference (absolute local path or drive path)
 */
public record FolderHandle(List<String> segments, String location) {

  public FolderHandle {
    segments = List.copyOf(segments);
  }

  public String relativePath() {
    return String.join("/", segments);
  }
}
