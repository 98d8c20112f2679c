package com.flamingo.ai.beoarchive.archive;

/** Result of {@link ArchiveStore#writeFileIfAbsent}. */
public record WriteResult(boolean created, String location) {

  public static WriteResult created(String location) {
    return new WriteResult(true, location);
  }

  public static WriteResult alreadyPresent(String location) {
    return new WriteResult(false, location);
  }
}
