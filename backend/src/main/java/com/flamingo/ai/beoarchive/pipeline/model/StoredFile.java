package com.flamingo.ai.beoarchive.pipeline.model;

/** One attachment written (or found already present) in the archive. */
public record StoredFile(String fileName, boolean created, String location) {}
