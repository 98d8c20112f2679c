package com.flamingo.ai.beoarchive.classification;

/** Text sent to the analyst agent for one bundle. */
public record ClassificationInput(String content, int documentCount, boolean truncated) {}
