package com.flamingo.ai.beoarchive.pipeline.model;

/** Terminal outcome of one bundle. */
public enum OutcomeStatus {
  SAVED,
  REJECTED,
  SKIPPED,
  FAILED
}
