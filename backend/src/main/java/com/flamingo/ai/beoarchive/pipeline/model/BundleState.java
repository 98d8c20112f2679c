package com.flamingo.ai.beoarchive.pipeline.model;

/** Processing stages a bundle moves through. */
public enum BundleState {
  RECEIVED,
  TEXT_EXTRACTED,
  CLASSIFIED,
  VALID,
  INVALID,
  SKIPPED,
  PATH_RESOLVED,
  STORED,
  FAILED,
  DONE
}
