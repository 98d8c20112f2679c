package com.flamingo.ai.beoarchive.extraction;

import com.flamingo.ai.beoarchive.exception.TextExtractionException;
import com.flamingo.ai.beoarchive.pipeline.model.ExtractedText;

/** Converts raw document bytes into page-ordered plain text. */
public interface TextExtractor {

  /**
   * Extracts the text of every page.
   *
   * @param fileName attachment name, used for diagnostics only
   * @param content raw PDF bytes
   * @return one string per page, empty for pages without a text layer
   * @throws TextExtractionException if the bytes are empty, corrupt or encrypted
   */
  ExtractedText extract(String fileName, byte[] content);
}
