package com.flamingo.ai.beoarchive.classification;

import com.flamingo.ai.beoarchive.config.BeoArchiveConfig;
import com.flamingo.ai.beoarchive.pipeline.model.ExtractedText;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Concatenates the attachments of a bundle into a single prompt body.
 *
 * <p>Truncation policy: when the combined text is over {@code maxInputChars}, every document
 * longer than an equal share of the budget is cut to that share, keeping its first half and its
 * last half around an omission marker. Shorter documents are left intact. Separator lines are not
 * counted against the budget.
 */
@Component
@Slf4j
public class ClassificationInputBuilder {

  static final String PAGE_SEPARATOR = "\n\n";
  static final String OMISSION_MARKER = "\n\n[... %d characters omitted ...]\n\n";

  private final int maxInputChars;

  public ClassificationInputBuilder(BeoArchiveConfig config) {
    this(config.getClassification().getMaxInputChars());
  }

  ClassificationInputBuilder(int maxInputChars) {
    if (maxInputChars < 2) {
      throw new IllegalArgumentException("maxInputChars must be at least 2");
    }
    this.maxInputChars = maxInputChars;
  }

  public ClassificationInput build(List<ExtractedText> texts) {
    List<String> bodies = new ArrayList<>(texts.size());
    long total = 0;
    for (ExtractedText text : texts) {
      String body = String.join(PAGE_SEPARATOR, text.pages()).strip();
      bodies.add(body);
      total += body.length();
    }

    boolean truncated = total > maxInputChars;
    if (truncated) {
      int share = Math.max(2, maxInputChars / Math.max(1, texts.size()));
      log.info(
          "Bundle text is {} chars, over budget of {}; truncating documents to {} chars each",
          total,
          maxInputChars,
          share);
      bodies.replaceAll(body -> keepHeadAndTail(body, share));
    }

    StringBuilder content = new StringBuilder();
    for (int i = 0; i < texts.size(); i++) {
      if (i > 0) {
        content.append("\n\n");
      }
      content
          .append("===== Document ")
          .append(i + 1)
          .append(" of ")
          .append(texts.size())
          .append(": ")
          .append(texts.get(i).fileName())
          .append(" =====\n")
          .append(bodies.get(i));
    }
    return new ClassificationInput(content.toString(), texts.size(), truncated);
  }

  static String keepHeadAndTail(String body, int limit) {
    if (body.length() <= limit) {
      return body;
    }
    int head = limit / 2;
    int tail = limit - head;
    int omitted = body.length() - head - tail;
    return body.substring(0, head)
        + String.format(OMISSION_MARKER, omitted)
        + body.substring(body.length() - tail);
  }
}
