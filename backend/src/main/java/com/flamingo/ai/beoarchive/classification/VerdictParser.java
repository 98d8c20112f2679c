package com.flamingo.ai.beoarchive.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.beoarchive.exception.ClassificationException;
import com.flamingo.ai.beoarchive.pipeline.model.StructuredFields;
import com.flamingo.ai.beoarchive.pipeline.model.ValidationVerdict;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Validates the analyst agent's raw JSON reply against the verdict schema.
 *
 * <p>Anything that does not match (non-JSON, missing or mistyped fields, out-of-range confidence,
 * an unreadable date) raises {@link ClassificationException} so the call is retried. A response is
 * never downgraded to an "invalid" verdict because it could not be read.
 */
@Component
@RequiredArgsConstructor
public class VerdictParser {

  static final String VALID = "valid";
  static final String CONFIDENCE = "confidence";
  static final String BEO_NUMBER = "beoNumber";
  static final String BEO_DATE = "beoDate";
  static final String ORGANIZATION_NAME = "organizationName";
  static final String REASON = "reason";

  private final ObjectMapper objectMapper;

  public ValidationVerdict parse(String rawResponse) {
    if (rawResponse == null || rawResponse.isBlank()) {
      throw new ClassificationException("Model returned an empty response");
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(rawResponse));
    } catch (JsonProcessingException e) {
      throw new ClassificationException(
          "Model response is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new ClassificationException("Model response is not a JSON object");
    }

    JsonNode validNode = root.get(VALID);
    if (validNode == null || !validNode.isBoolean()) {
      throw new ClassificationException("Field '" + VALID + "' must be a boolean");
    }
    JsonNode confidenceNode = root.get(CONFIDENCE);
    if (confidenceNode == null || !confidenceNode.isNumber()) {
      throw new ClassificationException("Field '" + CONFIDENCE + "' must be a number");
    }
    double confidence = confidenceNode.asDouble();
    if (confidence < 0.0 || confidence > 1.0) {
      throw new ClassificationException(
          "Field '" + CONFIDENCE + "' must be between 0 and 1, got " + confidence);
    }
    String reason = optionalText(root, REASON);

    if (!validNode.booleanValue()) {
      return ValidationVerdict.invalid(confidence, reason);
    }

    String beoNumber = requiredText(root, BEO_NUMBER);
    String beoDate = requiredText(root, BEO_DATE);
    String organizationName = requiredText(root, ORGANIZATION_NAME);
    LocalDate eventDate =
        EventDateParser.parse(beoDate)
            .orElseThrow(
                () ->
                    new ClassificationException(
                        "Field '" + BEO_DATE + "' is not a recognizable date: " + beoDate));

    return ValidationVerdict.valid(
        confidence, new StructuredFields(eventDate, beoNumber, organizationName), reason);
  }

  private String requiredText(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || !node.isTextual() || node.textValue().isBlank()) {
      throw new ClassificationException(
          "Field '" + field + "' must be a non-empty string when valid is true");
    }
    return node.textValue().strip();
  }

  private String optionalText(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isTextual()) {
      throw new ClassificationException("Field '" + field + "' must be a string");
    }
    return node.textValue();
  }

  private String stripCodeFence(String raw) {
    String trimmed = raw.strip();
    if (trimmed.startsWith("```")) {
      int firstNewline = trimmed.indexOf('\n');
      int closing = trimmed.lastIndexOf("```");
      if (firstNewline > 0 && closing > firstNewline) {
        return trimmed.substring(firstNewline + 1, closing);
      }
    }
    return trimmed;
  }
}
