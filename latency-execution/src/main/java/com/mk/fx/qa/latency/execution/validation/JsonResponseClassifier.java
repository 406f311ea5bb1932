package com.mk.fx.qa.latency.execution.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.latency.rest.JsonUtil;
import java.io.IOException;
import java.util.Objects;

/**
 * Rule-driven classifier for JSON APIs. Checks run in a fixed order and the first failing check
 * decides the reason:
 *
 * <ol>
 *   <li>transport failure
 *   <li>status other than 200
 *   <li>body is not a well-formed JSON object
 *   <li>engine-reported error in a top-level error field
 *   <li>metadata field missing
 *   <li>metadata status equals the error value
 *   <li>no result-bearing field present and non-empty
 * </ol>
 *
 * Steps 4 to 7 only apply to {@link ValidationProfile#SEARCH_API}; {@link ValidationProfile#JSON}
 * checks required fields instead, {@link ValidationProfile#STATUS_ONLY} stops after step 2.
 */
public final class JsonResponseClassifier implements ResponseClassifier {

  private static final int MAX_DETAIL_LENGTH = 200;

  private final ValidationRules rules;

  public JsonResponseClassifier(ValidationRules rules) {
    this.rules = Objects.requireNonNull(rules, "rules");
  }

  public ValidationRules rules() {
    return rules;
  }

  @Override
  public Classification classify(ClassifierInput input) {
    Objects.requireNonNull(input, "input");

    if (input.transportFailure() != null) {
      return Classification.transport(input.transportFailure(), input.transportDetail());
    }
    if (input.statusCode() == null) {
      return Classification.internal(new IllegalStateException("No status and no transport failure"));
    }
    if (input.statusCode() != 200) {
      return Classification.httpStatus(input.statusCode());
    }
    if (rules.profile() == ValidationProfile.STATUS_ONLY) {
      return Classification.ok();
    }

    JsonNode root;
    try {
      root = JsonUtil.readStrictTree(input.body());
    } catch (IOException e) {
      return Classification.parse(firstLine(e.getMessage()));
    }
    if (!root.isObject()) {
      return Classification.parse("Expected a JSON object but got " + root.getNodeType());
    }

    return switch (rules.profile()) {
      case JSON -> checkRequiredFields(root);
      case SEARCH_API -> checkSearchPayload(root);
      case STATUS_ONLY -> Classification.ok();
    };
  }

  private Classification checkRequiredFields(JsonNode root) {
    for (String field : rules.requiredFields()) {
      if (!root.has(field)) {
        return Classification.invalid(Classification.MISSING_FIELD, "Missing " + field);
      }
    }
    return Classification.ok();
  }

  private Classification checkSearchPayload(JsonNode root) {
    if (rules.errorField() != null && root.has(rules.errorField())) {
      return Classification.invalid(
          Classification.REPORTED_ERROR, "API Error: " + text(root.get(rules.errorField())));
    }

    JsonNode metadata = rules.metadataField() != null ? root.get(rules.metadataField()) : null;
    if (rules.metadataField() != null && metadata == null) {
      return Classification.invalid(
          Classification.MISSING_METADATA, "Missing " + rules.metadataField());
    }

    if (metadata != null && rules.metadataStatusField() != null && rules.errorStatusValue() != null) {
      JsonNode status = metadata.get(rules.metadataStatusField());
      if (status != null && rules.errorStatusValue().equalsIgnoreCase(status.asText())) {
        JsonNode error = rules.errorField() != null ? metadata.get(rules.errorField()) : null;
        return Classification.invalid(
            Classification.REPORTED_ERROR,
            "Search error: " + (error != null ? text(error) : "Unknown"));
      }
    }

    if (!hasResults(root)) {
      return Classification.invalid(Classification.EMPTY_RESULT, "No results found");
    }
    return Classification.ok();
  }

  private boolean hasResults(JsonNode root) {
    for (String field : rules.resultFields()) {
      JsonNode value = root.get(field);
      if (value != null && !value.isNull() && !isEmptyContainer(value)) {
        return true;
      }
    }
    return rules.fallbackFieldThreshold() > 0 && root.size() >= rules.fallbackFieldThreshold();
  }

  private static boolean isEmptyContainer(JsonNode node) {
    if (node.isTextual()) {
      return node.asText().isEmpty();
    }
    return node.isContainerNode() && node.size() == 0;
  }

  private static String text(JsonNode node) {
    return truncate(node.isValueNode() ? node.asText() : node.toString());
  }

  private static String firstLine(String message) {
    if (message == null) {
      return "Malformed body";
    }
    int newline = message.indexOf('\n');
    return truncate(newline >= 0 ? message.substring(0, newline) : message);
  }

  private static String truncate(String value) {
    return value.length() > MAX_DETAIL_LENGTH ? value.substring(0, MAX_DETAIL_LENGTH) : value;
  }
}
