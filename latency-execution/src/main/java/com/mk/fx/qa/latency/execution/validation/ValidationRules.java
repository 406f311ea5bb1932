package com.mk.fx.qa.latency.execution.validation;

import java.util.List;
import java.util.Objects;

/**
 * Configuration for {@link JsonResponseClassifier}.
 *
 * @param profile validation depth
 * @param metadataField top-level field every valid body must carry (SEARCH_API)
 * @param metadataStatusField field inside the metadata holding the engine status
 * @param errorStatusValue metadata status value signalling an engine-reported error
 * @param errorField top-level or metadata field carrying the engine error text
 * @param resultFields fields that carry a result payload (SEARCH_API)
 * @param fallbackFieldThreshold a body with at least this many top-level fields counts as carrying
 *     results even when none of {@code resultFields} is present
 * @param requiredFields top-level fields that must be present (JSON)
 */
public record ValidationRules(
    ValidationProfile profile,
    String metadataField,
    String metadataStatusField,
    String errorStatusValue,
    String errorField,
    List<String> resultFields,
    int fallbackFieldThreshold,
    List<String> requiredFields) {

  public static final List<String> SEARCH_RESULT_FIELDS =
      List.of(
          "organic_results",
          "inline_images",
          "local_results",
          "shopping_results",
          "jobs_results",
          "news_results",
          "video_results",
          "answer_box",
          "knowledge_graph");

  public ValidationRules {
    Objects.requireNonNull(profile, "profile");
    resultFields = resultFields != null ? List.copyOf(resultFields) : List.of();
    requiredFields = requiredFields != null ? List.copyOf(requiredFields) : List.of();
    if (fallbackFieldThreshold < 0) {
      throw new IllegalArgumentException("fallbackFieldThreshold must be >= 0");
    }
  }

  public static ValidationRules searchApi() {
    return new ValidationRules(
        ValidationProfile.SEARCH_API,
        "search_metadata",
        "status",
        "error",
        "error",
        SEARCH_RESULT_FIELDS,
        3,
        List.of());
  }

  public static ValidationRules json(List<String> requiredFields) {
    return new ValidationRules(
        ValidationProfile.JSON, null, null, null, null, List.of(), 0, requiredFields);
  }

  public static ValidationRules statusOnly() {
    return new ValidationRules(
        ValidationProfile.STATUS_ONLY, null, null, null, null, List.of(), 0, List.of());
  }
}
