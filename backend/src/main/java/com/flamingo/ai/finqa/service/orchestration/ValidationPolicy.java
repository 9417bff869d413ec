package com.flamingo.ai.finqa.service.orchestration;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.AggregationPolicy;

/**
 * Thresholds governing the validation loop of one question.
 *
 * @param confidenceThreshold partial answers below this are retried
 * @param maxRetries retries allowed per sub-query
 * @param aggregation how partial confidences combine
 */
public record ValidationPolicy(
    double confidenceThreshold, int maxRetries, AggregationPolicy aggregation) {

  public ValidationPolicy {
    if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
      throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative");
    }
    aggregation = aggregation == null ? AggregationPolicy.MINIMUM : aggregation;
  }

  public static ValidationPolicy from(FinQaConfig.Validation validation) {
    return new ValidationPolicy(
        validation.getConfidenceThreshold(),
        validation.getMaxRetries(),
        validation.getAggregation());
  }
}
