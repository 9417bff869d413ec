package com.flamingo.ai.finqa.domain.enums;

/** How partial-answer confidences are combined into the final confidence. */
public enum AggregationPolicy {
  /** Minimum across partial answers (conservative default). */
  MINIMUM,
  /** Average weighted by the number of supporting chunks of each partial answer. */
  WEIGHTED_AVERAGE
}
