package com.flamingo.ai.finqa.service.orchestration;

import com.flamingo.ai.finqa.domain.enums.AnswerStatus;
import com.flamingo.ai.finqa.domain.enums.ValidationState;
import java.util.List;

/**
 * Result of validating one question's partial answers.
 *
 * @param status composed or degraded
 * @param outcomes one outcome per sub-query, in routing order
 * @param retryCount retries across all sub-queries
 * @param timedOut whether the question deadline was hit
 * @param stateHistory states the question passed through, in order
 */
public record ValidationOutcome(
    AnswerStatus status,
    List<SubQueryOutcome> outcomes,
    int retryCount,
    boolean timedOut,
    List<ValidationState> stateHistory) {

  public ValidationOutcome {
    outcomes = List.copyOf(outcomes);
    stateHistory = List.copyOf(stateHistory);
  }
}
