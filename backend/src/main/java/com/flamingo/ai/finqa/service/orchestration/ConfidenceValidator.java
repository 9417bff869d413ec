package com.flamingo.ai.finqa.service.orchestration;

import com.flamingo.ai.finqa.domain.enums.AnswerStatus;
import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.enums.ValidationState;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Confidence-driven retry loop for one question.
 *
 * <p>Partial answers below the threshold are re-issued with relaxed filters, in rounds, until
 * every partial meets the threshold or its retry budget is spent. The question ends COMPOSED only
 * when every partial meets the threshold and the deadline was not hit; otherwise DEGRADED.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfidenceValidator {

  private final MeterRegistry meterRegistry;

  /**
   * Validates the gathered partial answers, retrying where needed.
   *
   * @param subQueries routed sub-queries
   * @param gathered first partial answer of each sub-query, same order
   * @param policy threshold, retry budget and aggregation
   * @param invoker runs retried sub-queries
   * @return the terminal outcome
   */
  public ValidationOutcome validate(
      List<SubQuery> subQueries,
      List<PartialAnswer> gathered,
      ValidationPolicy policy,
      BatchInvoker invoker) {
    if (subQueries.size() != gathered.size()) {
      throw new IllegalArgumentException(
          "Got " + gathered.size() + " partial answers for " + subQueries.size() + " sub-queries");
    }
    ValidationRun run = new ValidationRun();
    Map<String, SubQueryOutcome> outcomes = new LinkedHashMap<>();
    boolean timedOut = false;
    for (int i = 0; i < subQueries.size(); i++) {
      PartialAnswer partial = gathered.get(i);
      boolean cutOff = partial.gap() == EvidenceGap.TIMEOUT;
      timedOut |= cutOff;
      outcomes.put(
          subQueries.get(i).id(), new SubQueryOutcome(subQueries.get(i), partial, 0, cutOff));
    }
    run.transitionTo(ValidationState.VALIDATING);

    double threshold = policy.confidenceThreshold();
    while (!timedOut) {
      List<SubQueryOutcome> pending =
          outcomes.values().stream()
              .filter(o -> !o.partial().meets(threshold) && o.retries() < policy.maxRetries())
              .toList();
      if (pending.isEmpty()) {
        break;
      }
      List<SubQuery> retries = pending.stream().map(o -> o.subQuery().relaxed()).toList();
      log.info(
          "Retrying {} sub-quer{} below confidence {}",
          retries.size(),
          retries.size() == 1 ? "y" : "ies",
          threshold);
      meterRegistry.counter("validation.retries").increment(retries.size());

      List<PartialAnswer> answers = invoker.invoke(retries);
      for (int i = 0; i < retries.size(); i++) {
        SubQuery retry = retries.get(i);
        PartialAnswer answer = answers.get(i);
        SubQueryOutcome previous = outcomes.get(retry.id());
        if (answer.gap() == EvidenceGap.TIMEOUT) {
          timedOut = true;
          outcomes.put(
              retry.id(),
              new SubQueryOutcome(retry, previous.partial(), previous.retries() + 1, true));
        } else {
          outcomes.put(
              retry.id(), new SubQueryOutcome(retry, answer, previous.retries() + 1, false));
        }
      }
    }

    boolean allMeet = outcomes.values().stream().allMatch(o -> o.partial().meets(threshold));
    ValidationState terminal =
        allMeet && !timedOut ? ValidationState.COMPOSED : ValidationState.DEGRADED;
    run.transitionTo(terminal);

    int retryCount = outcomes.values().stream().mapToInt(SubQueryOutcome::retries).sum();
    log.debug("Validation finished {} after {} retries", terminal, retryCount);
    return new ValidationOutcome(
        terminal == ValidationState.COMPOSED ? AnswerStatus.COMPOSED : AnswerStatus.DEGRADED,
        List.copyOf(outcomes.values()),
        retryCount,
        timedOut,
        run.history());
  }
}
