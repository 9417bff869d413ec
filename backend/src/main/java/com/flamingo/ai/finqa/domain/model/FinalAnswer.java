package com.flamingo.ai.finqa.domain.model;

import com.flamingo.ai.finqa.domain.enums.AnswerStatus;
import java.util.List;

/**
 * Terminal artifact returned to the caller.
 *
 * @param text composed answer text, including any caveat
 * @param confidence aggregated confidence
 * @param citations de-duplicated citations across all partial answers
 * @param status composed or degraded
 * @param retryCount total number of retries across sub-queries
 * @param caveats one entry per category of insufficient evidence; empty when composed
 * @param partialAnswers final partial answer of every sub-query
 */
public record FinalAnswer(
    String text,
    double confidence,
    List<Citation> citations,
    AnswerStatus status,
    int retryCount,
    List<String> caveats,
    List<PartialAnswer> partialAnswers) {

  public FinalAnswer {
    citations = citations == null ? List.of() : List.copyOf(citations);
    caveats = caveats == null ? List.of() : List.copyOf(caveats);
    partialAnswers = partialAnswers == null ? List.of() : List.copyOf(partialAnswers);
  }

  public boolean isDegraded() {
    return status == AnswerStatus.DEGRADED;
  }
}
