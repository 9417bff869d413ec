package com.flamingo.ai.finqa.domain.model;

import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import java.util.List;

/**
 * Output of one agent invocation.
 *
 * @param subQueryId sub-query this answers
 * @param category category of the answering agent
 * @param text answer text
 * @param value computed numeric value, or {@code null} for qualitative answers
 * @param citations supporting chunks in order of use
 * @param confidence self-reported confidence in [0, 1]
 * @param gap why evidence was insufficient, or {@code null}
 * @param explanation short note on how the answer or its confidence was derived
 */
public record PartialAnswer(
    String subQueryId,
    TaskCategory category,
    String text,
    Double value,
    List<Citation> citations,
    double confidence,
    EvidenceGap gap,
    String explanation) {

  public PartialAnswer {
    citations = citations == null ? List.of() : List.copyOf(citations);
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  /** A zero-confidence answer recording why the sub-query could not be answered. */
  public static PartialAnswer insufficient(SubQuery subQuery, EvidenceGap gap, String explanation) {
    return new PartialAnswer(
        subQuery.id(),
        subQuery.category(),
        "Insufficient evidence: " + explanation,
        null,
        List.of(),
        0.0,
        gap,
        explanation);
  }

  public List<String> supportingChunkIds() {
    return citations.stream().map(Citation::chunkId).toList();
  }

  public boolean meets(double threshold) {
    return confidence >= threshold;
  }
}
