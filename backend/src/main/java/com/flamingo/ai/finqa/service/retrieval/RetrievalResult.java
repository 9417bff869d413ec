package com.flamingo.ai.finqa.service.retrieval;

import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.model.RetrievalCandidate;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import java.util.List;

/**
 * Candidates of one retrieval call plus how it went.
 *
 * @param candidates ranked candidates, best first; empty unless status is OK
 * @param status outcome of the call
 * @param filters filters the call ran with
 */
public record RetrievalResult(
    List<RetrievalCandidate> candidates, RetrievalStatus status, RetrievalFilters filters) {

  public RetrievalResult {
    candidates = candidates == null ? List.of() : List.copyOf(candidates);
  }

  public static RetrievalResult unavailable(RetrievalFilters filters) {
    return new RetrievalResult(List.of(), RetrievalStatus.UNAVAILABLE, filters);
  }

  public static RetrievalResult empty(RetrievalFilters filters) {
    return new RetrievalResult(List.of(), RetrievalStatus.EMPTY, filters);
  }

  public boolean hasCandidates() {
    return status == RetrievalStatus.OK && !candidates.isEmpty();
  }

  public boolean isUnavailable() {
    return status == RetrievalStatus.UNAVAILABLE;
  }

  /** Gap to report when this result yields no evidence. */
  public EvidenceGap evidenceGap() {
    return isUnavailable() ? EvidenceGap.COLLABORATOR_UNAVAILABLE : EvidenceGap.RETRIEVAL_EMPTY;
  }
}
