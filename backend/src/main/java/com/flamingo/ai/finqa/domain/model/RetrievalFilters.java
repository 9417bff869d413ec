package com.flamingo.ai.finqa.domain.model;

import com.flamingo.ai.finqa.domain.enums.ChunkKind;
import com.flamingo.ai.finqa.domain.enums.StatementType;
import java.util.Set;

/**
 * Conjunction of metadata constraints applied to retrieval. Null bounds and empty sets mean
 * "unconstrained".
 *
 * @param fiscalYearFrom lowest fiscal year (inclusive), or {@code null}
 * @param fiscalYearTo highest fiscal year (inclusive), or {@code null}
 * @param statementTypes allowed statement types
 * @param chunkKinds allowed chunk kinds
 * @param documentIds allowed documents
 */
public record RetrievalFilters(
    Integer fiscalYearFrom,
    Integer fiscalYearTo,
    Set<StatementType> statementTypes,
    Set<ChunkKind> chunkKinds,
    Set<String> documentIds) {

  public RetrievalFilters {
    statementTypes = statementTypes == null ? Set.of() : Set.copyOf(statementTypes);
    chunkKinds = chunkKinds == null ? Set.of() : Set.copyOf(chunkKinds);
    documentIds = documentIds == null ? Set.of() : Set.copyOf(documentIds);
    if (fiscalYearFrom != null && fiscalYearTo != null && fiscalYearFrom > fiscalYearTo) {
      throw new IllegalArgumentException(
          "fiscalYearFrom " + fiscalYearFrom + " is after fiscalYearTo " + fiscalYearTo);
    }
  }

  public static RetrievalFilters none() {
    return new RetrievalFilters(null, null, Set.of(), Set.of(), Set.of());
  }

  public RetrievalFilters withFiscalYears(Integer from, Integer to) {
    return new RetrievalFilters(from, to, statementTypes, chunkKinds, documentIds);
  }

  public RetrievalFilters withFiscalYear(int year) {
    return withFiscalYears(year, year);
  }

  public RetrievalFilters withStatementTypes(Set<StatementType> types) {
    return new RetrievalFilters(fiscalYearFrom, fiscalYearTo, types, chunkKinds, documentIds);
  }

  public RetrievalFilters withChunkKinds(Set<ChunkKind> kinds) {
    return new RetrievalFilters(fiscalYearFrom, fiscalYearTo, statementTypes, kinds, documentIds);
  }

  /** Widens both fiscal-year bounds by {@code years}; unbounded sides stay unbounded. */
  public RetrievalFilters widenFiscalRange(int years) {
    return withFiscalYears(
        fiscalYearFrom == null ? null : fiscalYearFrom - years,
        fiscalYearTo == null ? null : fiscalYearTo + years);
  }

  /**
   * Relaxed variant used on retry: the fiscal range grows by one year on each side and the
   * statement-type and chunk-kind filters are dropped. Document ids are kept.
   */
  public RetrievalFilters relax() {
    return new RetrievalFilters(fiscalYearFrom, fiscalYearTo, Set.of(), Set.of(), documentIds)
        .widenFiscalRange(1);
  }

  public boolean hasFiscalRange() {
    return fiscalYearFrom != null || fiscalYearTo != null;
  }

  /** Checks chunk metadata against every constraint. */
  public boolean matches(String documentId, ChunkMetadata metadata) {
    if (!documentIds.isEmpty() && !documentIds.contains(documentId)) {
      return false;
    }
    if (!statementTypes.isEmpty() && !statementTypes.contains(metadata.statementType())) {
      return false;
    }
    if (!chunkKinds.isEmpty() && !chunkKinds.contains(metadata.chunkKind())) {
      return false;
    }
    if (hasFiscalRange()) {
      return metadata.fiscalYears().stream().anyMatch(this::yearInRange);
    }
    return true;
  }

  private boolean yearInRange(int year) {
    return (fiscalYearFrom == null || year >= fiscalYearFrom)
        && (fiscalYearTo == null || year <= fiscalYearTo);
  }
}
