package com.flamingo.ai.finqa.domain.model;

import com.flamingo.ai.finqa.domain.enums.ChunkKind;
import com.flamingo.ai.finqa.domain.enums.StatementType;
import java.util.List;

/**
 * Structured metadata attached to every chunk; retrieval filters run against these fields.
 *
 * @param fiscalPeriods periods the chunk reports on, ascending
 * @param statementType statement the chunk belongs to
 * @param pageStart first page covered
 * @param pageEnd last page covered
 * @param sourceBoundaryIds ids of the boundaries that opened or lie inside the chunk
 * @param chunkKind narrative, tabular or mixed
 */
public record ChunkMetadata(
    List<FiscalPeriod> fiscalPeriods,
    StatementType statementType,
    int pageStart,
    int pageEnd,
    List<String> sourceBoundaryIds,
    ChunkKind chunkKind) {

  public ChunkMetadata {
    fiscalPeriods = fiscalPeriods == null ? List.of() : List.copyOf(fiscalPeriods);
    sourceBoundaryIds = sourceBoundaryIds == null ? List.of() : List.copyOf(sourceBoundaryIds);
  }

  /** Distinct fiscal years, ascending. */
  public List<Integer> fiscalYears() {
    return fiscalPeriods.stream().map(FiscalPeriod::year).distinct().sorted().toList();
  }
}
