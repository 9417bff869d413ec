package com.flamingo.ai.finqa.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chunk as stored in Elasticsearch: content, filterable statement metadata and the embedding.
 *
 * <p>Fiscal periods are kept twice: as years for range filtering and as labels (FY2023, Q3 2023)
 * so that quarters survive the round trip.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialChunkDocument {

  private String documentId;
  private int chunkIndex;
  private String content;
  private String statementType;
  private String chunkKind;
  @Builder.Default private List<Integer> fiscalYears = List.of();
  @Builder.Default private List<String> fiscalPeriods = List.of();
  private int pageStart;
  private int pageEnd;
  @Builder.Default private List<String> sourceBoundaryIds = List.of();
  private int tokenCount;
  private List<Float> embedding;
}
