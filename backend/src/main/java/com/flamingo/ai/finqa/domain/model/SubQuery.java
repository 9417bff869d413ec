package com.flamingo.ai.finqa.domain.model;

import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import java.util.List;

/**
 * A category-tagged fragment of a user question, owned by a single agent invocation.
 *
 * @param id stable id shared by every attempt of this sub-query
 * @param category task category deciding which agent answers
 * @param question the full user question
 * @param instruction category-specific instruction
 * @param filters metadata filters required by this sub-query
 * @param periods fiscal periods resolved from the question, ascending
 * @param attempt 0 for the first invocation, incremented on every retry
 */
public record SubQuery(
    String id,
    TaskCategory category,
    String question,
    String instruction,
    RetrievalFilters filters,
    List<FiscalPeriod> periods,
    int attempt) {

  public SubQuery {
    filters = filters == null ? RetrievalFilters.none() : filters;
    periods = periods == null ? List.of() : List.copyOf(periods);
  }

  /** Next attempt of this sub-query with relaxed filters. */
  public SubQuery relaxed() {
    return new SubQuery(id, category, question, instruction, filters.relax(), periods, attempt + 1);
  }

  public boolean isRetry() {
    return attempt > 0;
  }
}
