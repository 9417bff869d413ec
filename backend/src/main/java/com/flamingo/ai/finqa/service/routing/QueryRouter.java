package com.flamingo.ai.finqa.service.routing;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import com.flamingo.ai.finqa.service.period.FiscalPeriodParser;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Year;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decomposes a question into one {@link SubQuery} per task category.
 *
 * <p>Keyword rules run first; the language model is consulted only when none fires. Every
 * question yields at least one sub-query, GENERAL when nothing else applies. Temporal sub-queries
 * always carry at least two fiscal periods.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryRouter {

  private final KeywordTaskClassifier keywordClassifier;
  private final ModelTaskClassifier modelClassifier;
  private final FiscalPeriodParser periodParser;
  private final FinQaConfig config;
  private final MeterRegistry meterRegistry;

  public List<SubQuery> route(String questionId, String question, RetrievalFilters callerFilters) {
    RetrievalFilters base = callerFilters == null ? RetrievalFilters.none() : callerFilters;
    Set<TaskCategory> categories = classify(question);
    List<FiscalPeriod> periods = periodParser.parse(question);

    List<SubQuery> subQueries = new ArrayList<>(categories.size());
    for (TaskCategory category : categories) {
      List<FiscalPeriod> resolved =
          category == TaskCategory.TEMPORAL_COMPARISON ? comparisonPeriods(periods) : periods;
      subQueries.add(
          new SubQuery(
              questionId + "-" + category.name(),
              category,
              question,
              category.getInstruction(),
              filtersFor(category, base, resolved),
              resolved,
              0));
    }
    log.info("Routed question {} to {}", questionId, categories);
    return subQueries;
  }

  private Set<TaskCategory> classify(String question) {
    Set<TaskCategory> categories = EnumSet.noneOf(TaskCategory.class);
    categories.addAll(keywordClassifier.classify(question));
    if (categories.isEmpty() && config.getRouting().isModelFallbackEnabled()) {
      meterRegistry.counter("routing.model_fallback").increment();
      categories.addAll(modelClassifier.classify(question));
    }
    if (categories.size() > 1) {
      categories.remove(TaskCategory.GENERAL);
    }
    if (categories.isEmpty()) {
      categories.add(TaskCategory.GENERAL);
    }
    return categories;
  }

  /**
   * Temporal comparisons need two periods: a single period is compared with the same period one
   * year earlier, and a question without periods compares the reference year with the year
   * before.
   */
  private List<FiscalPeriod> comparisonPeriods(List<FiscalPeriod> periods) {
    if (periods.size() > 1) {
      return periods;
    }
    if (periods.size() == 1) {
      FiscalPeriod only = periods.get(0);
      return List.of(new FiscalPeriod(only.year() - 1, only.quarter()), only);
    }
    int reference = referenceFiscalYear();
    return List.of(FiscalPeriod.annual(reference - 1), FiscalPeriod.annual(reference));
  }

  /** Temporal sub-queries filter per period in the agent; other categories filter here. */
  private RetrievalFilters filtersFor(
      TaskCategory category, RetrievalFilters base, List<FiscalPeriod> periods) {
    if (category == TaskCategory.TEMPORAL_COMPARISON
        || periods.isEmpty()
        || base.hasFiscalRange()) {
      return base;
    }
    int from = periods.get(0).year();
    int to = periods.get(periods.size() - 1).year();
    return base.withFiscalYears(from, to);
  }

  private int referenceFiscalYear() {
    int configured = config.getRouting().getReferenceFiscalYear();
    return configured > 0 ? configured : Year.now().getValue() - 1;
  }
}
