package com.flamingo.ai.finqa.service.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.StatementType;
import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import com.flamingo.ai.finqa.service.period.FiscalPeriodParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueryRouter Tests")
class QueryRouterTest {

  @Mock private ModelTaskClassifier modelClassifier;

  private FinQaConfig config;
  private QueryRouter router;

  @BeforeEach
  void setUp() {
    config = new FinQaConfig();
    config.getRouting().setReferenceFiscalYear(2023);
    FiscalPeriodParser parser = new FiscalPeriodParser();
    router =
        new QueryRouter(
            new KeywordTaskClassifier(parser),
            modelClassifier,
            parser,
            config,
            new SimpleMeterRegistry());
  }

  private static List<TaskCategory> categories(List<SubQuery> subQueries) {
    return subQueries.stream().map(SubQuery::category).toList();
  }

  @Nested
  @DisplayName("Keyword routing")
  class KeywordRouting {

    @Test
    @DisplayName("Should route a year-over-year question to temporal comparison only")
    void shouldRouteYearOverYearToTemporalOnly() {
      List<SubQuery> subQueries =
          router.route(
              "q1",
              "How did revenue change year-over-year from 2022 to 2023?",
              RetrievalFilters.none());

      assertThat(subQueries)
          .singleElement()
          .satisfies(
              sq -> {
                assertThat(sq.id()).isEqualTo("q1-TEMPORAL_COMPARISON");
                assertThat(sq.category()).isEqualTo(TaskCategory.TEMPORAL_COMPARISON);
                assertThat(sq.periods())
                    .containsExactly(FiscalPeriod.annual(2022), FiscalPeriod.annual(2023));
                assertThat(sq.attempt()).isZero();
                assertThat(sq.instruction())
                    .isEqualTo(TaskCategory.TEMPORAL_COMPARISON.getInstruction());
              });
      verify(modelClassifier, never()).classify(anyString());
    }

    @Test
    @DisplayName("Should infer the latest two fiscal years for a YoY question without years")
    void shouldInferPeriodsForYoyQuestion() {
      List<SubQuery> subQueries =
          router.route("q1", "What was the YoY change in net income?", RetrievalFilters.none());

      assertThat(categories(subQueries)).containsExactly(TaskCategory.TEMPORAL_COMPARISON);
      assertThat(subQueries.get(0).periods())
          .containsExactly(FiscalPeriod.annual(2022), FiscalPeriod.annual(2023));
      verify(modelClassifier, never()).classify(anyString());
    }

    @Test
    @DisplayName("Should route a ratio question to calculation with a fiscal-year filter")
    void shouldRouteRatioToCalculation() {
      List<SubQuery> subQueries =
          router.route("q2", "What is the return on equity for FY2023?", RetrievalFilters.none());

      assertThat(categories(subQueries)).containsExactly(TaskCategory.CALCULATION);
      assertThat(subQueries.get(0).filters().fiscalYearFrom()).isEqualTo(2023);
      assertThat(subQueries.get(0).filters().fiscalYearTo()).isEqualTo(2023);
    }

    @Test
    @DisplayName("Should split a compound question into one sub-query per category")
    void shouldSplitCompoundQuestions() {
      List<SubQuery> subQueries =
          router.route(
              "q3",
              "What are the key credit risks, and how did net income grow in 2023?",
              RetrievalFilters.none());

      assertThat(categories(subQueries))
          .containsExactly(TaskCategory.TEMPORAL_COMPARISON, TaskCategory.RISK_EXTRACTION);
      assertThat(subQueries.get(0).periods())
          .containsExactly(FiscalPeriod.annual(2022), FiscalPeriod.annual(2023));
      assertThat(subQueries).extracting(SubQuery::id).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should compare against the reference year when no period is named")
    void shouldUseReferenceYearForTemporalQuestions() {
      SubQuery subQuery =
          router.route("q4", "Show the revenue trend", RetrievalFilters.none()).get(0);

      assertThat(subQuery.periods())
          .containsExactly(FiscalPeriod.annual(2022), FiscalPeriod.annual(2023));
    }

    @Test
    @DisplayName("Should treat two named years as a comparison")
    void shouldTreatTwoYearsAsComparison() {
      assertThat(categories(router.route("q5", "Revenue 2021 and 2023", RetrievalFilters.none())))
          .containsExactly(TaskCategory.TEMPORAL_COMPARISON);
    }

    @Test
    @DisplayName("Should keep caller filters and their fiscal range")
    void shouldKeepCallerFilters() {
      RetrievalFilters caller =
          RetrievalFilters.none()
              .withFiscalYears(2020, 2024)
              .withStatementTypes(Set.of(StatementType.INCOME_STATEMENT));

      SubQuery subQuery =
          router.route("q6", "What is the net profit margin in 2023?", caller).get(0);

      assertThat(subQuery.filters()).isEqualTo(caller);
    }
  }

  @Nested
  @DisplayName("Model fallback")
  class ModelFallback {

    @Test
    @DisplayName("Should default to general when no rule fires and the fallback is off")
    void shouldDefaultToGeneral() {
      config.getRouting().setModelFallbackEnabled(false);

      List<SubQuery> subQueries =
          router.route("q7", "Who audits the company?", RetrievalFilters.none());

      assertThat(categories(subQueries)).containsExactly(TaskCategory.GENERAL);
      verify(modelClassifier, never()).classify(anyString());
    }

    @Test
    @DisplayName("Should use the model only when no rule fires")
    void shouldConsultModel() {
      when(modelClassifier.classify("Who audits the company?"))
          .thenReturn(EnumSet.of(TaskCategory.GENERAL, TaskCategory.RISK_EXTRACTION));

      List<SubQuery> subQueries =
          router.route("q8", "Who audits the company?", RetrievalFilters.none());

      assertThat(categories(subQueries)).containsExactly(TaskCategory.RISK_EXTRACTION);
    }

    @Test
    @DisplayName("Should fall back to general when the model returns nothing usable")
    void shouldFallBackToGeneral() {
      when(modelClassifier.classify(anyString())).thenReturn(EnumSet.noneOf(TaskCategory.class));

      assertThat(categories(router.route("q9", "Who audits the company?", null)))
          .containsExactly(TaskCategory.GENERAL);
    }
  }
}
