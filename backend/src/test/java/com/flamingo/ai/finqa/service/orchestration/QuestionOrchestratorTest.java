package com.flamingo.ai.finqa.service.orchestration;

import static com.flamingo.ai.finqa.ReportFixtures.tableChunk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.finqa.agent.AnswerSynthesisAgent;
import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.AnswerStatus;
import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.enums.StatementType;
import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.domain.model.Chunk;
import com.flamingo.ai.finqa.domain.model.FinalAnswer;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.RetrievalCandidate;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import com.flamingo.ai.finqa.exception.AgentParseException;
import com.flamingo.ai.finqa.exception.CollaboratorUnavailableException;
import com.flamingo.ai.finqa.service.agents.AgentRegistry;
import com.flamingo.ai.finqa.service.agents.CalculationAgent;
import com.flamingo.ai.finqa.service.agents.FinancialCalculator;
import com.flamingo.ai.finqa.service.agents.SpecializedAgent;
import com.flamingo.ai.finqa.service.agents.TableValueExtractor;
import com.flamingo.ai.finqa.service.agents.TemporalComparisonAgent;
import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import com.flamingo.ai.finqa.service.period.FiscalPeriodParser;
import com.flamingo.ai.finqa.service.retrieval.RetrievalGateway;
import com.flamingo.ai.finqa.service.retrieval.RetrievalResult;
import com.flamingo.ai.finqa.service.retrieval.RetrievalStatus;
import com.flamingo.ai.finqa.service.routing.KeywordTaskClassifier;
import com.flamingo.ai.finqa.service.routing.ModelTaskClassifier;
import com.flamingo.ai.finqa.service.routing.QueryRouter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
@DisplayName("QuestionOrchestrator Tests")
class QuestionOrchestratorTest {

  private static final String ROE_QUESTION = "What was the return on equity in FY2023?";
  private static final String AUDITOR_QUESTION = "Who audited the statements?";

  @Mock private RetrievalGateway retrievalGateway;
  @Mock private ModelTaskClassifier modelClassifier;
  @Mock private SpecializedAgent generalAgent;
  @Mock private AnswerSynthesisAgent synthesisAgent;

  private FinQaConfig config;
  private SimpleMeterRegistry meterRegistry;
  private ExecutorService executor;
  private QueryRouter router;
  private AgentRegistry registry;
  private AnswerAggregator aggregator;
  private QuestionOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    config = new FinQaConfig();
    config.getRouting().setReferenceFiscalYear(2023);
    config.getRouting().setModelFallbackEnabled(false);
    meterRegistry = new SimpleMeterRegistry();
    executor = Executors.newFixedThreadPool(4);

    FiscalPeriodParser parser = new FiscalPeriodParser();
    router =
        new QueryRouter(
            new KeywordTaskClassifier(parser), modelClassifier, parser, config, meterRegistry);
    CalculationAgent calculationAgent =
        new CalculationAgent(
            retrievalGateway,
            new TableValueExtractor(parser),
            new FinancialCalculator(),
            config);
    when(generalAgent.category()).thenReturn(TaskCategory.GENERAL);
    TemporalComparisonAgent temporalAgent =
        new TemporalComparisonAgent(
            retrievalGateway,
            new TableValueExtractor(parser),
            new FinancialCalculator(),
            config);
    registry = new AgentRegistry(List.of(calculationAgent, temporalAgent, generalAgent));
    aggregator =
        new AnswerAggregator(
            synthesisAgent, new CollaboratorGuard(config, meterRegistry), config);

    orchestrator =
        new QuestionOrchestrator(
            router,
            registry,
            new ConfidenceValidator(meterRegistry),
            aggregator,
            config,
            executor,
            meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("Should retry a ratio once without the statement filter and then compose")
  void shouldRecoverDenominatorOnRelaxedRetry() {
    Chunk income =
        tableChunk(
            "ar_2",
            StatementType.INCOME_STATEMENT,
            "| Line item | FY2023 |\n| --- | --- |\n| Net income | 300 |",
            FiscalPeriod.annual(2023));
    Chunk equity =
        tableChunk(
            "ar_9",
            StatementType.NOTES,
            "| Line item | FY2023 |\n| --- | --- |\n| Total equity | 2,000 |",
            FiscalPeriod.annual(2023));
    when(retrievalGateway.search(contains("net income"), any(), anyInt()))
        .thenAnswer(inv -> found(income, inv.getArgument(1)));
    when(retrievalGateway.search(contains("total equity"), any(), anyInt()))
        .thenAnswer(
            inv -> {
              RetrievalFilters filters = inv.getArgument(1);
              return filters.statementTypes().contains(StatementType.BALANCE_SHEET)
                  ? RetrievalResult.empty(filters)
                  : found(equity, filters);
            });

    FinalAnswer answer = orchestrator.answer(ROE_QUESTION, RetrievalFilters.none());

    assertThat(answer.status()).isEqualTo(AnswerStatus.COMPOSED);
    assertThat(answer.retryCount()).isEqualTo(1);
    assertThat(answer.caveats()).isEmpty();
    assertThat(answer.text()).startsWith("Return on equity for FY2023: 15.00%");
    assertThat(answer.partialAnswers())
        .singleElement()
        .satisfies(p -> assertThat(p.value()).isEqualTo(15.0));
    verify(retrievalGateway, times(2)).search(contains("total equity"), any(), anyInt());
    assertThat(meterRegistry.counter("question.answers", "status", "COMPOSED").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should answer a YoY question with one retrieval per inferred fiscal year")
  void shouldCompareInferredPeriods() {
    Chunk income =
        tableChunk(
            "ar_2",
            StatementType.INCOME_STATEMENT,
            "| Line item | FY2023 | FY2022 |\n| --- | --- | --- |\n| Net income | 300 | 250 |",
            FiscalPeriod.annual(2023),
            FiscalPeriod.annual(2022));
    when(retrievalGateway.search(contains("net income"), any(), anyInt()))
        .thenAnswer(inv -> found(income, inv.getArgument(1)));

    FinalAnswer answer =
        orchestrator.answer("What was the YoY change in net income?", RetrievalFilters.none());

    assertThat(answer.status()).isEqualTo(AnswerStatus.COMPOSED);
    assertThat(answer.text())
        .isEqualTo(
            "Net income rose from 250.00 (FY2022) to 300.00 (FY2023), a change of 50.00"
                + " (+20.00%).");
    assertThat(answer.partialAnswers())
        .singleElement()
        .satisfies(p -> assertThat(p.category()).isEqualTo(TaskCategory.TEMPORAL_COMPARISON));
    ArgumentCaptor<RetrievalFilters> filters = ArgumentCaptor.forClass(RetrievalFilters.class);
    verify(retrievalGateway, times(2)).search(anyString(), filters.capture(), anyInt());
    assertThat(filters.getAllValues())
        .extracting(RetrievalFilters::fiscalYearFrom)
        .containsExactly(2022, 2023);
  }

  @Test
  @DisplayName("Should degrade with a caveat when evidence never appears")
  void shouldDegradeWhenEvidenceIsMissing() {
    when(retrievalGateway.search(any(), any(), anyInt()))
        .thenAnswer(inv -> RetrievalResult.empty(inv.getArgument(1)));

    FinalAnswer answer = orchestrator.answer(ROE_QUESTION, RetrievalFilters.none());

    assertThat(answer.status()).isEqualTo(AnswerStatus.DEGRADED);
    assertThat(answer.retryCount()).isEqualTo(2);
    assertThat(answer.confidence()).isZero();
    assertThat(answer.caveats())
        .containsExactly(
            "Insufficient evidence for calculation: "
                + EvidenceGap.RETRIEVAL_EMPTY.getDescription());
  }

  @Test
  @DisplayName("Should cut off a slow agent at the question deadline")
  void shouldTimeOutSlowAgent() {
    config.getOrchestration().setQuestionTimeout(Duration.ofMillis(100));
    CountDownLatch release = new CountDownLatch(1);
    when(generalAgent.answer(any()))
        .thenAnswer(
            inv -> {
              release.await(5, TimeUnit.SECONDS);
              return answered(inv.getArgument(0));
            });

    try {
      FinalAnswer answer = orchestrator.answer(AUDITOR_QUESTION, RetrievalFilters.none());

      assertThat(answer.status()).isEqualTo(AnswerStatus.DEGRADED);
      assertThat(answer.retryCount()).isZero();
      assertThat(answer.partialAnswers())
          .singleElement()
          .satisfies(p -> assertThat(p.gap()).isEqualTo(EvidenceGap.TIMEOUT));
      assertThat(meterRegistry.counter("question.timeouts").count()).isEqualTo(1.0);
    } finally {
      release.countDown();
    }
  }

  @Test
  @DisplayName("Should interrupt a sub-query still running at the question deadline")
  void shouldInterruptTimedOutAgent() throws InterruptedException {
    config.getOrchestration().setQuestionTimeout(Duration.ofMillis(100));
    CountDownLatch interrupted = new CountDownLatch(1);
    when(generalAgent.answer(any()))
        .thenAnswer(
            inv -> {
              try {
                Thread.sleep(5_000);
              } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
              }
              return answered(inv.getArgument(0));
            });

    FinalAnswer answer = orchestrator.answer(AUDITOR_QUESTION, RetrievalFilters.none());

    assertThat(answer.status()).isEqualTo(AnswerStatus.DEGRADED);
    assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  @DisplayName("Should report a sub-query the executor has no room for instead of throwing")
  void shouldContainRejectedSubQuery() {
    config.getValidation().setMaxRetries(0);
    QuestionOrchestrator saturated =
        new QuestionOrchestrator(
            router,
            registry,
            new ConfidenceValidator(meterRegistry),
            aggregator,
            config,
            task -> {
              throw new TaskRejectedException("Executor queue is full");
            },
            meterRegistry);

    FinalAnswer answer = saturated.answer(AUDITOR_QUESTION, RetrievalFilters.none());

    assertThat(answer.status()).isEqualTo(AnswerStatus.DEGRADED);
    assertThat(answer.partialAnswers())
        .singleElement()
        .satisfies(p -> assertThat(p.gap()).isEqualTo(EvidenceGap.COLLABORATOR_UNAVAILABLE));
    assertThat(meterRegistry.counter("subquery.rejections").count()).isEqualTo(1.0);
    verify(generalAgent, never()).answer(any());
  }

  @Nested
  @DisplayName("Agent failures")
  class AgentFailures {

    @BeforeEach
    void disableRetries() {
      config.getValidation().setMaxRetries(0);
    }

    @Test
    @DisplayName("Should record an unavailable collaborator as an evidence gap")
    void shouldMapCollaboratorFailure() {
      when(generalAgent.answer(any()))
          .thenThrow(
              new CollaboratorUnavailableException(
                  "language-model", 3, new IllegalStateException("503")));

      FinalAnswer answer = orchestrator.answer(AUDITOR_QUESTION, RetrievalFilters.none());

      PartialAnswer partial = answer.partialAnswers().get(0);
      assertThat(partial.gap()).isEqualTo(EvidenceGap.COLLABORATOR_UNAVAILABLE);
      assertThat(partial.explanation()).isEqualTo("the language-model service is unavailable");
      assertThat(answer.status()).isEqualTo(AnswerStatus.DEGRADED);
    }

    @Test
    @DisplayName("Should record an unreadable passage as a parse failure")
    void shouldMapParseFailure() {
      when(generalAgent.answer(any())).thenThrow(new AgentParseException("no table found"));

      FinalAnswer answer = orchestrator.answer(AUDITOR_QUESTION, RetrievalFilters.none());

      assertThat(answer.partialAnswers().get(0).gap()).isEqualTo(EvidenceGap.AGENT_PARSE_FAILURE);
      assertThat(meterRegistry.find("agent.failures").counter()).isNull();
    }

    @Test
    @DisplayName("Should contain an unexpected agent error and count it")
    void shouldContainUnexpectedFailure() {
      when(generalAgent.answer(any())).thenThrow(new NullPointerException("boom"));

      FinalAnswer answer = orchestrator.answer(AUDITOR_QUESTION, RetrievalFilters.none());

      assertThat(answer.partialAnswers().get(0).gap()).isEqualTo(EvidenceGap.AGENT_PARSE_FAILURE);
      assertThat(meterRegistry.counter("agent.failures", "category", "GENERAL").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should treat a missing answer as a parse failure")
    void shouldMapNullAnswer() {
      when(generalAgent.answer(any())).thenReturn(null);

      FinalAnswer answer = orchestrator.answer(AUDITOR_QUESTION, RetrievalFilters.none());

      assertThat(answer.partialAnswers().get(0).gap()).isEqualTo(EvidenceGap.AGENT_PARSE_FAILURE);
    }
  }

  private static RetrievalResult found(Chunk chunk, RetrievalFilters filters) {
    return new RetrievalResult(
        List.of(new RetrievalCandidate(chunk.id(), 0.8, filters, chunk)),
        RetrievalStatus.OK,
        filters);
  }

  private static PartialAnswer answered(SubQuery subQuery) {
    return new PartialAnswer(
        subQuery.id(), subQuery.category(), "Example LLP.", null, List.of(), 0.9, null, "test");
  }
}
