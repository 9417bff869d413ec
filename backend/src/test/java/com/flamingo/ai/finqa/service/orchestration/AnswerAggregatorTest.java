package com.flamingo.ai.finqa.service.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.finqa.agent.AnswerSynthesisAgent;
import com.flamingo.ai.finqa.config.FinQaConfig;

import com.flamingo.ai.finqa.domain.enums.AggregationPolicy;
import com.flamingo.ai.finqa.domain.enums.AnswerStatus;
import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.domain.enums.ValidationState;
import com.flamingo.ai.finqa.domain.model.Citation;
import com.flamingo.ai.finqa.domain.model.FinalAnswer;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnswerAggregator Tests")
class AnswerAggregatorTest {

  private static final String QUESTION = "What was ROE in FY2023 and what are the main risks?";
  private static final ValidationPolicy MINIMUM =
      new ValidationPolicy(0.6, 2, AggregationPolicy.MINIMUM);

  @Mock private AnswerSynthesisAgent synthesisAgent;

  private FinQaConfig config;
  private AnswerAggregator aggregator;

  @BeforeEach
  void setUp() {
    config = new FinQaConfig();
    config.getCollaborator().setMaxAttempts(2);
    config.getCollaborator().setInitialBackoff(Duration.ofMillis(1));
    aggregator =
        new AnswerAggregator(
            synthesisAgent, new CollaboratorGuard(config, new SimpleMeterRegistry()), config);
  }

  private final SubQuery calculation = subQuery("q-0", TaskCategory.CALCULATION);
  private final SubQuery risk = subQuery("q-1", TaskCategory.RISK_EXTRACTION);

  @Test
  @DisplayName("Should return a single partial's text unchanged")
  void shouldPassThroughSinglePartial() {
    PartialAnswer roe = partial(calculation, "ROE was 15%.", 0.8, "ar_2", "ar_4");

    FinalAnswer answer =
        aggregator.aggregate(QUESTION, composed(outcome(calculation, roe)), MINIMUM);

    assertThat(answer.text()).isEqualTo("ROE was 15%.");
    assertThat(answer.status()).isEqualTo(AnswerStatus.COMPOSED);
    assertThat(answer.caveats()).isEmpty();
    assertThat(answer.confidence()).isEqualTo(0.8);
    assertThat(answer.partialAnswers()).containsExactly(roe);
  }

  @Test
  @DisplayName("Should label each part and de-duplicate citations when synthesis is unavailable")
  void shouldComposeSectionsAndDeduplicateCitations() {
    PartialAnswer roe = partial(calculation, "ROE was 15%.", 0.8, "ar_2", "ar_4");
    PartialAnswer risks = partial(risk, "Credit risk is elevated.", 0.7, "ar_4", "ar_12");
    when(synthesisAgent.synthesize(anyString(), anyString()))
        .thenThrow(new IllegalStateException("model overloaded"));

    FinalAnswer answer =
        aggregator.aggregate(
            QUESTION, composed(outcome(calculation, roe), outcome(risk, risks)), MINIMUM);

    assertThat(answer.text())
        .isEqualTo("Calculation: ROE was 15%.\n\nRisk extraction: Credit risk is elevated.");
    assertThat(answer.citations())
        .extracting(Citation::chunkId)
        .containsExactly("ar_2", "ar_4", "ar_12");
    assertThat(answer.confidence()).isEqualTo(0.7);
    verify(synthesisAgent, times(2)).synthesize(anyString(), anyString());
  }

  @Nested
  @DisplayName("Synthesis")
  class Synthesis {

    private final PartialAnswer roe = partial(calculation, "ROE was 15%.", 0.8, "ar_2");
    private final PartialAnswer risks = partial(risk, "Credit risk is elevated.", 0.7, "ar_12");

    @Test
    @DisplayName("Should merge the findings of several agents with the language model")
    void shouldSynthesizeSeveralParts() {
      when(synthesisAgent.synthesize(eq(QUESTION), anyString()))
          .thenReturn("  ROE was 15%, achieved despite elevated credit risk.  ");

      FinalAnswer answer =
          aggregator.aggregate(
              QUESTION, composed(outcome(calculation, roe), outcome(risk, risks)), MINIMUM);

      ArgumentCaptor<String> findings = ArgumentCaptor.forClass(String.class);
      verify(synthesisAgent).synthesize(eq(QUESTION), findings.capture());
      assertThat(findings.getValue())
          .isEqualTo("Calculation: ROE was 15%.\n\nRisk extraction: Credit risk is elevated.");
      assertThat(answer.text()).isEqualTo("ROE was 15%, achieved despite elevated credit risk.");
      assertThat(answer.partialAnswers()).containsExactly(roe, risks);
    }

    @Test
    @DisplayName("Should fall back to sections when the model returns nothing")
    void shouldFallBackOnBlankSynthesis() {
      when(synthesisAgent.synthesize(anyString(), anyString())).thenReturn(" ");

      FinalAnswer answer =
          aggregator.aggregate(
              QUESTION, composed(outcome(calculation, roe), outcome(risk, risks)), MINIMUM);

      assertThat(answer.text()).startsWith("Calculation: ROE was 15%.");
    }

    @Test
    @DisplayName("Should merge only the parts that found evidence and keep the caveats")
    void shouldSynthesizeAnsweredPartsOnly() {
      SubQuery temporal = subQuery("q-2", TaskCategory.TEMPORAL_COMPARISON);
      PartialAnswer missing =
          PartialAnswer.insufficient(temporal, EvidenceGap.RETRIEVAL_EMPTY, "no FY2022 figures");
      when(synthesisAgent.synthesize(eq(QUESTION), anyString())).thenReturn("Merged.");

      FinalAnswer answer =
          aggregator.aggregate(
              QUESTION,
              degraded(
                  false,
                  outcome(calculation, roe),
                  outcome(risk, risks),
                  outcome(temporal, missing)),
              MINIMUM);

      ArgumentCaptor<String> findings = ArgumentCaptor.forClass(String.class);
      verify(synthesisAgent).synthesize(eq(QUESTION), findings.capture());
      assertThat(findings.getValue()).doesNotContain("Temporal comparison");
      assertThat(answer.text())
          .isEqualTo(
              "Merged.\n\nCaveats:\n- Insufficient evidence for temporal comparison: "
                  + EvidenceGap.RETRIEVAL_EMPTY.getDescription());
    }

    @Test
    @DisplayName("Should not call the model for a single part")
    void shouldSkipSinglePart() {
      aggregator.aggregate(QUESTION, composed(outcome(calculation, roe)), MINIMUM);

      verifyNoInteractions(synthesisAgent);
    }

    @Test
    @DisplayName("Should not call the model when synthesis is disabled")
    void shouldSkipWhenDisabled() {
      config.getAgents().setSynthesizeAnswers(false);

      FinalAnswer answer =
          aggregator.aggregate(
              QUESTION, composed(outcome(calculation, roe), outcome(risk, risks)), MINIMUM);

      assertThat(answer.text()).startsWith("Calculation: ");
      verify(synthesisAgent, never()).synthesize(anyString(), anyString());
    }
  }

  @Test
  @DisplayName("Should weight confidences by citation count when configured")
  void shouldWeightByCitations() {
    PartialAnswer strong = partial(calculation, "a", 0.9, "ar_1", "ar_2", "ar_3");
    PartialAnswer weak = partial(risk, "b", 0.3);
    ValidationPolicy weighted = new ValidationPolicy(0.2, 2, AggregationPolicy.WEIGHTED_AVERAGE);

    FinalAnswer answer =
        aggregator.aggregate(
            QUESTION, composed(outcome(calculation, strong), outcome(risk, weak)), weighted);

    assertThat(answer.confidence()).isCloseTo(0.75, within(1e-9));
  }

  @Test
  @DisplayName("Should report zero confidence when there is nothing to aggregate")
  void shouldHandleNoPartials() {
    FinalAnswer answer = aggregator.aggregate(QUESTION, composed(), MINIMUM);

    assertThat(answer.confidence()).isZero();
    assertThat(answer.citations()).isEmpty();
  }

  @Nested
  @DisplayName("Degraded answers")
  class DegradedAnswers {

    @Test
    @DisplayName("Should name the category and gap of every insufficient part")
    void shouldAppendCaveatsForGaps() {
      PartialAnswer roe =
          PartialAnswer.insufficient(
              calculation, EvidenceGap.RETRIEVAL_EMPTY, "no passages found for total equity");
      PartialAnswer risks = partial(risk, "Credit risk is elevated.", 0.7, "ar_12");

      FinalAnswer answer =
          aggregator.aggregate(
              QUESTION, degraded(false, outcome(calculation, roe), outcome(risk, risks)), MINIMUM);

      String caveat =
          "Insufficient evidence for calculation: " + EvidenceGap.RETRIEVAL_EMPTY.getDescription();
      assertThat(answer.caveats()).containsExactly(caveat);
      assertThat(answer.text()).endsWith("\n\nCaveats:\n- " + caveat);
      assertThat(answer.isDegraded()).isTrue();
      assertThat(answer.confidence()).isZero();
    }

    @Test
    @DisplayName("Should explain a low-confidence part that carries no gap")
    void shouldExplainLowConfidence() {
      PartialAnswer roe = partial(calculation, "ROE was 150%.", 0.4, "ar_2");

      FinalAnswer answer =
          aggregator.aggregate(QUESTION, degraded(false, outcome(calculation, roe)), MINIMUM);

      assertThat(answer.caveats())
          .containsExactly(
              "Insufficient evidence for calculation: " + AnswerAggregator.BELOW_THRESHOLD);
    }

    @Test
    @DisplayName("Should report a timed-out part as a timeout even with a usable earlier answer")
    void shouldReportTimeout() {
      PartialAnswer risks = partial(risk, "Credit risk is elevated.", 0.9, "ar_12");
      SubQueryOutcome cutOff = new SubQueryOutcome(risk, risks, 1, true);

      FinalAnswer answer = aggregator.aggregate(QUESTION, degraded(true, cutOff), MINIMUM);

      assertThat(answer.caveats())
          .containsExactly(
              "Insufficient evidence for risk extraction: "
                  + EvidenceGap.TIMEOUT.getDescription());
    }
  }

  private static SubQueryOutcome outcome(SubQuery subQuery, PartialAnswer partial) {
    return new SubQueryOutcome(subQuery, partial, 0, false);
  }

  private static ValidationOutcome composed(SubQueryOutcome... outcomes) {
    return new ValidationOutcome(
        AnswerStatus.COMPOSED,
        List.of(outcomes),
        0,
        false,
        List.of(ValidationState.GATHERING, ValidationState.VALIDATING, ValidationState.COMPOSED));
  }

  private static ValidationOutcome degraded(boolean timedOut, SubQueryOutcome... outcomes) {
    return new ValidationOutcome(
        AnswerStatus.DEGRADED,
        List.of(outcomes),
        Arrays.stream(outcomes).mapToInt(SubQueryOutcome::retries).sum(),
        timedOut,
        List.of(ValidationState.GATHERING, ValidationState.VALIDATING, ValidationState.DEGRADED));
  }

  private static PartialAnswer partial(
      SubQuery subQuery, String text, double confidence, String... chunkIds) {
    List<Citation> citations =
        Arrays.stream(chunkIds).map(id -> new Citation(id, "ar", 1, 1)).toList();
    return new PartialAnswer(
        subQuery.id(), subQuery.category(), text, null, citations, confidence, null, "test");
  }

  private static SubQuery subQuery(String id, TaskCategory category) {
    return new SubQuery(
        id, category, "question", category.getInstruction(), RetrievalFilters.none(), List.of(), 0);
  }
}
