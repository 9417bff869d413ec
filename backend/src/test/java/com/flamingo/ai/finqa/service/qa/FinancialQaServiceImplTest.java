package com.flamingo.ai.finqa.service.qa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.finqa.domain.enums.AnswerStatus;
import com.flamingo.ai.finqa.domain.model.FinalAnswer;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.service.ingestion.IngestionService;
import com.flamingo.ai.finqa.service.orchestration.QuestionOrchestrator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FinancialQaServiceImpl Tests")
class FinancialQaServiceImplTest {

  @Mock private QuestionOrchestrator questionOrchestrator;
  @Mock private IngestionService ingestionService;

  private FinancialQaServiceImpl service;

  @BeforeEach
  void setUp() {
    service = new FinancialQaServiceImpl(questionOrchestrator, ingestionService);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   ", "\n\t"})
  @DisplayName("Should reject a blank question")
  void shouldRejectBlankQuestion(String question) {
    assertThatThrownBy(() -> service.answerQuestion(question))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Question must not be blank");
    verifyNoInteractions(questionOrchestrator);
  }

  @Test
  @DisplayName("Should trim the question and default missing filters")
  void shouldTrimQuestionAndDefaultFilters() {
    FinalAnswer expected =
        new FinalAnswer("ok", 0.9, List.of(), AnswerStatus.COMPOSED, 0, List.of(), List.of());
    when(questionOrchestrator.answer(anyString(), any())).thenReturn(expected);

    FinalAnswer answer = service.answerQuestion("  What was revenue in FY2023?  ", null);

    assertThat(answer).isSameAs(expected);
    verify(questionOrchestrator).answer("What was revenue in FY2023?", RetrievalFilters.none());
  }

  @Test
  @DisplayName("Should skip ingestion for an empty batch")
  void shouldSkipEmptyBatch() {
    assertThat(service.ingestDocuments(List.of())).isEmpty();
    assertThat(service.ingestDocuments(null)).isEmpty();
    verifyNoInteractions(ingestionService);
  }
}
