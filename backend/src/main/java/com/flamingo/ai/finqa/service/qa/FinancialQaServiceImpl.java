package com.flamingo.ai.finqa.service.qa;

import com.flamingo.ai.finqa.domain.model.ExtractedDocument;
import com.flamingo.ai.finqa.domain.model.FinalAnswer;
import com.flamingo.ai.finqa.domain.model.IngestionResult;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.service.ingestion.IngestionService;
import com.flamingo.ai.finqa.service.orchestration.QuestionOrchestrator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link FinancialQaService}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinancialQaServiceImpl implements FinancialQaService {

  private final QuestionOrchestrator questionOrchestrator;
  private final IngestionService ingestionService;

  @Override
  public FinalAnswer answerQuestion(String question) {
    return answerQuestion(question, RetrievalFilters.none());
  }

  @Override
  public FinalAnswer answerQuestion(String question, RetrievalFilters filters) {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }
    log.debug("Answering question: {}", question);
    return questionOrchestrator.answer(
        question.trim(), filters == null ? RetrievalFilters.none() : filters);
  }

  @Override
  public IngestionResult ingestDocument(ExtractedDocument document) {
    return ingestionService.ingest(document);
  }

  @Override
  public List<IngestionResult> ingestDocuments(List<ExtractedDocument> documents) {
    if (documents == null || documents.isEmpty()) {
      return List.of();
    }
    return ingestionService.ingestAll(documents);
  }
}
